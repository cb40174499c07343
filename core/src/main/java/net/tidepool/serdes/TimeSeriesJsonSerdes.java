// This file is part of Tidepool.
// Copyright (C) 2018  The Tidepool Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tidepool.serdes;

import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Lists;

import net.tidepool.core.Const;
import net.tidepool.data.Event;
import net.tidepool.data.EventType;
import net.tidepool.exceptions.MissingRequiredOptionException;
import net.tidepool.exceptions.SerdesException;
import net.tidepool.series.TimeSeries;
import net.tidepool.time.Index;
import net.tidepool.utils.JSON;
import net.tidepool.utils.JSONException;

/**
 * Reads and writes the tabular JSON form of a series:
 * <pre>
 * { "name": "traffic", "utc": true, "index": "2015-06", 
 *   "columns": ["time", "in", "out"],
 *   "points": [[1400425947000, 52, 34], ...] }
 * </pre>
 * Meta data is written at the top level next to the columns and points.
 * The first column names the event variant and each point starts with 
 * the event key: epoch milliseconds, a two element list of epoch 
 * milliseconds or an index string. Events missing a column get a null in
 * that position.
 * 
 * @since 1.0
 */
public class TimeSeriesJsonSerdes implements TimeSeriesSerdes {
  /** Field holding the column names. */
  public static final String COLUMNS = "columns";

  /** Field holding the rows. */
  public static final String POINTS = "points";

  @Override
  public byte[] serialize(final TimeSeries series) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    try {
      return JSON.serializeToBytes(toJSON(series));
    } catch (JSONException e) {
      throw new SerdesException("Failed to serialize series " 
          + series.name(), e);
    }
  }

  @Override
  public TimeSeries deserialize(final byte[] data) {
    if (data == null || data.length < 1) {
      throw new IllegalArgumentException("Data cannot be null or empty.");
    }
    return fromJSON(new String(data, Const.UTF8_CHARSET));
  }

  /**
   * @param series A non-null series.
   * @return The series as a JSON string.
   */
  public static String serializeToString(final TimeSeries series) {
    return JSON.serializeToString(toJSON(series));
  }

  /**
   * @param series A non-null series.
   * @return The tabular form as a tree.
   */
  public static ObjectNode toJSON(final TimeSeries series) {
    final ObjectNode root = JSON.getMapper().createObjectNode();
    for (final Entry<String, Object> entry : series.meta().entrySet()) {
      if (entry.getValue() instanceof Index) {
        root.put(entry.getKey(), ((Index) entry.getValue()).toJSON());
      } else {
        root.set(entry.getKey(), JSON.toTree(entry.getValue()));
      }
    }

    final EventType type = series.type() == null ? EventType.TIME 
        : series.type();
    final List<String> columns = series.columns();
    final ArrayNode column_node = root.putArray(COLUMNS);
    column_node.add(type.getName());
    for (final String column : columns) {
      column_node.add(column);
    }

    final ArrayNode points = root.putArray(POINTS);
    for (final Event event : series.events()) {
      final ArrayNode point = points.addArray();
      for (final Object value : event.toPoint(columns)) {
        point.add(JSON.toTree(value));
      }
    }
    return root;
  }

  /**
   * @param json A non-null JSON string.
   * @return The parsed series.
   * @throws IllegalArgumentException if the JSON was malformed or not a 
   * series.
   */
  public static TimeSeries fromJSON(final String json) {
    return fromJSON(JSON.parseToTree(json));
  }

  /**
   * @param root A non-null object node.
   * @return The parsed series.
   * @throws IllegalArgumentException if the node was not a series.
   */
  public static TimeSeries fromJSON(final JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("A series must be a JSON object.");
    }
    final JsonNode column_node = root.get(COLUMNS);
    final JsonNode point_node = root.get(POINTS);
    if (column_node == null || !column_node.isArray()) {
      throw new MissingRequiredOptionException("A series requires a "
          + "columns array.");
    }
    if (point_node == null || !point_node.isArray()) {
      throw new MissingRequiredOptionException("A series requires a "
          + "points array.");
    }

    final TimeSeries.Builder builder = TimeSeries.newBuilder();
    final Iterator<Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      final Entry<String, JsonNode> field = fields.next();
      if (field.getKey().equals(COLUMNS) || field.getKey().equals(POINTS)) {
        continue;
      }
      builder.addMeta(field.getKey(), JSON.toJavaObject(field.getValue()));
    }

    final List<String> columns = Lists.newArrayList();
    for (final JsonNode column : column_node) {
      if (!column.isTextual()) {
        throw new IllegalArgumentException("Column names must be strings: " 
            + column);
      }
      columns.add(column.asText());
    }

    final List<List<Object>> points = Lists.newArrayList();
    for (final JsonNode point : point_node) {
      if (!point.isArray()) {
        throw new IllegalArgumentException("Points must be arrays: " 
            + point);
      }
      final List<Object> row = Lists.newArrayListWithCapacity(point.size());
      for (final JsonNode value : point) {
        row.add(JSON.toJavaObject(value));
      }
      points.add(row);
    }
    return builder.setColumns(columns)
        .setPoints(points)
        .build();
  }
}
