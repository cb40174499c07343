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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.Schema.Field;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.SchemaBuilder.FieldAssembler;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.EncoderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Lists;

import net.tidepool.data.Event;
import net.tidepool.data.EventType;
import net.tidepool.exceptions.SchemaDecodeException;
import net.tidepool.exceptions.SerdesException;
import net.tidepool.series.TimeSeries;
import net.tidepool.time.TimeRange;
import net.tidepool.utils.JSON;

/**
 * Encodes series with the Avro binary encoding, without a container 
 * header so the reader must supply the writer's schema. The schema is 
 * derived from the series:
 * <pre>
 * record TimeSeries {
 *   string name;
 *   boolean utc;
 *   array&lt;string&gt; columns;
 *   array&lt;record Event { &lt;key&gt;; record Data { ... } data; }&gt; points;
 * }
 * </pre>
 * The key field is {@code long time}, {@code array<long> timerange} or 
 * {@code string index} depending on the event variant. The data record 
 * has one nullable field per column: {@code double} for numeric columns,
 * {@code string} or {@code boolean} for uniform columns of those types 
 * and a JSON encoded {@code string} flagged with the {@link #JSON_PROP}
 * property for nested or mixed columns. Numbers therefore come back as 
 * doubles.
 * <p>
 * Decoding rebuilds the tabular JSON form and parses it like 
 * {@link TimeSeriesJsonSerdes} so the same validation applies. Payloads 
 * that do not match the schema are logged and raise a 
 * {@link SchemaDecodeException}.
 * 
 * @since 1.0
 */
public class AvroTimeSeriesSerdes implements TimeSeriesSerdes {
  private static final Logger LOG = LoggerFactory.getLogger(
      AvroTimeSeriesSerdes.class);

  /** Field property marking JSON encoded columns. */
  public static final String JSON_PROP = "tidepool.json";

  /** The kinds of data columns. */
  static enum ColumnKind {
    DOUBLE,
    STRING,
    BOOLEAN,
    JSON
  }

  /** The writer schema. */
  private final Schema schema;

  /**
   * Default ctor.
   * @param schema A non-null schema as returned by 
   * {@link #schemaFor(TimeSeries)}.
   */
  public AvroTimeSeriesSerdes(final Schema schema) {
    if (schema == null) {
      throw new IllegalArgumentException("Schema cannot be null.");
    }
    this.schema = schema;
  }

  /** @return The schema used for reading and writing. */
  public Schema schema() {
    return schema;
  }

  @Override
  public byte[] serialize(final TimeSeries series) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    final ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try {
      final GenericRecord record = toRecord(series);
      final BinaryEncoder encoder = 
          EncoderFactory.get().binaryEncoder(baos, null);
      new GenericDatumWriter<GenericRecord>(schema).write(record, encoder);
      encoder.flush();
    } catch (IOException e) {
      throw new SerdesException("Failed to encode series " 
          + series.name(), e);
    } catch (AvroRuntimeException | ClassCastException e) {
      throw new SerdesException("Series " + series.name() 
          + " does not match the schema", e);
    }
    return baos.toByteArray();
  }

  @Override
  public TimeSeries deserialize(final byte[] data) {
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    final ObjectNode root;
    try {
      final BinaryDecoder decoder = 
          DecoderFactory.get().binaryDecoder(data, null);
      final GenericRecord record = new GenericDatumReader<GenericRecord>(
          schema).read(null, decoder);
      if (!decoder.isEnd()) {
        throw new IOException("Trailing bytes after the series record.");
      }
      // a record of the wrong shape fails here with casts or nulls
      root = toJSON(record);
    } catch (IOException | RuntimeException e) {
      LOG.error("Unable to decode a series of " + data.length 
          + " bytes with schema " + schema.getFullName(), e);
      throw new SchemaDecodeException("Unable to decode series from Avro "
          + "payload", e);
    }
    return TimeSeriesJsonSerdes.fromJSON(root);
  }

  /**
   * Derives the schema for a series from its variant and column values.
   * @param series A non-null series.
   * @return The schema.
   * @throws SerdesException if a column name was not a valid Avro name.
   */
  public static Schema schemaFor(final TimeSeries series) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    final EventType type = series.type() == null ? EventType.TIME 
        : series.type();
    try {
      FieldAssembler<Schema> data = SchemaBuilder.record("Data").fields();
      for (final String column : series.columns()) {
        switch (kindOf(series, column)) {
        case DOUBLE:
          data = data.name(column).type().optional().doubleType();
          break;
        case STRING:
          data = data.name(column).type().optional().stringType();
          break;
        case BOOLEAN:
          data = data.name(column).type().optional().booleanType();
          break;
        default:
          data = data.name(column).prop(JSON_PROP, "true")
              .type().optional().stringType();
        }
      }
      final Schema data_schema = data.endRecord();

      FieldAssembler<Schema> event = SchemaBuilder.record("Event").fields();
      switch (type) {
      case TIME:
        event = event.name(type.getName()).type().longType().noDefault();
        break;
      case TIMERANGE:
        event = event.name(type.getName()).type().array().items().longType()
            .noDefault();
        break;
      default:
        event = event.name(type.getName()).type().stringType().noDefault();
      }
      final Schema event_schema = event
          .name("data").type(data_schema).noDefault()
          .endRecord();

      return SchemaBuilder.record("TimeSeries").namespace("net.tidepool")
          .fields()
          .name(TimeSeries.NAME_KEY).type().stringType().noDefault()
          .name(TimeSeries.UTC_KEY).type().booleanType().noDefault()
          .name(TimeSeriesJsonSerdes.COLUMNS).type().array().items()
            .stringType().noDefault()
          .name(TimeSeriesJsonSerdes.POINTS).type().array().items(event_schema)
            .noDefault()
          .endRecord();
    } catch (AvroRuntimeException e) {
      throw new SerdesException("Unable to build a schema for series " 
          + series.name(), e);
    }
  }

  /**
   * @return The kind of a column: double if every non-null value is a 
   * number (or all values are null), string or boolean if every one is of
   * that type, JSON otherwise.
   */
  static ColumnKind kindOf(final TimeSeries series, final String column) {
    ColumnKind kind = null;
    for (final Event event : series.events()) {
      final Object value = event.data().get(column);
      if (value == null) {
        continue;
      }
      final ColumnKind current;
      if (value instanceof Number) {
        current = ColumnKind.DOUBLE;
      } else if (value instanceof String) {
        current = ColumnKind.STRING;
      } else if (value instanceof Boolean) {
        current = ColumnKind.BOOLEAN;
      } else {
        return ColumnKind.JSON;
      }
      if (kind == null) {
        kind = current;
      } else if (kind != current) {
        return ColumnKind.JSON;
      }
    }
    return kind == null ? ColumnKind.DOUBLE : kind;
  }

  private GenericRecord toRecord(final TimeSeries series) {
    final EventType type = series.type() == null ? EventType.TIME 
        : series.type();
    final Schema points_schema = 
        schema.getField(TimeSeriesJsonSerdes.POINTS).schema();
    final Schema event_schema = points_schema.getElementType();
    final Schema data_schema = event_schema.getField("data").schema();

    final List<String> columns = Lists.newArrayList();
    for (final Field field : data_schema.getFields()) {
      columns.add(field.name());
    }

    final GenericData.Array<GenericRecord> points = 
        new GenericData.Array<GenericRecord>(series.size(), points_schema);
    for (final Event event : series.events()) {
      final GenericRecord data = new GenericData.Record(data_schema);
      for (final Field field : data_schema.getFields()) {
        final Object value = event.data().get(field.name());
        data.put(field.name(), toAvroValue(field, value));
      }
      final GenericRecord point = new GenericData.Record(event_schema);
      switch (type) {
      case TIME:
        point.put(type.getName(), event.timestamp().toEpochMilli());
        break;
      case TIMERANGE:
        final TimeRange range = event.timerange();
        point.put(type.getName(), Lists.newArrayList(
            range.begin().toEpochMilli(), range.end().toEpochMilli()));
        break;
      default:
        point.put(type.getName(), event.key());
      }
      point.put("data", data);
      points.add(point);
    }

    final GenericRecord record = new GenericData.Record(schema);
    record.put(TimeSeries.NAME_KEY, series.name());
    record.put(TimeSeries.UTC_KEY, series.isUTC());
    final List<String> column_names = Lists.newArrayList(type.getName());
    column_names.addAll(columns);
    record.put(TimeSeriesJsonSerdes.COLUMNS, column_names);
    record.put(TimeSeriesJsonSerdes.POINTS, points);
    return record;
  }

  private static Object toAvroValue(final Field field, final Object value) {
    if (value == null) {
      return null;
    }
    if (field.getProp(JSON_PROP) != null) {
      return JSON.serializeToString(value);
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    return value;
  }

  /** Rebuilds the tabular JSON form from a decoded record. */
  private ObjectNode toJSON(final GenericRecord record) {
    final ObjectNode root = JSON.getMapper().createObjectNode();
    root.put(TimeSeries.NAME_KEY, String.valueOf(
        record.get(TimeSeries.NAME_KEY)));
    root.put(TimeSeries.UTC_KEY, (Boolean) record.get(TimeSeries.UTC_KEY));

    final List<?> columns = (List<?>) record.get(TimeSeriesJsonSerdes.COLUMNS);
    final ArrayNode column_node = root.putArray(TimeSeriesJsonSerdes.COLUMNS);
    for (final Object column : columns) {
      column_node.add(String.valueOf(column));
    }
    final String key_field = columns.isEmpty() ? null 
        : String.valueOf(columns.get(0));

    final ArrayNode point_node = root.putArray(TimeSeriesJsonSerdes.POINTS);
    for (final Object entry : 
        (List<?>) record.get(TimeSeriesJsonSerdes.POINTS)) {
      final GenericRecord point = (GenericRecord) entry;
      final ArrayNode row = point_node.addArray();
      final Object key = point.get(key_field);
      if (key instanceof List) {
        final ArrayNode range = row.addArray();
        for (final Object ms : (List<?>) key) {
          range.add((Long) ms);
        }
      } else if (key instanceof Long) {
        row.add((Long) key);
      } else {
        row.add(String.valueOf(key));
      }

      final GenericRecord data = (GenericRecord) point.get("data");
      for (int i = 1; i < columns.size(); i++) {
        final Field field = data.getSchema().getField(
            String.valueOf(columns.get(i)));
        final Object value = field == null ? null : data.get(field.pos());
        if (value == null) {
          row.addNull();
        } else if (field.getProp(JSON_PROP) != null) {
          row.add(JSON.parseToTree(value.toString()));
        } else if (value instanceof CharSequence) {
          row.add(value.toString());
        } else {
          row.add(JSON.toTree(value));
        }
      }
    }
    return root;
  }
}
