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
package net.tidepool.data;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Objects;
import com.google.common.collect.Lists;

import net.tidepool.utils.JSON;

/**
 * Shared payload handling for the event variants.
 * 
 * @since 1.0
 */
public abstract class BaseEvent implements Event {

  /** The non-null payload. */
  protected final EventData data;

  /**
   * Default ctor.
   * @param data The payload, null is treated as empty.
   */
  protected BaseEvent(final EventData data) {
    this.data = data == null ? EventData.EMPTY : data;
  }

  @Override
  public EventData data() {
    return data;
  }

  @Override
  public Object get(final FieldPath path) {
    return data.get(path);
  }

  @Override
  public Object get(final String path) {
    return data.get(FieldPath.orDefault(path));
  }

  @Override
  public Instant timestamp() {
    return begin();
  }

  @Override
  public ObjectNode toJSON() {
    final ObjectNode node = JSON.getMapper().createObjectNode();
    node.set(type().getName(), JSON.toTree(keyJSON()));
    node.set("data", JSON.toTree(data));
    return node;
  }

  @Override
  public List<Object> toPoint() {
    return toPoint(Lists.newArrayList(data.keys()));
  }

  @Override
  public List<Object> toPoint(final List<String> columns) {
    // ArrayList as missing columns are nulls
    final List<Object> point = Lists.newArrayListWithCapacity(
        columns.size() + 1);
    point.add(keyJSON());
    for (final String column : columns) {
      point.add(data.get(column));
    }
    return point;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Event other = (Event) o;
    return Objects.equal(key(), other.key()) 
        && Objects.equal(data, other.data());
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type(), key(), data);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("type=")
        .append(type().getName())
        .append(", key=")
        .append(key())
        .append(", data=")
        .append(data)
        .toString();
  }
}
