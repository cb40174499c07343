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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.AbstractMap;
import java.util.Collections;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * The immutable payload of an event: an insertion ordered mapping of column
 * names to values where a value may be {@code null}, a number, a string, a
 * boolean, a list or another {@link EventData}.
 * <p>
 * Writes are copy-on-write and only copy the maps along the written path,
 * untouched nested data is shared between the old and new instances.
 * <p>
 * Numbers are normalized on the way in: integral types become {@link Long}s
 * and floating point types become {@link Double}s so that data compares
 * equal regardless of how it was built or parsed. Nested maps become 
 * {@link EventData} and lists become unmodifiable.
 * 
 * @since 1.0
 */
public final class EventData implements Iterable<Entry<String, Object>> {

  /** The empty instance. */
  public static final EventData EMPTY = 
      new EventData(Collections.<String, Object>emptyMap());

  /** The unmodifiable backing map. */
  private final Map<String, Object> map;

  /**
   * Private ctor that takes ownership of an already normalized map.
   * @param map The map to wrap.
   */
  private EventData(final Map<String, Object> map) {
    this.map = Collections.unmodifiableMap(map);
  }

  /**
   * Builds data from a plain map, normalizing values recursively.
   * @param values A map of columns to values. May be null or empty.
   * @return The data, {@link #EMPTY} if the map was null or empty.
   */
  public static EventData of(final Map<String, ?> values) {
    if (values == null || values.isEmpty()) {
      return EMPTY;
    }
    if (values instanceof EventData.MapView) {
      return ((MapView) values).data;
    }
    final Map<String, Object> copy = Maps.newLinkedHashMap();
    for (final Entry<String, ?> entry : values.entrySet()) {
      copy.put(entry.getKey(), normalize(entry.getValue()));
    }
    return new EventData(copy);
  }

  /**
   * @param key A non-null column name.
   * @param value A value, may be null.
   * @return Data with a single column.
   */
  public static EventData of(final String key, final Object value) {
    return newBuilder().put(key, value).build();
  }

  /**
   * @return Data with two columns in the given order.
   */
  public static EventData of(final String k1, final Object v1, 
                             final String k2, final Object v2) {
    return newBuilder().put(k1, v1).put(k2, v2).build();
  }

  /**
   * @param key A column name. May be null.
   * @return The value of the top level column, null if absent.
   */
  public Object get(final String key) {
    return map.get(key);
  }

  /**
   * Walks nested data along the path.
   * @param path A non-null path.
   * @return The value or null if any segment along the way was absent or 
   * not nested data.
   */
  public Object get(final FieldPath path) {
    Object current = this;
    for (final String segment : path.segments()) {
      if (!(current instanceof EventData)) {
        return null;
      }
      current = ((EventData) current).map.get(segment);
    }
    return current;
  }

  /**
   * @param path A non-null path.
   * @return True if every segment of the path exists, even when the value
   * at the end is null.
   */
  public boolean has(final FieldPath path) {
    EventData current = this;
    final List<String> segments = path.segments();
    for (int i = 0; i < segments.size(); i++) {
      if (!current.map.containsKey(segments.get(i))) {
        return false;
      }
      if (i == segments.size() - 1) {
        return true;
      }
      final Object next = current.map.get(segments.get(i));
      if (!(next instanceof EventData)) {
        return false;
      }
      current = (EventData) next;
    }
    return false;
  }

  /**
   * @param key A non-null column name.
   * @param value The value to store, may be null.
   * @return A new instance with the column set. Existing columns keep their
   * position, new columns are appended.
   */
  public EventData with(final String key, final Object value) {
    if (key == null) {
      throw new IllegalArgumentException("Key cannot be null.");
    }
    final Map<String, Object> copy = Maps.newLinkedHashMap(map);
    copy.put(key, normalize(value));
    return new EventData(copy);
  }

  /**
   * Sets a value at a possibly nested path, creating intermediate data as
   * needed and replacing non-nested values along the way.
   * @param path A non-null path.
   * @param value The value to store, may be null.
   * @return A new instance with the value set.
   */
  public EventData with(final FieldPath path, final Object value) {
    return with(path.segments(), 0, value);
  }

  private EventData with(final List<String> segments, 
                         final int depth, 
                         final Object value) {
    final String key = segments.get(depth);
    if (depth == segments.size() - 1) {
      return with(key, value);
    }
    final Object existing = map.get(key);
    final EventData child = existing instanceof EventData ? 
        (EventData) existing : EMPTY;
    final Map<String, Object> copy = Maps.newLinkedHashMap(map);
    copy.put(key, child.with(segments, depth + 1, value));
    return new EventData(copy);
  }

  /**
   * @param key A column name.
   * @return A new instance without the column, or this if it was absent.
   */
  public EventData without(final String key) {
    if (!map.containsKey(key)) {
      return this;
    }
    final Map<String, Object> copy = Maps.newLinkedHashMap(map);
    copy.remove(key);
    return copy.isEmpty() ? EMPTY : new EventData(copy);
  }

  /**
   * @param keys Column names to keep.
   * @return A new instance with only the given top level columns, in the 
   * order they appear in this data.
   */
  public EventData retain(final Collection<String> keys) {
    final Map<String, Object> copy = Maps.newLinkedHashMap();
    for (final Entry<String, Object> entry : map.entrySet()) {
      if (keys.contains(entry.getKey())) {
        copy.put(entry.getKey(), entry.getValue());
      }
    }
    return copy.isEmpty() ? EMPTY : new EventData(copy);
  }

  /** @return The top level column names in insertion order. */
  public Set<String> keys() {
    return map.keySet();
  }

  /** @return The number of top level columns. */
  public int size() {
    return map.size();
  }

  /** @return Whether there are no columns. */
  public boolean isEmpty() {
    return map.isEmpty();
  }

  /** @return An unmodifiable view of the top level columns. */
  @JsonValue
  public Map<String, Object> asMap() {
    return new MapView(this);
  }

  @Override
  public Iterator<Entry<String, Object>> iterator() {
    return map.entrySet().iterator();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return map.equals(((EventData) o).map);
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public String toString() {
    return map.toString();
  }

  /**
   * Normalizes a raw value.
   * @param value The value, may be null.
   * @return The normalized value.
   */
  @SuppressWarnings("unchecked")
  public static Object normalize(final Object value) {
    if (value == null || value instanceof EventData 
        || value instanceof String || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Long) {
      return value;
    }
    if (value instanceof Integer || value instanceof Short 
        || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger) {
      final BigInteger big = (BigInteger) value;
      return big.bitLength() < 64 ? (Object) big.longValue() 
          : (Object) big.doubleValue();
    }
    if (value instanceof Double) {
      return value;
    }
    if (value instanceof Float || value instanceof BigDecimal) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Map) {
      return of((Map<String, ?>) value);
    }
    if (value instanceof Iterable) {
      final List<Object> list = Lists.newArrayList();
      for (final Object entry : (Iterable<?>) value) {
        list.add(normalize(entry));
      }
      return Collections.unmodifiableList(list);
    }
    return value;
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * @param data Data to start from.
   * @return A builder pre-populated with the data's columns.
   */
  public static Builder newBuilder(final EventData data) {
    final Builder builder = new Builder();
    builder.values.putAll(data.map);
    return builder;
  }

  /** Accumulates columns in insertion order. */
  public static final class Builder {
    private final Map<String, Object> values = 
        Maps.newLinkedHashMap();

    /**
     * @param key A non-null column name.
     * @param value The value, may be null.
     * @return The builder.
     */
    public Builder put(final String key, final Object value) {
      if (key == null) {
        throw new IllegalArgumentException("Key cannot be null.");
      }
      values.put(key, normalize(value));
      return this;
    }

    /**
     * @param path A non-null path.
     * @param value The value, may be null.
     * @return The builder.
     */
    public Builder put(final FieldPath path, final Object value) {
      if (path.depth() == 1) {
        return put(path.head(), value);
      }
      final EventData current = new EventData(
          Maps.newLinkedHashMap(values));
      final EventData updated = current.with(path, value);
      values.clear();
      values.putAll(updated.map);
      return this;
    }

    public EventData build() {
      if (values.isEmpty()) {
        return EMPTY;
      }
      return new EventData(Maps.newLinkedHashMap(values));
    }
  }

  /** 
   * Read only map view handed out by {@link #asMap()} so that data can be 
   * passed back into {@link #of(Map)} without copying.
   */
  private static final class MapView extends AbstractMap<String, Object> {
    private final EventData data;

    private MapView(final EventData data) {
      this.data = data;
    }

    @Override
    public Set<Entry<String, Object>> entrySet() {
      return data.map.entrySet();
    }

    @Override
    public Object get(final Object key) {
      return data.map.get(key);
    }

    @Override
    public boolean containsKey(final Object key) {
      return data.map.containsKey(key);
    }

    @Override
    public int size() {
      return data.map.size();
    }
  }
}
