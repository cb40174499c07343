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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.tidepool.query.aggregators.Reducer;
import net.tidepool.query.aggregators.ValueFilter;

/**
 * Static helpers operating on events: validity checks, field selection and
 * collapsing, and the per-key combining and merging used when several 
 * series are folded into one.
 * 
 * @since 1.0
 */
public final class Events {

  private Events() {
    // Static only
  }

  /**
   * Value equality of two events: same variant, same key and equal data.
   * @param a An event, may be null.
   * @param b An event, may be null.
   * @return True if both are null or equal.
   */
  public static boolean is(final Event a, final Event b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null) {
      return false;
    }
    return a.type() == b.type() 
        && a.key().equals(b.key()) 
        && a.data().equals(b.data());
  }

  /**
   * @param event A non-null event.
   * @param path A non-null path.
   * @return True if the value at the path is neither null nor NaN.
   */
  public static boolean isValidValue(final Event event, final FieldPath path) {
    return ValueFilter.isValid(event.get(path));
  }

  /**
   * Keeps only the given fields of an event. Nested paths keep their 
   * nesting.
   * @param event A non-null event.
   * @param paths The fields to keep.
   * @return A new event of the same variant and key.
   */
  public static Event select(final Event event, 
                             final Collection<FieldPath> paths) {
    final EventData.Builder builder = EventData.newBuilder();
    for (final FieldPath path : paths) {
      if (event.data().has(path)) {
        builder.put(path, event.get(path));
      }
    }
    return event.setData(builder.build());
  }

  /**
   * Reduces several fields of an event into a single new field.
   * @param event A non-null event.
   * @param paths The fields to reduce.
   * @param name The name of the output column.
   * @param reducer The reducer applied to the field values.
   * @param append Whether to keep the existing data and add the new column
   * or to replace the data with the new column alone.
   * @return A new event of the same variant and key.
   */
  public static Event collapse(final Event event,
                               final Collection<FieldPath> paths,
                               final String name,
                               final Reducer reducer,
                               final boolean append) {
    final List<Object> values = Lists.newArrayListWithCapacity(paths.size());
    for (final FieldPath path : paths) {
      values.add(event.get(path));
    }
    final Object reduced = reducer.reduce(values);
    if (append) {
      return event.setData(event.data().with(name, reduced));
    }
    return event.setData(EventData.of(name, reduced));
  }

  /**
   * Groups events by key, in order of first appearance.
   * @param events A non-null list of events.
   * @return The map of keys to events.
   */
  public static Map<String, List<Event>> groupByKey(
      final Collection<? extends Event> events) {
    final Map<String, List<Event>> groups = Maps.newLinkedHashMap();
    for (final Event event : events) {
      List<Event> group = groups.get(event.key());
      if (group == null) {
        group = Lists.newArrayList();
        groups.put(event.key(), group);
      }
      group.add(event);
    }
    return groups;
  }

  /**
   * Combines events sharing the same key by reducing their field values.
   * The output holds one event per key, in order of first appearance, with
   * the key and variant of the first event for that key.
   * @param events A non-null list of events.
   * @param paths The fields to reduce. If null or empty, every top level
   * column seen for that key is reduced.
   * @param reducer The non-null reducer.
   * @return The combined events.
   */
  public static List<Event> combine(final Collection<? extends Event> events,
                                    final List<FieldPath> paths,
                                    final Reducer reducer) {
    final List<Event> combined = Lists.newArrayList();
    for (final List<Event> group : groupByKey(events).values()) {
      final List<FieldPath> fields;
      if (paths == null || paths.isEmpty()) {
        fields = Lists.newArrayList();
        for (final String column : columns(group)) {
          fields.add(FieldPath.of(ImmutableList.of(column)));
        }
      } else {
        fields = paths;
      }
      
      final EventData.Builder builder = EventData.newBuilder();
      for (final FieldPath field : fields) {
        final List<Object> values = Lists.newArrayListWithCapacity(
            group.size());
        for (final Event event : group) {
          values.add(event.get(field));
        }
        builder.put(field, reducer.reduce(values));
      }
      combined.add(group.get(0).setData(builder.build()));
    }
    return combined;
  }

  /**
   * Merges events sharing the same key into a single event carrying the
   * union of their columns. When several events have the same column the 
   * first non-null value wins.
   * @param events A non-null list of events.
   * @return One event per key, in order of first appearance.
   */
  public static List<Event> merge(final Collection<? extends Event> events) {
    final List<Event> merged = Lists.newArrayList();
    for (final List<Event> group : groupByKey(events).values()) {
      if (group.size() == 1) {
        merged.add(group.get(0));
        continue;
      }
      final Map<String, Object> union = Maps.newLinkedHashMap();
      for (final Event event : group) {
        for (final Entry<String, Object> entry : event.data()) {
          if (union.get(entry.getKey()) == null) {
            union.put(entry.getKey(), entry.getValue());
          }
        }
      }
      merged.add(group.get(0).setData(EventData.of(union)));
    }
    return merged;
  }

  /**
   * @param events A non-null list of events.
   * @return The union of the top level columns in order of first 
   * appearance.
   */
  public static List<String> columns(final Collection<? extends Event> events) {
    final Set<String> columns = Sets.newLinkedHashSet();
    for (final Event event : events) {
      columns.addAll(event.data().keys());
    }
    return Lists.newArrayList(columns);
  }
}
