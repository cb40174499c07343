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
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tidepool.query.aggregators.PercentileInterpolation;
import net.tidepool.query.aggregators.Reducer;
import net.tidepool.query.aggregators.Reducers;
import net.tidepool.query.aggregators.ValueFilter;
import net.tidepool.time.TimeRange;

/**
 * An immutable, ordered list of events of a single variant. Operations 
 * returning collections leave this instance untouched.
 * <p>
 * Order is not enforced: the collection keeps events in the order given
 * and {@link #isChronological()} tells callers whether the order is by
 * time. {@link #sortByTime()} returns a chronological copy.
 * 
 * @since 1.0
 */
public final class EventCollection implements Iterable<Event> {

  /** The variant of every event, null only for an untyped empty 
   * collection. */
  private final EventType type;

  /** The events. */
  private final ImmutableList<Event> events;

  /**
   * Default ctor.
   * @param type The variant. If null it is taken from the first event.
   * @param events The events, may be null or empty.
   * @throws IllegalArgumentException if an event was null or not of the 
   * collection's variant.
   */
  public EventCollection(final EventType type, 
                         final List<? extends Event> events) {
    this.events = events == null ? ImmutableList.<Event>of() 
        : ImmutableList.<Event>copyOf(events);
    this.type = type != null ? type 
        : this.events.isEmpty() ? null : this.events.get(0).type();
    for (final Event event : this.events) {
      if (event.type() != this.type) {
        throw new IllegalArgumentException("Cannot add a " 
            + event.type().getName() + " event to a " + this.type.getName() 
            + " collection.");
      }
    }
  }

  /**
   * @param events The events, the variant is taken from the first one.
   * @return The collection.
   */
  public static EventCollection of(final List<? extends Event> events) {
    return new EventCollection(null, events);
  }

  /**
   * @param type The variant.
   * @return An empty collection of that variant.
   */
  public static EventCollection empty(final EventType type) {
    return new EventCollection(type, null);
  }

  /** @return The variant of the events, null for an untyped empty 
   * collection. */
  public EventType type() {
    return type;
  }

  /** @return The events, unmodifiable. */
  public List<Event> events() {
    return events;
  }

  @Override
  public Iterator<Event> iterator() {
    return events.iterator();
  }

  /** @return The number of events. */
  public int size() {
    return events.size();
  }

  /** @return The number of events. */
  public int count() {
    return events.size();
  }

  /** @return Whether the collection is empty. */
  public boolean isEmpty() {
    return events.isEmpty();
  }

  /**
   * @param path A non-null path.
   * @return The number of events with a valid value at the path.
   */
  public int sizeValid(final FieldPath path) {
    int valid = 0;
    for (final Event event : events) {
      if (Events.isValidValue(event, path)) {
        valid++;
      }
    }
    return valid;
  }

  /**
   * @param pos A position within the collection.
   * @return The event at the position.
   * @throws IndexOutOfBoundsException if the position was out of range.
   */
  public Event at(final int pos) {
    return events.get(pos);
  }

  /** @return The first event or null if empty. */
  public Event atFirst() {
    return events.isEmpty() ? null : events.get(0);
  }

  /** @return The last event or null if empty. */
  public Event atLast() {
    return events.isEmpty() ? null : events.get(events.size() - 1);
  }

  /**
   * @param key A key such as "1431699673432" or "2015-06".
   * @return The events with the key, possibly empty.
   */
  public List<Event> atKey(final String key) {
    final List<Event> matches = Lists.newArrayList();
    for (final Event event : events) {
      if (event.key().equals(key)) {
        matches.add(event);
      }
    }
    return matches;
  }

  /**
   * Same as {@link #bisect(Instant, int)} starting at the first event.
   * @param instant A non-null instant.
   * @return The position or null if the collection is empty.
   */
  public Integer bisect(final Instant instant) {
    return bisect(instant, 0);
  }

  /**
   * Finds the position of the last event at or before the instant by 
   * scanning forward from the hint. Before the first event the result is
   * clamped to 0, after the last event it is the last position.
   * @param instant A non-null instant.
   * @param hint The position to start scanning from.
   * @return The position or null if the collection is empty.
   */
  public Integer bisect(final Instant instant, final int hint) {
    if (events.isEmpty()) {
      return null;
    }
    final int start = Math.max(0, Math.min(hint, events.size() - 1));
    for (int i = start; i < events.size(); i++) {
      final Instant ts = events.get(i).timestamp();
      if (ts.isAfter(instant)) {
        return i - 1 >= 0 ? i - 1 : 0;
      }
      if (ts.equals(instant)) {
        return i;
      }
    }
    return events.size() - 1;
  }

  /**
   * Half open slice of the collection. Positions are clamped to the 
   * collection and the order is not checked.
   * @param begin The first position, inclusive.
   * @param end The last position, exclusive.
   * @return The slice.
   */
  public EventCollection slice(final int begin, final int end) {
    final int b = Math.max(0, Math.min(begin, events.size()));
    final int e = Math.max(b, Math.min(end, events.size()));
    return new EventCollection(type, events.subList(b, e));
  }

  /**
   * @param path A non-null path.
   * @return A collection without the events whose value at the path is 
   * null, absent or NaN.
   */
  public EventCollection clean(final FieldPath path) {
    return filter(new Predicate<Event>() {
      @Override
      public boolean test(final Event event) {
        return Events.isValidValue(event, path);
      }
    });
  }

  /**
   * @param predicate A non-null predicate.
   * @return A collection with only the events passing the predicate.
   */
  public EventCollection filter(final Predicate<Event> predicate) {
    final List<Event> kept = Lists.newArrayList();
    for (final Event event : events) {
      if (predicate.test(event)) {
        kept.add(event);
      }
    }
    return new EventCollection(type, kept);
  }

  /**
   * @param mapper A non-null function returning non-null events. 
   * Exceptions are propagated.
   * @return A collection with the mapped events, the variant is taken from
   * the mapped events.
   */
  public EventCollection map(final Function<Event, Event> mapper) {
    final List<Event> mapped = Lists.newArrayListWithCapacity(events.size());
    for (final Event event : events) {
      mapped.add(mapper.apply(event));
    }
    return new EventCollection(mapped.isEmpty() ? type : null, mapped);
  }

  /**
   * @param event A non-null event of the collection's variant.
   * @return A new collection with the event appended.
   */
  public EventCollection addEvent(final Event event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null.");
    }
    final List<Event> added = Lists.newArrayList(events);
    added.add(event);
    return new EventCollection(type, added);
  }

  /** @return A collection stably sorted by timestamp. */
  public EventCollection sortByTime() {
    if (isChronological()) {
      return this;
    }
    final List<Event> sorted = Lists.newArrayList(events);
    Collections.sort(sorted, new Comparator<Event>() {
      @Override
      public int compare(final Event a, final Event b) {
        return a.timestamp().compareTo(b.timestamp());
      }
    });
    return new EventCollection(type, sorted);
  }

  /**
   * Stable sort by the value at a path. Numbers sort numerically, other 
   * values by their string form after numbers and missing values last.
   * @param path A non-null path.
   * @return The sorted collection.
   */
  public EventCollection sort(final FieldPath path) {
    final List<Event> sorted = Lists.newArrayList(events);
    Collections.sort(sorted, new Comparator<Event>() {
      @Override
      public int compare(final Event a, final Event b) {
        final Object va = a.get(path);
        final Object vb = b.get(path);
        final boolean valid_a = ValueFilter.isValid(va);
        final boolean valid_b = ValueFilter.isValid(vb);
        if (!valid_a || !valid_b) {
          return valid_a == valid_b ? 0 : valid_a ? -1 : 1;
        }
        final boolean num_a = va instanceof Number;
        final boolean num_b = vb instanceof Number;
        if (num_a && num_b) {
          return Double.compare(((Number) va).doubleValue(), 
              ((Number) vb).doubleValue());
        }
        if (num_a != num_b) {
          return num_a ? -1 : 1;
        }
        return va.toString().compareTo(vb.toString());
      }
    });
    return new EventCollection(type, sorted);
  }

  /** @return True if every event's timestamp is at or after the previous
   * one's. */
  public boolean isChronological() {
    for (int i = 1; i < events.size(); i++) {
      if (events.get(i).timestamp().isBefore(events.get(i - 1).timestamp())) {
        return false;
      }
    }
    return true;
  }

  /** @return The range from the earliest begin to the latest end, null if
   * empty. */
  public TimeRange range() {
    if (events.isEmpty()) {
      return null;
    }
    Instant begin = events.get(0).begin();
    Instant end = events.get(0).end();
    for (final Event event : events) {
      if (event.begin().isBefore(begin)) {
        begin = event.begin();
      }
      if (event.end().isAfter(end)) {
        end = event.end();
      }
    }
    return new TimeRange(begin, end);
  }

  /** @return The earliest begin or null if empty. */
  public Instant begin() {
    final TimeRange range = range();
    return range == null ? null : range.begin();
  }

  /** @return The latest end or null if empty. */
  public Instant end() {
    final TimeRange range = range();
    return range == null ? null : range.end();
  }

  /** @return The union of top level columns in order of first appearance. */
  public List<String> columns() {
    return Events.columns(events);
  }

  /**
   * @param path A non-null path.
   * @return The raw values at the path, one per event, nulls included.
   */
  public List<Object> values(final FieldPath path) {
    final List<Object> values = Lists.newArrayListWithCapacity(events.size());
    for (final Event event : events) {
      values.add(event.get(path));
    }
    return values;
  }

  /**
   * Reduces the values at a path.
   * @param reducer A non-null reducer.
   * @param path A non-null path.
   * @return The reduced value, may be null.
   */
  public Object aggregate(final Reducer reducer, final FieldPath path) {
    if (reducer == null) {
      throw new IllegalArgumentException("Reducer cannot be null.");
    }
    return reducer.reduce(values(path));
  }

  public Double sum(final FieldPath path) {
    return sum(path, ValueFilter.IGNORE_MISSING);
  }

  public Double sum(final FieldPath path, final ValueFilter filter) {
    return (Double) aggregate(Reducers.sum(filter), path);
  }

  public Double min(final FieldPath path) {
    return min(path, ValueFilter.IGNORE_MISSING);
  }

  public Double min(final FieldPath path, final ValueFilter filter) {
    return (Double) aggregate(Reducers.min(filter), path);
  }

  public Double max(final FieldPath path) {
    return max(path, ValueFilter.IGNORE_MISSING);
  }

  public Double max(final FieldPath path, final ValueFilter filter) {
    return (Double) aggregate(Reducers.max(filter), path);
  }

  public Double avg(final FieldPath path) {
    return avg(path, ValueFilter.IGNORE_MISSING);
  }

  public Double avg(final FieldPath path, final ValueFilter filter) {
    return (Double) aggregate(Reducers.avg(filter), path);
  }

  /** Alias of {@link #avg(FieldPath)}. */
  public Double mean(final FieldPath path) {
    return avg(path);
  }

  public Double mean(final FieldPath path, final ValueFilter filter) {
    return avg(path, filter);
  }

  public Double median(final FieldPath path) {
    return median(path, ValueFilter.IGNORE_MISSING);
  }

  public Double median(final FieldPath path, final ValueFilter filter) {
    return (Double) aggregate(Reducers.median(filter), path);
  }

  public Double stdev(final FieldPath path) {
    return stdev(path, ValueFilter.IGNORE_MISSING);
  }

  public Double stdev(final FieldPath path, final ValueFilter filter) {
    return (Double) aggregate(Reducers.stdev(filter), path);
  }

  public Object first(final FieldPath path) {
    return first(path, ValueFilter.IGNORE_MISSING);
  }

  public Object first(final FieldPath path, final ValueFilter filter) {
    return aggregate(Reducers.first(filter), path);
  }

  public Object last(final FieldPath path) {
    return last(path, ValueFilter.IGNORE_MISSING);
  }

  public Object last(final FieldPath path, final ValueFilter filter) {
    return aggregate(Reducers.last(filter), path);
  }

  /**
   * @param q The percentile from 0 to 100.
   * @param path A non-null path.
   * @return The linearly interpolated percentile or null if there were no
   * valid values.
   */
  public Double percentile(final double q, final FieldPath path) {
    return percentile(q, path, PercentileInterpolation.LINEAR, 
        ValueFilter.IGNORE_MISSING);
  }

  /**
   * @param q The percentile from 0 to 100.
   * @param path A non-null path.
   * @param interpolation How to pick between bracketing values.
   * @param filter How to treat missing values.
   * @return The percentile or null if there were no valid values.
   * @throws IllegalArgumentException if q was out of range.
   */
  public Double percentile(final double q, 
                           final FieldPath path,
                           final PercentileInterpolation interpolation,
                           final ValueFilter filter) {
    return (Double) aggregate(
        Reducers.percentile(q, interpolation, filter), path);
  }

  /**
   * Splits the values into {@code n} equally sized parts.
   * @param n The number of parts, at least 1.
   * @param path A non-null path.
   * @param interpolation How to pick between bracketing values.
   * @return The {@code n - 1} cut points, nulls if there were no valid
   * values.
   * @throws IllegalArgumentException if n was less than 1.
   */
  public List<Double> quantile(final int n, 
                               final FieldPath path,
                               final PercentileInterpolation interpolation) {
    if (n < 1) {
      throw new IllegalArgumentException("Quantile count must be at least "
          + "1: " + n);
    }
    final List<Double> cuts = Lists.newArrayListWithCapacity(n - 1);
    for (int i = 1; i < n; i++) {
      cuts.add(percentile(100.0 * i / n, path, interpolation, 
          ValueFilter.IGNORE_MISSING));
    }
    return cuts;
  }

  /**
   * Value equality of two collections: same variant and pairwise equal 
   * events.
   * @param a A collection, may be null.
   * @param b A collection, may be null.
   * @return True if both are null or value equal.
   */
  public static boolean is(final EventCollection a, final EventCollection b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null || a.size() != b.size()) {
      return false;
    }
    if (a.type != b.type && !(a.isEmpty() && b.isEmpty())) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!Events.is(a.events.get(i), b.events.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return is(this, (EventCollection) o);
  }

  @Override
  public int hashCode() {
    return events.hashCode();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("type=")
        .append(type == null ? "null" : type.getName())
        .append(", events=")
        .append(events)
        .toString();
  }
}
