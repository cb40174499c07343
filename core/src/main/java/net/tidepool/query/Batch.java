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
package net.tidepool.query;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tidepool.data.Event;

/**
 * The events flowing between pipeline stages along with the grouping in
 * effect. Stages that emit one event per group (e.g. aggregation) pin the 
 * group key of their output so that later stages and the final collection
 * see the group the event was built for, not a key recomputed from the
 * new event.
 * 
 * @since 1.0
 */
public final class Batch {
  private final List<Event> events;
  private final Grouping grouping;

  /** Pinned keys, one per event, or null to compute them. */
  private final List<String> keys;

  private Batch(final List<Event> events, 
                final Grouping grouping, 
                final List<String> keys) {
    this.events = events;
    this.grouping = grouping;
    this.keys = keys;
  }

  /**
   * @param events The non-null source events.
   * @return A batch without grouping.
   */
  public static Batch of(final List<Event> events) {
    return new Batch(ImmutableList.copyOf(events), Grouping.NONE, null);
  }

  /** @return The events. */
  public List<Event> events() {
    return events;
  }

  /** @return The grouping in effect. */
  public Grouping grouping() {
    return grouping;
  }

  /**
   * @param i The position of an event.
   * @return The group key of the event.
   */
  public String keyOf(final int i) {
    return keys != null ? keys.get(i) : grouping.keyFor(events.get(i));
  }

  /** @return The events by group key in order of first appearance. */
  public Map<String, List<Event>> groups() {
    final Map<String, List<Event>> groups = Maps.newLinkedHashMap();
    for (int i = 0; i < events.size(); i++) {
      final String key = keyOf(i);
      List<Event> group = groups.get(key);
      if (group == null) {
        group = Lists.newArrayList();
        groups.put(key, group);
      }
      group.add(events.get(i));
    }
    return groups;
  }

  /**
   * @param events The new events.
   * @return A batch with the events, the grouping and keys computed from 
   * the new events.
   */
  public Batch withEvents(final List<Event> events) {
    return new Batch(ImmutableList.copyOf(events), grouping, null);
  }

  /**
   * @param events The new events.
   * @param keys The group key of each event.
   * @return A batch with the events and pinned keys.
   */
  public Batch withKeyedEvents(final List<Event> events, 
                               final List<String> keys) {
    if (events.size() != keys.size()) {
      throw new IllegalArgumentException("Got " + events.size() 
          + " events but " + keys.size() + " keys.");
    }
    return new Batch(ImmutableList.copyOf(events), grouping, 
        ImmutableList.copyOf(keys));
  }

  /**
   * @param grouping The new grouping.
   * @return A batch with the same events whose keys follow the new
   * grouping.
   */
  public Batch withGrouping(final Grouping grouping) {
    return new Batch(events, grouping, null);
  }

  /**
   * Maps every event one to one, keeping pinned keys.
   * @param mapper A function returning non-null events.
   * @return The mapped batch.
   */
  public Batch mapEvents(final Function<Event, Event> mapper) {
    final List<Event> mapped = Lists.newArrayListWithCapacity(events.size());
    for (final Event event : events) {
      mapped.add(mapper.apply(event));
    }
    return new Batch(ImmutableList.copyOf(mapped), grouping, keys);
  }

  /**
   * Replaces the events one to one, keeping pinned keys.
   * @param events As many events as this batch holds, in the same order.
   * @return The new batch.
   */
  public Batch withReplacedEvents(final List<Event> events) {
    if (events.size() != this.events.size()) {
      throw new IllegalArgumentException("Expected " + this.events.size() 
          + " events but got " + events.size());
    }
    return new Batch(ImmutableList.copyOf(events), grouping, keys);
  }

  /**
   * Keeps the events at the given positions, keeping pinned keys.
   * @param positions Ascending positions.
   * @return The filtered batch.
   */
  public Batch retain(final List<Integer> positions) {
    final List<Event> kept = Lists.newArrayListWithCapacity(positions.size());
    final List<String> kept_keys = keys == null ? null 
        : Lists.<String>newArrayListWithCapacity(positions.size());
    for (final int i : positions) {
      kept.add(events.get(i));
      if (kept_keys != null) {
        kept_keys.add(keys.get(i));
      }
    }
    return new Batch(ImmutableList.copyOf(kept), grouping, 
        kept_keys == null ? null : ImmutableList.copyOf(kept_keys));
  }
}
