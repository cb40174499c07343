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

import net.tidepool.time.Index;
import net.tidepool.time.TimeRange;

/**
 * An event keyed by an {@link Index}, a fixed bucket or a calendar period.
 * Produced by windowed aggregations.
 * 
 * @since 1.0
 */
public final class IndexedEvent extends BaseEvent {

  /** The index of the event. */
  private final Index index;

  /**
   * Default ctor.
   * @param index A non-null index.
   * @param data The payload, may be null for an empty one.
   */
  public IndexedEvent(final Index index, final EventData data) {
    super(data);
    if (index == null) {
      throw new IllegalArgumentException("Index cannot be null.");
    }
    this.index = index;
  }

  /**
   * Ctor parsing the index.
   * @param index A non-null index string.
   * @param data The payload, may be null for an empty one.
   * @param utc Whether calendar indices resolve in UTC.
   */
  public IndexedEvent(final String index, 
                      final EventData data, 
                      final boolean utc) {
    this(new Index(index, utc), data);
  }

  @Override
  public EventType type() {
    return EventType.INDEX;
  }

  @Override
  public String key() {
    return index.asString();
  }

  @Override
  public Object keyJSON() {
    return index.asString();
  }

  /** @return The index. */
  public Index index() {
    return index;
  }

  /** @return The raw index string. */
  public String indexAsString() {
    return index.asString();
  }

  /** @return Whether the index resolves in UTC. */
  public boolean isUTC() {
    return index.isUTC();
  }

  @Override
  public Instant begin() {
    return index.begin();
  }

  @Override
  public Instant end() {
    return index.end();
  }

  @Override
  public TimeRange timerange() {
    return index.asTimeRange();
  }

  /** @return The covered range formatted in UTC. */
  public String timerangeAsUTCString() {
    return timerange().toUTCString();
  }

  /** @return The covered range formatted in the system default zone. */
  public String timerangeAsLocalString() {
    return timerange().toLocalString();
  }

  @Override
  public IndexedEvent setData(final EventData data) {
    return new IndexedEvent(index, data);
  }
}
