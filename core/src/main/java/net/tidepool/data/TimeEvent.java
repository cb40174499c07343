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

import net.tidepool.time.TimeRange;

/**
 * An event at a single point in time.
 * 
 * @since 1.0
 */
public final class TimeEvent extends BaseEvent {

  /** The instant of the event. */
  private final Instant timestamp;

  /**
   * Default ctor.
   * @param timestamp A non-null instant.
   * @param data The payload, may be null for an empty one.
   */
  public TimeEvent(final Instant timestamp, final EventData data) {
    super(data);
    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null.");
    }
    this.timestamp = timestamp;
  }

  /**
   * Ctor from epoch milliseconds.
   * @param timestamp The time in epoch milliseconds.
   * @param data The payload, may be null for an empty one.
   */
  public TimeEvent(final long timestamp, final EventData data) {
    this(Instant.ofEpochMilli(timestamp), data);
  }

  /**
   * Ctor with a single "value" column.
   * @param timestamp The time in epoch milliseconds.
   * @param value The value of the column, may be null.
   */
  public TimeEvent(final long timestamp, final Object value) {
    this(Instant.ofEpochMilli(timestamp), 
        EventData.of(FieldPath.DEFAULT.head(), value));
  }

  @Override
  public EventType type() {
    return EventType.TIME;
  }

  @Override
  public String key() {
    return Long.toString(timestamp.toEpochMilli());
  }

  @Override
  public Object keyJSON() {
    return timestamp.toEpochMilli();
  }

  @Override
  public Instant timestamp() {
    return timestamp;
  }

  @Override
  public Instant begin() {
    return timestamp;
  }

  @Override
  public Instant end() {
    return timestamp;
  }

  @Override
  public TimeRange timerange() {
    return new TimeRange(timestamp, timestamp);
  }

  @Override
  public TimeEvent setData(final EventData data) {
    return new TimeEvent(timestamp, data);
  }
}
