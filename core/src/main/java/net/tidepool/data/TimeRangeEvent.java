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
 * An event spanning a range of time, e.g. the output of a rate or of an
 * aggregation without a window.
 * 
 * @since 1.0
 */
public final class TimeRangeEvent extends BaseEvent {

  /** The span of the event. */
  private final TimeRange range;

  /**
   * Default ctor.
   * @param range A non-null range.
   * @param data The payload, may be null for an empty one.
   */
  public TimeRangeEvent(final TimeRange range, final EventData data) {
    super(data);
    if (range == null) {
      throw new IllegalArgumentException("Range cannot be null.");
    }
    this.range = range;
  }

  @Override
  public EventType type() {
    return EventType.TIMERANGE;
  }

  @Override
  public String key() {
    return range.begin().toEpochMilli() + "," + range.end().toEpochMilli();
  }

  @Override
  public Object keyJSON() {
    return range.toJSON();
  }

  @Override
  public Instant begin() {
    return range.begin();
  }

  @Override
  public Instant end() {
    return range.end();
  }

  @Override
  public TimeRange timerange() {
    return range;
  }

  /** @return The range formatted in UTC. */
  public String timerangeAsUTCString() {
    return range.toUTCString();
  }

  /** @return The range formatted in the system default zone. */
  public String timerangeAsLocalString() {
    return range.toLocalString();
  }

  /** @return The length of the range in a human readable form. */
  public String humanizeDuration() {
    return range.humanizeDuration();
  }

  @Override
  public TimeRangeEvent setData(final EventData data) {
    return new TimeRangeEvent(range, data);
  }
}
