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
package net.tidepool.query.pojo;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import net.tidepool.time.TimeRange;

/**
 * Which instant of a span represents it when converting to point events,
 * or where a point sits within the span built around it.
 * @since 1.0
 */
public enum TimeAlignment {
  /** The begin of the span. */
  BEGIN("begin"),
  
  /** The middle of the span. */
  CENTER("center"),
  
  /** The end of the span. */
  END("end");

  private final String name;

  TimeAlignment(final String name) {
    this.name = name;
  }

  @JsonValue
  public String getName() {
    return name;
  }

  /**
   * @param range A non-null range.
   * @return The instant of the range matching this alignment.
   */
  public Instant pick(final TimeRange range) {
    switch (this) {
    case BEGIN:
      return range.begin();
    case CENTER:
      return Instant.ofEpochMilli((range.begin().toEpochMilli() 
          + range.end().toEpochMilli()) / 2);
    case END:
      return range.end();
    default:
      throw new IllegalStateException("Unhandled alignment: " + this);
    }
  }

  /**
   * Builds a range of the given length around an instant.
   * @param instant A non-null instant.
   * @param duration The length of the range in milliseconds.
   * @return The range with the instant at its begin, center or end.
   */
  public TimeRange around(final Instant instant, final long duration) {
    final long ts = instant.toEpochMilli();
    switch (this) {
    case BEGIN:
      return new TimeRange(ts, ts + duration);
    case CENTER:
      return new TimeRange(ts - duration / 2, ts + duration / 2);
    case END:
      return new TimeRange(ts - duration, ts);
    default:
      throw new IllegalStateException("Unhandled alignment: " + this);
    }
  }

  /**
   * @param name A user friendly name, "lead" and "lag" are accepted for
   * end and begin.
   * @return The alignment.
   * @throws IllegalArgumentException if the name doesn't match
   */
  @JsonCreator
  public static TimeAlignment fromString(final String name) {
    if ("lag".equalsIgnoreCase(name)) {
      return BEGIN;
    }
    if ("lead".equalsIgnoreCase(name)) {
      return END;
    }
    for (final TimeAlignment alignment : TimeAlignment.values()) {
      if (alignment.name.equalsIgnoreCase(name)) {
        return alignment;
      }
    }
    throw new IllegalArgumentException("Unrecognized time alignment: " + name);
  }
}
