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
package net.tidepool.time;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;

import net.tidepool.core.Const;
import net.tidepool.utils.DateTime;

/**
 * An immutable, closed span of time between two instants with millisecond
 * resolution. Ranges are ordered by their begin, then end instant.
 * 
 * @since 1.0
 */
public final class TimeRange implements Comparable<TimeRange> {

  /** The inclusive start. */
  private final Instant begin;

  /** The inclusive end. */
  private final Instant end;

  /**
   * Default ctor.
   * @param begin A non-null begin instant.
   * @param end A non-null end instant equal to or after the begin.
   * @throws IllegalArgumentException if either instant was null or the end
   * was before the begin.
   */
  public TimeRange(final Instant begin, final Instant end) {
    checkArgument(begin != null, "Begin cannot be null.");
    checkArgument(end != null, "End cannot be null.");
    checkArgument(!end.isBefore(begin), 
        "The end cannot be before the begin. Begin %s, end %s", 
        begin.toEpochMilli(), end.toEpochMilli());
    this.begin = begin;
    this.end = end;
  }

  /**
   * Ctor from epoch milliseconds.
   * @param begin_ms The begin in Unix epoch milliseconds.
   * @param end_ms The end in Unix epoch milliseconds.
   * @throws IllegalArgumentException if the end was before the begin.
   */
  public TimeRange(final long begin_ms, final long end_ms) {
    this(Instant.ofEpochMilli(begin_ms), Instant.ofEpochMilli(end_ms));
  }

  /**
   * Parses a two element array of epoch milliseconds.
   * @param json A non-null list of two numbers.
   * @return The range.
   * @throws IllegalArgumentException if the list was null, of the wrong
   * size or contained something other than numbers.
   */
  public static TimeRange fromJSON(final List<?> json) {
    checkArgument(json != null && json.size() == 2, 
        "Time range must be an array of two timestamps: %s", json);
    checkArgument(json.get(0) instanceof Number && json.get(1) instanceof Number, 
        "Time range timestamps must be numeric: %s", json);
    return new TimeRange(((Number) json.get(0)).longValue(), 
        ((Number) json.get(1)).longValue());
  }

  /** @return The begin instant. */
  public Instant begin() {
    return begin;
  }

  /** @return The end instant. */
  public Instant end() {
    return end;
  }

  /** @return A new range with the given begin and this range's end. */
  public TimeRange setBegin(final Instant begin) {
    return new TimeRange(begin, end);
  }

  /** @return A new range with this range's begin and the given end. */
  public TimeRange setEnd(final Instant end) {
    return new TimeRange(begin, end);
  }

  /** @return The span of the range. */
  public Duration duration() {
    return Duration.between(begin, end);
  }

  /**
   * @param instant A non-null instant.
   * @return True if the instant falls within the range, bounds included.
   */
  public boolean contains(final Instant instant) {
    return !instant.isBefore(begin) && !instant.isAfter(end);
  }

  /**
   * @param other A non-null range.
   * @return True if the other range lies entirely within this one.
   */
  public boolean contains(final TimeRange other) {
    return !other.begin.isBefore(begin) && !other.end.isAfter(end);
  }

  /**
   * @param other A non-null range.
   * @return True if this range lies entirely within the other.
   */
  public boolean within(final TimeRange other) {
    return other.contains(this);
  }

  /**
   * @param other A non-null range.
   * @return True if the ranges share at least one instant.
   */
  public boolean overlaps(final TimeRange other) {
    return !other.begin.isAfter(end) && !other.end.isBefore(begin);
  }

  /**
   * @param other A non-null range.
   * @return True if the ranges share nothing.
   */
  public boolean disjoint(final TimeRange other) {
    return !overlaps(other);
  }

  /**
   * @param other A non-null range.
   * @return The smallest range covering both ranges.
   */
  public TimeRange extents(final TimeRange other) {
    final Instant b = begin.isBefore(other.begin) ? begin : other.begin;
    final Instant e = end.isAfter(other.end) ? end : other.end;
    return new TimeRange(b, e);
  }

  /**
   * @param other A non-null range.
   * @return The shared part of both ranges or null if they are disjoint.
   */
  public TimeRange intersection(final TimeRange other) {
    if (disjoint(other)) {
      return null;
    }
    final Instant b = begin.isAfter(other.begin) ? begin : other.begin;
    final Instant e = end.isBefore(other.end) ? end : other.end;
    return new TimeRange(b, e);
  }

  /** @return The range as a two element list of epoch milliseconds. */
  public List<Long> toJSON() {
    return ImmutableList.of(begin.toEpochMilli(), end.toEpochMilli());
  }

  /** @return Both bounds formatted in UTC, e.g. "[2015-..., 2015-...]". */
  public String toUTCString() {
    return "[" + DateTime.toUTCString(begin) + ", " 
        + DateTime.toUTCString(end) + "]";
  }

  /** @return Both bounds formatted in the system default zone. */
  public String toLocalString() {
    return "[" + DateTime.toLocalString(begin) + ", " 
        + DateTime.toLocalString(end) + "]";
  }

  /** @return The duration in a human readable form, e.g. "2 hours". */
  public String humanizeDuration() {
    return DateTime.humanizeDuration(duration().toMillis());
  }

  @Override
  public int compareTo(final TimeRange other) {
    return ComparisonChain.start()
        .compare(begin, other.begin)
        .compare(end, other.end)
        .result();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeRange other = (TimeRange) o;
    return Objects.equal(begin, other.begin) 
        && Objects.equal(end, other.end);
  }

  @Override
  public int hashCode() {
    return buildHashCode().asInt();
  }

  /** @return A HashCode object for deterministic, non-secure hashing */
  public HashCode buildHashCode() {
    return Const.HASH_FUNCTION().newHasher()
        .putLong(begin.toEpochMilli())
        .putLong(end.toEpochMilli())
        .hash();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("begin=")
        .append(begin.toEpochMilli())
        .append(", end=")
        .append(end.toEpochMilli())
        .toString();
  }
}
