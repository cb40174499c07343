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

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.Locale;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.hash.HashCode;
import com.google.common.math.LongMath;

import net.tidepool.core.Const;
import net.tidepool.utils.DateTime;

/**
 * A string identifier for a span of time. Two families are understood:
 * <ul>
 * <li>Fixed buckets {@code <size>-<n>}, e.g. {@code 5m-4135}, covering
 * {@code [n * size, (n + 1) * size]} in epoch milliseconds.</li>
 * <li>Calendar periods {@code YYYY}, {@code YYYY-MM} or {@code YYYY-MM-DD}
 * covering the whole year, month or day, resolved in UTC or in the system
 * default zone.</li>
 * </ul>
 * The range is resolved once at construction. Indices are ordered by the
 * begin of their range.
 * 
 * @since 1.0
 */
public final class Index implements Comparable<Index> {

  /** The raw index string. */
  private final String raw;

  /** Whether calendar periods resolve in UTC. */
  private final boolean utc;

  /** The resolved range. */
  private final TimeRange range;

  /** Which family the index belongs to. */
  private final Granularity granularity;

  /** The family of an index. */
  private enum Granularity {
    FIXED,
    YEAR,
    MONTH,
    DAY
  }

  /**
   * Ctor resolving calendar periods in UTC.
   * @param raw The non-null index string.
   * @throws IllegalArgumentException if the string could not be parsed.
   */
  public Index(final String raw) {
    this(raw, true);
  }

  /**
   * Default ctor.
   * @param raw The non-null index string.
   * @param utc Whether calendar periods resolve in UTC (true) or in the
   * system default zone (false). Ignored for fixed buckets.
   * @throws IllegalArgumentException if the string could not be parsed.
   */
  public Index(final String raw, final boolean utc) {
    if (Strings.isNullOrEmpty(raw)) {
      throw new IllegalArgumentException("Index cannot be null or empty.");
    }
    this.raw = raw;
    this.utc = utc;
    
    final String[] parts = raw.split("-", 2);
    if (parts.length == 2 && DateTime.isSizeSpec(parts[0])) {
      final long length = DateTime.parseSizeSpec(parts[0]);
      final String digits = parts[1].startsWith("-") 
          ? parts[1].substring(1) : parts[1];
      if (digits.isEmpty() || !DateTime.DIGITS.matchesAllOf(digits)) {
        throw new IllegalArgumentException("Invalid bucket position in index: " 
            + raw);
      }
      final long position;
      try {
        position = Long.parseLong(parts[1]);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid bucket position in index: " 
            + raw, e);
      }
      granularity = Granularity.FIXED;
      try {
        final long begin = LongMath.checkedMultiply(position, length);
        range = new TimeRange(begin, LongMath.checkedAdd(begin, length));
      } catch (ArithmeticException e) {
        throw new IllegalArgumentException("Bucket position out of range in "
            + "index: " + raw, e);
      }
      return;
    }
    
    final ZoneId zone = Const.zone(utc);
    final String[] fields = raw.split("-");
    final int[] values = new int[fields.length];
    if (fields.length > 3 || fields[0].length() != 4) {
      throw new IllegalArgumentException("Unrecognized index: " + raw);
    }
    for (int i = 0; i < fields.length; i++) {
      if (fields[i].isEmpty() || !DateTime.DIGITS.matchesAllOf(fields[i])
          || (i > 0 && fields[i].length() != 2)) {
        throw new IllegalArgumentException("Unrecognized index: " + raw);
      }
      values[i] = Integer.parseInt(fields[i]);
    }
    
    final LocalDate start;
    final LocalDate next;
    try {
      switch (fields.length) {
      case 1:
        granularity = Granularity.YEAR;
        start = LocalDate.of(values[0], 1, 1);
        next = start.plusYears(1);
        break;
      case 2:
        granularity = Granularity.MONTH;
        start = LocalDate.of(values[0], values[1], 1);
        next = start.plusMonths(1);
        break;
      default:
        granularity = Granularity.DAY;
        start = LocalDate.of(values[0], values[1], values[2]);
        next = start.plusDays(1);
      }
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("Invalid calendar index: " + raw, e);
    }
    range = new TimeRange(start.atStartOfDay(zone).toInstant(),
        next.atStartOfDay(zone).toInstant().minusMillis(1));
  }

  /** @return The raw index string. */
  public String asString() {
    return raw;
  }

  /** @return The resolved range. */
  public TimeRange asTimeRange() {
    return range;
  }

  /** @return The begin of the resolved range. */
  public Instant begin() {
    return range.begin();
  }

  /** @return The end of the resolved range. */
  public Instant end() {
    return range.end();
  }

  /** @return Whether calendar periods resolve in UTC. */
  public boolean isUTC() {
    return utc;
  }

  /** @return Whether this is a fixed size bucket index. */
  public boolean isFixed() {
    return granularity == Granularity.FIXED;
  }

  /** @return The JSON form, the raw string. */
  public String toJSON() {
    return raw;
  }

  /**
   * Renders calendar indices for display: "2015" for a year, "June" for a
   * month and "June 12th" for a day. Fixed indices render as is.
   * @return The nice string.
   */
  public String toNiceString() {
    final ZonedDateTime start = range.begin().atZone(Const.zone(utc));
    switch (granularity) {
    case YEAR:
      return Integer.toString(start.getYear());
    case MONTH:
      return start.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    case DAY:
      return start.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH) 
          + " " + DateTime.ordinal(start.getDayOfMonth());
    default:
      return raw;
    }
  }

  /**
   * Builds a day index such as "2015-06-12".
   * @param instant A non-null instant.
   * @param utc Whether to resolve the day in UTC or the local zone.
   * @return The index string.
   */
  public static String dailyIndexString(final Instant instant, 
                                        final boolean utc) {
    final ZonedDateTime dt = instant.atZone(Const.zone(utc));
    return String.format("%04d-%02d-%02d", 
        dt.getYear(), dt.getMonthValue(), dt.getDayOfMonth());
  }

  /**
   * Builds a month index such as "2015-06".
   * @param instant A non-null instant.
   * @param utc Whether to resolve the month in UTC or the local zone.
   * @return The index string.
   */
  public static String monthlyIndexString(final Instant instant, 
                                          final boolean utc) {
    final ZonedDateTime dt = instant.atZone(Const.zone(utc));
    return String.format("%04d-%02d", dt.getYear(), dt.getMonthValue());
  }

  /**
   * Builds a year index such as "2015".
   * @param instant A non-null instant.
   * @param utc Whether to resolve the year in UTC or the local zone.
   * @return The index string.
   */
  public static String yearlyIndexString(final Instant instant, 
                                         final boolean utc) {
    return String.format("%04d", instant.atZone(Const.zone(utc)).getYear());
  }

  /**
   * Builds a fixed bucket index such as "5m-4135". Always UTC.
   * @param size A valid bucket size.
   * @param instant A non-null instant.
   * @return The index string.
   * @throws net.tidepool.exceptions.InvalidSizeSpecException if the size
   * was malformed.
   */
  public static String fixedIndexString(final String size, 
                                        final Instant instant) {
    return BucketGenerator.bucketIndex(size, instant);
  }

  @Override
  public int compareTo(final Index other) {
    return range.compareTo(other.range);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Index other = (Index) o;
    return Objects.equal(raw, other.raw) && utc == other.utc;
  }

  @Override
  public int hashCode() {
    return buildHashCode().asInt();
  }

  /** @return A HashCode object for deterministic, non-secure hashing */
  public HashCode buildHashCode() {
    return Const.HASH_FUNCTION().newHasher()
        .putString(raw, Const.UTF8_CHARSET)
        .putBoolean(utc)
        .hash();
  }

  @Override
  public String toString() {
    return raw;
  }
}
