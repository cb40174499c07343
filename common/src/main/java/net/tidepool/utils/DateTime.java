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
package net.tidepool.utils;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import net.tidepool.core.Const;
import net.tidepool.exceptions.InvalidSizeSpecException;

/**
 * Utility class that provides helpers for dealing with bucket sizes,
 * calendar periods and human readable time strings.
 * <p>
 * Bucket sizes follow the grammar {@code <positive integer><unit>} where the
 * unit is one of:<ul>
 * <li>{@code s}: seconds</li>
 * <li>{@code m}: minutes</li>
 * <li>{@code h}: hours</li>
 * <li>{@code d}: days</li></ul>
 * @since 1.0
 */
public class DateTime {

  /** Multipliers, in seconds, for each size unit. */
  public static final Map<Character, Long> UNITS =
      ImmutableMap.<Character, Long>builder()
        .put('s', 1L)
        .put('m', 60L)
        .put('h', 3600L)
        .put('d', 86400L)
        .build();

  /** Labels for each size unit, used when humanizing. */
  private static final Map<Character, String> UNIT_LABELS =
      ImmutableMap.<Character, String>builder()
        .put('s', "seconds")
        .put('m', "minutes")
        .put('h', "hours")
        .put('d', "days")
        .build();

  /** Format used for {@link #toUTCString(Instant)} and friends. */
  private static final DateTimeFormatter FORMATTER =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");

  /** ASCII digits only, other Unicode digits are rejected. */
  public static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  /**
   * Parses a bucket size (e.g, "30s", "5m", "1h", "1d") into milliseconds.
   * @param size The size to parse.
   * @return A strictly positive number of milliseconds.
   * @throws InvalidSizeSpecException if the size was null, empty or
   * malformed.
   */
  public static long parseSizeSpec(final String size) {
    if (Strings.isNullOrEmpty(size)) {
      throw new InvalidSizeSpecException("Size cannot be null or empty.");
    }
    final int unit = unitIndex(size);
    final long count;
    try {
      count = Long.parseLong(size.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new InvalidSizeSpecException("Invalid size (number): " + size, e);
    }
    if (count <= 0) {
      throw new InvalidSizeSpecException("Zero or negative size: " + size);
    }
    final long multiplier = UNITS.get(size.charAt(unit)) * 1000;
    if ((double) count * multiplier > Long.MAX_VALUE) {
      throw new InvalidSizeSpecException("Size must be < Long.MAX_VALUE ms: "
          + size);
    }
    return count * multiplier;
  }

  /**
   * Whether or not the string matches the bucket size grammar.
   * @param size A string to check. May be null.
   * @return True if {@link #parseSizeSpec(String)} would succeed.
   */
  public static boolean isSizeSpec(final String size) {
    if (Strings.isNullOrEmpty(size)) {
      return false;
    }
    try {
      parseSizeSpec(size);
      return true;
    } catch (InvalidSizeSpecException e) {
      return false;
    }
  }

  /**
   * Returns the unit character of a bucket size.
   * @param size A non-null and valid size.
   * @return The unit, one of s, m, h or d.
   * @throws InvalidSizeSpecException if the size was malformed.
   */
  public static char getSizeUnits(final String size) {
    if (Strings.isNullOrEmpty(size)) {
      throw new InvalidSizeSpecException("Size cannot be null or empty.");
    }
    return size.charAt(unitIndex(size));
  }

  /**
   * Returns the numeric part of a bucket size.
   * @param size A non-null and valid size.
   * @return The count of units.
   * @throws InvalidSizeSpecException if the size was malformed.
   */
  public static long getSizeCount(final String size) {
    return parseSizeSpec(size) / (UNITS.get(getSizeUnits(size)) * 1000);
  }

  /**
   * Renders a number of milliseconds in a human readable way using the
   * largest whole unit, e.g. "2 hours" or "1 day".
   * @param ms A non-negative duration in milliseconds.
   * @return The humanized duration.
   */
  public static String humanizeDuration(final long ms) {
    if (ms < 1000) {
      return ms + (ms == 1 ? " millisecond" : " milliseconds");
    }
    final long seconds = ms / 1000;
    for (final char unit : new char[] { 'd', 'h', 'm', 's' }) {
      final long multiplier = UNITS.get(unit);
      if (seconds >= multiplier) {
        final long count = seconds / multiplier;
        final String label = UNIT_LABELS.get(unit);
        return count + " " + (count == 1
            ? label.substring(0, label.length() - 1) : label);
      }
    }
    // unreachable as seconds is at least 1 here
    return seconds + " seconds";
  }

  /**
   * Formats the instant in UTC as an ISO-8601 string with milliseconds.
   * @param instant A non-null instant.
   * @return The formatted string.
   */
  public static String toUTCString(final Instant instant) {
    return FORMATTER.format(instant.atZone(Const.UTC));
  }

  /**
   * Formats the instant in the system default zone.
   * @param instant A non-null instant.
   * @return The formatted string.
   */
  public static String toLocalString(final Instant instant) {
    return FORMATTER.format(instant.atZone(ZoneId.systemDefault()));
  }

  /**
   * Appends the English ordinal suffix to a day of month.
   * @param day The day, 1 to 31.
   * @return E.g. "1st", "12th" or "23rd".
   */
  public static String ordinal(final int day) {
    if (day % 100 >= 11 && day % 100 <= 13) {
      return day + "th";
    }
    switch (day % 10) {
    case 1:
      return day + "st";
    case 2:
      return day + "nd";
    case 3:
      return day + "rd";
    default:
      return day + "th";
    }
  }

  /**
   * Locates the unit character and validates the digits before it.
   * @param size A non-empty size.
   * @return The index of the unit.
   */
  private static int unitIndex(final String size) {
    int unit = 0;
    while (unit < size.length() && DIGITS.matches(size.charAt(unit))) {
      unit++;
    }
    if (unit == 0) {
      throw new InvalidSizeSpecException("Invalid size, must start with an "
          + "integer: " + size);
    }
    if (unit != size.length() - 1) {
      throw new InvalidSizeSpecException("Invalid size, must have an "
          + "integer and a single unit: " + size);
    }
    if (!UNITS.containsKey(size.charAt(unit))) {
      throw new InvalidSizeSpecException("Invalid size (suffix): " + size);
    }
    return unit;
  }
}
