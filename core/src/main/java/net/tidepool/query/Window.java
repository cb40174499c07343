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

import java.time.Instant;

import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.tidepool.time.BucketGenerator;
import net.tidepool.time.Index;
import net.tidepool.utils.DateTime;

/**
 * A windowing policy mapping each instant to the index of the window 
 * containing it. Windows are either fixed size buckets ("30s", "5m", "1d",
 * "hourly" being an alias of "1h") or calendar periods ("daily", "monthly",
 * "yearly") resolved in UTC or in the system default zone.
 * <p>
 * The zone is fixed per window from the pipeline's utc flag, the zone of 
 * an individual event never changes which calendar period it falls in.
 * 
 * @since 1.0
 */
public final class Window {
  public static final String HOURLY = "hourly";
  public static final String DAILY = "daily";
  public static final String MONTHLY = "monthly";
  public static final String YEARLY = "yearly";

  /** The window as given. */
  private final String spec;

  /** Whether calendar windows resolve in UTC. */
  private final boolean utc;

  /** The generator for fixed windows, null for calendar ones. */
  private final BucketGenerator generator;

  private Window(final String spec, final boolean utc) {
    validate(spec);
    this.spec = spec;
    this.utc = utc;
    if (HOURLY.equals(spec)) {
      generator = new BucketGenerator("1h");
    } else if (DateTime.isSizeSpec(spec)) {
      generator = new BucketGenerator(spec);
    } else {
      generator = null;
    }
  }

  /**
   * @param spec A bucket size or one of the calendar names.
   * @param utc Whether calendar windows resolve in UTC.
   * @return The window.
   * @throws IllegalArgumentException if the spec was invalid.
   */
  public static Window of(final String spec, final boolean utc) {
    return new Window(spec, utc);
  }

  /**
   * Checks a window spec.
   * @param spec The spec to check.
   * @throws net.tidepool.exceptions.InvalidSizeSpecException if the spec 
   * was neither a calendar name nor a valid bucket size.
   */
  public static void validate(final String spec) {
    if (Strings.isNullOrEmpty(spec)) {
      throw new IllegalArgumentException("Window cannot be null or empty.");
    }
    if (HOURLY.equals(spec) || DAILY.equals(spec) || MONTHLY.equals(spec) 
        || YEARLY.equals(spec)) {
      return;
    }
    DateTime.parseSizeSpec(spec);
  }

  /** @return The window as given. */
  public String spec() {
    return spec;
  }

  /** @return Whether calendar windows resolve in UTC. */
  public boolean isUTC() {
    return utc;
  }

  /** @return Whether the window is a fixed size bucket. */
  public boolean isFixed() {
    return generator != null;
  }

  /**
   * @param instant A non-null instant.
   * @return The index string of the window containing the instant.
   */
  public String indexString(final Instant instant) {
    if (generator != null) {
      return generator.bucketIndex(instant);
    }
    switch (spec) {
    case DAILY:
      return Index.dailyIndexString(instant, utc);
    case MONTHLY:
      return Index.monthlyIndexString(instant, utc);
    default:
      return Index.yearlyIndexString(instant, utc);
    }
  }

  /**
   * @param instant A non-null instant.
   * @return The index of the window containing the instant.
   */
  public Index index(final Instant instant) {
    return new Index(indexString(instant), utc);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Window other = (Window) o;
    return Objects.equal(spec, other.spec) && utc == other.utc;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(spec, utc);
  }

  @Override
  public String toString() {
    return spec + (utc ? " (UTC)" : " (local)");
  }
}
