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

import com.google.common.base.Strings;

import net.tidepool.exceptions.MissingRequiredOptionException;
import net.tidepool.query.Window;

/**
 * Options for a rollup: the window to aggregate over, the aggregation to
 * apply per window and whether the windowed output should be converted 
 * back to point events at the begin of each window.
 * @since 1.0
 */
public class RollupOptions extends Validatable {
  private final String window_size;
  private final Aggregation aggregation;
  private final boolean to_time_events;
  private final Boolean utc;

  protected RollupOptions(final Builder builder) {
    window_size = builder.windowSize;
    aggregation = builder.aggregation;
    to_time_events = builder.toTimeEvents;
    utc = builder.utc;
  }

  /** @return The window, a bucket size or "hourly", "daily", "monthly" or
   * "yearly". */
  public String getWindowSize() {
    return window_size;
  }

  /** @return The aggregation. */
  public Aggregation getAggregation() {
    return aggregation;
  }

  /** @return Whether to convert the output to time events. */
  public boolean getToTimeEvents() {
    return to_time_events;
  }

  /** @return Whether calendar windows resolve in UTC, null to use the 
   * series' setting. */
  public Boolean getUtc() {
    return utc;
  }

  /**
   * @throws MissingRequiredOptionException if the window size or the 
   * aggregation was missing.
   * @throws IllegalArgumentException if the window size was invalid.
   */
  @Override
  public void validate() {
    if (Strings.isNullOrEmpty(window_size)) {
      throw new MissingRequiredOptionException("Rollup requires a window "
          + "size.");
    }
    if (aggregation == null) {
      throw new MissingRequiredOptionException("Rollup requires an "
          + "aggregation.");
    }
    Window.validate(window_size);
    validatePOJO(aggregation, "aggregation");
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("windowSize=")
        .append(window_size)
        .append(", aggregation=")
        .append(aggregation)
        .append(", toTimeEvents=")
        .append(to_time_events)
        .append(", utc=")
        .append(utc)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Clones options into a new builder.
   * @param options A non-null options to pull values from
   * @return A new builder populated with values from the given options.
   */
  public static Builder newBuilder(final RollupOptions options) {
    if (options == null) {
      throw new IllegalArgumentException("Options cannot be null.");
    }
    return new Builder()
        .setWindowSize(options.window_size)
        .setAggregation(options.aggregation)
        .setToTimeEvents(options.to_time_events)
        .setUtc(options.utc);
  }

  public static final class Builder {
    private String windowSize;
    private Aggregation aggregation;
    private boolean toTimeEvents;
    private Boolean utc;

    public Builder setWindowSize(final String window_size) {
      this.windowSize = window_size;
      return this;
    }

    public Builder setAggregation(final Aggregation aggregation) {
      this.aggregation = aggregation;
      return this;
    }

    public Builder setToTimeEvents(final boolean to_time_events) {
      this.toTimeEvents = to_time_events;
      return this;
    }

    public Builder setUtc(final Boolean utc) {
      this.utc = utc;
      return this;
    }

    /**
     * Builds the options without validating them so that the window can be
     * filled in by the rollup helpers.
     * @return The options.
     */
    public RollupOptions build() {
      return new RollupOptions(this);
    }
  }
}
