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
package net.tidepool.query.aggregators;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;

/**
 * How a percentile falling between two order statistics is computed, the
 * same modes as numpy's percentile.
 * 
 * @since 1.0
 */
public enum PercentileInterpolation {
  /** {@code v0 + (v1 - v0) * fraction} */
  LINEAR("linear"),
  
  /** The lower order statistic. */
  LOWER("lower"),
  
  /** The higher order statistic. */
  HIGHER("higher"),
  
  /** Whichever order statistic is nearest, the higher one on ties. */
  NEAREST("nearest"),
  
  /** The mean of both order statistics. */
  MIDPOINT("midpoint");

  private final String name;

  PercentileInterpolation(final String name) {
    this.name = name;
  }

  @JsonValue
  public String getName() {
    return name;
  }

  /**
   * Interpolates between two bracketing values.
   * @param v0 The lower order statistic.
   * @param v1 The higher order statistic.
   * @param fraction The position between both, from 0 inclusive to 1
   * exclusive.
   * @return The interpolated value.
   */
  public double interpolate(final double v0, 
                            final double v1, 
                            final double fraction) {
    if (fraction == 0) {
      return v0;
    }
    switch (this) {
    case LINEAR:
      return v0 + (v1 - v0) * fraction;
    case LOWER:
      return v0;
    case HIGHER:
      return v1;
    case NEAREST:
      return fraction < 0.5 ? v0 : v1;
    case MIDPOINT:
      return (v0 + v1) / 2;
    default:
      throw new IllegalStateException("Unhandled interpolation: " + this);
    }
  }

  /**
   * @param name A non-null name, case insensitive.
   * @return The interpolation.
   * @throws IllegalArgumentException if the name was null, empty or 
   * unknown.
   */
  @JsonCreator
  public static PercentileInterpolation fromString(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Interpolation cannot be null or "
          + "empty.");
    }
    for (final PercentileInterpolation interpolation : values()) {
      if (interpolation.name.equalsIgnoreCase(name)) {
        return interpolation;
      }
    }
    throw new IllegalArgumentException("Unknown interpolation: " + name);
  }
}
