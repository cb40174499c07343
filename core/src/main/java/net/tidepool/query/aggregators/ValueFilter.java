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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

/**
 * How missing values (null or NaN) are treated before they reach a 
 * reducer.
 * 
 * @since 1.0
 */
public enum ValueFilter {
  /** Values are passed as is, missing ones included. */
  KEEP_MISSING("keepMissing"),
  
  /** Missing values are dropped. */
  IGNORE_MISSING("ignoreMissing"),
  
  /** Missing values are replaced with zero. */
  ZERO_MISSING("zeroMissing"),
  
  /** Any missing value makes the whole reduction null. */
  PROPAGATE_MISSING("propagateMissing"),
  
  /** An empty list of values makes the reduction null. */
  NONE_IF_EMPTY("noneIfEmpty");

  private final String name;

  ValueFilter(final String name) {
    this.name = name;
  }

  @JsonValue
  public String getName() {
    return name;
  }

  /**
   * Applies the filter.
   * @param values A non-null list of values.
   * @return The values to reduce or null if the reduction must be null.
   */
  public List<Object> apply(final List<Object> values) {
    switch (this) {
    case KEEP_MISSING:
      return values;
    case IGNORE_MISSING: {
      final List<Object> valid = Lists.newArrayListWithCapacity(values.size());
      for (final Object value : values) {
        if (isValid(value)) {
          valid.add(value);
        }
      }
      return valid;
    }
    case ZERO_MISSING: {
      final List<Object> zeroed = Lists.newArrayListWithCapacity(values.size());
      for (final Object value : values) {
        zeroed.add(isValid(value) ? value : (Object) 0.0);
      }
      return zeroed;
    }
    case PROPAGATE_MISSING:
      for (final Object value : values) {
        if (!isValid(value)) {
          return null;
        }
      }
      return values;
    case NONE_IF_EMPTY:
      return values.isEmpty() ? null : values;
    default:
      throw new IllegalStateException("Unhandled filter: " + this);
    }
  }

  /**
   * @param value A value, may be null.
   * @return False if the value is null or a NaN number, true otherwise.
   */
  public static boolean isValid(final Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Double) {
      return !((Double) value).isNaN();
    }
    if (value instanceof Float) {
      return !((Float) value).isNaN();
    }
    return true;
  }

  /**
   * Parses a filter name, either the camel case form such as 
   * "ignoreMissing" or the enum name.
   * @param name A non-null name.
   * @return The filter.
   * @throws IllegalArgumentException if the name was null, empty or 
   * unknown.
   */
  @JsonCreator
  public static ValueFilter fromString(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Filter name cannot be null or "
          + "empty.");
    }
    for (final ValueFilter filter : values()) {
      if (filter.name.equalsIgnoreCase(name) 
          || filter.name().equalsIgnoreCase(name)) {
        return filter;
      }
    }
    throw new IllegalArgumentException("Unknown value filter: " + name);
  }
}
