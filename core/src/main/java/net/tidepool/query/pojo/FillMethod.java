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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import net.tidepool.exceptions.InvalidFillMethodException;

/**
 * How invalid values are replaced by a fill stage.
 * @since 1.0
 */
public enum FillMethod {
  /** Replace with zero. */
  ZERO("zero"),
  
  /** Replace with the previous valid value. */
  PAD("pad"),
  
  /** Interpolate linearly, by time, between the bracketing valid values. */
  LINEAR("linear");

  // The user-friendly name of this method.
  private final String name;

  FillMethod(final String name) {
    this.name = name;
  }

  /**
   * Get this fill method's user-friendly name.
   * @return this fill method's user-friendly name.
   */
  @JsonValue
  public String getName() {
    return name;
  }

  /**
   * Get an instance of this enumeration from a user-friendly name.
   * @param name The user-friendly name of a fill method.
   * @return an instance of {@link FillMethod}.
   * @throws InvalidFillMethodException if the name doesn't match a method
   */
  @JsonCreator
  public static FillMethod fromString(final String name) {
    for (final FillMethod method : FillMethod.values()) {
      if (method.name.equalsIgnoreCase(name)) {
        return method;
      }
    }

    throw new InvalidFillMethodException("Unrecognized fill method: " + name);
  }
}
