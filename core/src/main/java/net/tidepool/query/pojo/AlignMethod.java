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

/**
 * How values are synthesized on period boundaries by an align stage.
 * @since 1.0
 */
public enum AlignMethod {
  /** Interpolate between the events either side of the boundary. */
  LINEAR("linear"),
  
  /** Hold the value of the event before the boundary. */
  PAD("pad");

  private final String name;

  AlignMethod(final String name) {
    this.name = name;
  }

  @JsonValue
  public String getName() {
    return name;
  }

  /**
   * @param name A user friendly name, "hold" is accepted for pad.
   * @return The method.
   * @throws IllegalArgumentException if the name doesn't match a method
   */
  @JsonCreator
  public static AlignMethod fromString(final String name) {
    if ("hold".equalsIgnoreCase(name)) {
      return PAD;
    }
    for (final AlignMethod method : AlignMethod.values()) {
      if (method.name.equalsIgnoreCase(name)) {
        return method;
      }
    }
    throw new IllegalArgumentException("Unrecognized align method: " + name);
  }
}
