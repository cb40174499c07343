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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When grouped results are emitted. Pipelines run in batch mode only so
 * results are emitted once the whole input has been processed.
 * @since 1.0
 */
public enum EmitPolicy {
  /** Emit each group once, after all input has been seen. */
  DISCARD("discard");

  private final String name;

  EmitPolicy(final String name) {
    this.name = name;
  }

  @JsonValue
  public String getName() {
    return name;
  }

  /**
   * @param name The name of the policy.
   * @return The policy.
   * @throws IllegalArgumentException if the name was not "discard".
   */
  @JsonCreator
  public static EmitPolicy fromString(final String name) {
    for (final EmitPolicy policy : EmitPolicy.values()) {
      if (policy.name.equalsIgnoreCase(name)) {
        return policy;
      }
    }
    throw new IllegalArgumentException("Unsupported emit policy, only batch "
        + "emission with 'discard' is available: " + name);
  }
}
