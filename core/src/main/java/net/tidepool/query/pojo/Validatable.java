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

import java.util.Collection;

/**
 * Base for the option POJOs so they can check themselves before use.
 * @since 1.0
 */
public abstract class Validatable {

  /**
   * Validates the options.
   * @throws IllegalArgumentException if one or more options were invalid.
   */
  abstract public void validate();

  /**
   * Validate a single POJO
   * @param pojo The POJO object to validate
   * @param name name of the field
   */
  <T extends Validatable> void validatePOJO(final T pojo, final String name) {
    try {
      pojo.validate();
    } catch (final IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid " + name, e);
    }
  }

  /**
   * Checks a list of field paths.
   * @param fieldSpec The paths, may be null or empty.
   * @param name The name of the option for error messages.
   * @throws IllegalArgumentException if a path was null or empty.
   */
  protected static void validateFieldSpec(final Collection<String> fieldSpec, 
                                final String name) {
    if (fieldSpec == null) {
      return;
    }
    for (final String path : fieldSpec) {
      if (path == null || path.isEmpty() || path.startsWith(".") 
          || path.endsWith(".") || path.contains("..")) {
        throw new IllegalArgumentException("Invalid path in " + name + ": '" 
            + path + "'");
      }
    }
  }
}
