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
package net.tidepool.exceptions;

/**
 * Thrown eagerly when a required option such as a window size, an
 * aggregation or a reducer was not supplied.
 * @since 1.0
 */
public class MissingRequiredOptionException extends IllegalArgumentException {
  private static final long serialVersionUID = 5032281137569915423L;

  /**
   * Default ctor.
   * @param msg A descriptive message.
   */
  public MissingRequiredOptionException(final String msg) {
    super(msg);
  }
}
