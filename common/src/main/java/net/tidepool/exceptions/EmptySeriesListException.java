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
 * Thrown when a cross-series reduce or merge is given a null or empty list
 * of series.
 * @since 1.0
 */
public class EmptySeriesListException extends IllegalArgumentException {
  private static final long serialVersionUID = 8602194406287729310L;

  /**
   * Default ctor.
   * @param msg A descriptive message.
   */
  public EmptySeriesListException(final String msg) {
    super(msg);
  }
}
