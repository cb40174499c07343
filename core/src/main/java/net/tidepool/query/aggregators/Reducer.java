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

/**
 * Reduces a list of values, usually the values of one column across a 
 * group of events, to a single value. Implementations must not modify the 
 * list and should return null when there is nothing to reduce.
 * 
 * @since 1.0
 */
@FunctionalInterface
public interface Reducer {

  /**
   * @param values A non-null list of raw values, possibly with nulls.
   * @return The reduced value, may be null.
   */
  public Object reduce(final List<Object> values);
}
