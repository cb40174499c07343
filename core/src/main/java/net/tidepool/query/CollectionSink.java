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

import net.tidepool.data.EventCollection;

/**
 * Receives the keyed output collections of a pipeline, in order of first
 * appearance of each key.
 * @since 1.0
 */
@FunctionalInterface
public interface CollectionSink {

  /**
   * @param key The group key, "all" without grouping.
   * @param collection The non-null collection of the group.
   */
  public void onCollection(final String key, 
                           final EventCollection collection);
}
