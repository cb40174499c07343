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
package net.tidepool.query.processor;

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.tidepool.data.Event;
import net.tidepool.data.Events;
import net.tidepool.data.FieldPath;

/**
 * Keeps only the given fields of every event.
 * 
 * @since 1.0
 */
public class SelectProcessor extends AbstractEventProcessor {
  private final List<FieldPath> paths;

  /**
   * Default ctor.
   * @param paths A non-null list of paths to keep.
   */
  public SelectProcessor(final List<FieldPath> paths) {
    if (paths == null || paths.isEmpty()) {
      throw new IllegalArgumentException("Select requires at least one "
          + "field path.");
    }
    this.paths = ImmutableList.copyOf(paths);
  }

  @Override
  protected Event processEvent(final Event event) {
    return Events.select(event, paths);
  }
}
