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

import net.tidepool.data.Event;
import net.tidepool.data.Events;
import net.tidepool.data.FieldPath;
import net.tidepool.query.pojo.CollapseConfig;

/**
 * Reduces several fields of every event into a single new field.
 * 
 * @since 1.0
 */
public class CollapseProcessor extends AbstractEventProcessor {
  private final CollapseConfig config;
  private final List<FieldPath> paths;

  /**
   * Default ctor.
   * @param config A non-null and validated config.
   */
  public CollapseProcessor(final CollapseConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.config = config;
    this.paths = config.fieldPaths();
  }

  @Override
  protected Event processEvent(final Event event) {
    return Events.collapse(event, paths, config.getName(), 
        config.getReducer(), config.getAppend());
  }
}
