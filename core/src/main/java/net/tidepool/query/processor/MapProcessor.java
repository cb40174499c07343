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

import java.util.function.Function;

import net.tidepool.data.Event;

/**
 * Applies a caller supplied function to every event. Exceptions thrown by
 * the function propagate out of the pipeline.
 * 
 * @since 1.0
 */
public class MapProcessor extends AbstractEventProcessor {
  private final Function<Event, Event> mapper;

  /**
   * Default ctor.
   * @param mapper A non-null function returning non-null events.
   */
  public MapProcessor(final Function<Event, Event> mapper) {
    if (mapper == null) {
      throw new IllegalArgumentException("Mapper cannot be null.");
    }
    this.mapper = mapper;
  }

  @Override
  protected Event processEvent(final Event event) {
    final Event mapped = mapper.apply(event);
    if (mapped == null) {
      throw new IllegalStateException("Mapper returned a null event for " 
          + event);
    }
    return mapped;
  }
}
