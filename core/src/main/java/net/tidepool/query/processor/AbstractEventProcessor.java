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
import net.tidepool.query.Batch;

/**
 * A processor base for stages that map each event to exactly one event.
 * Group keys pinned by earlier stages are kept.
 * 
 * @since 1.0
 */
public abstract class AbstractEventProcessor implements EventProcessor {

  @Override
  public Batch process(final Batch batch) {
    return batch.mapEvents(new Function<Event, Event>() {
      @Override
      public Event apply(final Event event) {
        return processEvent(event);
      }
    });
  }

  /**
   * @param event A non-null event.
   * @return The non-null processed event.
   */
  protected abstract Event processEvent(final Event event);
}
