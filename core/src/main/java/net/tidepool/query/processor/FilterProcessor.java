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
import java.util.function.Predicate;

import com.google.common.collect.Lists;

import net.tidepool.data.Event;
import net.tidepool.query.Batch;

/**
 * Drops the events failing a predicate.
 * 
 * @since 1.0
 */
public class FilterProcessor implements EventProcessor {
  private final Predicate<Event> predicate;

  /**
   * Default ctor.
   * @param predicate A non-null predicate, events passing it are kept.
   */
  public FilterProcessor(final Predicate<Event> predicate) {
    if (predicate == null) {
      throw new IllegalArgumentException("Predicate cannot be null.");
    }
    this.predicate = predicate;
  }

  @Override
  public Batch process(final Batch batch) {
    final List<Integer> kept = Lists.newArrayList();
    for (int i = 0; i < batch.events().size(); i++) {
      if (predicate.test(batch.events().get(i))) {
        kept.add(i);
      }
    }
    return batch.retain(kept);
  }
}
