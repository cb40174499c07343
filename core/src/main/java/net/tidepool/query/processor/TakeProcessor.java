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
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tidepool.query.Batch;

/**
 * Keeps the first {@code n} events of every group.
 * 
 * @since 1.0
 */
public class TakeProcessor implements EventProcessor {
  private final int limit;

  /**
   * Default ctor.
   * @param limit The number of events to keep per group, zero or more.
   */
  public TakeProcessor(final int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("Take limit cannot be negative: " 
          + limit);
    }
    this.limit = limit;
  }

  @Override
  public Batch process(final Batch batch) {
    final Map<String, Integer> counts = Maps.newHashMap();
    final List<Integer> kept = Lists.newArrayList();
    for (int i = 0; i < batch.events().size(); i++) {
      final String key = batch.keyOf(i);
      final Integer count = counts.get(key);
      final int taken = count == null ? 0 : count;
      if (taken < limit) {
        kept.add(i);
        counts.put(key, taken + 1);
      }
    }
    return batch.retain(kept);
  }
}
