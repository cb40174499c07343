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
import net.tidepool.data.EventData;
import net.tidepool.data.FieldPath;
import net.tidepool.query.aggregators.ValueFilter;

/**
 * Adds a constant to the numeric values at the given paths. Missing and
 * non-numeric values are left as is.
 * 
 * @since 1.0
 */
public class OffsetProcessor extends AbstractEventProcessor {
  private final double amount;
  private final List<FieldPath> paths;

  /**
   * Default ctor.
   * @param amount The constant to add.
   * @param paths A non-null list of paths.
   */
  public OffsetProcessor(final double amount, final List<FieldPath> paths) {
    if (paths == null || paths.isEmpty()) {
      throw new IllegalArgumentException("Offset requires at least one "
          + "field path.");
    }
    this.amount = amount;
    this.paths = ImmutableList.copyOf(paths);
  }

  @Override
  protected Event processEvent(final Event event) {
    EventData data = event.data();
    for (final FieldPath path : paths) {
      final Object value = data.get(path);
      if (value instanceof Number && ValueFilter.isValid(value)) {
        data = data.with(path, ((Number) value).doubleValue() + amount);
      }
    }
    return data == event.data() ? event : event.setData(data);
  }
}
