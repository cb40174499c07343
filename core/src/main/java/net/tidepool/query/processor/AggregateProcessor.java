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
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.tidepool.data.Event;
import net.tidepool.data.EventCollection;
import net.tidepool.data.EventData;
import net.tidepool.data.IndexedEvent;
import net.tidepool.data.TimeRangeEvent;
import net.tidepool.query.Batch;
import net.tidepool.query.Grouping;
import net.tidepool.query.Window;
import net.tidepool.query.pojo.Aggregation;
import net.tidepool.time.Index;

/**
 * Emits one event per group holding the reduced values described by an
 * {@link Aggregation}. With a window, the output is an indexed event on the
 * window's index, otherwise a time range event covering the group's 
 * events. Groups are emitted in order of first appearance.
 * 
 * @since 1.0
 */
public class AggregateProcessor implements EventProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(
      AggregateProcessor.class);

  private final Aggregation aggregation;

  /**
   * Default ctor.
   * @param aggregation A non-null and validated aggregation.
   */
  public AggregateProcessor(final Aggregation aggregation) {
    if (aggregation == null) {
      throw new IllegalArgumentException("Aggregation cannot be null.");
    }
    this.aggregation = aggregation;
  }

  @Override
  public Batch process(final Batch batch) {
    final Grouping grouping = batch.grouping();
    final Window window = grouping.window();
    final Map<String, List<Event>> groups = batch.groups();
    final List<Event> output = Lists.newArrayListWithCapacity(groups.size());
    final List<String> keys = Lists.newArrayListWithCapacity(groups.size());
    
    for (final Entry<String, List<Event>> group : groups.entrySet()) {
      final EventCollection collection = EventCollection.of(group.getValue());
      final EventData.Builder builder = EventData.newBuilder();
      for (final Aggregation.Output column : aggregation.outputs()) {
        builder.put(column.name(), 
            collection.aggregate(column.reducer(), column.path()));
      }
      
      if (window != null) {
        final Index index = new Index(grouping.windowKey(group.getKey()), 
            window.isUTC());
        output.add(new IndexedEvent(index, builder.build()));
      } else {
        output.add(new TimeRangeEvent(collection.range(), builder.build()));
      }
      keys.add(group.getKey());
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Aggregated " + batch.events().size() + " events into " 
          + output.size() + " groups with " + grouping);
    }
    return batch.withKeyedEvents(output, keys);
  }
}
