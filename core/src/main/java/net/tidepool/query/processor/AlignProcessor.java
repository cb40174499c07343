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

import com.google.common.collect.Lists;

import net.tidepool.data.Event;
import net.tidepool.data.EventData;
import net.tidepool.data.EventType;
import net.tidepool.data.FieldPath;
import net.tidepool.data.TimeEvent;
import net.tidepool.query.Batch;
import net.tidepool.query.aggregators.ValueFilter;
import net.tidepool.query.pojo.AlignConfig;
import net.tidepool.query.pojo.AlignMethod;
import net.tidepool.time.BucketGenerator;

/**
 * Resamples point events onto the boundaries of a fixed period. For every
 * pair of consecutive events, one event is synthesized per period boundary
 * crossed between them, carrying only the aligned fields. The first event
 * is passed through when it already sits on a boundary.
 * <p>
 * Linear alignment interpolates by time and yields null when either side
 * is missing or not numeric. Pad alignment holds the value of the earlier
 * event. When a gap crosses more boundaries than the limit, every boundary
 * of that gap gets null values.
 * 
 * @since 1.0
 */
public class AlignProcessor implements EventProcessor {
  private final AlignConfig config;
  private final List<FieldPath> paths;
  private final long period;

  /**
   * Default ctor.
   * @param config A non-null and validated config.
   */
  public AlignProcessor(final AlignConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.config = config;
    this.paths = config.fieldPaths();
    this.period = config.periodLength();
  }

  @Override
  public Batch process(final Batch batch) {
    final List<Event> output = Lists.newArrayList();
    Event previous = null;
    for (final Event event : batch.events()) {
      if (event.type() != EventType.TIME) {
        throw new IllegalArgumentException("Only time events can be aligned "
            + "but got a " + event.type().getName() + " event.");
      }
      
      if (previous == null) {
        if (event.timestamp().toEpochMilli() % period == 0) {
          output.add(event);
        }
        previous = event;
        continue;
      }
      
      final long prev_pos = BucketGenerator.bucketPosition(
          previous.timestamp(), period);
      final long curr_pos = BucketGenerator.bucketPosition(
          event.timestamp(), period);
      final long boundaries = curr_pos - prev_pos;
      final Integer limit = config.getLimit();
      for (long pos = prev_pos + 1; pos <= curr_pos; pos++) {
        final long boundary = pos * period;
        if (limit != null && boundaries > limit) {
          output.add(nulls(boundary));
        } else if (config.getMethod() == AlignMethod.LINEAR) {
          output.add(linear(boundary, previous, event));
        } else {
          output.add(hold(boundary, previous));
        }
      }
      previous = event;
    }
    return batch.withEvents(output);
  }

  private Event nulls(final long boundary) {
    final EventData.Builder builder = EventData.newBuilder();
    for (final FieldPath path : paths) {
      builder.put(path, null);
    }
    return new TimeEvent(boundary, builder.build());
  }

  private Event hold(final long boundary, final Event previous) {
    final EventData.Builder builder = EventData.newBuilder();
    for (final FieldPath path : paths) {
      builder.put(path, previous.get(path));
    }
    return new TimeEvent(boundary, builder.build());
  }

  private Event linear(final long boundary, 
                       final Event previous, 
                       final Event next) {
    final long t0 = previous.timestamp().toEpochMilli();
    final long t1 = next.timestamp().toEpochMilli();
    final double fraction = (double) (boundary - t0) / (t1 - t0);
    final EventData.Builder builder = EventData.newBuilder();
    for (final FieldPath path : paths) {
      final Object v0 = previous.get(path);
      final Object v1 = next.get(path);
      if (!ValueFilter.isValid(v0) || !ValueFilter.isValid(v1) 
          || !(v0 instanceof Number) || !(v1 instanceof Number)) {
        builder.put(path, null);
      } else {
        final double d0 = ((Number) v0).doubleValue();
        final double d1 = ((Number) v1).doubleValue();
        builder.put(path, d0 + fraction * (d1 - d0));
      }
    }
    return new TimeEvent(boundary, builder.build());
  }
}
