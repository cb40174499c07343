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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.tidepool.data.Event;
import net.tidepool.data.EventData;
import net.tidepool.data.FieldPath;
import net.tidepool.data.TimeRangeEvent;
import net.tidepool.query.Batch;
import net.tidepool.query.aggregators.ValueFilter;
import net.tidepool.query.pojo.RateConfig;
import net.tidepool.time.TimeRange;

/**
 * Emits the per second rate of change between consecutive events as time
 * range events spanning each pair. The rate of path {@code a.b} is stored
 * at {@code a.b_rate}.
 * <p>
 * Pairs with a missing or non-numeric value, or no time between them, get
 * a null rate. Negative rates are nulled when they are not allowed.
 * 
 * @since 1.0
 */
public class RateProcessor implements EventProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(
      RateProcessor.class);

  private final RateConfig config;
  private final List<FieldPath> paths;
  private final List<FieldPath> rate_paths;

  /**
   * Default ctor.
   * @param config A non-null and validated config.
   */
  public RateProcessor(final RateConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.config = config;
    this.paths = config.fieldPaths();
    this.rate_paths = Lists.newArrayListWithCapacity(paths.size());
    for (final FieldPath path : paths) {
      final List<String> segments = Lists.newArrayList(path.segments());
      segments.set(segments.size() - 1, 
          segments.get(segments.size() - 1) + "_rate");
      rate_paths.add(FieldPath.of(segments));
    }
  }

  @Override
  public Batch process(final Batch batch) {
    final List<Event> output = Lists.newArrayList();
    Event previous = null;
    for (final Event event : batch.events()) {
      if (previous != null) {
        output.add(rate(previous, event));
      }
      previous = event;
    }
    return batch.withEvents(output);
  }

  private Event rate(final Event previous, final Event current) {
    final long t0 = previous.timestamp().toEpochMilli();
    final long t1 = current.timestamp().toEpochMilli();
    final double seconds = (t1 - t0) / 1000.0;
    
    final EventData.Builder builder = EventData.newBuilder();
    for (int i = 0; i < paths.size(); i++) {
      final Object v0 = previous.get(paths.get(i));
      final Object v1 = current.get(paths.get(i));
      Double rate = null;
      if (!(v0 instanceof Number) || !(v1 instanceof Number) 
          || !ValueFilter.isValid(v0) || !ValueFilter.isValid(v1)) {
        LOG.warn("Unable to compute the rate of " + paths.get(i) 
            + " between " + previous.key() + " and " + current.key() 
            + ", values were " + v0 + " and " + v1);
      } else if (seconds > 0) {
        rate = (((Number) v1).doubleValue() - ((Number) v0).doubleValue()) 
            / seconds;
        if (rate < 0 && !config.getAllowNegative()) {
          rate = null;
        }
      }
      builder.put(rate_paths.get(i), rate);
    }
    return new TimeRangeEvent(new TimeRange(
        previous.timestamp(), current.timestamp()), builder.build());
  }
}
