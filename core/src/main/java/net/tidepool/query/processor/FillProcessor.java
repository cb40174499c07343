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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tidepool.data.Event;
import net.tidepool.data.EventData;
import net.tidepool.data.FieldPath;
import net.tidepool.query.Batch;
import net.tidepool.query.aggregators.ValueFilter;
import net.tidepool.query.pojo.FillConfig;
import net.tidepool.query.pojo.FillMethod;

/**
 * Replaces invalid values (null, missing or NaN) at the configured paths.
 * <ul>
 * <li>zero: with 0</li>
 * <li>pad: with the previous valid value, runs before the first valid value
 * are left as is</li>
 * <li>linear: with a value interpolated by time between the valid values
 * bracketing the run. Runs that cannot be bracketed, i.e. at either end of
 * the input or interrupted by a non-numeric value, are left as is.</li>
 * </ul>
 * The optional limit caps the consecutive fills of each run. For zero and
 * pad the first {@code limit} invalid values of a run are filled, for 
 * linear a run longer than the limit is left entirely as is.
 * 
 * @since 1.0
 */
public class FillProcessor implements EventProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(
      FillProcessor.class);

  private final FillConfig config;
  private final List<FieldPath> paths;

  /**
   * Default ctor.
   * @param config A non-null and validated config.
   */
  public FillProcessor(final FillConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.config = config;
    this.paths = config.fieldPaths();
  }

  @Override
  public Batch process(final Batch batch) {
    final List<Event> filled;
    if (config.getMethod() == FillMethod.LINEAR) {
      filled = fillLinear(batch.events(), paths.get(0));
    } else {
      filled = fillConstant(batch.events());
    }
    return batch.withReplacedEvents(filled);
  }

  /** Zero and pad fills. */
  private List<Event> fillConstant(final List<Event> events) {
    final Integer limit = config.getLimit();
    final Map<FieldPath, Integer> run_counts = Maps.newHashMap();
    final Map<FieldPath, Object> previous = Maps.newHashMap();
    final List<Event> output = Lists.newArrayListWithCapacity(events.size());
    
    for (final Event event : events) {
      EventData data = event.data();
      for (final FieldPath path : paths) {
        final Object value = data.get(path);
        if (ValueFilter.isValid(value)) {
          run_counts.put(path, 0);
          previous.put(path, value);
          continue;
        }
        
        final Integer count = run_counts.get(path);
        final int filled = count == null ? 0 : count;
        if (limit != null && filled >= limit) {
          continue;
        }
        
        if (config.getMethod() == FillMethod.ZERO) {
          data = data.with(path, 0L);
          run_counts.put(path, filled + 1);
        } else if (previous.containsKey(path)) {
          data = data.with(path, previous.get(path));
          run_counts.put(path, filled + 1);
        }
      }
      output.add(data == event.data() ? event : event.setData(data));
    }
    return output;
  }

  /** Linear fill of a single path. */
  private List<Event> fillLinear(final List<Event> events, 
                                 final FieldPath path) {
    final Integer limit = config.getLimit();
    final List<Event> output = Lists.newArrayListWithCapacity(events.size());
    final List<Event> run = Lists.newArrayList();
    Event last_good = null;
    
    for (final Event event : events) {
      final Object value = event.get(path);
      
      if (!ValueFilter.isValid(value)) {
        if (last_good == null) {
          output.add(event);
        } else {
          run.add(event);
        }
        continue;
      }
      
      if (!(value instanceof Number)) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Cannot interpolate over non-numeric value at " + path 
              + " for event " + event.key());
        }
        output.addAll(run);
        run.clear();
        output.add(event);
        last_good = null;
        continue;
      }
      
      if (!run.isEmpty()) {
        if (limit != null && run.size() > limit) {
          output.addAll(run);
        } else {
          for (final Event missing : run) {
            output.add(missing.setData(missing.data().with(path, 
                interpolate(last_good, event, missing, path))));
          }
        }
        run.clear();
      }
      output.add(event);
      last_good = event;
    }
    output.addAll(run);
    return output;
  }

  /**
   * @return The value at the missing event's time on the line between the
   * two bracketing events.
   */
  private static double interpolate(final Event before, 
                                    final Event after, 
                                    final Event missing, 
                                    final FieldPath path) {
    final double v0 = ((Number) before.get(path)).doubleValue();
    final double v1 = ((Number) after.get(path)).doubleValue();
    final long t0 = before.timestamp().toEpochMilli();
    final long t1 = after.timestamp().toEpochMilli();
    if (t1 == t0) {
      return v0;
    }
    final long t = missing.timestamp().toEpochMilli();
    return v0 + (v1 - v0) * ((double) (t - t0) / (t1 - t0));
  }
}
