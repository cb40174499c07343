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

import net.tidepool.data.Event;
import net.tidepool.data.IndexedEvent;
import net.tidepool.data.TimeEvent;
import net.tidepool.data.TimeRangeEvent;
import net.tidepool.query.pojo.TimeAlignment;
import net.tidepool.time.BucketGenerator;
import net.tidepool.time.Index;
import net.tidepool.utils.DateTime;

/**
 * Converts events between variants. Events already of the target variant
 * pass through untouched.
 * <ul>
 * <li>To time events: the begin, center or end of the event's range.</li>
 * <li>To time range events: the range of indexed events, or a range of the
 * given duration placed around time events.</li>
 * <li>To indexed events: the fixed bucket of the given size containing the
 * event's timestamp.</li>
 * </ul>
 * 
 * @since 1.0
 */
public class ConvertProcessor extends AbstractEventProcessor {

  /** The variant to convert to. */
  private enum Target {
    TIME,
    TIMERANGE,
    INDEX
  }

  private final Target target;
  private final TimeAlignment alignment;
  private final String duration;
  private final long length;

  private ConvertProcessor(final Target target, 
                           final TimeAlignment alignment, 
                           final String duration) {
    this.target = target;
    this.alignment = alignment == null ? TimeAlignment.BEGIN : alignment;
    this.duration = duration;
    this.length = duration == null ? 0 : DateTime.parseSizeSpec(duration);
  }

  /**
   * @param alignment Which instant of a span to keep, begin if null.
   * @return A converter to time events.
   */
  public static ConvertProcessor toTimeEvents(final TimeAlignment alignment) {
    return new ConvertProcessor(Target.TIME, alignment, null);
  }

  /**
   * @param alignment Where time events sit within their new range, begin if
   * null.
   * @param duration The length of the ranges built around time events, a 
   * bucket size such as "5m".
   * @return A converter to time range events.
   * @throws net.tidepool.exceptions.InvalidSizeSpecException if the 
   * duration was invalid.
   */
  public static ConvertProcessor toTimeRangeEvents(
      final TimeAlignment alignment, 
      final String duration) {
    if (duration == null) {
      throw new IllegalArgumentException("Duration cannot be null.");
    }
    return new ConvertProcessor(Target.TIMERANGE, alignment, duration);
  }

  /**
   * @param duration The bucket size, e.g. "1h".
   * @return A converter to indexed events.
   * @throws net.tidepool.exceptions.InvalidSizeSpecException if the 
   * duration was invalid.
   */
  public static ConvertProcessor toIndexedEvents(final String duration) {
    if (duration == null) {
      throw new IllegalArgumentException("Duration cannot be null.");
    }
    return new ConvertProcessor(Target.INDEX, null, duration);
  }

  @Override
  protected Event processEvent(final Event event) {
    switch (target) {
    case TIME:
      switch (event.type()) {
      case TIME:
        return event;
      default:
        return new TimeEvent(alignment.pick(event.timerange()), event.data());
      }
    case TIMERANGE:
      switch (event.type()) {
      case TIMERANGE:
        return event;
      case INDEX:
        return new TimeRangeEvent(event.timerange(), event.data());
      default:
        return new TimeRangeEvent(alignment.around(event.timestamp(), length), 
            event.data());
      }
    case INDEX:
      switch (event.type()) {
      case INDEX:
        return event;
      default:
        return new IndexedEvent(new Index(BucketGenerator.bucketIndex(
            duration, event.timestamp())), event.data());
      }
    default:
      throw new IllegalStateException("Unhandled target: " + target);
    }
  }
}
