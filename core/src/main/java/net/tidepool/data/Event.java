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
package net.tidepool.data;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;

import net.tidepool.time.TimeRange;

/**
 * An immutable, time keyed bag of data. Implementations form a closed
 * family identified by {@link #type()}:
 * {@link TimeEvent}, {@link TimeRangeEvent} and {@link IndexedEvent}.
 * 
 * @since 1.0
 */
public interface Event {

  /** @return The variant of this event. */
  public EventType type();

  /** @return The key identifying the event's time, e.g. "1431699673432",
   * "1000,2000" or "2015-06". */
  public String key();

  /** @return The key in its JSON form: epoch ms, a two element list of 
   * epoch ms or the index string. */
  public Object keyJSON();

  /** @return The instant the event is ordered by, the begin for spans. */
  public Instant timestamp();

  /** @return The begin of the event's time. */
  public Instant begin();

  /** @return The end of the event's time, same as the begin for points. */
  public Instant end();

  /** @return The time covered by the event. */
  public TimeRange timerange();

  /** @return The payload. */
  public EventData data();

  /**
   * @param path A non-null path.
   * @return The value at the path or null if absent.
   */
  public Object get(final FieldPath path);

  /**
   * @param path A dotted path, null or empty for the default "value" 
   * column.
   * @return The value at the path or null if absent.
   */
  public Object get(final String path);

  /**
   * @param data The new, non-null payload.
   * @return A new event of the same variant and key with the payload.
   */
  public Event setData(final EventData data);

  /**
   * @return The event as an object keyed by the variant name plus the 
   * payload, e.g. {"time":1431699673432,"data":{"value":42}} or 
   * {"index":"1d-16570","data":{...}}.
   */
  public ObjectNode toJSON();

  /** @return The key in JSON form followed by the payload's values in 
   * insertion order. */
  public List<Object> toPoint();

  /**
   * Renders the event as a row of a series' points.
   * @param columns The column order, non-null.
   * @return The key in JSON form followed by the value of each column, 
   * null where the payload lacks the column.
   */
  public List<Object> toPoint(final List<String> columns);
}
