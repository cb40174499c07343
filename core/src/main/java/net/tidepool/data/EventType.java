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

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import net.tidepool.exceptions.UnknownEventVariantException;

/**
 * The closed family of event variants. The name doubles as the first column
 * of the tabular JSON form and the key field of the binary form.
 * 
 * @since 1.0
 */
public enum EventType {
  /** A single point in time, {@link TimeEvent}. */
  TIME("time"),
  
  /** A span between two instants, {@link TimeRangeEvent}. */
  TIMERANGE("timerange"),
  
  /** A fixed bucket or calendar period, {@link IndexedEvent}. */
  INDEX("index");

  /** Lookup by column name. */
  private static final Map<String, EventType> BY_NAME;
  static {
    final ImmutableMap.Builder<String, EventType> builder = 
        ImmutableMap.builder();
    for (final EventType type : values()) {
      builder.put(type.name, type);
    }
    BY_NAME = builder.build();
  }

  /** The column name. */
  private final String name;

  EventType(final String name) {
    this.name = name;
  }

  /** @return The column name. */
  @JsonValue
  public String getName() {
    return name;
  }

  /**
   * Converts a column name to the variant.
   * @param name A non-null and non-empty name, case insensitive.
   * @return The variant.
   * @throws UnknownEventVariantException if the name was null, empty or not
   * one of "time", "timerange" or "index".
   */
  @JsonCreator
  public static EventType fromString(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new UnknownEventVariantException("Event type cannot be null "
          + "or empty.");
    }
    final EventType type = BY_NAME.get(name.toLowerCase());
    if (type == null) {
      throw new UnknownEventVariantException("Unknown event type: " + name);
    }
    return type;
  }
}
