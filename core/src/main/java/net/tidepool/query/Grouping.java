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
package net.tidepool.query;

import java.util.function.Function;

import net.tidepool.core.Const;
import net.tidepool.data.Event;
import net.tidepool.data.FieldPath;

/**
 * The grouping state of a pipeline: an optional window and an optional
 * group-by function. Events sharing a group key are collected, taken and
 * aggregated together.
 * 
 * @since 1.0
 */
public final class Grouping {

  /** No window, no group-by. Every event falls in the "all" group. */
  public static final Grouping NONE = new Grouping(null, null, null);

  private final Window window;
  private final Function<Event, String> group_by;
  private final String group_by_name;

  private Grouping(final Window window, 
                   final Function<Event, String> group_by,
                   final String group_by_name) {
    this.window = window;
    this.group_by = group_by;
    this.group_by_name = group_by_name;
  }

  /** @return The window or null. */
  public Window window() {
    return window;
  }

  /** @return Whether a group-by is set. */
  public boolean hasGroupBy() {
    return group_by != null;
  }

  /** @return Whether a window or a group-by is set. */
  public boolean isActive() {
    return window != null || group_by != null;
  }

  /**
   * @param window A window, null to clear it.
   * @return A grouping with the window and this grouping's group-by.
   */
  public Grouping withWindow(final Window window) {
    return new Grouping(window, group_by, group_by_name);
  }

  /**
   * Groups by the string form of the value at a path, "null" when absent.
   * @param path A non-null path.
   * @return A grouping with this grouping's window and the group-by.
   */
  public Grouping withGroupBy(final FieldPath path) {
    return new Grouping(window, new Function<Event, String>() {
      @Override
      public String apply(final Event event) {
        return String.valueOf(event.get(path));
      }
    }, path.asString());
  }

  /**
   * @param group_by A function returning the group key of an event, null
   * to clear the group-by.
   * @return A grouping with this grouping's window and the group-by.
   */
  public Grouping withGroupBy(final Function<Event, String> group_by) {
    return new Grouping(window, group_by, group_by == null ? null : "fn");
  }

  /**
   * @param event A non-null event.
   * @return The window key, the group-by key, both joined with "::" or 
   * "all" when neither is set.
   */
  public String keyFor(final Event event) {
    final String window_key = window == null ? null 
        : window.indexString(event.timestamp());
    final String group_key = group_by == null ? null 
        : group_by.apply(event);
    if (window_key != null && group_key != null) {
      return window_key + Const.GROUP_SEPARATOR + group_key;
    }
    if (window_key != null) {
      return window_key;
    }
    if (group_key != null) {
      return group_key;
    }
    return Const.ALL_KEY;
  }

  /**
   * @param key A key produced by {@link #keyFor(Event)}.
   * @return The window part of the key or null without a window.
   */
  public String windowKey(final String key) {
    if (window == null) {
      return null;
    }
    if (group_by == null) {
      return key;
    }
    final int idx = key.indexOf(Const.GROUP_SEPARATOR);
    return idx < 0 ? key : key.substring(0, idx);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("window=")
        .append(window)
        .append(", groupBy=")
        .append(group_by_name)
        .toString();
  }
}
