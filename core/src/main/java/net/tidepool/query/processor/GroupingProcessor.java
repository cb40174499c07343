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

import java.util.function.Function;

import net.tidepool.data.Event;
import net.tidepool.data.FieldPath;
import net.tidepool.query.Batch;
import net.tidepool.query.Grouping;
import net.tidepool.query.Window;

/**
 * Changes the grouping of the events flowing through a pipeline without 
 * touching the events themselves.
 * 
 * @since 1.0
 */
public class GroupingProcessor implements EventProcessor {

  /** What to change. */
  private enum Change {
    SET_WINDOW,
    CLEAR_WINDOW,
    GROUP_BY_PATH,
    GROUP_BY_FUNCTION,
    CLEAR_GROUP_BY
  }

  private final Change change;
  private final Window window;
  private final FieldPath path;
  private final Function<Event, String> function;

  private GroupingProcessor(final Change change, 
                            final Window window, 
                            final FieldPath path,
                            final Function<Event, String> function) {
    this.change = change;
    this.window = window;
    this.path = path;
    this.function = function;
  }

  /**
   * @param window A non-null window.
   * @return A processor setting the window.
   */
  public static GroupingProcessor window(final Window window) {
    if (window == null) {
      throw new IllegalArgumentException("Window cannot be null.");
    }
    return new GroupingProcessor(Change.SET_WINDOW, window, null, null);
  }

  /** @return A processor removing the window. */
  public static GroupingProcessor clearWindow() {
    return new GroupingProcessor(Change.CLEAR_WINDOW, null, null, null);
  }

  /**
   * @param path A non-null path whose value is the group key.
   * @return A processor setting the group-by.
   */
  public static GroupingProcessor groupBy(final FieldPath path) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    return new GroupingProcessor(Change.GROUP_BY_PATH, null, path, null);
  }

  /**
   * @param function A non-null function returning the group key.
   * @return A processor setting the group-by.
   */
  public static GroupingProcessor groupBy(
      final Function<Event, String> function) {
    if (function == null) {
      throw new IllegalArgumentException("Function cannot be null.");
    }
    return new GroupingProcessor(Change.GROUP_BY_FUNCTION, null, null, 
        function);
  }

  /** @return A processor removing the group-by. */
  public static GroupingProcessor clearGroupBy() {
    return new GroupingProcessor(Change.CLEAR_GROUP_BY, null, null, null);
  }

  @Override
  public Batch process(final Batch batch) {
    final Grouping grouping = batch.grouping();
    switch (change) {
    case SET_WINDOW:
      return batch.withGrouping(grouping.withWindow(window));
    case CLEAR_WINDOW:
      return batch.withGrouping(grouping.withWindow(null));
    case GROUP_BY_PATH:
      return batch.withGrouping(grouping.withGroupBy(path));
    case GROUP_BY_FUNCTION:
      return batch.withGrouping(grouping.withGroupBy(function));
    case CLEAR_GROUP_BY:
      return batch.withGrouping(grouping.withGroupBy(
          (Function<Event, String>) null));
    default:
      throw new IllegalStateException("Unhandled change: " + change);
    }
  }
}
