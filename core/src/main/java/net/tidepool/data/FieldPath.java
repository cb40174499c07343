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

import java.util.Collection;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.tidepool.core.Const;

/**
 * The address of a value within nested event data, either a single column
 * such as {@code value} or a path into nested data such as {@code in.avg}.
 * 
 * @since 1.0
 */
public final class FieldPath {
  private static final Splitter SPLITTER = Splitter.on('.');
  private static final Joiner JOINER = Joiner.on('.');

  /** The path used when the caller does not give one. */
  public static final FieldPath DEFAULT = new FieldPath(
      ImmutableList.of(Const.DEFAULT_FIELD));

  /** The non-empty segments. */
  private final List<String> segments;

  private FieldPath(final List<String> segments) {
    this.segments = segments;
  }

  /**
   * Parses a dotted path.
   * @param path A non-null and non-empty path, e.g. "in.avg".
   * @return The path.
   * @throws IllegalArgumentException if the path was null, empty or had an
   * empty segment.
   */
  public static FieldPath of(final String path) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Field path cannot be null or empty.");
    }
    return of(SPLITTER.splitToList(path));
  }

  /**
   * Builds a path from its segments.
   * @param segments A non-null and non-empty list of segments.
   * @return The path.
   * @throws IllegalArgumentException if the list was null, empty or had an
   * empty segment.
   */
  public static FieldPath of(final List<String> segments) {
    if (segments == null || segments.isEmpty()) {
      throw new IllegalArgumentException("Field path cannot be null or empty.");
    }
    for (final String segment : segments) {
      if (Strings.isNullOrEmpty(segment)) {
        throw new IllegalArgumentException("Field path cannot contain an "
            + "empty segment: " + segments);
      }
    }
    return new FieldPath(ImmutableList.copyOf(segments));
  }

  /**
   * @param path A dotted path or null.
   * @return The parsed path or {@link #DEFAULT} when the path was null or 
   * empty.
   */
  public static FieldPath orDefault(final String path) {
    return Strings.isNullOrEmpty(path) ? DEFAULT : of(path);
  }

  /**
   * Parses every dotted path of a field spec.
   * @param paths A list of dotted paths. If null or empty, the default path
   * is returned.
   * @return A non-empty list of paths.
   */
  public static List<FieldPath> listOf(final Collection<String> paths) {
    if (paths == null || paths.isEmpty()) {
      return ImmutableList.of(DEFAULT);
    }
    final ImmutableList.Builder<FieldPath> builder = ImmutableList.builder();
    for (final String path : paths) {
      builder.add(of(path));
    }
    return builder.build();
  }

  /** @return The segments of the path. */
  public List<String> segments() {
    return segments;
  }

  /** @return The top level column the path starts at. */
  public String head() {
    return segments.get(0);
  }

  /** @return The number of segments. */
  public int depth() {
    return segments.size();
  }

  /** @return The dotted form of the path. */
  public String asString() {
    return JOINER.join(segments);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return segments.equals(((FieldPath) o).segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public String toString() {
    return asString();
  }
}
