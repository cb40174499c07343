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
package net.tidepool.query.pojo;

import java.util.List;
import java.util.Set;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.tidepool.data.FieldPath;
import net.tidepool.exceptions.MissingRequiredOptionException;
import net.tidepool.query.aggregators.Reducer;
import net.tidepool.query.aggregators.Reducers;

/**
 * Describes the output columns of an aggregation: for each output name, the
 * input path and the reducer applied to that path's values across a group.
 * <pre>
 * Aggregation.newBuilder()
 *   .add("in_avg", "in", Reducers.AVG)
 *   .add("out_max", "out", Reducers.MAX)
 *   .build();
 * </pre>
 * @since 1.0
 */
public class Aggregation extends Validatable {

  /** One output column. */
  public static final class Output {
    private final String name;
    private final FieldPath path;
    private final Reducer reducer;

    Output(final String name, final FieldPath path, final Reducer reducer) {
      this.name = name;
      this.path = path;
      this.reducer = reducer;
    }

    /** @return The name of the output column. */
    public String name() {
      return name;
    }

    /** @return The path read from the input events. */
    public FieldPath path() {
      return path;
    }

    /** @return The reducer. */
    public Reducer reducer() {
      return reducer;
    }
  }

  private final List<Output> outputs;

  protected Aggregation(final Builder builder) {
    outputs = ImmutableList.copyOf(builder.outputs);
  }

  /** @return The output columns in the order they were added. */
  public List<Output> outputs() {
    return outputs;
  }

  @Override
  public void validate() {
    if (outputs.isEmpty()) {
      throw new MissingRequiredOptionException("Aggregation requires at "
          + "least one output column.");
    }
    final Set<String> names = Sets.newHashSet();
    for (final Output output : outputs) {
      if (!names.add(output.name)) {
        throw new IllegalArgumentException("Duplicate output column: " 
            + output.name);
      }
    }
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("{");
    for (int i = 0; i < outputs.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append(outputs.get(i).name)
         .append('=')
         .append(outputs.get(i).path);
    }
    return buf.append('}').toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private final List<Output> outputs = Lists.newArrayList();

    /**
     * Adds an output column.
     * @param name The non-null and non-empty output column name.
     * @param path The dotted input path.
     * @param reducer The non-null reducer.
     * @return The builder.
     * @throws MissingRequiredOptionException if the name, path or reducer
     * was missing.
     */
    public Builder add(final String name, 
                       final String path, 
                       final Reducer reducer) {
      if (Strings.isNullOrEmpty(name)) {
        throw new MissingRequiredOptionException("Output name cannot be "
            + "null or empty.");
      }
      if (Strings.isNullOrEmpty(path)) {
        throw new MissingRequiredOptionException("Input path cannot be "
            + "null or empty for " + name);
      }
      if (reducer == null) {
        throw new MissingRequiredOptionException("Reducer cannot be null "
            + "for " + name);
      }
      outputs.add(new Output(name, FieldPath.of(path), reducer));
      return this;
    }

    /**
     * Adds an output column with a named reducer.
     * @param name The non-null and non-empty output column name.
     * @param path The dotted input path.
     * @param reducer The name of a reducer known to {@link Reducers}.
     * @return The builder.
     */
    public Builder add(final String name, 
                       final String path, 
                       final String reducer) {
      return add(name, path, Reducers.get(reducer));
    }

    public Aggregation build() {
      final Aggregation aggregation = new Aggregation(this);
      aggregation.validate();
      return aggregation;
    }
  }
}
