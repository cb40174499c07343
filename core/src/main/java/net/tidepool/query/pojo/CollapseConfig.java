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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.tidepool.data.FieldPath;
import net.tidepool.exceptions.MissingRequiredOptionException;
import net.tidepool.query.aggregators.Reducer;

/**
 * Options for a collapse stage reducing several fields of each event into 
 * one new field, e.g. summing "in" and "out" into "total".
 * @since 1.0
 */
public class CollapseConfig extends Validatable {
  private final List<String> field_spec_list;
  private final String name;
  private final Reducer reducer;
  private final boolean append;

  protected CollapseConfig(final Builder builder) {
    field_spec_list = builder.fieldSpecList == null ? null 
        : ImmutableList.copyOf(builder.fieldSpecList);
    name = builder.name;
    reducer = builder.reducer;
    append = builder.append;
  }

  /** @return The paths to collapse. */
  public List<String> getFieldSpecList() {
    return field_spec_list;
  }

  /** @return The parsed paths. */
  public List<FieldPath> fieldPaths() {
    return FieldPath.listOf(field_spec_list);
  }

  /** @return The name of the output column. */
  public String getName() {
    return name;
  }

  /** @return The reducer. */
  public Reducer getReducer() {
    return reducer;
  }

  /** @return Whether the output column is appended to the existing data. */
  public boolean getAppend() {
    return append;
  }

  @Override
  public void validate() {
    if (field_spec_list == null || field_spec_list.isEmpty()) {
      throw new MissingRequiredOptionException("Collapse requires at least "
          + "one field path.");
    }
    validateFieldSpec(field_spec_list, "fieldSpecList");
    if (Strings.isNullOrEmpty(name)) {
      throw new MissingRequiredOptionException("Collapse requires an output "
          + "name.");
    }
    if (reducer == null) {
      throw new MissingRequiredOptionException("Collapse requires a reducer.");
    }
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("fieldSpecList=")
        .append(field_spec_list)
        .append(", name=")
        .append(name)
        .append(", append=")
        .append(append)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private List<String> fieldSpecList;
    private String name;
    private Reducer reducer;
    private boolean append;

    public Builder setFieldSpecList(final List<String> field_spec_list) {
      this.fieldSpecList = field_spec_list;
      return this;
    }

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setReducer(final Reducer reducer) {
      this.reducer = reducer;
      return this;
    }

    public Builder setAppend(final boolean append) {
      this.append = append;
      return this;
    }

    public CollapseConfig build() {
      final CollapseConfig config = new CollapseConfig(this);
      config.validate();
      return config;
    }
  }
}
