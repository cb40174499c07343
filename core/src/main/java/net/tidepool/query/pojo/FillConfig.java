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

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;

import net.tidepool.core.Const;
import net.tidepool.data.FieldPath;

/**
 * Options for a fill stage replacing invalid (null, missing or NaN) values.
 * <p>
 * The {@code limit} caps the number of consecutive invalid values filled in
 * a run, the rest of the run is left as is. Linear fills can only bracket
 * runs no longer than the limit and leave longer runs untouched. A null 
 * limit means no cap.
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = FillConfig.Builder.class)
public class FillConfig extends Validatable {
  public static final FillMethod DEFAULT_METHOD = FillMethod.ZERO;

  /** The paths to fill. */
  private final List<String> field_spec;

  /** How to fill. */
  private final FillMethod method;

  /** Optional cap on consecutive fills. */
  private final Integer limit;

  protected FillConfig(final Builder builder) {
    field_spec = builder.fieldSpec == null || builder.fieldSpec.isEmpty() 
        ? ImmutableList.of(Const.DEFAULT_FIELD) 
        : ImmutableList.copyOf(builder.fieldSpec);
    method = builder.method == null ? DEFAULT_METHOD : builder.method;
    limit = builder.limit;
  }

  /** @return The paths to fill, "value" by default. */
  public List<String> getFieldSpec() {
    return field_spec;
  }

  /** @return The parsed paths. */
  public List<FieldPath> fieldPaths() {
    return FieldPath.listOf(field_spec);
  }

  /** @return The fill method, zero by default. */
  public FillMethod getMethod() {
    return method;
  }

  /** @return The cap on consecutive fills, null for none. */
  public Integer getLimit() {
    return limit;
  }

  /** Validates the config
   * @throws IllegalArgumentException if one or more parameters were invalid
   */
  @Override
  public void validate() {
    validateFieldSpec(field_spec, "fieldSpec");
    if (limit != null && limit < 0) {
      throw new IllegalArgumentException("Limit cannot be negative: " + limit);
    }
    if (method == FillMethod.LINEAR && field_spec.size() != 1) {
      throw new IllegalArgumentException("A linear fill takes exactly one "
          + "field path but was given " + field_spec);
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final FillConfig config = (FillConfig) o;
    return Objects.equal(field_spec, config.field_spec)
        && Objects.equal(method, config.method)
        && Objects.equal(limit, config.limit);
  }

  @Override
  public int hashCode() {
    return buildHashCode().asInt();
  }

  /** @return A HashCode object for deterministic, non-secure hashing */
  public HashCode buildHashCode() {
    final Hasher hasher = Const.HASH_FUNCTION().newHasher();
    for (final String path : field_spec) {
      hasher.putString(path, Const.UTF8_CHARSET);
    }
    return hasher
        .putString(method.getName(), Const.UTF8_CHARSET)
        .putInt(limit == null ? -1 : limit)
        .hash();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("fieldSpec=")
        .append(field_spec)
        .append(", method=")
        .append(method.getName())
        .append(", limit=")
        .append(limit)
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Clones a config into a new builder.
   * @param config A non-null config to pull values from.
   * @return A new builder populated with values from the given config.
   * @throws IllegalArgumentException if the config was null.
   */
  public static Builder newBuilder(final FillConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    return new Builder()
        .setFieldSpec(config.field_spec)
        .setMethod(config.method)
        .setLimit(config.limit);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> fieldSpec;
    @JsonProperty
    private FillMethod method = DEFAULT_METHOD;
    @JsonProperty
    private Integer limit;

    public Builder setFieldSpec(final List<String> field_spec) {
      this.fieldSpec = field_spec;
      return this;
    }

    public Builder setFieldSpec(final String field_spec) {
      this.fieldSpec = field_spec == null ? null : ImmutableList.of(field_spec);
      return this;
    }

    public Builder setMethod(final FillMethod method) {
      this.method = method;
      return this;
    }

    public Builder setMethod(final String method) {
      this.method = FillMethod.fromString(method);
      return this;
    }

    public Builder setLimit(final Integer limit) {
      this.limit = limit;
      return this;
    }

    /**
     * @return The validated config.
     * @throws IllegalArgumentException if the config was invalid.
     */
    public FillConfig build() {
      final FillConfig config = new FillConfig(this);
      config.validate();
      return config;
    }
  }
}
