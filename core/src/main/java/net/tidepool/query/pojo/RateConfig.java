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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;

import net.tidepool.core.Const;
import net.tidepool.data.FieldPath;

/**
 * Options for a rate stage. For every consecutive pair of events the rate
 * of change per second is emitted in a {@code <path>_rate} column of a 
 * time range event spanning the pair.
 * <p>
 * Counters resetting to zero produce negative rates, setting 
 * {@code allowNegative} to false turns those into nulls.
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = RateConfig.Builder.class)
public class RateConfig extends Validatable implements Comparable<RateConfig> {
  public static final boolean DEFAULT_ALLOW_NEGATIVE = true;

  private final List<String> field_spec;

  /** Whether negative rates are emitted or nulled. */
  private final boolean allow_negative;

  protected RateConfig(final Builder builder) {
    field_spec = builder.fieldSpec == null || builder.fieldSpec.isEmpty() 
        ? ImmutableList.of(Const.DEFAULT_FIELD) 
        : ImmutableList.copyOf(builder.fieldSpec);
    allow_negative = builder.allowNegative;
  }

  /** @return The paths to compute rates for, "value" by default. */
  public List<String> getFieldSpec() {
    return field_spec;
  }

  /** @return The parsed paths. */
  public List<FieldPath> fieldPaths() {
    return FieldPath.listOf(field_spec);
  }

  /** @return Whether negative rates are emitted, true by default. */
  public boolean getAllowNegative() {
    return allow_negative;
  }

  /** Validates the config
   * @throws IllegalArgumentException if one or more parameters were invalid
   */
  @Override
  public void validate() {
    validateFieldSpec(field_spec, "fieldSpec");
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final RateConfig config = (RateConfig) o;
    return Objects.equal(field_spec, config.field_spec)
        && Objects.equal(allow_negative, config.allow_negative);
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
    return hasher.putBoolean(allow_negative).hash();
  }

  @Override
  public int compareTo(final RateConfig other) {
    return ComparisonChain.start()
        .compare(field_spec.toString(), other.field_spec.toString())
        .compareTrueFirst(allow_negative, other.allow_negative)
        .result();
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append('{');
    buf.append(field_spec);
    buf.append(',').append(allow_negative);
    buf.append('}');
    return buf.toString();
  }

  /** @return A new builder to construct a RateConfig from. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Clones a config into a new builder.
   * @param config A non-null config to pull values from
   * @return A new builder populated with values from the given config.
   * @throws IllegalArgumentException if the config was null.
   */
  public static Builder newBuilder(final RateConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("RateConfig cannot be null.");
    }
    return new Builder()
        .setFieldSpec(config.field_spec)
        .setAllowNegative(config.allow_negative);
  }

  /**
   * A builder for the rate config.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> fieldSpec;
    @JsonProperty
    private boolean allowNegative = DEFAULT_ALLOW_NEGATIVE;

    public Builder setFieldSpec(final List<String> field_spec) {
      this.fieldSpec = field_spec;
      return this;
    }

    public Builder setFieldSpec(final String field_spec) {
      this.fieldSpec = field_spec == null ? null : ImmutableList.of(field_spec);
      return this;
    }

    public Builder setAllowNegative(final boolean allow_negative) {
      this.allowNegative = allow_negative;
      return this;
    }

    public RateConfig build() {
      final RateConfig config = new RateConfig(this);
      config.validate();
      return config;
    }
  }
}
