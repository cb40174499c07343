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
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;

import net.tidepool.core.Const;
import net.tidepool.data.FieldPath;
import net.tidepool.utils.DateTime;

/**
 * Options for an align stage that resamples point events onto the 
 * boundaries of a fixed period.
 * <p>
 * When the gap between two events spans more boundaries than the 
 * {@code limit}, every boundary in that gap gets a null value instead of an
 * interpolated one. A limit of zero nulls every gap, a null limit means no
 * cap.
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = AlignConfig.Builder.class)
public class AlignConfig extends Validatable {
  public static final String DEFAULT_PERIOD = "5m";
  public static final AlignMethod DEFAULT_METHOD = AlignMethod.LINEAR;

  private final List<String> field_spec;
  private final String period;
  private final AlignMethod method;
  private final Integer limit;

  protected AlignConfig(final Builder builder) {
    field_spec = builder.fieldSpec == null || builder.fieldSpec.isEmpty() 
        ? ImmutableList.of(Const.DEFAULT_FIELD) 
        : ImmutableList.copyOf(builder.fieldSpec);
    period = Strings.isNullOrEmpty(builder.period) ? DEFAULT_PERIOD 
        : builder.period;
    method = builder.method == null ? DEFAULT_METHOD : builder.method;
    limit = builder.limit;
  }

  /** @return The paths to align, "value" by default. */
  public List<String> getFieldSpec() {
    return field_spec;
  }

  /** @return The parsed paths. */
  public List<FieldPath> fieldPaths() {
    return FieldPath.listOf(field_spec);
  }

  /** @return The period as a bucket size, "5m" by default. */
  public String getPeriod() {
    return period;
  }

  /** @return The period in milliseconds. */
  public long periodLength() {
    return DateTime.parseSizeSpec(period);
  }

  /** @return The method, linear by default. */
  public AlignMethod getMethod() {
    return method;
  }

  /** @return The maximum number of boundaries in a gap, null for no cap. */
  public Integer getLimit() {
    return limit;
  }

  /** Validates the config
   * @throws IllegalArgumentException if one or more parameters were invalid
   */
  @Override
  public void validate() {
    validateFieldSpec(field_spec, "fieldSpec");
    DateTime.parseSizeSpec(period);
    if (limit != null && limit < 0) {
      throw new IllegalArgumentException("Limit cannot be negative: " + limit);
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final AlignConfig config = (AlignConfig) o;
    return Objects.equal(field_spec, config.field_spec)
        && Objects.equal(period, config.period)
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
        .putString(period, Const.UTF8_CHARSET)
        .putString(method.getName(), Const.UTF8_CHARSET)
        .putInt(limit == null ? -1 : limit)
        .hash();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("fieldSpec=")
        .append(field_spec)
        .append(", period=")
        .append(period)
        .append(", method=")
        .append(method.getName())
        .append(", limit=")
        .append(limit)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(final AlignConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    return new Builder()
        .setFieldSpec(config.field_spec)
        .setPeriod(config.period)
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
    private String period = DEFAULT_PERIOD;
    @JsonProperty
    private AlignMethod method = DEFAULT_METHOD;
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

    public Builder setPeriod(final String period) {
      this.period = period;
      return this;
    }

    public Builder setMethod(final AlignMethod method) {
      this.method = method;
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
    public AlignConfig build() {
      final AlignConfig config = new AlignConfig(this);
      config.validate();
      return config;
    }
  }
}
