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
package net.tidepool.series;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.tidepool.data.FieldPath;
import net.tidepool.exceptions.EmptySeriesListException;
import net.tidepool.exceptions.MissingRequiredOptionException;
import net.tidepool.query.aggregators.Reducer;
import net.tidepool.query.aggregators.Reducers;
import net.tidepool.query.pojo.Validatable;

/**
 * Options for combining a list of series into one with 
 * {@link TimeSeries#timeSeriesListReduce(SeriesListOptions)} or
 * {@link TimeSeries#timeSeriesListMerge(SeriesListOptions)}. Any meta 
 * data given here (name, utc, extra keys) is attached to the result.
 * 
 * @since 1.0
 */
public class SeriesListOptions extends Validatable {
  /** The series to combine. */
  private final List<TimeSeries> series_list;

  /** Optional columns to reduce, null for all of them. */
  private final List<String> field_spec;

  /** The reducer, required for reductions only. */
  private final Reducer reducer;

  /** Meta data for the result. */
  private final Map<String, Object> meta;

  protected SeriesListOptions(final Builder builder) {
    series_list = builder.seriesList;
    field_spec = builder.fieldSpec;
    reducer = builder.reducer;
    meta = ImmutableMap.copyOf(builder.meta);
  }

  /** @return The series to combine, may be null if not set. */
  public List<TimeSeries> getSeriesList() {
    return series_list;
  }

  /** @return The columns to reduce, null for every column. */
  public List<String> getFieldSpec() {
    return field_spec;
  }

  /** @return The parsed columns to reduce, null for every column. */
  public List<FieldPath> fieldPaths() {
    return field_spec == null || field_spec.isEmpty() ? null 
        : FieldPath.listOf(field_spec);
  }

  /** @return The reducer, may be null. */
  public Reducer getReducer() {
    return reducer;
  }

  /** @return The meta data for the result, may be empty. */
  public Map<String, Object> getMeta() {
    return meta;
  }

  /**
   * Checks the list only. Reductions also call {@link #validateReducer()}.
   * @throws EmptySeriesListException if the list was null or empty.
   */
  @Override
  public void validate() {
    if (series_list == null || series_list.isEmpty()) {
      throw new EmptySeriesListException("A list of series must be supplied.");
    }
    for (int i = 0; i < series_list.size(); i++) {
      if (series_list.get(i) == null) {
        throw new IllegalArgumentException("Series at index " + i 
            + " was null.");
      }
    }
    validateFieldSpec(field_spec, "fieldSpec");
  }

  /**
   * @throws MissingRequiredOptionException if the reducer was null.
   */
  public void validateReducer() {
    if (reducer == null) {
      throw new MissingRequiredOptionException("A reducer must be supplied, "
          + "for example Reducers.AVG.");
    }
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("seriesList=")
        .append(series_list == null ? "null" : series_list.size())
        .append(", fieldSpec=")
        .append(field_spec)
        .append(", reducer=")
        .append(reducer)
        .append(", meta=")
        .append(meta)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private List<TimeSeries> seriesList;
    private List<String> fieldSpec;
    private Reducer reducer;
    private Map<String, Object> meta = Maps.newLinkedHashMap();

    public Builder setSeriesList(final List<TimeSeries> series_list) {
      seriesList = series_list == null ? null : 
        ImmutableList.copyOf(series_list);
      return this;
    }

    public Builder setFieldSpec(final List<String> field_spec) {
      fieldSpec = field_spec == null ? null : ImmutableList.copyOf(field_spec);
      return this;
    }

    public Builder setFieldSpec(final String field_spec) {
      fieldSpec = ImmutableList.of(field_spec);
      return this;
    }

    public Builder setReducer(final Reducer reducer) {
      this.reducer = reducer;
      return this;
    }

    /**
     * @param reducer The name of a registered reducer, e.g. "sum".
     * @return The builder.
     */
    public Builder setReducer(final String reducer) {
      this.reducer = Reducers.get(reducer);
      return this;
    }

    public Builder setName(final String name) {
      return addMeta(TimeSeries.NAME_KEY, name);
    }

    public Builder setUtc(final boolean utc) {
      return addMeta(TimeSeries.UTC_KEY, utc);
    }

    /**
     * @param key A non-null key.
     * @param value The value, null values are ignored.
     * @return The builder.
     */
    public Builder addMeta(final String key, final Object value) {
      if (key == null) {
        throw new IllegalArgumentException("Meta key cannot be null.");
      }
      if (value != null) {
        meta.put(key, value);
      }
      return this;
    }

    public SeriesListOptions build() {
      return new SeriesListOptions(this);
    }
  }
}
