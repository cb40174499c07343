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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.tidepool.data.FieldPath;
import net.tidepool.exceptions.EmptySeriesListException;
import net.tidepool.exceptions.MissingRequiredOptionException;
import net.tidepool.query.aggregators.Reducers;

public class TestSeriesListOptions {

  @Test
  public void builder() throws Exception {
    final TimeSeries series = TimeSeries.fromJSON("{\"columns\":[\"time\","
        + "\"value\"],\"points\":[[1000,1]]}");
    final SeriesListOptions options = SeriesListOptions.newBuilder()
        .setSeriesList(Lists.newArrayList(series))
        .setFieldSpec(Lists.newArrayList("in", "net.out"))
        .setReducer("max")
        .setName("peak")
        .setUtc(false)
        .addMeta("site", null)
        .build();
    options.validate();
    options.validateReducer();
    assertSame(series, options.getSeriesList().get(0));
    assertSame(Reducers.MAX, options.getReducer());
    assertEquals(Lists.newArrayList(FieldPath.of("in"), 
        FieldPath.of("net.out")), options.fieldPaths());
    assertEquals(ImmutableMap.of("name", "peak", "utc", false), 
        options.getMeta());
    
    final SeriesListOptions defaults = SeriesListOptions.newBuilder()
        .setSeriesList(Lists.newArrayList(series))
        .build();
    assertNull(defaults.fieldPaths());
    assertNull(defaults.getReducer());
    assertTrue(defaults.getMeta().isEmpty());
  }

  @Test
  public void validate() throws Exception {
    try {
      SeriesListOptions.newBuilder().build().validate();
      fail("Expected EmptySeriesListException");
    } catch (EmptySeriesListException e) { }
    
    try {
      SeriesListOptions.newBuilder()
          .setSeriesList(Lists.<TimeSeries>newArrayList())
          .build()
          .validate();
      fail("Expected EmptySeriesListException");
    } catch (EmptySeriesListException e) { }
    
    try {
      SeriesListOptions.newBuilder().build().validateReducer();
      fail("Expected MissingRequiredOptionException");
    } catch (MissingRequiredOptionException e) { }
    
    try {
      SeriesListOptions.newBuilder().setReducer("nosuchreducer");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
