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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.tidepool.data.FieldPath;
import net.tidepool.exceptions.InvalidFillMethodException;
import net.tidepool.utils.JSON;

public class TestFillConfig {

  @Test
  public void builder() throws Exception {
    FillConfig config = FillConfig.newBuilder().build();
    assertEquals(Lists.newArrayList("value"), config.getFieldSpec());
    assertEquals(Lists.newArrayList(FieldPath.DEFAULT), config.fieldPaths());
    assertSame(FillMethod.ZERO, config.getMethod());
    assertNull(config.getLimit());
    
    config = FillConfig.newBuilder()
        .setFieldSpec(Lists.newArrayList("in", "direction.out"))
        .setMethod(FillMethod.PAD)
        .setLimit(3)
        .build();
    assertEquals(Lists.newArrayList("in", "direction.out"), 
        config.getFieldSpec());
    assertEquals(FieldPath.of("direction.out"), config.fieldPaths().get(1));
    assertSame(FillMethod.PAD, config.getMethod());
    assertEquals(3, (int) config.getLimit());
    
    config = FillConfig.newBuilder()
        .setFieldSpec("in")
        .setMethod("linear")
        .build();
    assertSame(FillMethod.LINEAR, config.getMethod());
  }

  @Test
  public void builderErrors() throws Exception {
    try {
      FillConfig.newBuilder().setLimit(-1).build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      FillConfig.newBuilder()
          .setFieldSpec(Lists.newArrayList("in", "out"))
          .setMethod(FillMethod.LINEAR)
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      FillConfig.newBuilder().setFieldSpec("in..out").build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      FillConfig.newBuilder().setMethod("spline");
      fail("Expected InvalidFillMethodException");
    } catch (InvalidFillMethodException e) { }
  }

  @Test
  public void cloneBuilder() throws Exception {
    final FillConfig config = FillConfig.newBuilder()
        .setFieldSpec("in")
        .setMethod(FillMethod.PAD)
        .setLimit(2)
        .build();
    final FillConfig clone = FillConfig.newBuilder(config).build();
    assertEquals(config, clone);
    assertEquals(config.hashCode(), clone.hashCode());
    
    final FillConfig other = FillConfig.newBuilder(config)
        .setLimit(null)
        .build();
    assertNotEquals(config, other);
    assertNotEquals(config.hashCode(), other.hashCode());
  }

  @Test
  public void serdes() throws Exception {
    final FillConfig config = FillConfig.newBuilder()
        .setFieldSpec("in")
        .setMethod(FillMethod.PAD)
        .build();
    final String json = JSON.serializeToString(config);
    assertTrue(json.contains("\"fieldSpec\":[\"in\"]"));
    assertTrue(json.contains("\"method\":\"pad\""));
    assertFalse(json.contains("limit"));
    assertEquals(config, JSON.parseToObject(json, FillConfig.class));
    
    final FillConfig parsed = JSON.parseToObject(
        "{\"fieldSpec\":\"out\",\"method\":\"linear\",\"limit\":5,"
        + "\"unknown\":true}", FillConfig.class);
    assertEquals(Lists.newArrayList("out"), parsed.getFieldSpec());
    assertSame(FillMethod.LINEAR, parsed.getMethod());
    assertEquals(5, (int) parsed.getLimit());
    
    assertEquals(FillConfig.newBuilder().build(), 
        JSON.parseToObject("{}", FillConfig.class));
  }

  @Test(expected = IllegalArgumentException.class)
  public void serdesInvalidMethod() throws Exception {
    JSON.parseToObject("{\"method\":\"spline\"}", FillConfig.class);
  }
}
