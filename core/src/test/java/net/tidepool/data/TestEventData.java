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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.tidepool.utils.JSON;

public class TestEventData {

  @Test
  public void ofNormalizesNumbers() throws Exception {
    final EventData data = EventData.of("a", 1, "b", 1.5f);
    assertEquals(1L, data.get("a"));
    assertEquals(1.5, data.get("b"));
    assertEquals(EventData.of("a", 1L, "b", 1.5), data);
    assertEquals(EventData.of("a", 1L, "b", 1.5).hashCode(), data.hashCode());
  }

  @Test
  public void nestedMaps() throws Exception {
    final EventData data = EventData.of("in", 
        ImmutableMap.of("avg", 5, "max", 9));
    assertTrue(data.get("in") instanceof EventData);
    assertEquals(5L, data.get(FieldPath.of("in.avg")));
    assertEquals(9L, data.get(FieldPath.of("in.max")));
    assertNull(data.get(FieldPath.of("in.min")));
    assertNull(data.get(FieldPath.of("in.avg.deeper")));
    assertNull(data.get(FieldPath.of("out")));
  }

  @Test
  public void has() throws Exception {
    final EventData data = EventData.newBuilder()
        .put("a", null)
        .put("b", ImmutableMap.of("c", 1))
        .build();
    assertTrue(data.has(FieldPath.of("a")));
    assertTrue(data.has(FieldPath.of("b.c")));
    assertFalse(data.has(FieldPath.of("b.d")));
    assertFalse(data.has(FieldPath.of("a.b")));
    assertFalse(data.has(FieldPath.of("z")));
  }

  @Test
  public void withSharesUntouchedData() throws Exception {
    final EventData data = EventData.of(
        "a", ImmutableMap.of("x", 1), 
        "b", ImmutableMap.of("y", 2));
    final EventData updated = data.with(FieldPath.of("a.x"), 3);
    
    assertEquals(3L, updated.get(FieldPath.of("a.x")));
    assertEquals(1L, data.get(FieldPath.of("a.x")));
    assertSame(data.get("b"), updated.get("b"));
    assertEquals(ImmutableList.of("a", "b"), 
        Lists.newArrayList(updated.keys()));
  }

  @Test
  public void withCreatesIntermediateData() throws Exception {
    final EventData data = EventData.of("a", 1);
    final EventData updated = data.with(FieldPath.of("a.b.c"), "x");
    assertEquals("x", updated.get(FieldPath.of("a.b.c")));
    assertEquals(1, updated.size());
    assertEquals(1L, data.get("a"));
  }

  @Test
  public void withAppendsNewColumns() throws Exception {
    final EventData data = EventData.of("a", 1, "b", 2).with("a", 10)
        .with("c", 3);
    assertEquals(ImmutableList.of("a", "b", "c"), 
        Lists.newArrayList(data.keys()));
    assertEquals(10L, data.get("a"));
  }

  @Test
  public void withoutAndRetain() throws Exception {
    final EventData data = EventData.of("a", 1, "b", 2);
    assertEquals(EventData.of("b", 2), data.without("a"));
    assertSame(data, data.without("z"));
    assertSame(EventData.EMPTY, EventData.of("a", 1).without("a"));
    
    assertEquals(EventData.of("b", 2), data.retain(ImmutableList.of("b", "z")));
    assertTrue(data.retain(ImmutableList.of("z")).isEmpty());
  }

  @Test
  public void listsAreNormalized() throws Exception {
    final EventData data = EventData.of("l", Lists.newArrayList(1, 2.5f));
    final List<?> list = (List<?>) data.get("l");
    assertEquals(1L, list.get(0));
    assertEquals(2.5, list.get(1));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void listsAreImmutable() throws Exception {
    @SuppressWarnings("unchecked")
    final List<Object> list = (List<Object>) 
        EventData.of("l", Lists.newArrayList(1)).get("l");
    list.add(2);
  }

  @Test
  public void ofMapView() throws Exception {
    final EventData data = EventData.of("a", 1);
    assertSame(data, EventData.of(data.asMap()));
    assertSame(EventData.EMPTY, EventData.of((java.util.Map<String, ?>) null));
  }

  @Test(expected = IllegalArgumentException.class)
  public void withNullKey() throws Exception {
    EventData.EMPTY.with((String) null, 1);
  }

  @Test
  public void builderFromData() throws Exception {
    final EventData data = EventData.newBuilder(EventData.of("a", 1))
        .put(FieldPath.of("b.c"), 2)
        .build();
    assertEquals(1L, data.get("a"));
    assertEquals(2L, data.get(FieldPath.of("b.c")));
    assertSame(EventData.EMPTY, EventData.newBuilder().build());
  }

  @Test
  public void serialize() throws Exception {
    final EventData data = EventData.newBuilder()
        .put("a", 1)
        .put("b", null)
        .put("c", ImmutableMap.of("d", "x"))
        .build();
    assertEquals("{\"a\":1,\"b\":null,\"c\":{\"d\":\"x\"}}", 
        JSON.serializeToString(data));
  }
}
