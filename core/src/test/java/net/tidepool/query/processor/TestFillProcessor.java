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
package net.tidepool.query.processor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.tidepool.data.Event;
import net.tidepool.data.EventData;
import net.tidepool.data.TimeEvent;
import net.tidepool.query.Batch;
import net.tidepool.query.pojo.FillConfig;
import net.tidepool.query.pojo.FillMethod;

public class TestFillProcessor {

  private static List<Event> events(final Object... values) {
    final List<Event> events = Lists.newArrayList();
    for (int i = 0; i < values.length; i++) {
      events.add(new TimeEvent(i * 1000L, values[i]));
    }
    return events;
  }

  private static List<Event> fill(final List<Event> events, 
                                  final FillMethod method, 
                                  final Integer limit) {
    return new FillProcessor(FillConfig.newBuilder()
        .setMethod(method)
        .setLimit(limit)
        .build())
      .process(Batch.of(events))
      .events();
  }

  @Test
  public void zero() throws Exception {
    final List<Event> filled = fill(events(1, null, Double.NaN, 4), 
        FillMethod.ZERO, null);
    assertEquals(1L, filled.get(0).get("value"));
    assertEquals(0L, filled.get(1).get("value"));
    assertEquals(0L, filled.get(2).get("value"));
    assertEquals(4L, filled.get(3).get("value"));
  }

  @Test
  public void zeroLimit() throws Exception {
    final List<Event> filled = fill(events(null, null, null, 4, null), 
        FillMethod.ZERO, 2);
    assertEquals(0L, filled.get(0).get("value"));
    assertEquals(0L, filled.get(1).get("value"));
    assertNull(filled.get(2).get("value"));
    assertEquals(4L, filled.get(3).get("value"));
    assertEquals(0L, filled.get(4).get("value"));
  }

  @Test
  public void zeroMissingColumn() throws Exception {
    final List<Event> source = Lists.<Event>newArrayList(
        new TimeEvent(1000, EventData.of("a", 1)),
        new TimeEvent(2000, EventData.of("b", 2)));
    final List<Event> filled = new FillProcessor(FillConfig.newBuilder()
        .setFieldSpec(Lists.newArrayList("a", "nested.c"))
        .build())
      .process(Batch.of(source))
      .events();
    assertEquals(1L, filled.get(0).get("a"));
    assertEquals(0L, filled.get(0).get("nested.c"));
    assertEquals(0L, filled.get(1).get("a"));
    assertEquals(2L, filled.get(1).get("b"));
  }

  @Test
  public void pad() throws Exception {
    final List<Event> filled = fill(events(null, 1, null, null, 4, null), 
        FillMethod.PAD, null);
    assertNull(filled.get(0).get("value"));
    assertEquals(1L, filled.get(1).get("value"));
    assertEquals(1L, filled.get(2).get("value"));
    assertEquals(1L, filled.get(3).get("value"));
    assertEquals(4L, filled.get(4).get("value"));
    assertEquals(4L, filled.get(5).get("value"));
  }

  @Test
  public void padLimit() throws Exception {
    final List<Event> filled = fill(events(1, null, null, null), 
        FillMethod.PAD, 1);
    assertEquals(1L, filled.get(1).get("value"));
    assertNull(filled.get(2).get("value"));
    assertNull(filled.get(3).get("value"));
  }

  @Test
  public void linear() throws Exception {
    final List<Event> filled = fill(events(1, null, null, 4), 
        FillMethod.LINEAR, null);
    assertEquals(4, filled.size());
    assertEquals(1L, filled.get(0).get("value"));
    assertEquals(2.0, (Double) filled.get(1).get("value"), 0.0001);
    assertEquals(3.0, (Double) filled.get(2).get("value"), 0.0001);
    assertEquals(4L, filled.get(3).get("value"));
  }

  @Test
  public void linearByTime() throws Exception {
    final List<Event> source = Lists.<Event>newArrayList(
        new TimeEvent(0, 0),
        new TimeEvent(1000, (Object) null),
        new TimeEvent(4000, 8));
    final List<Event> filled = fill(source, FillMethod.LINEAR, null);
    assertEquals(2.0, (Double) filled.get(1).get("value"), 0.0001);
  }

  @Test
  public void linearUnbracketed() throws Exception {
    final List<Event> filled = fill(events(null, 1, null, 3, null), 
        FillMethod.LINEAR, null);
    assertNull(filled.get(0).get("value"));
    assertEquals(2.0, (Double) filled.get(2).get("value"), 0.0001);
    assertNull(filled.get(4).get("value"));
  }

  @Test
  public void linearLimit() throws Exception {
    List<Event> filled = fill(events(1, null, null, 4, null, 6), 
        FillMethod.LINEAR, 1);
    assertNull(filled.get(1).get("value"));
    assertNull(filled.get(2).get("value"));
    assertEquals(5.0, (Double) filled.get(4).get("value"), 0.0001);
    
    filled = fill(events(1, null, 3), FillMethod.LINEAR, 0);
    assertNull(filled.get(1).get("value"));
  }

  @Test
  public void linearNonNumeric() throws Exception {
    final List<Event> filled = fill(events(1, null, "up", null, 5), 
        FillMethod.LINEAR, null);
    assertEquals(5, filled.size());
    assertNull(filled.get(1).get("value"));
    assertEquals("up", filled.get(2).get("value"));
    assertNull(filled.get(3).get("value"));
    assertEquals(5L, filled.get(4).get("value"));
  }

  @Test
  public void validUntouched() throws Exception {
    final List<Event> source = events(1, 2);
    final List<Event> filled = fill(source, FillMethod.PAD, null);
    assertSame(source.get(0), filled.get(0));
    assertSame(source.get(1), filled.get(1));
  }
}
