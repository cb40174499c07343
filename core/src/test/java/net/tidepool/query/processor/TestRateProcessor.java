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
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.tidepool.data.Event;
import net.tidepool.data.EventData;
import net.tidepool.data.EventType;
import net.tidepool.data.TimeEvent;
import net.tidepool.query.Batch;
import net.tidepool.query.pojo.RateConfig;
import net.tidepool.time.TimeRange;

public class TestRateProcessor {

  private static List<Event> rate(final List<Event> events, 
                                  final boolean allow_negative) {
    return new RateProcessor(RateConfig.newBuilder()
        .setAllowNegative(allow_negative)
        .build())
      .process(Batch.of(events))
      .events();
  }

  @Test
  public void rate() throws Exception {
    final List<Event> source = Lists.<Event>newArrayList(
        new TimeEvent(0, 10),
        new TimeEvent(10000, 30),
        new TimeEvent(20000, 25));
    final List<Event> rates = rate(source, true);
    assertEquals(2, rates.size());
    assertEquals(EventType.TIMERANGE, rates.get(0).type());
    assertEquals(new TimeRange(0, 10000), rates.get(0).timerange());
    assertEquals(2.0, (Double) rates.get(0).get("value_rate"), 0.0001);
    assertEquals(new TimeRange(10000, 20000), rates.get(1).timerange());
    assertEquals(-0.5, (Double) rates.get(1).get("value_rate"), 0.0001);
    assertEquals(1, rates.get(0).data().size());
  }

  @Test
  public void negativeNotAllowed() throws Exception {
    final List<Event> source = Lists.<Event>newArrayList(
        new TimeEvent(0, 10),
        new TimeEvent(10000, 5));
    final List<Event> rates = rate(source, false);
    assertEquals(1, rates.size());
    assertTrue(rates.get(0).data().keys().contains("value_rate"));
    assertNull(rates.get(0).get("value_rate"));
  }

  @Test
  public void missingAndNonNumeric() throws Exception {
    final List<Event> source = Lists.<Event>newArrayList(
        new TimeEvent(0, 10),
        new TimeEvent(1000, (Object) null),
        new TimeEvent(2000, "up"),
        new TimeEvent(3000, 4));
    final List<Event> rates = rate(source, true);
    assertEquals(3, rates.size());
    for (final Event event : rates) {
      assertNull(event.get("value_rate"));
    }
  }

  @Test
  public void zeroInterval() throws Exception {
    final List<Event> source = Lists.<Event>newArrayList(
        new TimeEvent(1000, 1),
        new TimeEvent(1000, 2));
    assertNull(rate(source, true).get(0).get("value_rate"));
  }

  @Test
  public void nestedPaths() throws Exception {
    final List<Event> source = Lists.<Event>newArrayList(
        new TimeEvent(0, EventData.of("net", EventData.of("in", 0))),
        new TimeEvent(2000, EventData.of("net", EventData.of("in", 4))));
    final List<Event> rates = new RateProcessor(RateConfig.newBuilder()
        .setFieldSpec("net.in")
        .build())
      .process(Batch.of(source))
      .events();
    assertEquals(2.0, (Double) rates.get(0).get("net.in_rate"), 0.0001);
  }

  @Test
  public void singleEvent() throws Exception {
    assertTrue(rate(Lists.<Event>newArrayList(new TimeEvent(0, 1)), true)
        .isEmpty());
  }
}
