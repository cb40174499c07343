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
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tidepool.query.aggregators.PercentileInterpolation;
import net.tidepool.query.aggregators.Reducers;
import net.tidepool.query.aggregators.ValueFilter;
import net.tidepool.time.TimeRange;

public class TestEventCollection {
  private static final FieldPath VALUE = FieldPath.DEFAULT;

  private static EventCollection collection(final Object... values) {
    final List<Event> events = Lists.newArrayList();
    for (int i = 0; i < values.length; i++) {
      events.add(new TimeEvent((i + 1) * 1000L, values[i]));
    }
    return EventCollection.of(events);
  }

  private static final EventCollection BISECT = EventCollection.of(
      ImmutableList.of(new TimeEvent(100, 1), new TimeEvent(200, 2), 
          new TimeEvent(300, 3)));

  @Test
  public void ctor() throws Exception {
    final EventCollection c = collection(1, 2, 3);
    assertEquals(EventType.TIME, c.type());
    assertEquals(3, c.size());
    assertEquals(3, c.count());
    assertFalse(c.isEmpty());
    assertEquals(1L, c.atFirst().get(VALUE));
    assertEquals(3L, c.atLast().get(VALUE));
    assertEquals(2L, c.at(1).get(VALUE));
    
    final EventCollection empty = EventCollection.empty(EventType.INDEX);
    assertEquals(EventType.INDEX, empty.type());
    assertNull(empty.atFirst());
    assertNull(empty.atLast());
    assertNull(empty.range());
  }

  @Test(expected = IllegalArgumentException.class)
  public void ctorMixedTypes() throws Exception {
    EventCollection.of(ImmutableList.of(new TimeEvent(1000, 1), 
        new TimeRangeEvent(new TimeRange(1000, 2000), EventData.EMPTY)));
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void atOutOfRange() throws Exception {
    collection(1).at(1);
  }

  @Test
  public void atKey() throws Exception {
    final EventCollection c = EventCollection.of(ImmutableList.of(
        new TimeEvent(1000, 1), new TimeEvent(1000, 2), new TimeEvent(2000, 3)));
    assertEquals(2, c.atKey("1000").size());
    assertTrue(c.atKey("5000").isEmpty());
  }

  @Test
  public void bisect() throws Exception {
    assertEquals(0, (int) BISECT.bisect(Instant.ofEpochMilli(150)));
    assertEquals(1, (int) BISECT.bisect(Instant.ofEpochMilli(200)));
    assertEquals(0, (int) BISECT.bisect(Instant.ofEpochMilli(50)));
    assertEquals(2, (int) BISECT.bisect(Instant.ofEpochMilli(400)));
    assertEquals(0, (int) BISECT.bisect(Instant.ofEpochMilli(100)));
    assertEquals(2, (int) BISECT.bisect(Instant.ofEpochMilli(300)));
    assertEquals(1, (int) BISECT.bisect(Instant.ofEpochMilli(250), 1));
    assertNull(EventCollection.empty(EventType.TIME)
        .bisect(Instant.ofEpochMilli(100)));
  }

  @Test
  public void slice() throws Exception {
    final EventCollection c = collection(1, 2, 3, 4);
    assertEquals(2, c.slice(1, 3).size());
    assertEquals(2L, c.slice(1, 3).atFirst().get(VALUE));
    assertEquals(3L, c.slice(1, 3).atLast().get(VALUE));
    assertEquals(4, c.slice(-5, 10).size());
    assertTrue(c.slice(3, 1).isEmpty());
  }

  @Test
  public void cleanAndSizeValid() throws Exception {
    final EventCollection c = collection(1, null, Double.NaN, 4);
    assertEquals(2, c.sizeValid(VALUE));
    final EventCollection cleaned = c.clean(VALUE);
    assertEquals(2, cleaned.size());
    assertEquals(4L, cleaned.atLast().get(VALUE));
  }

  @Test
  public void filterAndMap() throws Exception {
    final EventCollection c = collection(1, 2, 3, 4);
    final EventCollection even = c.filter(new Predicate<Event>() {
      @Override
      public boolean test(final Event event) {
        return ((Long) event.get(VALUE)) % 2 == 0;
      }
    });
    assertEquals(2, even.size());
    
    final EventCollection mapped = c.map(new Function<Event, Event>() {
      @Override
      public Event apply(final Event event) {
        return event.setData(EventData.of("value", 
            ((Long) event.get(VALUE)) * 10));
      }
    });
    assertEquals(40L, mapped.atLast().get(VALUE));
    assertEquals(4L, c.atLast().get(VALUE));
  }

  @Test
  public void addEvent() throws Exception {
    final EventCollection c = collection(1);
    final EventCollection added = c.addEvent(new TimeEvent(5000, 5));
    assertEquals(1, c.size());
    assertEquals(2, added.size());
    try {
      c.addEvent(new IndexedEvent("2015", EventData.EMPTY, true));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void sortByTime() throws Exception {
    final EventCollection c = EventCollection.of(ImmutableList.of(
        new TimeEvent(3000, 3), new TimeEvent(1000, 1), new TimeEvent(2000, 2)));
    assertFalse(c.isChronological());
    final EventCollection sorted = c.sortByTime();
    assertTrue(sorted.isChronological());
    assertEquals(1L, sorted.atFirst().get(VALUE));
    assertSame(sorted, sorted.sortByTime());
  }

  @Test
  public void sortByValue() throws Exception {
    final EventCollection sorted = collection(3, null, 1.5, 2).sort(VALUE);
    assertEquals(1.5, sorted.at(0).get(VALUE));
    assertEquals(2L, sorted.at(1).get(VALUE));
    assertEquals(3L, sorted.at(2).get(VALUE));
    assertNull(sorted.at(3).get(VALUE));
  }

  @Test
  public void range() throws Exception {
    final EventCollection c = EventCollection.of(ImmutableList.of(
        new TimeRangeEvent(new TimeRange(1000, 5000), EventData.EMPTY),
        new TimeRangeEvent(new TimeRange(2000, 3000), EventData.EMPTY)));
    assertEquals(new TimeRange(1000, 5000), c.range());
    assertEquals(Instant.ofEpochMilli(1000), c.begin());
    assertEquals(Instant.ofEpochMilli(5000), c.end());
  }

  @Test
  public void columns() throws Exception {
    final EventCollection c = EventCollection.of(ImmutableList.of(
        new TimeEvent(1000, EventData.of("in", 1)),
        new TimeEvent(2000, EventData.of("out", 1, "in", 2))));
    assertEquals(ImmutableList.of("in", "out"), c.columns());
  }

  @Test
  public void statistics() throws Exception {
    final EventCollection c = collection(1, 2, 3, 4);
    assertEquals(10.0, c.sum(VALUE), 0.0001);
    assertEquals(2.5, c.avg(VALUE), 0.0001);
    assertEquals(2.5, c.mean(VALUE), 0.0001);
    assertEquals(1.0, c.min(VALUE), 0.0001);
    assertEquals(4.0, c.max(VALUE), 0.0001);
    assertEquals(2.5, c.median(VALUE), 0.0001);
    assertEquals(1.118033988749895, c.stdev(VALUE), 0.0001);
    assertEquals(1L, c.first(VALUE));
    assertEquals(4L, c.last(VALUE));
    assertEquals(4L, c.aggregate(Reducers.COUNT, VALUE));
  }

  @Test
  public void statisticsWithMissing() throws Exception {
    final EventCollection c = collection(1, 2, null, 3, 4);
    assertEquals(10.0, c.sum(VALUE), 0.0001);
    assertEquals(2.5, c.avg(VALUE, ValueFilter.IGNORE_MISSING), 0.0001);
    assertEquals(2.0, c.avg(VALUE, ValueFilter.ZERO_MISSING), 0.0001);
    assertNull(c.avg(VALUE, ValueFilter.PROPAGATE_MISSING));
    assertNull(c.sum(VALUE, ValueFilter.KEEP_MISSING));
    assertNull(c.first(VALUE, ValueFilter.PROPAGATE_MISSING));
    assertEquals(5L, c.aggregate(Reducers.count(ValueFilter.KEEP_MISSING), 
        VALUE));
    assertEquals(4L, c.aggregate(Reducers.COUNT, VALUE));
  }

  @Test
  public void statisticsEmpty() throws Exception {
    final EventCollection c = collection(null, Double.NaN);
    assertNull(c.sum(VALUE));
    assertNull(c.avg(VALUE));
    assertNull(c.median(VALUE));
    assertNull(c.stdev(VALUE));
    assertNull(c.first(VALUE));
    assertNull(c.percentile(50, VALUE));
    assertNull(EventCollection.empty(EventType.TIME).max(VALUE));
  }

  @Test
  public void percentile() throws Exception {
    final EventCollection c = collection(4, 2, 1, 3);
    assertEquals(2.5, c.percentile(50, VALUE), 0.0001);
    assertEquals(1.75, c.percentile(25, VALUE), 0.0001);
    assertEquals(1.0, c.percentile(0, VALUE), 0.0001);
    assertEquals(4.0, c.percentile(100, VALUE), 0.0001);
    assertEquals(2.0, c.percentile(50, VALUE, PercentileInterpolation.LOWER, 
        ValueFilter.IGNORE_MISSING), 0.0001);
    assertEquals(3.0, c.percentile(50, VALUE, PercentileInterpolation.HIGHER, 
        ValueFilter.IGNORE_MISSING), 0.0001);
    assertEquals(3.0, c.percentile(50, VALUE, 
        PercentileInterpolation.NEAREST, ValueFilter.IGNORE_MISSING), 0.0001);
    assertEquals(2.0, c.percentile(25, VALUE, 
        PercentileInterpolation.NEAREST, ValueFilter.IGNORE_MISSING), 0.0001);
    assertEquals(2.5, c.percentile(50, VALUE, 
        PercentileInterpolation.MIDPOINT, ValueFilter.IGNORE_MISSING), 0.0001);
  }

  @Test(expected = IllegalArgumentException.class)
  public void percentileOutOfRange() throws Exception {
    collection(1, 2).percentile(101, VALUE);
  }

  @Test
  public void quantile() throws Exception {
    final List<Double> cuts = collection(1, 2, 3, 4).quantile(4, VALUE, 
        PercentileInterpolation.LINEAR);
    assertEquals(3, cuts.size());
    assertEquals(1.75, cuts.get(0), 0.0001);
    assertEquals(2.5, cuts.get(1), 0.0001);
    assertEquals(3.25, cuts.get(2), 0.0001);
    assertTrue(collection(1).quantile(1, VALUE, 
        PercentileInterpolation.LINEAR).isEmpty());
  }

  @Test
  public void is() throws Exception {
    assertTrue(EventCollection.is(collection(1, 2), collection(1, 2)));
    assertFalse(EventCollection.is(collection(1, 2), collection(1, 3)));
    assertFalse(EventCollection.is(collection(1, 2), collection(1)));
    assertEquals(collection(1, 2), collection(1, 2));
    assertEquals(collection(1, 2).hashCode(), collection(1, 2).hashCode());
    assertTrue(EventCollection.is(EventCollection.empty(EventType.TIME), 
        EventCollection.empty(EventType.INDEX)));
  }
}
