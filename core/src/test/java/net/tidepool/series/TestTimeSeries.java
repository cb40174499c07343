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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.tidepool.data.Event;
import net.tidepool.data.EventCollection;
import net.tidepool.data.EventData;
import net.tidepool.data.EventType;
import net.tidepool.data.TimeEvent;
import net.tidepool.exceptions.EmptySeriesListException;
import net.tidepool.exceptions.MissingRequiredOptionException;
import net.tidepool.exceptions.NonChronologicalInputException;
import net.tidepool.exceptions.UnknownEventVariantException;
import net.tidepool.query.aggregators.Reducers;
import net.tidepool.query.pojo.Aggregation;
import net.tidepool.query.pojo.FillMethod;
import net.tidepool.query.pojo.RateConfig;
import net.tidepool.query.pojo.RollupOptions;
import net.tidepool.time.Index;
import net.tidepool.time.TimeRange;

public class TestTimeSeries {
  private static final String TRAFFIC_JSON = "{\"name\":\"traffic\","
      + "\"utc\":true,\"columns\":[\"time\",\"in\",\"out\"],\"points\":["
      + "[1400425947000,52,34],[1400425948000,18,13],"
      + "[1400425949000,26,67],[1400425950000,93,91]]}";

  private static final String OUTAGES_JSON = "{\"name\":\"outages\","
      + "\"columns\":[\"timerange\",\"title\",\"esnet_ticket\"],\"points\":["
      + "[[1429673400000,1429707600000],\"BOOM\",\"ESNET-20080101-001\"],"
      + "[[1429673500000,1429707700000],\"BAM\",\"ESNET-20080101-002\"]]}";

  private static final String INDEXED_JSON = "{\"index\":\"1d-625\","
      + "\"columns\":[\"index\",\"value\"],\"points\":["
      + "[\"1d-16000\",1],[\"1d-16001\",2]]}";

  /** 2015-06-12T01:00:00Z */
  private static final long JUNE_12 = 1434070800000L;

  private static final Aggregation SUM = Aggregation.newBuilder()
      .add("value", "value", Reducers.SUM)
      .build();

  private static TimeSeries hourly() {
    return TimeSeries.newBuilder()
        .setName("hourly")
        .setEvents(Lists.<Event>newArrayList(
            new TimeEvent(JUNE_12, 1),
            new TimeEvent(JUNE_12 + 1800000, 2),
            new TimeEvent(JUNE_12 + 3600000, 3),
            new TimeEvent(JUNE_12 + 86400000, 4)))
        .build();
  }

  @Test
  public void fromJSON() throws Exception {
    final TimeSeries series = TimeSeries.fromJSON(TRAFFIC_JSON);
    assertEquals("traffic", series.name());
    assertTrue(series.isUTC());
    assertEquals(EventType.TIME, series.type());
    assertEquals(4, series.size());
    assertEquals(Lists.newArrayList("in", "out"), series.columns());
    assertEquals(52L, series.at(0).get("in"));
    assertEquals(91L, series.atLast().get("out"));
    assertEquals(Instant.ofEpochMilli(1400425947000L), series.begin());
    assertEquals(Instant.ofEpochMilli(1400425950000L), series.end());
    assertNull(series.index());
  }

  @Test
  public void toJSON() throws Exception {
    final TimeSeries series = TimeSeries.fromJSON(TRAFFIC_JSON);
    assertEquals(TRAFFIC_JSON, series.toString());
    assertEquals(series, TimeSeries.fromJSON(series.toJSON()));
    assertEquals(series.hashCode(), 
        TimeSeries.fromJSON(series.toString()).hashCode());
  }

  @Test
  public void jsonTimeRanges() throws Exception {
    final TimeSeries series = TimeSeries.fromJSON(OUTAGES_JSON);
    assertEquals(EventType.TIMERANGE, series.type());
    assertEquals(new TimeRange(1429673400000L, 1429707600000L), 
        series.at(0).timerange());
    assertEquals("BAM", series.at(1).get("title"));
    assertEquals(new TimeRange(1429673400000L, 1429707700000L), 
        series.timerange());
    assertEquals(series, TimeSeries.fromJSON(series.toString()));
  }

  @Test
  public void jsonIndexed() throws Exception {
    final TimeSeries series = TimeSeries.fromJSON(INDEXED_JSON);
    assertEquals(EventType.INDEX, series.type());
    assertEquals("1d-625", series.indexAsString());
    assertEquals(new TimeRange(625 * 86400000L, 626 * 86400000L), 
        series.indexAsRange());
    assertEquals("1d-16001", series.at(1).key());
    assertEquals(16000 * 86400000L, series.begin().toEpochMilli());
    
    final String json = series.toString();
    assertTrue(json.contains("\"index\":\"1d-625\""));
    assertEquals(series, TimeSeries.fromJSON(json));
  }

  @Test
  public void jsonMissingColumns() throws Exception {
    final TimeSeries series = TimeSeries.newBuilder()
        .setEvents(Lists.<Event>newArrayList(
            new TimeEvent(1000, EventData.of("in", 1)),
            new TimeEvent(2000, EventData.of("out", 2))))
        .build();
    assertEquals("{\"name\":\"\",\"utc\":true,\"columns\":"
        + "[\"time\",\"in\",\"out\"],\"points\":[[1000,1,null],[2000,null,2]]}", 
        series.toString());
    final TimeSeries parsed = TimeSeries.fromJSON(series.toString());
    assertTrue(parsed.at(0).data().keys().contains("out"));
    assertNull(parsed.at(0).get("out"));
  }

  @Test
  public void jsonNaN() throws Exception {
    final TimeSeries series = TimeSeries.newBuilder()
        .setEvents(Lists.<Event>newArrayList(
            new TimeEvent(1000, Double.NaN)))
        .build();
    final String json = series.toString();
    assertTrue(json.contains("[1000,NaN]"));
    assertTrue(((Double) TimeSeries.fromJSON(json).at(0).get("value"))
        .isNaN());
  }

  @Test
  public void jsonErrors() throws Exception {
    try {
      TimeSeries.fromJSON("{\"columns\":[\"bogus\",\"value\"],"
          + "\"points\":[[1,2]]}");
      fail("Expected UnknownEventVariantException");
    } catch (UnknownEventVariantException e) { }
    
    try {
      TimeSeries.fromJSON("{\"points\":[[1,2]]}");
      fail("Expected MissingRequiredOptionException");
    } catch (MissingRequiredOptionException e) { }
    
    try {
      TimeSeries.fromJSON("{\"columns\":[\"time\",\"value\"]}");
      fail("Expected MissingRequiredOptionException");
    } catch (MissingRequiredOptionException e) { }
    
    try {
      TimeSeries.fromJSON("{\"columns\":[\"time\",\"value\"],"
          + "\"points\":[[2000,1],[1000,2]]}");
      fail("Expected NonChronologicalInputException");
    } catch (NonChronologicalInputException e) { }
    
    try {
      TimeSeries.fromJSON("{\"columns\":[\"time\",\"value\"],"
          + "\"points\":[[\"notatime\",1]]}");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      TimeSeries.fromJSON("[1, 2]");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      TimeSeries.fromJSON("{not json");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void builder() throws Exception {
    final TimeSeries series = TimeSeries.newBuilder()
        .setName("table")
        .setUtc(false)
        .setIndex("2015-06")
        .addMeta("site", "lbl")
        .addMeta("dropped", null)
        .setColumns(Lists.newArrayList("time", "in", "out"))
        .setPoints(ImmutableList.of(
            Lists.<Object>newArrayList(1000L, 1, 2),
            Lists.<Object>newArrayList(2000L, 3)))
        .build();
    assertEquals("table", series.name());
    assertFalse(series.isUTC());
    assertEquals(new Index("2015-06", false), series.index());
    assertEquals("lbl", series.meta("site"));
    assertFalse(series.meta().containsKey("dropped"));
    assertEquals(2, series.size());
    assertEquals(3L, series.at(1).get("in"));
    assertTrue(series.at(1).data().keys().contains("out"));
    assertNull(series.at(1).get("out"));
    
    final TimeSeries from_collection = TimeSeries.newBuilder()
        .setCollection(series.collection())
        .build();
    assertSame(series.collection(), from_collection.collection());
    assertEquals("", from_collection.name());
    assertTrue(from_collection.isUTC());
  }

  @Test
  public void builderErrors() throws Exception {
    try {
      TimeSeries.newBuilder().setName("empty").build();
      fail("Expected MissingRequiredOptionException");
    } catch (MissingRequiredOptionException e) { }
    
    try {
      TimeSeries.newBuilder()
          .setEvents(Lists.<Event>newArrayList(new TimeEvent(1000, 1)))
          .setCollection(EventCollection.empty(EventType.TIME))
          .build();
      fail("Expected IllegalArgumentException");
    } catch (MissingRequiredOptionException e) {
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      TimeSeries.newBuilder()
          .setEvents(Lists.<Event>newArrayList(
              new TimeEvent(2000, 1), new TimeEvent(1000, 2)))
          .build();
      fail("Expected NonChronologicalInputException");
    } catch (NonChronologicalInputException e) { }
    
    try {
      TimeSeries.newBuilder()
          .addMeta("utc", "yes")
          .setEvents(Lists.<Event>newArrayList())
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      TimeSeries.newBuilder()
          .setColumns(Lists.newArrayList("time", "value"))
          .build();
      fail("Expected MissingRequiredOptionException");
    } catch (MissingRequiredOptionException e) { }
  }

  @Test
  public void emptySeries() throws Exception {
    final TimeSeries series = TimeSeries.newBuilder()
        .setEvents(Lists.<Event>newArrayList())
        .build();
    assertEquals(0, series.size());
    assertNull(series.timerange());
    assertNull(series.atFirst());
    assertNull(series.atTime(Instant.ofEpochMilli(1000)));
    assertNull(series.sum("value"));
    assertEquals("{\"name\":\"\",\"utc\":true,\"columns\":[\"time\"],"
        + "\"points\":[]}", series.toString());
  }

  @Test
  public void meta() throws Exception {
    final TimeSeries series = TimeSeries.fromJSON(TRAFFIC_JSON);
    final TimeSeries renamed = series.setName("bytes");
    assertEquals("traffic", series.name());
    assertEquals("bytes", renamed.name());
    assertSame(series.collection(), renamed.collection());
    
    final TimeSeries indexed = series.setMeta("index", "2014-05");
    assertEquals("2014-05", indexed.indexAsString());
    assertEquals(Instant.parse("2014-05-01T00:00:00Z"), 
        indexed.indexAsRange().begin());
    assertEquals(ImmutableMap.of("name", "traffic", "utc", true), 
        series.meta());
  }

  @Test
  public void equalAndIs() throws Exception {
    final TimeSeries a = TimeSeries.fromJSON(TRAFFIC_JSON);
    final TimeSeries b = TimeSeries.fromJSON(TRAFFIC_JSON);
    assertTrue(TimeSeries.equal(a, a));
    assertFalse(TimeSeries.equal(a, b));
    assertTrue(TimeSeries.is(a, b));
    assertEquals(a, b);
    
    final TimeSeries same_name = a.setName("traffic");
    assertFalse(TimeSeries.equal(a, same_name));
    assertTrue(TimeSeries.is(a, same_name));
    
    assertFalse(TimeSeries.is(a, a.setName("other")));
    assertNotEquals(a, a.slice(0, 2));
    assertFalse(TimeSeries.is(a, null));
  }

  @Test
  public void accessors() throws Exception {
    final TimeSeries series = TimeSeries.fromJSON(TRAFFIC_JSON);
    assertEquals(18L, series.atTime(Instant.ofEpochMilli(1400425948500L))
        .get("in"));
    assertEquals(52L, series.atTime(Instant.ofEpochMilli(0)).get("in"));
    assertEquals(93L, series.atTime(Instant.ofEpochMilli(Long.MAX_VALUE / 2))
        .get("in"));
    assertEquals(1, (int) series.bisect(
        Instant.ofEpochMilli(1400425948000L)));
    assertEquals(2, (int) series.bisect(
        Instant.ofEpochMilli(1400425949999L), 1));
    assertEquals(4, series.count());
    assertEquals(4, series.sizeValid("in"));
    
    try {
      series.at(4);
      fail("Expected IndexOutOfBoundsException");
    } catch (IndexOutOfBoundsException e) { }
  }

  @Test
  public void sliceCropClean() throws Exception {
    final TimeSeries series = TimeSeries.fromJSON(TRAFFIC_JSON);
    final TimeSeries sliced = series.slice(1, 3);
    assertEquals(2, sliced.size());
    assertEquals(18L, sliced.atFirst().get("in"));
    assertEquals("traffic", sliced.name());
    
    final TimeSeries cropped = series.crop(
        new TimeRange(1400425948000L, 1400425949000L));
    assertEquals(2, cropped.size());
    assertEquals(18L, cropped.atFirst().get("in"));
    assertEquals(26L, cropped.atLast().get("in"));
    
    final TimeSeries dirty = TimeSeries.newBuilder()
        .setEvents(Lists.<Event>newArrayList(
            new TimeEvent(1000, 1),
            new TimeEvent(2000, (Object) null),
            new TimeEvent(3000, Double.NaN)))
        .build();
    assertEquals(1, dirty.sizeValid(null));
    assertEquals(1, dirty.clean("value").size());
  }

  @Test
  public void statistics() throws Exception {
    final TimeSeries series = TimeSeries.fromJSON(TRAFFIC_JSON);
    assertEquals(189.0, series.sum("in"), 0.0001);
    assertEquals(47.25, series.avg("in"), 0.0001);
    assertEquals(47.25, series.mean("in"), 0.0001);
    assertEquals(93.0, series.max("in"), 0.0001);
    assertEquals(18.0, series.min("in"), 0.0001);
    assertEquals(39.0, series.median("in"), 0.0001);
    assertEquals(39.0, series.percentile(50, "in"), 0.0001);
    assertEquals(4L, series.aggregate(Reducers.COUNT, "in"));
    assertNull(series.sum("nosuchcolumn"));
  }

  @Test
  public void mapSelectCollapse() throws Exception {
    final TimeSeries series = TimeSeries.fromJSON(TRAFFIC_JSON);
    final TimeSeries selected = series.select(Lists.newArrayList("in"));
    assertEquals(Lists.newArrayList("in"), selected.columns());
    assertEquals("traffic", selected.name());
    
    final TimeSeries collapsed = series.collapse(
        Lists.newArrayList("in", "out"), "total", Reducers.SUM, false);
    assertEquals(Lists.newArrayList("total"), collapsed.columns());
    assertEquals(86.0, collapsed.at(0).get("total"));
    
    final TimeSeries doubled = series.map(new Function<Event, Event>() {
      @Override
      public Event apply(final Event event) {
        return event.setData(event.data().with("in", 
            ((Long) event.get("in")) * 2));
      }
    });
    assertEquals(104L, doubled.at(0).get("in"));
    assertEquals(52L, series.at(0).get("in"));
  }

  @Test(expected = NonChronologicalInputException.class)
  public void mapOutOfOrder() throws Exception {
    TimeSeries.fromJSON(TRAFFIC_JSON).map(new Function<Event, Event>() {
      @Override
      public Event apply(final Event event) {
        return new TimeEvent(-event.timestamp().toEpochMilli(), event.data());
      }
    });
  }

  @Test
  public void renameColumns() throws Exception {
    final TimeSeries renamed = TimeSeries.fromJSON(TRAFFIC_JSON)
        .renameColumns(ImmutableMap.of("in", "ingress"));
    assertEquals(Lists.newArrayList("ingress", "out"), renamed.columns());
    assertEquals(52L, renamed.at(0).get("ingress"));
  }

  @Test
  public void fillLinearChain() throws Exception {
    final TimeSeries series = TimeSeries.fromJSON("{\"columns\":"
        + "[\"time\",\"in\",\"out\"],\"points\":[[1000,1,10],[2000,null,null],"
        + "[3000,3,null],[4000,4,40]]}");
    final TimeSeries filled = series.fill(Lists.newArrayList("in", "out"), 
        FillMethod.LINEAR, null);
    assertEquals(2.0, filled.at(1).get("in"));
    assertEquals(20.0, filled.at(1).get("out"));
    assertEquals(30.0, filled.at(2).get("out"));
    
    final TimeSeries zeroed = series.fill(Lists.newArrayList("in", "out"), 
        FillMethod.ZERO, 1);
    assertEquals(0L, zeroed.at(1).get("out"));
    assertNull(zeroed.at(2).get("out"));
  }

  @Test
  public void rate() throws Exception {
    final TimeSeries rates = TimeSeries.fromJSON(TRAFFIC_JSON)
        .rate(RateConfig.newBuilder().setFieldSpec("in").build());
    assertEquals(EventType.TIMERANGE, rates.type());
    assertEquals(3, rates.size());
    assertEquals(-34.0, rates.at(0).get("in_rate"));
  }

  @Test
  public void fixedWindowRollup() throws Exception {
    final TimeSeries series = hourly();
    final TimeSeries rolled = series.fixedWindowRollup(
        RollupOptions.newBuilder()
          .setWindowSize("1d")
          .setAggregation(SUM)
          .build());
    assertEquals(EventType.INDEX, rolled.type());
    assertEquals("hourly", rolled.name());
    assertEquals(2, rolled.size());
    assertEquals("1d-16598", rolled.at(0).key());
    assertEquals(6.0, rolled.at(0).get("value"));
    assertEquals("1d-16599", rolled.at(1).key());
    assertEquals(4.0, rolled.at(1).get("value"));
    
    final TimeSeries as_time = series.fixedWindowRollup(
        RollupOptions.newBuilder()
          .setWindowSize("1d")
          .setAggregation(SUM)
          .setToTimeEvents(true)
          .build());
    assertEquals(EventType.TIME, as_time.type());
    assertEquals(16598 * 86400000L, as_time.at(0).timestamp().toEpochMilli());
  }

  @Test
  public void calendarRollups() throws Exception {
    final TimeSeries series = hourly();
    final RollupOptions options = RollupOptions.newBuilder()
        .setAggregation(SUM)
        .build();
    
    final TimeSeries hours = series.hourlyRollup(options);
    assertEquals(3, hours.size());
    assertEquals("1h-398353", hours.at(0).key());
    assertEquals(3.0, hours.at(0).get("value"));
    
    final TimeSeries days = series.dailyRollup(options);
    assertEquals(2, days.size());
    assertEquals("2015-06-12", days.at(0).key());
    assertEquals(6.0, days.at(0).get("value"));
    assertEquals("2015-06-13", days.at(1).key());
    
    final TimeSeries months = series.monthlyRollup(options);
    assertEquals(1, months.size());
    assertEquals("2015-06", months.at(0).key());
    assertEquals(10.0, months.at(0).get("value"));
    
    final TimeSeries years = series.yearlyRollup(options);
    assertEquals("2015", years.at(0).key());
  }

  @Test
  public void rollupErrors() throws Exception {
    try {
      hourly().fixedWindowRollup(RollupOptions.newBuilder()
          .setAggregation(SUM)
          .build());
      fail("Expected MissingRequiredOptionException");
    } catch (MissingRequiredOptionException e) { }
    
    try {
      hourly().dailyRollup(RollupOptions.newBuilder().build());
      fail("Expected MissingRequiredOptionException");
    } catch (MissingRequiredOptionException e) { }
    
    try {
      hourly().fixedWindowRollup(null);
      fail("Expected MissingRequiredOptionException");
    } catch (MissingRequiredOptionException e) { }
  }

  @Test
  public void collectByFixedWindow() throws Exception {
    final Map<String, EventCollection> windows = 
        hourly().collectByFixedWindow("1h");
    assertEquals(Lists.newArrayList("1h-398353", "1h-398354", "1h-398377"), 
        Lists.newArrayList(windows.keySet()));
    assertEquals(2, windows.get("1h-398353").size());
    
    try {
      hourly().collectByFixedWindow(null);
      fail("Expected MissingRequiredOptionException");
    } catch (MissingRequiredOptionException e) { }
  }

  @Test
  public void listReduce() throws Exception {
    final TimeSeries a = TimeSeries.fromJSON("{\"name\":\"a\",\"columns\":"
        + "[\"time\",\"in\",\"out\"],\"points\":[[1000,1,2],[2000,3,4]]}");
    final TimeSeries b = TimeSeries.fromJSON("{\"name\":\"b\",\"columns\":"
        + "[\"time\",\"in\",\"out\"],\"points\":[[1000,5,6],[2000,7,8]]}");
    
    final TimeSeries summed = TimeSeries.timeSeriesListReduce(
        SeriesListOptions.newBuilder()
          .setSeriesList(Lists.newArrayList(a, b))
          .setReducer(Reducers.SUM)
          .setName("total")
          .build());
    assertEquals("total", summed.name());
    assertEquals(2, summed.size());
    assertEquals(6.0, summed.at(0).get("in"));
    assertEquals(8.0, summed.at(0).get("out"));
    assertEquals(12.0, summed.at(1).get("out"));
    
    final TimeSeries in_only = TimeSeries.timeSeriesListReduce(
        SeriesListOptions.newBuilder()
          .setSeriesList(Lists.newArrayList(a, b))
          .setFieldSpec("in")
          .setReducer("avg")
          .build());
    assertEquals(Lists.newArrayList("in"), in_only.columns());
    assertEquals(5.0, in_only.at(1).get("in"));
  }

  @Test
  public void listReduceSortsByTime() throws Exception {
    final TimeSeries a = TimeSeries.fromJSON("{\"columns\":[\"time\","
        + "\"value\"],\"points\":[[1000,1],[3000,3]]}");
    final TimeSeries b = TimeSeries.fromJSON("{\"columns\":[\"time\","
        + "\"value\"],\"points\":[[2000,2]]}");
    final TimeSeries reduced = TimeSeries.timeSeriesListReduce(
        SeriesListOptions.newBuilder()
          .setSeriesList(Lists.newArrayList(a, b))
          .setReducer(Reducers.MAX)
          .build());
    assertEquals(3, reduced.size());
    assertEquals(2000, reduced.at(1).timestamp().toEpochMilli());
  }

  @Test
  public void listMerge() throws Exception {
    final TimeSeries in = TimeSeries.fromJSON("{\"columns\":[\"time\","
        + "\"in\"],\"points\":[[1000,1],[2000,3]]}");
    final TimeSeries out = TimeSeries.fromJSON("{\"columns\":[\"time\","
        + "\"out\"],\"points\":[[1000,2],[2000,4]]}");
    final TimeSeries merged = TimeSeries.timeSeriesListMerge(
        SeriesListOptions.newBuilder()
          .setSeriesList(Lists.newArrayList(in, out))
          .setName("traffic")
          .setUtc(false)
          .build());
    assertEquals("traffic", merged.name());
    assertFalse(merged.isUTC());
    assertEquals(Lists.newArrayList("in", "out"), merged.columns());
    assertEquals(2, merged.size());
    assertEquals(3L, merged.at(1).get("in"));
    assertEquals(4L, merged.at(1).get("out"));
  }

  @Test
  public void listErrors() throws Exception {
    try {
      TimeSeries.timeSeriesListMerge(SeriesListOptions.newBuilder()
          .setSeriesList(Lists.<TimeSeries>newArrayList())
          .build());
      fail("Expected EmptySeriesListException");
    } catch (EmptySeriesListException e) { }
    
    try {
      TimeSeries.timeSeriesListReduce(SeriesListOptions.newBuilder().build());
      fail("Expected EmptySeriesListException");
    } catch (EmptySeriesListException e) { }
    
    try {
      TimeSeries.timeSeriesListReduce(SeriesListOptions.newBuilder()
          .setSeriesList(Lists.newArrayList(TimeSeries.fromJSON(TRAFFIC_JSON)))
          .build());
      fail("Expected MissingRequiredOptionException");
    } catch (MissingRequiredOptionException e) { }
    
    try {
      TimeSeries.timeSeriesListMerge(null);
      fail("Expected MissingRequiredOptionException");
    } catch (MissingRequiredOptionException e) { }
  }
}
