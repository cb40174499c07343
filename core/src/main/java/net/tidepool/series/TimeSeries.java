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

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.function.Function;
import java.util.function.Predicate;

import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.hash.HashCode;

import net.tidepool.core.Const;
import net.tidepool.data.Event;
import net.tidepool.data.EventCollection;
import net.tidepool.data.EventData;
import net.tidepool.data.EventType;
import net.tidepool.data.Events;
import net.tidepool.data.FieldPath;
import net.tidepool.data.IndexedEvent;
import net.tidepool.data.TimeEvent;
import net.tidepool.data.TimeRangeEvent;
import net.tidepool.exceptions.MissingRequiredOptionException;
import net.tidepool.exceptions.NonChronologicalInputException;
import net.tidepool.query.EmitPolicy;
import net.tidepool.query.Pipeline;
import net.tidepool.query.Window;
import net.tidepool.query.aggregators.PercentileInterpolation;
import net.tidepool.query.aggregators.Reducer;
import net.tidepool.query.aggregators.ValueFilter;
import net.tidepool.query.pojo.AlignConfig;
import net.tidepool.query.pojo.FillConfig;
import net.tidepool.query.pojo.FillMethod;
import net.tidepool.query.pojo.RateConfig;
import net.tidepool.query.pojo.RollupOptions;
import net.tidepool.serdes.AvroTimeSeriesSerdes;
import net.tidepool.serdes.TimeSeriesJsonSerdes;
import net.tidepool.time.Index;
import net.tidepool.time.TimeRange;

/**
 * An immutable series of events of a single variant in chronological 
 * order along with meta data. The meta data always carries a name and a
 * UTC flag and may carry an {@link Index} and any extra keys supplied by
 * the caller.
 * <p>
 * Every method that changes the series returns a new instance sharing
 * the untouched parts of this one.
 * <p>
 * Series are created with {@link #newBuilder()} from events, a 
 * collection or columns and points, or parsed from the tabular JSON form:
 * <pre>
 * {
 *   "name": "traffic",
 *   "columns": ["time", "in", "out"],
 *   "points": [[1400425947000, 52, 34], [1400425948000, 18, 13]]
 * }
 * </pre>
 * 
 * @since 1.0
 */
public final class TimeSeries {
  private static final Logger LOG = LoggerFactory.getLogger(TimeSeries.class);

  /** Meta key for the name of the series. */
  public static final String NAME_KEY = "name";

  /** Meta key for the UTC flag. */
  public static final String UTC_KEY = "utc";

  /** Meta key for the optional index. */
  public static final String INDEX_KEY = "index";

  /** The events. */
  private final EventCollection collection;

  /** The meta data, always holding the name and UTC flag. */
  private final ImmutableMap<String, Object> meta;

  private TimeSeries(final EventCollection collection, 
                     final ImmutableMap<String, Object> meta) {
    this.collection = collection;
    this.meta = meta;
  }

  /**
   * Parses the tabular JSON form.
   * @param json A non-null JSON string.
   * @return The series.
   * @throws IllegalArgumentException if the JSON could not be parsed or 
   * was not a series.
   * @throws net.tidepool.exceptions.UnknownEventVariantException if the 
   * first column was not "time", "timerange" or "index".
   * @throws NonChronologicalInputException if the points were out of 
   * order.
   */
  public static TimeSeries fromJSON(final String json) {
    return TimeSeriesJsonSerdes.fromJSON(json);
  }

  /**
   * Parses the tabular JSON form.
   * @param json A non-null JSON object node.
   * @return The series.
   * @throws IllegalArgumentException if the node was not a series.
   * @throws net.tidepool.exceptions.UnknownEventVariantException if the 
   * first column was not "time", "timerange" or "index".
   * @throws NonChronologicalInputException if the points were out of 
   * order.
   */
  public static TimeSeries fromJSON(final JsonNode json) {
    return TimeSeriesJsonSerdes.fromJSON(json);
  }

  /**
   * Decodes an Avro binary payload.
   * @param bytes The non-null payload.
   * @param schema The schema the payload was written with.
   * @return The series.
   * @throws net.tidepool.exceptions.SchemaDecodeException if the payload 
   * did not match the schema.
   */
  public static TimeSeries fromAvro(final byte[] bytes, final Schema schema) {
    return new AvroTimeSeriesSerdes(schema).deserialize(bytes);
  }

  // ------------------------------------------------------------------
  // Accessors

  /** @return The range covered by the events, null if empty. */
  public TimeRange timerange() {
    return collection.range();
  }

  /** @return The range covered by the events, null if empty. */
  public TimeRange range() {
    return timerange();
  }

  /** @return The earliest instant, null if empty. */
  public Instant begin() {
    return collection.begin();
  }

  /** @return The latest instant, null if empty. */
  public Instant end() {
    return collection.end();
  }

  /**
   * @param pos A position.
   * @return The event at the position.
   * @throws IndexOutOfBoundsException if the position was out of range.
   */
  public Event at(final int pos) {
    return collection.at(pos);
  }

  /**
   * @param instant A non-null instant.
   * @return The last event at or before the instant, the first event if 
   * the instant is earlier than every event, null if the series is empty.
   */
  public Event atTime(final Instant instant) {
    final Integer pos = bisect(instant);
    return pos == null ? null : collection.at(pos);
  }

  public Event atFirst() {
    return collection.atFirst();
  }

  public Event atLast() {
    return collection.atLast();
  }

  /**
   * @param instant A non-null instant.
   * @return The position of the last event at or before the instant, null 
   * if empty.
   * @see EventCollection#bisect(Instant, int)
   */
  public Integer bisect(final Instant instant) {
    return collection.bisect(instant);
  }

  public Integer bisect(final Instant instant, final int hint) {
    return collection.bisect(instant, hint);
  }

  /** @return The events in order. */
  public List<Event> events() {
    return collection.events();
  }

  /** @return The backing collection. */
  public EventCollection collection() {
    return collection;
  }

  /** @return The variant of the events, null for an untyped empty 
   * series. */
  public EventType type() {
    return collection.type();
  }

  /** @return The top level columns of all events in order of first 
   * appearance. */
  public List<String> columns() {
    return collection.columns();
  }

  /** @return The name, an empty string by default. */
  public String name() {
    return (String) meta.get(NAME_KEY);
  }

  /** @return The index or null if the series does not have one. */
  public Index index() {
    return (Index) meta.get(INDEX_KEY);
  }

  public String indexAsString() {
    final Index index = index();
    return index == null ? null : index.asString();
  }

  public TimeRange indexAsRange() {
    final Index index = index();
    return index == null ? null : index.asTimeRange();
  }

  /** @return Whether calendar windows and indices resolve in UTC. */
  public boolean isUTC() {
    return (Boolean) meta.get(UTC_KEY);
  }

  /** @return All of the meta data. */
  public Map<String, Object> meta() {
    return meta;
  }

  /**
   * @param key A key.
   * @return The meta value or null if not present.
   */
  public Object meta(final String key) {
    return meta.get(key);
  }

  public int size() {
    return collection.size();
  }

  /**
   * @param path A dotted path, "value" if null.
   * @return The number of events with a valid value at the path.
   */
  public int sizeValid(final String path) {
    return collection.sizeValid(FieldPath.orDefault(path));
  }

  public int count() {
    return collection.count();
  }

  // ------------------------------------------------------------------
  // Meta and collection mutators

  /**
   * @param key A non-null key.
   * @param value The value. Index strings are parsed.
   * @return A new series sharing the collection.
   */
  public TimeSeries setMeta(final String key, final Object value) {
    final Map<String, Object> updated = Maps.newLinkedHashMap(meta);
    updated.put(key, value);
    return new TimeSeries(collection, buildMeta(updated));
  }

  public TimeSeries setName(final String name) {
    return setMeta(NAME_KEY, name == null ? "" : name);
  }

  /**
   * @param collection The collection, null for an empty one.
   * @param is_chronological Whether the caller knows the collection is in
   * order, skipping the check.
   * @return A new series sharing the meta data.
   * @throws NonChronologicalInputException if the order was checked and 
   * the collection was out of order.
   */
  public TimeSeries setCollection(final EventCollection collection, 
                                  final boolean is_chronological) {
    final EventCollection c = collection == null 
        ? EventCollection.empty(this.collection.type()) : collection;
    if (!is_chronological && !c.isChronological()) {
      throw new NonChronologicalInputException("Collection supplied is not "
          + "chronological.");
    }
    return new TimeSeries(c, meta);
  }

  /**
   * @param begin The first position, inclusive.
   * @param end The last position, exclusive.
   * @return A new series with the slice of events.
   */
  public TimeSeries slice(final int begin, final int end) {
    return setCollection(collection.slice(begin, end), true);
  }

  /**
   * @param range A non-null range.
   * @return A new series with the events whose timestamp lies within the 
   * range, both ends included.
   */
  public TimeSeries crop(final TimeRange range) {
    if (range == null) {
      throw new IllegalArgumentException("Range cannot be null.");
    }
    return setCollection(collection.filter(new Predicate<Event>() {
      @Override
      public boolean test(final Event event) {
        return !event.timestamp().isBefore(range.begin()) 
            && !event.timestamp().isAfter(range.end());
      }
    }), true);
  }

  /**
   * @param path A dotted path, "value" if null.
   * @return A new series without events whose value at the path was null,
   * missing or NaN.
   */
  public TimeSeries clean(final String path) {
    return setCollection(collection.clean(FieldPath.orDefault(path)), true);
  }

  // ------------------------------------------------------------------
  // Pipeline based mutators

  /** @return A pipeline reading from this series' events. */
  public Pipeline pipeline() {
    return Pipeline.from(collection);
  }

  /**
   * @param mapper A non-null mapper, one event in, one event out.
   * @return A new series with the mapped events.
   * @throws NonChronologicalInputException if the mapping broke the 
   * order.
   */
  public TimeSeries map(final Function<Event, Event> mapper) {
    return setCollection(all(pipeline().map(mapper)), false);
  }

  public TimeSeries select(final List<String> field_spec) {
    return setCollection(all(pipeline().select(field_spec)), true);
  }

  public TimeSeries collapse(final List<String> field_spec_list,
                             final String name,
                             final Reducer reducer,
                             final boolean append) {
    return setCollection(all(pipeline()
        .collapse(field_spec_list, name, reducer, append)), true);
  }

  /**
   * Renames top level columns.
   * @param renames A non-null map of old to new column names.
   * @return A new series with the renamed columns.
   */
  public TimeSeries renameColumns(final Map<String, String> renames) {
    if (renames == null) {
      throw new IllegalArgumentException("Rename map cannot be null.");
    }
    return map(new Function<Event, Event>() {
      @Override
      public Event apply(final Event event) {
        final EventData.Builder builder = EventData.newBuilder();
        for (final Entry<String, Object> entry : event.data()) {
          final String renamed = renames.get(entry.getKey());
          builder.put(renamed == null ? entry.getKey() : renamed, 
              entry.getValue());
        }
        return event.setData(builder.build());
      }
    });
  }

  public TimeSeries fill(final FillConfig config) {
    return setCollection(all(pipeline().fill(config)), true);
  }

  /**
   * Fills the given columns. Linear fills over several columns chain one
   * fill per column.
   * @param field_spec The dotted paths, "value" if null or empty.
   * @param method A non-null method.
   * @param limit The maximum number of consecutive fills, null for no 
   * limit.
   * @return A new series with filled values.
   */
  public TimeSeries fill(final List<String> field_spec, 
                         final FillMethod method, 
                         final Integer limit) {
    if (method == null) {
      throw new IllegalArgumentException("Fill method cannot be null.");
    }
    final List<String> paths = field_spec == null || field_spec.isEmpty() 
        ? ImmutableList.of(Const.DEFAULT_FIELD) : field_spec;
    Pipeline pipeline = pipeline();
    if (method == FillMethod.LINEAR) {
      for (final String path : paths) {
        pipeline = pipeline.fill(FillConfig.newBuilder()
            .setFieldSpec(path)
            .setMethod(method)
            .setLimit(limit)
            .build());
      }
    } else {
      pipeline = pipeline.fill(FillConfig.newBuilder()
          .setFieldSpec(paths)
          .setMethod(method)
          .setLimit(limit)
          .build());
    }
    return setCollection(all(pipeline), true);
  }

  public TimeSeries align(final AlignConfig config) {
    return setCollection(all(pipeline().align(config)), true);
  }

  public TimeSeries rate(final RateConfig config) {
    return setCollection(all(pipeline().rate(config)), true);
  }

  /**
   * Aggregates the events into fixed windows.
   * @param options Options with a window size like "5m" and an 
   * aggregation.
   * @return A new series of indexed events, or time events if requested.
   * @throws MissingRequiredOptionException if the window size or the 
   * aggregation was missing.
   */
  public TimeSeries fixedWindowRollup(final RollupOptions options) {
    if (options == null) {
      throw new MissingRequiredOptionException("Rollup options cannot be "
          + "null.");
    }
    options.validate();
    return rollup(options);
  }

  /** Rolls up into hourly windows, the options' window size is ignored. */
  public TimeSeries hourlyRollup(final RollupOptions options) {
    return fixedWindowRollup(withWindow(options, "1h"));
  }

  /** Rolls up into calendar days in the series' zone. */
  public TimeSeries dailyRollup(final RollupOptions options) {
    return fixedWindowRollup(withWindow(options, Window.DAILY));
  }

  /** Rolls up into calendar months in the series' zone. */
  public TimeSeries monthlyRollup(final RollupOptions options) {
    return fixedWindowRollup(withWindow(options, Window.MONTHLY));
  }

  /** Rolls up into calendar years in the series' zone. */
  public TimeSeries yearlyRollup(final RollupOptions options) {
    return fixedWindowRollup(withWindow(options, Window.YEARLY));
  }

  /**
   * Groups the events into fixed windows without aggregating them.
   * @param window_size A non-null window size like "1h".
   * @return The events of each window keyed by window index in order.
   */
  public Map<String, EventCollection> collectByFixedWindow(
      final String window_size) {
    if (Strings.isNullOrEmpty(window_size)) {
      throw new MissingRequiredOptionException("Window size must be "
          + "supplied, for example '5m'.");
    }
    return pipeline()
        .windowBy(window_size, isUTC())
        .emitOn(EmitPolicy.DISCARD)
        .toKeyedCollections();
  }

  // ------------------------------------------------------------------
  // Statistics

  public Object aggregate(final Reducer reducer, final String path) {
    return collection.aggregate(reducer, FieldPath.orDefault(path));
  }

  public Double sum(final String path) {
    return collection.sum(FieldPath.orDefault(path));
  }

  public Double sum(final String path, final ValueFilter filter) {
    return collection.sum(FieldPath.orDefault(path), filter);
  }

  public Double max(final String path) {
    return collection.max(FieldPath.orDefault(path));
  }

  public Double max(final String path, final ValueFilter filter) {
    return collection.max(FieldPath.orDefault(path), filter);
  }

  public Double min(final String path) {
    return collection.min(FieldPath.orDefault(path));
  }

  public Double min(final String path, final ValueFilter filter) {
    return collection.min(FieldPath.orDefault(path), filter);
  }

  public Double avg(final String path) {
    return collection.avg(FieldPath.orDefault(path));
  }

  public Double avg(final String path, final ValueFilter filter) {
    return collection.avg(FieldPath.orDefault(path), filter);
  }

  public Double mean(final String path) {
    return collection.mean(FieldPath.orDefault(path));
  }

  public Double mean(final String path, final ValueFilter filter) {
    return collection.mean(FieldPath.orDefault(path), filter);
  }

  public Double median(final String path) {
    return collection.median(FieldPath.orDefault(path));
  }

  public Double median(final String path, final ValueFilter filter) {
    return collection.median(FieldPath.orDefault(path), filter);
  }

  public Double stdev(final String path) {
    return collection.stdev(FieldPath.orDefault(path));
  }

  public Double stdev(final String path, final ValueFilter filter) {
    return collection.stdev(FieldPath.orDefault(path), filter);
  }

  public Double percentile(final double q, final String path) {
    return collection.percentile(q, FieldPath.orDefault(path));
  }

  public Double percentile(final double q, 
                           final String path,
                           final PercentileInterpolation interpolation,
                           final ValueFilter filter) {
    return collection.percentile(q, FieldPath.orDefault(path), 
        interpolation, filter);
  }

  public List<Double> quantile(final int n, 
                               final String path,
                               final PercentileInterpolation interpolation) {
    return collection.quantile(n, FieldPath.orDefault(path), interpolation);
  }

  // ------------------------------------------------------------------
  // Codecs

  /** @return The tabular JSON form. */
  public JsonNode toJSON() {
    return TimeSeriesJsonSerdes.toJSON(this);
  }

  /** @return The Avro schema describing this series. */
  public Schema avroSchema() {
    return AvroTimeSeriesSerdes.schemaFor(this);
  }

  /**
   * @return The Avro binary encoding of this series, decodable with
   * {@link #avroSchema()}.
   * @throws net.tidepool.exceptions.SerdesException if the series could
   * not be encoded.
   */
  public byte[] toAvro() {
    return new AvroTimeSeriesSerdes(avroSchema()).serialize(this);
  }

  // ------------------------------------------------------------------
  // Series lists

  /**
   * Combines the events of several series sharing a key by reducing the
   * field values, e.g. summing the "in" column of three series.
   * @param options Options with the series, a reducer and optional 
   * columns.
   * @return The reduced series carrying the options' meta data.
   * @throws net.tidepool.exceptions.EmptySeriesListException if the list
   * was null or empty.
   * @throws MissingRequiredOptionException if the reducer was missing.
   */
  public static TimeSeries timeSeriesListReduce(
      final SeriesListOptions options) {
    if (options == null) {
      throw new MissingRequiredOptionException("Options cannot be null.");
    }
    options.validate();
    options.validateReducer();
    return fromCombinedEvents(Events.combine(flatten(options), 
        options.fieldPaths(), options.getReducer()), options);
  }

  /**
   * Merges the events of several series sharing a key into events with 
   * the union of their columns, e.g. an "in" and an "out" series into one
   * series with both columns.
   * @param options Options with the series.
   * @return The merged series carrying the options' meta data.
   * @throws net.tidepool.exceptions.EmptySeriesListException if the list
   * was null or empty.
   */
  public static TimeSeries timeSeriesListMerge(
      final SeriesListOptions options) {
    if (options == null) {
      throw new MissingRequiredOptionException("Options cannot be null.");
    }
    options.validate();
    return fromCombinedEvents(Events.merge(flatten(options)), options);
  }

  private static List<Event> flatten(final SeriesListOptions options) {
    final List<Event> events = Lists.newArrayList();
    for (final TimeSeries series : options.getSeriesList()) {
      events.addAll(series.events());
    }
    return events;
  }

  private static TimeSeries fromCombinedEvents(final List<Event> events, 
      final SeriesListOptions options) {
    EventCollection collection = EventCollection.of(events);
    if (!collection.isChronological()) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Sorting " + collection.size() + " combined events from " 
            + options.getSeriesList().size() + " series by time");
      }
      collection = collection.sortByTime();
    }
    final Builder builder = newBuilder().setCollection(collection);
    for (final Entry<String, Object> entry : options.getMeta().entrySet()) {
      builder.addMeta(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  // ------------------------------------------------------------------
  // Equality

  /**
   * @return True if both series share the very same collection and meta 
   * instances.
   */
  public static boolean equal(final TimeSeries a, final TimeSeries b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null) {
      return false;
    }
    return a.meta == b.meta && a.collection == b.collection;
  }

  /**
   * @return True if both series have equal meta data and value equal 
   * events.
   */
  public static boolean is(final TimeSeries a, final TimeSeries b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null) {
      return false;
    }
    return Objects.equal(a.meta, b.meta) 
        && EventCollection.is(a.collection, b.collection);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return is(this, (TimeSeries) o);
  }

  @Override
  public int hashCode() {
    return buildHashCode().asInt();
  }

  /** @return A HashCode object for deterministic, non-secure hashing */
  public HashCode buildHashCode() {
    return Const.HASH_FUNCTION().newHasher()
        .putInt(meta.hashCode())
        .putInt(collection.hashCode())
        .hash();
  }

  /** @return The tabular JSON form as a string. */
  @Override
  public String toString() {
    return TimeSeriesJsonSerdes.serializeToString(this);
  }

  // ------------------------------------------------------------------
  // Helpers

  /** @return The "all" collection of a pipeline run, empty if none. */
  private EventCollection all(final Pipeline pipeline) {
    final EventCollection result = 
        pipeline.toKeyedCollections().get(Const.ALL_KEY);
    return result == null ? EventCollection.empty(collection.type()) : result;
  }

  private TimeSeries rollup(final RollupOptions options) {
    final boolean utc = options.getUtc() != null ? options.getUtc() : isUTC();
    Pipeline pipeline = pipeline()
        .windowBy(options.getWindowSize(), utc)
        .emitOn(EmitPolicy.DISCARD)
        .aggregate(options.getAggregation());
    if (options.getToTimeEvents()) {
      pipeline = pipeline.asTimeEvents();
    }
    final Map<String, EventCollection> collections = 
        pipeline.clearWindow().toKeyedCollections();
    final EventCollection result = collections.get(Const.ALL_KEY);
    return setCollection(result == null ? EventCollection.of(null) : result, 
        true);
  }

  private static RollupOptions withWindow(final RollupOptions options, 
                                          final String window) {
    if (options == null) {
      throw new MissingRequiredOptionException("Rollup options cannot be "
          + "null.");
    }
    return RollupOptions.newBuilder(options)
        .setWindowSize(window)
        .build();
  }

  /**
   * Normalizes meta data: the name and UTC flag are defaulted, an index
   * string is parsed in the series' zone, null values are dropped and 
   * the remaining values normalized like event data.
   */
  private static ImmutableMap<String, Object> buildMeta(
      final Map<String, Object> raw) {
    final Object name = raw.get(NAME_KEY);
    final Object utc = raw.get(UTC_KEY);
    if (utc != null && !(utc instanceof Boolean)) {
      throw new IllegalArgumentException("The utc meta value must be a "
          + "boolean: " + utc);
    }
    final boolean is_utc = utc == null ? true : (Boolean) utc;

    final ImmutableMap.Builder<String, Object> builder = 
        ImmutableMap.builder();
    builder.put(NAME_KEY, name == null ? "" : name.toString());
    builder.put(UTC_KEY, is_utc);
    final Object index = raw.get(INDEX_KEY);
    if (index instanceof Index) {
      builder.put(INDEX_KEY, index);
    } else if (index instanceof String) {
      builder.put(INDEX_KEY, new Index((String) index, is_utc));
    } else if (index != null) {
      throw new IllegalArgumentException("The index meta value must be an "
          + "index or a string: " + index);
    }
    for (final Entry<String, Object> entry : raw.entrySet()) {
      if (entry.getKey().equals(NAME_KEY) || entry.getKey().equals(UTC_KEY) 
          || entry.getKey().equals(INDEX_KEY) || entry.getValue() == null) {
        continue;
      }
      builder.put(entry.getKey(), EventData.normalize(entry.getValue()));
    }
    return builder.build();
  }

  /**
   * Builds an event of the given variant from a tabular key.
   * @param type The non-null variant.
   * @param key The key: epoch millis, a two element list of epoch millis
   * or an index string.
   * @param data The payload.
   * @param utc Whether index keys resolve in UTC.
   * @return The event.
   * @throws IllegalArgumentException if the key did not suit the variant.
   */
  static Event eventFor(final EventType type, 
                        final Object key, 
                        final EventData data,
                        final boolean utc) {
    switch (type) {
    case TIME:
      if (!(key instanceof Number)) {
        throw new IllegalArgumentException("Time keys must be epoch "
            + "milliseconds: " + key);
      }
      return new TimeEvent(((Number) key).longValue(), data);
    case TIMERANGE:
      if (!(key instanceof List)) {
        throw new IllegalArgumentException("Time range keys must be a list "
            + "of two epoch milliseconds: " + key);
      }
      return new TimeRangeEvent(TimeRange.fromJSON((List<?>) key), data);
    case INDEX:
      if (!(key instanceof String)) {
        throw new IllegalArgumentException("Index keys must be strings: " 
            + key);
      }
      return new IndexedEvent((String) key, data, utc);
    default:
      throw new IllegalArgumentException("Unhandled event type: " + type);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builds a series from exactly one of a list of events, a collection or
   * columns and points.
   */
  public static final class Builder {
    private final Map<String, Object> meta = Maps.newLinkedHashMap();
    private List<? extends Event> events;
    private EventCollection collection;
    private List<String> columns;
    private List<? extends List<?>> points;

    public Builder setName(final String name) {
      meta.put(NAME_KEY, name);
      return this;
    }

    public Builder setUtc(final boolean utc) {
      meta.put(UTC_KEY, utc);
      return this;
    }

    public Builder setIndex(final Index index) {
      meta.put(INDEX_KEY, index);
      return this;
    }

    /** @param index An index string, resolved in the series' zone. */
    public Builder setIndex(final String index) {
      meta.put(INDEX_KEY, index);
      return this;
    }

    /**
     * @param key A non-null key.
     * @param value The value, null values are dropped.
     * @return The builder.
     */
    public Builder addMeta(final String key, final Object value) {
      if (key == null) {
        throw new IllegalArgumentException("Meta key cannot be null.");
      }
      meta.put(key, value);
      return this;
    }

    public Builder setEvents(final List<? extends Event> events) {
      this.events = events;
      return this;
    }

    public Builder setCollection(final EventCollection collection) {
      this.collection = collection;
      return this;
    }

    /**
     * @param columns The column names, the first one naming the variant:
     * "time", "timerange" or "index".
     * @return The builder.
     */
    public Builder setColumns(final List<String> columns) {
      this.columns = columns;
      return this;
    }

    /**
     * @param points Rows starting with the key followed by one value per
     * remaining column.
     * @return The builder.
     */
    public Builder setPoints(final List<? extends List<?>> points) {
      this.points = points;
      return this;
    }

    /**
     * @return The series.
     * @throws MissingRequiredOptionException if no source was given.
     * @throws IllegalArgumentException if more than one source was given.
     * @throws net.tidepool.exceptions.UnknownEventVariantException if the 
     * first column was not a known variant.
     * @throws NonChronologicalInputException if the events were out of 
     * order.
     */
    public TimeSeries build() {
      final boolean tabular = columns != null || points != null;
      int sources = 0;
      if (events != null) {
        sources++;
      }
      if (collection != null) {
        sources++;
      }
      if (tabular) {
        sources++;
      }
      if (sources == 0) {
        throw new MissingRequiredOptionException("A series needs events, a "
            + "collection or columns and points.");
      }
      if (sources > 1) {
        throw new IllegalArgumentException("A series takes exactly one of "
            + "events, a collection or columns and points.");
      }

      final ImmutableMap<String, Object> built_meta = buildMeta(meta);
      final EventCollection c;
      if (events != null) {
        c = EventCollection.of(events);
      } else if (collection != null) {
        c = collection;
      } else {
        c = fromTable((Boolean) built_meta.get(UTC_KEY));
      }
      if (!c.isChronological()) {
        throw new NonChronologicalInputException("Series was given "
            + "non-chronological events.");
      }
      return new TimeSeries(c, built_meta);
    }

    private EventCollection fromTable(final boolean utc) {
      if (columns == null || columns.isEmpty()) {
        throw new MissingRequiredOptionException("Tabular series need "
            + "columns.");
      }
      if (points == null) {
        throw new MissingRequiredOptionException("Tabular series need "
            + "points.");
      }
      final EventType type = EventType.fromString(columns.get(0));
      final List<String> fields = columns.subList(1, columns.size());
      final List<Event> parsed = Lists.newArrayListWithCapacity(points.size());
      for (final List<?> point : points) {
        if (point == null || point.isEmpty()) {
          throw new IllegalArgumentException("Points must start with a key.");
        }
        final EventData.Builder data = EventData.newBuilder();
        for (int i = 0; i < fields.size(); i++) {
          data.put(fields.get(i), i + 1 < point.size() ? point.get(i + 1) 
              : null);
        }
        parsed.add(eventFor(type, point.get(0), data.build(), utc));
      }
      return new EventCollection(type, parsed);
    }
  }
}
