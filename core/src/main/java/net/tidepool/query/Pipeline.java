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
package net.tidepool.query;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.function.Function;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tidepool.data.Event;
import net.tidepool.data.EventCollection;
import net.tidepool.data.FieldPath;
import net.tidepool.exceptions.MissingRequiredOptionException;
import net.tidepool.query.aggregators.Reducer;
import net.tidepool.query.pojo.AlignConfig;
import net.tidepool.query.pojo.Aggregation;
import net.tidepool.query.pojo.CollapseConfig;
import net.tidepool.query.pojo.FillConfig;
import net.tidepool.query.pojo.RateConfig;
import net.tidepool.query.pojo.TimeAlignment;
import net.tidepool.query.processor.AggregateProcessor;
import net.tidepool.query.processor.AlignProcessor;
import net.tidepool.query.processor.CollapseProcessor;
import net.tidepool.query.processor.ConvertProcessor;
import net.tidepool.query.processor.EventProcessor;
import net.tidepool.query.processor.FillProcessor;
import net.tidepool.query.processor.FilterProcessor;
import net.tidepool.query.processor.GroupingProcessor;
import net.tidepool.query.processor.MapProcessor;
import net.tidepool.query.processor.OffsetProcessor;
import net.tidepool.query.processor.RateProcessor;
import net.tidepool.query.processor.SelectProcessor;
import net.tidepool.query.processor.TakeProcessor;

/**
 * An immutable, chainable description of a batch transformation over a 
 * source of events. Every configuring call returns a new pipeline, the 
 * receiver is never modified so pipelines can be shared and extended 
 * freely.
 * <pre>
 * Map&lt;String, EventCollection&gt; hourly = Pipeline.from(collection)
 *     .windowBy("1h")
 *     .aggregate(Aggregation.newBuilder()
 *         .add("value", "value", Reducers.AVG)
 *         .build())
 *     .toKeyedCollections();
 * </pre>
 * Running the pipeline is a deterministic function of the stages and the
 * source. Within a group, output order follows input order and groups 
 * appear in order of first appearance.
 * 
 * @since 1.0
 */
public final class Pipeline {
  private static final Logger LOG = LoggerFactory.getLogger(Pipeline.class);

  /** The source events, null until {@link #from(List)} is called. */
  private final List<Event> source;

  /** The stages, in order. */
  private final List<EventProcessor> stages;

  /** The emit policy. */
  private final EmitPolicy emit_policy;

  private Pipeline(final List<Event> source, 
                   final List<EventProcessor> stages,
                   final EmitPolicy emit_policy) {
    this.source = source;
    this.stages = stages;
    this.emit_policy = emit_policy;
  }

  /** @return A pipeline without source or stages. */
  public static Pipeline newPipeline() {
    return new Pipeline(null, ImmutableList.<EventProcessor>of(), 
        EmitPolicy.DISCARD);
  }

  /**
   * @param collection A non-null source collection.
   * @return A pipeline reading from the collection.
   */
  public static Pipeline from(final EventCollection collection) {
    return newPipeline().withSource(collection);
  }

  /**
   * @param events A non-null list of source events.
   * @return A pipeline reading from the events.
   */
  public static Pipeline from(final List<? extends Event> events) {
    return newPipeline().withSource(events);
  }

  /**
   * @param collection A non-null source collection.
   * @return A new pipeline with the same stages and the given source.
   */
  public Pipeline withSource(final EventCollection collection) {
    if (collection == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    return withSource(collection.events());
  }

  /**
   * @param events A non-null list of source events.
   * @return A new pipeline with the same stages and the given source.
   */
  public Pipeline withSource(final List<? extends Event> events) {
    if (events == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    return new Pipeline(ImmutableList.<Event>copyOf(events), stages, 
        emit_policy);
  }

  /**
   * @param stage A non-null stage.
   * @return A new pipeline with the stage appended.
   */
  public Pipeline addStage(final EventProcessor stage) {
    if (stage == null) {
      throw new IllegalArgumentException("Stage cannot be null.");
    }
    return new Pipeline(source, ImmutableList.<EventProcessor>builder()
        .addAll(stages)
        .add(stage)
        .build(), emit_policy);
  }

  /** @return The stages, in order. */
  public List<EventProcessor> stages() {
    return stages;
  }

  /** @return The emit policy. */
  public EmitPolicy emitPolicy() {
    return emit_policy;
  }

  public Pipeline map(final Function<Event, Event> mapper) {
    return addStage(new MapProcessor(mapper));
  }

  public Pipeline filter(final Predicate<Event> predicate) {
    return addStage(new FilterProcessor(predicate));
  }

  /**
   * @param field_spec The dotted paths to keep.
   * @return A new pipeline keeping only the given fields.
   */
  public Pipeline select(final List<String> field_spec) {
    return addStage(new SelectProcessor(FieldPath.listOf(field_spec)));
  }

  public Pipeline select(final String field_path) {
    return addStage(new SelectProcessor(
        ImmutableList.of(FieldPath.of(field_path))));
  }

  /**
   * @param field_spec_list The dotted paths to collapse.
   * @param name The output column.
   * @param reducer The reducer.
   * @param append Whether to keep the other columns.
   * @return A new pipeline collapsing the fields.
   */
  public Pipeline collapse(final List<String> field_spec_list, 
                           final String name, 
                           final Reducer reducer, 
                           final boolean append) {
    return collapse(CollapseConfig.newBuilder()
        .setFieldSpecList(field_spec_list)
        .setName(name)
        .setReducer(reducer)
        .setAppend(append)
        .build());
  }

  public Pipeline collapse(final CollapseConfig config) {
    return addStage(new CollapseProcessor(config));
  }

  /**
   * @param amount The constant to add.
   * @param field_spec The dotted paths to offset, "value" if null.
   * @return A new pipeline offsetting the fields.
   */
  public Pipeline offsetBy(final double amount, final List<String> field_spec) {
    return addStage(new OffsetProcessor(amount, FieldPath.listOf(field_spec)));
  }

  /**
   * @param n The number of events to keep per group.
   * @return A new pipeline keeping the first events of each group.
   */
  public Pipeline take(final int n) {
    return addStage(new TakeProcessor(n));
  }

  public Pipeline fill(final FillConfig config) {
    return addStage(new FillProcessor(config));
  }

  /**
   * Resamples each group onto the config's window boundaries.
   * @param config The non-null alignment config. A limit of zero nulls 
   * every gap, a null limit interpolates gaps of any length.
   * @return A new pipeline aligning the events.
   */
  public Pipeline align(final AlignConfig config) {
    return addStage(new AlignProcessor(config));
  }

  public Pipeline rate(final RateConfig config) {
    return addStage(new RateProcessor(config));
  }

  /**
   * Windows in UTC.
   * @param window A bucket size or "hourly", "daily", "monthly", "yearly".
   * @return A new pipeline grouping by the window.
   */
  public Pipeline windowBy(final String window) {
    return windowBy(window, true);
  }

  /**
   * @param window A bucket size or "hourly", "daily", "monthly", "yearly".
   * @param utc Whether calendar windows resolve in UTC or the system 
   * default zone.
   * @return A new pipeline grouping by the window.
   */
  public Pipeline windowBy(final String window, final boolean utc) {
    return addStage(GroupingProcessor.window(Window.of(window, utc)));
  }

  public Pipeline clearWindow() {
    return addStage(GroupingProcessor.clearWindow());
  }

  /**
   * @param field_path The dotted path whose value is the group key.
   * @return A new pipeline grouping by the value.
   */
  public Pipeline groupBy(final String field_path) {
    return addStage(GroupingProcessor.groupBy(FieldPath.of(field_path)));
  }

  public Pipeline groupBy(final Function<Event, String> function) {
    return addStage(GroupingProcessor.groupBy(function));
  }

  public Pipeline clearGroupBy() {
    return addStage(GroupingProcessor.clearGroupBy());
  }

  /**
   * @param policy The name of the policy, only "discard" is supported.
   * @return A new pipeline with the policy.
   * @throws IllegalArgumentException if the policy was not supported.
   */
  public Pipeline emitOn(final String policy) {
    return emitOn(EmitPolicy.fromString(policy));
  }

  public Pipeline emitOn(final EmitPolicy policy) {
    if (policy == null) {
      throw new IllegalArgumentException("Emit policy cannot be null.");
    }
    return new Pipeline(source, stages, policy);
  }

  public Pipeline aggregate(final Aggregation aggregation) {
    return addStage(new AggregateProcessor(aggregation));
  }

  /** @return A new pipeline converting events to time events at their 
   * begin. */
  public Pipeline asTimeEvents() {
    return asTimeEvents(TimeAlignment.BEGIN);
  }

  public Pipeline asTimeEvents(final TimeAlignment alignment) {
    return addStage(ConvertProcessor.toTimeEvents(alignment));
  }

  public Pipeline asTimeRangeEvents(final TimeAlignment alignment, 
                                    final String duration) {
    return addStage(ConvertProcessor.toTimeRangeEvents(alignment, duration));
  }

  public Pipeline asIndexedEvents(final String duration) {
    return addStage(ConvertProcessor.toIndexedEvents(duration));
  }

  /**
   * Runs the pipeline.
   * @return The output collections by group key in order of first 
   * appearance, a single "all" collection without grouping.
   * @throws MissingRequiredOptionException if the pipeline has no source.
   */
  public Map<String, EventCollection> toKeyedCollections() {
    final Batch batch = run();
    final Map<String, EventCollection> collections = Maps.newLinkedHashMap();
    for (final Entry<String, List<Event>> group : batch.groups().entrySet()) {
      collections.put(group.getKey(), EventCollection.of(group.getValue()));
    }
    return collections;
  }

  /**
   * Runs the pipeline.
   * @return The output events in order.
   * @throws MissingRequiredOptionException if the pipeline has no source.
   */
  public List<Event> toEventList() {
    return Lists.newArrayList(run().events());
  }

  /**
   * Runs the pipeline and hands each keyed collection to the sink.
   * @param sink A non-null sink.
   */
  public void to(final CollectionSink sink) {
    if (sink == null) {
      throw new IllegalArgumentException("Sink cannot be null.");
    }
    for (final Entry<String, EventCollection> entry : 
        toKeyedCollections().entrySet()) {
      sink.onCollection(entry.getKey(), entry.getValue());
    }
  }

  /**
   * Runs the pipeline and hands each output event to the sink.
   * @param sink A non-null sink.
   */
  public void to(final EventSink sink) {
    if (sink == null) {
      throw new IllegalArgumentException("Sink cannot be null.");
    }
    for (final Event event : run().events()) {
      sink.onEvent(event);
    }
  }

  /** @return The batch produced by the last stage. */
  private Batch run() {
    if (source == null) {
      throw new MissingRequiredOptionException("Pipeline has no source.");
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Running pipeline with " + stages.size() + " stages over " 
          + source.size() + " events, emit policy " + emit_policy.getName());
    }
    Batch batch = Batch.of(source);
    for (final EventProcessor stage : stages) {
      batch = stage.process(batch);
      if (LOG.isTraceEnabled()) {
        LOG.trace(stage.getClass().getSimpleName() + " emitted " 
            + batch.events().size() + " events");
      }
    }
    return batch;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append("source=")
        .append(source == null ? "null" : source.size() + " events")
        .append(", stages=[");
    for (int i = 0; i < stages.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append(stages.get(i).getClass().getSimpleName());
    }
    return buf.append("], emitPolicy=")
        .append(emit_policy.getName())
        .toString();
  }
}
