/*
 * Copyright 2021 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.vperf.app.services;

import com.rackspace.vperf.app.model.CounterDefinition;
import com.rackspace.vperf.app.model.EntityRef;
import com.rackspace.vperf.app.model.FlatRecord;
import com.rackspace.vperf.app.model.InstanceResult;
import com.rackspace.vperf.app.model.Partition;
import com.rackspace.vperf.app.model.PerfMetricId;
import com.rackspace.vperf.app.model.ProviderQuerySpec;
import com.rackspace.vperf.app.model.QuerySelector;
import com.rackspace.vperf.app.model.ResolvedInterval;
import com.rackspace.vperf.app.model.SampleBlock;
import com.rackspace.vperf.app.model.SampleQueryResult;
import com.rackspace.vperf.app.model.ValidatedQuery;
import com.rackspace.vperf.app.provider.MetricsProvider;
import com.rackspace.vperf.app.validation.QueryValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs sample queries against the metrics provider: validate, fetch in one provider call, then
 * flatten the result on a bounded set of workers and merge it newest first.
 */
@Service
@Slf4j
public class PerfQueryService {

  private static final Comparator<CounterDefinition> BY_STAT_KEY =
      Comparator.comparing(CounterDefinition::getGroup)
          .thenComparing(CounterDefinition::getName)
          .thenComparing(CounterDefinition::getRollupType);

  private final MetricsProvider metricsProvider;
  private final CounterCatalogService counterCatalogService;
  private final QueryValidator queryValidator;
  private final QuerySpecAssembler querySpecAssembler;
  private final SamplePartitioner samplePartitioner;
  private final SampleFlattener sampleFlattener;
  private final SampleMerger sampleMerger;
  private final ExecutorService flatteningExecutor;
  private final Counter sampleQueryCounter;
  private final Counter metricsQueryCounter;
  private final Counter instancesQueryCounter;
  private final Counter noDataCounter;
  private final Timer flattenTimer;

  @Autowired
  public PerfQueryService(MetricsProvider metricsProvider,
                          CounterCatalogService counterCatalogService,
                          QueryValidator queryValidator,
                          QuerySpecAssembler querySpecAssembler,
                          SamplePartitioner samplePartitioner,
                          SampleFlattener sampleFlattener,
                          SampleMerger sampleMerger,
                          @Qualifier("flatteningExecutor") ExecutorService flatteningExecutor,
                          MeterRegistry meterRegistry) {
    this.metricsProvider = metricsProvider;
    this.counterCatalogService = counterCatalogService;
    this.queryValidator = queryValidator;
    this.querySpecAssembler = querySpecAssembler;
    this.samplePartitioner = samplePartitioner;
    this.sampleFlattener = sampleFlattener;
    this.sampleMerger = sampleMerger;
    this.flatteningExecutor = flatteningExecutor;
    this.sampleQueryCounter = meterRegistry.counter("vperf.query", "type", "samples");
    this.metricsQueryCounter = meterRegistry.counter("vperf.query", "type", "metrics");
    this.instancesQueryCounter = meterRegistry.counter("vperf.query", "type", "instances");
    this.noDataCounter = meterRegistry.counter("vperf.query.nodata");
    this.flattenTimer = meterRegistry.timer("vperf.flatten");
  }

  public SampleQueryResult querySamples(QuerySelector selector) {
    sampleQueryCounter.increment();
    final CounterCatalog catalog = counterCatalogService.loadCatalog();
    final ValidatedQuery query = queryValidator.validate(selector, catalog);
    final List<ProviderQuerySpec> specs = querySpecAssembler.assemble(query);

    final List<SampleBlock> blocks = metricsProvider.querySamples(specs);
    if (blocks == null || (!blocks.isEmpty() && blocks.stream().noneMatch(SampleBlock::hasValues))) {
      log.debug("Provider returned no values for {} entities", specs.size());
      noDataCounter.increment();
      return SampleQueryResult.noData();
    }

    final int blockCount = blocks.size();
    final int workerCount = samplePartitioner.workerCount(selector.getThreads());
    // blocks must not be referenced after flattening so they can be collected while merging
    final List<List<FlatRecord>> workerOutputs = flattenTimer.record(() ->
        flatten(blocks, workerCount, catalog, query.getEntities()));
    final List<FlatRecord> records = sampleMerger.mergeAndCap(workerOutputs, query.getMaxSamples());

    log.info("Query for {} entities and {} stats returned {} records from {} blocks",
        query.getEntities().size(), query.getCounterIds().size(), records.size(), blockCount);
    return SampleQueryResult.of(records);
  }

  /**
   * @return definitions of every counter the provider has for the entity at the interval,
   * sorted by group, name and rollup
   */
  public List<CounterDefinition> listAvailableMetrics(EntityRef entity, String interval) {
    metricsQueryCounter.increment();
    final ResolvedInterval resolved = queryValidator.validateIntrospection(List.of(entity), interval);
    final CounterCatalog catalog = counterCatalogService.loadCatalog();

    final Set<Integer> counterIds = new LinkedHashSet<>();
    for (PerfMetricId metricId :
        metricsProvider.listAvailableMetrics(entity.getId(), resolved.getIntervalId())) {
      counterIds.add(metricId.getCounterId());
    }

    final List<CounterDefinition> definitions = new ArrayList<>(counterIds.size());
    for (Integer counterId : counterIds) {
      final Optional<CounterDefinition> definition = catalog.describe(counterId);
      if (definition.isPresent()) {
        definitions.add(definition.get());
      } else {
        log.debug("Skipping counter {} of {} that is not in the catalog", counterId, entity.getId());
      }
    }
    definitions.sort(BY_STAT_KEY);
    return definitions;
  }

  /**
   * @return every instance the provider has for each requested stat of each entity
   */
  public List<InstanceResult> listAvailableInstances(QuerySelector selector) {
    instancesQueryCounter.increment();
    final ResolvedInterval resolved =
        queryValidator.validateIntrospection(selector.getEntities(), selector.getInterval());
    final CounterCatalog catalog = counterCatalogService.loadCatalog();
    final Map<String, Integer> counterIds = queryValidator.resolveStats(selector.getStats(), catalog);

    final List<InstanceResult> results = new ArrayList<>();
    for (EntityRef entity : selector.getEntities()) {
      final List<PerfMetricId> available =
          metricsProvider.listAvailableMetrics(entity.getId(), resolved.getIntervalId());
      counterIds.forEach((stat, counterId) -> available.stream()
          .filter(metricId -> metricId.getCounterId() == counterId)
          .map(PerfMetricId::getInstance)
          .distinct()
          .forEach(instance -> results.add(new InstanceResult(entity.getId(), stat, instance))));
    }
    return results;
  }

  private List<List<FlatRecord>> flatten(List<SampleBlock> blocks, int workerCount,
                                         CounterCatalog catalog, List<EntityRef> entities) {
    final Map<String, EntityRef> entitiesById = new HashMap<>();
    for (EntityRef entity : entities) {
      entitiesById.putIfAbsent(entity.getId(), entity);
    }

    final List<Partition> partitions = samplePartitioner.partition(blocks, workerCount);
    log.debug("Flattening {} blocks across {} partitions", blocks.size(), partitions.size());

    final List<CompletableFuture<List<FlatRecord>>> tasks = partitions.stream()
        .filter(partition -> !partition.getBlocks().isEmpty())
        .map(partition -> CompletableFuture.supplyAsync(
            withLoggingContext(() -> sampleFlattener.flatten(partition, catalog, entitiesById)),
            flatteningExecutor))
        .collect(Collectors.toList());

    try {
      CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
    } catch (CompletionException e) {
      throw unwrap(e);
    }
    return tasks.stream()
        .map(CompletableFuture::join)
        .collect(Collectors.toList());
  }

  /**
   * Carries the caller's MDC, such as the request trace id, onto the worker thread.
   */
  private static <T> Supplier<T> withLoggingContext(Supplier<T> work) {
    final Map<String, String> callerContext = MDC.getCopyOfContextMap();
    return () -> {
      final Map<String, String> workerContext = MDC.getCopyOfContextMap();
      setContext(callerContext);
      try {
        return work.get();
      } finally {
        setContext(workerContext);
      }
    };
  }

  private static void setContext(Map<String, String> context) {
    if (context == null) {
      MDC.clear();
    } else {
      MDC.setContextMap(context);
    }
  }

  private static RuntimeException unwrap(CompletionException e) {
    final Throwable cause = Objects.requireNonNullElse(e.getCause(), e);
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    return new IllegalStateException("Flattening worker failed", cause);
  }
}
