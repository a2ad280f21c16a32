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

package com.rackspace.vperf.app.validation;

import com.rackspace.vperf.app.exceptions.InvalidInstanceException;
import com.rackspace.vperf.app.exceptions.InvalidTimeWindowException;
import com.rackspace.vperf.app.exceptions.QueryValidationException;
import com.rackspace.vperf.app.exceptions.UnknownStatException;
import com.rackspace.vperf.app.exceptions.UnsupportedEntityTypeException;
import com.rackspace.vperf.app.exceptions.UnsupportedIntervalForEntityException;
import com.rackspace.vperf.app.model.EntityRef;
import com.rackspace.vperf.app.model.EntityType;
import com.rackspace.vperf.app.model.HistoricalInterval;
import com.rackspace.vperf.app.model.IntervalClass;
import com.rackspace.vperf.app.model.PerfMetricId;
import com.rackspace.vperf.app.model.QuerySelector;
import com.rackspace.vperf.app.model.ResolvedInterval;
import com.rackspace.vperf.app.model.ValidatedQuery;
import com.rackspace.vperf.app.provider.MetricsProvider;
import com.rackspace.vperf.app.services.CounterCatalog;
import com.rackspace.vperf.app.services.TimestampProvider;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

/**
 * Rejects malformed queries before any samples are requested from the provider.
 */
@Component
@Slf4j
public class QueryValidator {

  /**
   * Instance selector that matches every instance and is never checked against the provider.
   */
  public static final String WILDCARD_INSTANCE = "*";

  private final MetricsProvider metricsProvider;
  private final TimestampProvider timestampProvider;

  @Autowired
  public QueryValidator(MetricsProvider metricsProvider, TimestampProvider timestampProvider) {
    this.metricsProvider = metricsProvider;
    this.timestampProvider = timestampProvider;
  }

  public ValidatedQuery validate(QuerySelector selector, CounterCatalog catalog) {
    final IntervalClass intervalClass = IntervalClass.parse(selector.getInterval());
    validateEntities(selector.getEntities(), intervalClass);
    validateTimeWindow(selector.getStart(), selector.getFinish());
    final Map<String, Integer> counterIds = resolveStats(selector.getStats(), catalog);

    final ResolvedInterval interval = resolveInterval(intervalClass);

    Instant start = selector.getStart();
    Instant finish = selector.getFinish();
    if (start == null && finish == null && containsDatastore(selector.getEntities())) {
      final HistoricalInterval config = interval.getHistoricalInterval();
      finish = timestampProvider.now();
      start = finish.minusSeconds(
          config.getRetentionLengthSeconds() - config.getSamplingPeriodSeconds());
      log.debug("Derived datastore query window [{}, {}) for {}", start, finish, intervalClass);
    }

    final List<String> instances = selector.getInstances() == null ?
        List.of() : List.copyOf(new LinkedHashSet<>(selector.getInstances()));
    if (!selector.isSkipInstanceCheck() && !instances.isEmpty()) {
      validateInstances(selector.getEntities(), counterIds, instances, interval.getIntervalId());
    }

    return new ValidatedQuery(
        List.copyOf(selector.getEntities()),
        counterIds,
        instances,
        intervalClass,
        interval.getIntervalId(),
        start,
        finish,
        selector.getMaxSamples()
    );
  }

  /**
   * Validates the interval token and entities of a query that skips time window and instance
   * checks, such as listing available metrics or instances.
   */
  public ResolvedInterval validateIntrospection(List<EntityRef> entities, String intervalToken) {
    final IntervalClass intervalClass = IntervalClass.parse(intervalToken);
    validateEntities(entities, intervalClass);
    return resolveInterval(intervalClass);
  }

  /**
   * @return counter ids keyed by stat, in request order
   */
  public Map<String, Integer> resolveStats(List<String> stats, CounterCatalog catalog) {
    if (CollectionUtils.isEmpty(stats)) {
      throw new QueryValidationException("At least one stat is required");
    }
    final Map<String, Integer> counterIds = new LinkedHashMap<>();
    for (String stat : stats) {
      final OptionalInt counterId = catalog.resolve(stat);
      if (counterId.isEmpty()) {
        throw new UnknownStatException(stat);
      }
      counterIds.put(stat, counterId.getAsInt());
    }
    return counterIds;
  }

  private void validateEntities(List<EntityRef> entities, IntervalClass intervalClass) {
    if (CollectionUtils.isEmpty(entities)) {
      throw new QueryValidationException("At least one entity is required");
    }
    for (EntityRef entity : entities) {
      if (entity.getType() == null) {
        throw new UnsupportedEntityTypeException(null);
      }
      if (!entity.getType().supports(intervalClass)) {
        throw new UnsupportedIntervalForEntityException(entity, intervalClass);
      }
    }
  }

  private void validateTimeWindow(Instant start, Instant finish) {
    if (start != null && finish != null && !start.isBefore(finish)) {
      throw new InvalidTimeWindowException(start, finish);
    }
  }

  private ResolvedInterval resolveInterval(IntervalClass intervalClass) {
    if (intervalClass.isRealtime()) {
      return new ResolvedInterval(intervalClass, null, null);
    }
    final HistoricalInterval config =
        metricsProvider.historicalIntervalConfig(intervalClass.getHistoricalIndex());
    return new ResolvedInterval(
        intervalClass, Math.toIntExact(config.getSamplingPeriodSeconds()), config);
  }

  private static boolean containsDatastore(List<EntityRef> entities) {
    return entities.stream().anyMatch(entity -> entity.getType() == EntityType.DATASTORE);
  }

  private void validateInstances(List<EntityRef> entities, Map<String, Integer> counterIds,
                                 List<String> instances, Integer intervalId) {
    for (EntityRef entity : entities) {
      final List<PerfMetricId> available =
          metricsProvider.listAvailableMetrics(entity.getId(), intervalId);

      for (Map.Entry<String, Integer> stat : counterIds.entrySet()) {
        final Set<String> validInstances = new LinkedHashSet<>();
        for (PerfMetricId metricId : available) {
          if (metricId.getCounterId() == stat.getValue()) {
            validInstances.add(metricId.getInstance());
          }
        }

        final List<String> invalidInstances = new ArrayList<>();
        for (String instance : instances) {
          if (!WILDCARD_INSTANCE.equals(instance) && !validInstances.contains(instance)) {
            invalidInstances.add(instance);
          }
        }
        if (!invalidInstances.isEmpty()) {
          throw new InvalidInstanceException(
              stat.getKey(), invalidInstances, new ArrayList<>(validInstances));
        }
      }
    }
  }
}
