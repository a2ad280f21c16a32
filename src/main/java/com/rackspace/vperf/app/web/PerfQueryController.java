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

package com.rackspace.vperf.app.web;

import com.rackspace.vperf.app.config.AppProperties;
import com.rackspace.vperf.app.model.CounterDefinition;
import com.rackspace.vperf.app.model.EntityRef;
import com.rackspace.vperf.app.model.EntityType;
import com.rackspace.vperf.app.model.InstanceResult;
import com.rackspace.vperf.app.model.PerfQueryRequest;
import com.rackspace.vperf.app.model.QuerySelector;
import com.rackspace.vperf.app.model.SampleQueryResult;
import com.rackspace.vperf.app.services.PerfQueryService;
import com.rackspace.vperf.app.services.TimestampProvider;
import com.rackspace.vperf.app.utils.DateTimeUtils;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import javax.validation.Valid;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Performance sample query API. The query pipeline blocks on provider calls and on its
 * flattening workers, so every request is moved off the event loop.
 */
@RestController
@RequestMapping("/api/perf")
public class PerfQueryController {

  private final PerfQueryService perfQueryService;
  private final AppProperties appProperties;
  private final TimestampProvider timestampProvider;

  @Autowired
  public PerfQueryController(PerfQueryService perfQueryService, AppProperties appProperties,
                             TimestampProvider timestampProvider) {
    this.perfQueryService = perfQueryService;
    this.appProperties = appProperties;
    this.timestampProvider = timestampProvider;
  }

  @PostMapping("/query")
  public Mono<SampleQueryResult> query(@Valid @RequestBody PerfQueryRequest request,
                                       @RequestHeader(value = MDCFilter.X_B3_TRACE_ID, required = false)
                                           String traceId) {
    return offload(traceId, () -> perfQueryService.querySamples(toSelector(request)));
  }

  @GetMapping("/metrics")
  public Flux<CounterDefinition> availableMetrics(@RequestParam String entityId,
                                                  @RequestParam(required = false) String entityName,
                                                  @RequestParam String entityType,
                                                  @RequestParam String interval,
                                                  @RequestHeader(value = MDCFilter.X_B3_TRACE_ID, required = false)
                                                      String traceId) {
    return offload(traceId, () -> perfQueryService.listAvailableMetrics(
            new EntityRef(entityId, entityName, EntityType.parse(entityType)), interval))
        .flatMapMany(Flux::fromIterable);
  }

  @PostMapping("/instances")
  public Flux<InstanceResult> availableInstances(@Valid @RequestBody PerfQueryRequest request,
                                                 @RequestHeader(value = MDCFilter.X_B3_TRACE_ID, required = false)
                                                     String traceId) {
    return offload(traceId, () -> perfQueryService.listAvailableInstances(toSelector(request)))
        .flatMapMany(Flux::fromIterable);
  }

  /**
   * Runs blocking work on the bounded elastic scheduler with the request's trace id in the MDC.
   */
  private static <T> Mono<T> offload(String traceId, Callable<T> work) {
    return Mono.fromCallable(() -> {
      if (traceId == null) {
        MDC.remove(MDCFilter.X_B3_TRACE_ID);
        return work.call();
      }
      try (MDC.MDCCloseable ignored = MDC.putCloseable(MDCFilter.X_B3_TRACE_ID, traceId)) {
        return work.call();
      }
    }).subscribeOn(Schedulers.boundedElastic());
  }

  private QuerySelector toSelector(PerfQueryRequest request) {
    final Instant now = timestampProvider.now();
    final List<EntityRef> entities = request.getEntities().stream()
        .map(entity -> new EntityRef(
            entity.getId(),
            Objects.requireNonNullElse(entity.getName(), entity.getId()),
            EntityType.parse(entity.getType())))
        .collect(Collectors.toList());

    return new QuerySelector()
        .setEntities(entities)
        .setStats(request.getStats() == null ? List.of() : request.getStats())
        .setInstances(request.getInstances() == null ? List.of() : request.getInstances())
        .setStart(DateTimeUtils.parseOptionalInstant(request.getStart(), now))
        .setFinish(DateTimeUtils.parseOptionalInstant(request.getFinish(), now))
        .setInterval(request.getInterval())
        .setMaxSamples(Objects.requireNonNullElse(
            request.getMaxSamples(), appProperties.getDefaultMaxSamples()))
        .setThreads(request.getThreads() != null ?
            request.getThreads() : appProperties.getDefaultThreads())
        .setSkipInstanceCheck(Objects.requireNonNullElse(
            request.getSkipInstanceCheck(), appProperties.isSkipInstanceCheck()));
  }
}
