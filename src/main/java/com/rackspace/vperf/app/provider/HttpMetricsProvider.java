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

package com.rackspace.vperf.app.provider;

import com.rackspace.vperf.app.config.AppProperties;
import com.rackspace.vperf.app.model.CounterDefinition;
import com.rackspace.vperf.app.model.HistoricalInterval;
import com.rackspace.vperf.app.model.PerfMetricId;
import com.rackspace.vperf.app.model.ProviderQuerySpec;
import com.rackspace.vperf.app.model.SampleBlock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Talks JSON to a metrics provider gateway. Each call blocks the calling thread, so callers on a
 * reactive pipeline must schedule onto a thread that allows blocking.
 */
@Component
@Slf4j
public class HttpMetricsProvider implements MetricsProvider {

  private final WebClient webClient;
  private final Duration timeout;

  @Autowired
  public HttpMetricsProvider(AppProperties appProperties, WebClient.Builder webClientBuilder) {
    this.webClient = webClientBuilder
        .baseUrl(appProperties.getProvider().getBaseUrl())
        .build();
    this.timeout = appProperties.getProvider().getTimeout();
  }

  @Override
  public List<CounterDefinition> listCounterDefinitions() {
    final List<CounterDefinition> counters = webClient.get()
        .uri("/counters")
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(new ParameterizedTypeReference<List<CounterDefinition>>() {})
        .block(timeout);
    log.debug("Loaded {} counter definitions", counters == null ? 0 : counters.size());
    return counters == null ? List.of() : counters;
  }

  @Override
  public List<PerfMetricId> listAvailableMetrics(String entityId, Integer intervalId) {
    final List<PerfMetricId> metricIds = webClient.get()
        .uri(uriBuilder -> uriBuilder.path("/entities/{entityId}/available-metrics")
            .queryParamIfPresent("intervalId", Optional.ofNullable(intervalId))
            .build(entityId))
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(new ParameterizedTypeReference<List<PerfMetricId>>() {})
        .block(timeout);
    return metricIds == null ? List.of() : metricIds;
  }

  @Override
  public HistoricalInterval historicalIntervalConfig(int intervalIndex) {
    final HistoricalInterval interval = webClient.get()
        .uri("/historical-intervals/{index}", intervalIndex)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(HistoricalInterval.class)
        .block(timeout);
    if (interval == null) {
      throw new IllegalStateException("Provider has no historical interval " + intervalIndex);
    }
    return interval;
  }

  @Override
  public List<SampleBlock> querySamples(List<ProviderQuerySpec> specs) {
    return webClient.post()
        .uri("/samples")
        .accept(MediaType.APPLICATION_JSON)
        .contentType(MediaType.APPLICATION_JSON)
        .body(BodyInserters.fromValue(specs))
        .retrieve()
        .bodyToMono(new ParameterizedTypeReference<List<SampleBlock>>() {})
        .block(timeout);
  }
}
