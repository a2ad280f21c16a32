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

import com.rackspace.vperf.app.model.EntityRef;
import com.rackspace.vperf.app.model.PerfMetricId;
import com.rackspace.vperf.app.model.ProviderQuerySpec;
import com.rackspace.vperf.app.model.ValidatedQuery;
import com.rackspace.vperf.app.validation.QueryValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class QuerySpecAssembler {

  /**
   * Instance sent to the provider to select the entity level aggregate.
   */
  public static final String AGGREGATE_INSTANCE = "";

  /**
   * Builds one provider spec per entity. Each stat expands into one metric id per requested
   * instance, or a single aggregate metric id when no instance was requested. A wildcard among
   * the requested instances replaces all the others.
   */
  public List<ProviderQuerySpec> assemble(ValidatedQuery query) {
    final List<PerfMetricId> metricIds = buildMetricIds(query.getCounterIds(), query.getInstances());
    final Integer maxSample = query.getMaxSamples() == 0 || query.getIntervalClass().isRealtime() ?
        null : query.getMaxSamples();

    final List<ProviderQuerySpec> specs = new ArrayList<>(query.getEntities().size());
    for (EntityRef entity : query.getEntities()) {
      specs.add(new ProviderQuerySpec()
          .setEntityId(entity.getId())
          .setIntervalId(query.getIntervalId())
          .setMetricIds(metricIds)
          .setStartTime(query.getStart())
          .setEndTime(query.getFinish())
          .setMaxSample(maxSample));
    }
    return specs;
  }

  private List<PerfMetricId> buildMetricIds(Map<String, Integer> counterIds, List<String> requested) {
    // the wildcard already covers every concrete instance
    final List<String> instances = requested.contains(QueryValidator.WILDCARD_INSTANCE) ?
        List.of(QueryValidator.WILDCARD_INSTANCE) : requested;
    final List<PerfMetricId> metricIds = new ArrayList<>();
    for (Integer counterId : counterIds.values()) {
      if (instances.isEmpty()) {
        metricIds.add(new PerfMetricId(counterId, AGGREGATE_INSTANCE));
      } else {
        for (String instance : instances) {
          metricIds.add(new PerfMetricId(counterId, instance));
        }
      }
    }
    return List.copyOf(metricIds);
  }
}
