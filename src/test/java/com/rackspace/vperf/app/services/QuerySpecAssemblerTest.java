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

import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.vperf.app.model.EntityRef;
import com.rackspace.vperf.app.model.EntityType;
import com.rackspace.vperf.app.model.IntervalClass;
import com.rackspace.vperf.app.model.PerfMetricId;
import com.rackspace.vperf.app.model.ProviderQuerySpec;
import com.rackspace.vperf.app.model.ValidatedQuery;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QuerySpecAssemblerTest {

  QuerySpecAssembler assembler = new QuerySpecAssembler();

  Instant start = Instant.parse("2021-03-01T00:00:00Z");
  Instant finish = Instant.parse("2021-03-02T00:00:00Z");

  List<EntityRef> entities = List.of(
      new EntityRef("host-1", "esx-01", EntityType.HOST),
      new EntityRef("host-2", "esx-02", EntityType.HOST));

  Map<String, Integer> counterIds = new LinkedHashMap<>(Map.of("cpu.usage.average", 2));

  private ValidatedQuery query(List<String> instances, IntervalClass intervalClass,
                               Integer intervalId, int maxSamples) {
    return new ValidatedQuery(entities, counterIds, instances, intervalClass, intervalId, start,
        finish, maxSamples);
  }

  @Test
  void onePerEntityWithAggregateInstance() {
    final List<ProviderQuerySpec> specs =
        assembler.assemble(query(List.of(), IntervalClass.HIST_1, 300, 10));

    assertThat(specs).hasSize(2);
    assertThat(specs).extracting(ProviderQuerySpec::getEntityId).containsExactly("host-1", "host-2");
    assertThat(specs.get(0).getMetricIds()).containsExactly(new PerfMetricId(2, ""));
    assertThat(specs.get(0).getIntervalId()).isEqualTo(300);
    assertThat(specs.get(0).getStartTime()).isEqualTo(start);
    assertThat(specs.get(0).getEndTime()).isEqualTo(finish);
    assertThat(specs.get(0).getMaxSample()).isEqualTo(10);
  }

  @Test
  void expandsEveryRequestedInstance() {
    counterIds.put("mem.active.average", 33);

    final List<ProviderQuerySpec> specs =
        assembler.assemble(query(List.of("0", "1"), IntervalClass.HIST_2, 1800, 0));

    assertThat(specs.get(1).getMetricIds()).containsExactly(
        new PerfMetricId(2, "0"),
        new PerfMetricId(2, "1"),
        new PerfMetricId(33, "0"),
        new PerfMetricId(33, "1"));
  }

  @Test
  void wildcardReplacesConcreteInstances() {
    counterIds.put("mem.active.average", 33);

    final List<ProviderQuerySpec> specs =
        assembler.assemble(query(List.of("*", "0"), IntervalClass.HIST_2, 1800, 0));

    assertThat(specs).allSatisfy(spec -> assertThat(spec.getMetricIds()).containsExactly(
        new PerfMetricId(2, "*"),
        new PerfMetricId(33, "*")));
  }

  @Test
  void unlimitedSamplesHasNoHint() {
    final List<ProviderQuerySpec> specs =
        assembler.assemble(query(List.of(), IntervalClass.HIST_1, 300, 0));

    assertThat(specs).extracting(ProviderQuerySpec::getMaxSample).containsOnlyNulls();
  }

  @Test
  void realtimeHasNoHint() {
    final List<ProviderQuerySpec> specs =
        assembler.assemble(query(List.of(), IntervalClass.REALTIME, null, 25));

    assertThat(specs).extracting(ProviderQuerySpec::getMaxSample).containsOnlyNulls();
    assertThat(specs).extracting(ProviderQuerySpec::getIntervalId).containsOnlyNulls();
  }
}
