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

import static com.rackspace.vperf.app.services.SampleFixtures.counter;
import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.vperf.app.model.CounterDefinition;
import java.util.List;
import org.junit.jupiter.api.Test;

class CounterCatalogTest {

  @Test
  void buildsLookupTables() {
    final CounterCatalog catalog = SampleFixtures.standardCatalog();

    assertThat(catalog.size()).isEqualTo(3);
    assertThat(catalog.resolve("cpu.usage.average")).hasValue(2);
    assertThat(catalog.statKey(33)).isEqualTo("mem.active.average");
    assertThat(catalog.unit(180)).isEqualTo("kiloBytesPerSecond");
    assertThat(catalog.describe(2)).get()
        .extracting(CounterDefinition::getGroup).isEqualTo("cpu");
  }

  @Test
  void unknownStat() {
    final CounterCatalog catalog = SampleFixtures.standardCatalog();

    assertThat(catalog.resolve("cpu.usage.maximum")).isEmpty();
    assertThat(catalog.contains(9999)).isFalse();
    assertThat(catalog.statKey(9999)).isNull();
    assertThat(catalog.describe(9999)).isEmpty();
  }

  @Test
  void skipsReservedLevel() {
    final CounterCatalog catalog = CounterCatalog.from(List.of(
        counter(1, "cpu", "usage", "average", "percent"),
        counter(7, "sys", "internal", "latest", "number").setLevel(CounterDefinition.RESERVED_LEVEL)
    ));

    assertThat(catalog.resolve("sys.internal.latest")).isEmpty();
    assertThat(catalog.contains(7)).isFalse();
    assertThat(catalog.size()).isEqualTo(1);
  }

  @Test
  void firstDefinitionWinsForDuplicateStatKey() {
    final CounterCatalog catalog = CounterCatalog.from(List.of(
        counter(5, "cpu", "ready", "summation", "millisecond"),
        counter(6, "cpu", "ready", "summation", "percent")
    ));

    assertThat(catalog.resolve("cpu.ready.summation")).hasValue(5);
    assertThat(catalog.unit(5)).isEqualTo("millisecond");
    assertThat(catalog.contains(6)).isFalse();
  }
}
