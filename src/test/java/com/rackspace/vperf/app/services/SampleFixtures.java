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
import com.rackspace.vperf.app.model.MetricSeries;
import com.rackspace.vperf.app.model.SampleBlock;
import com.rackspace.vperf.app.model.SampleInfo;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class SampleFixtures {

  public static final int CPU_USAGE_AVG = 2;
  public static final int MEM_ACTIVE_AVG = 33;
  public static final int DISK_READ_AVG = 180;

  public static final Instant T0 = Instant.parse("2021-03-01T10:00:00Z");

  public static CounterDefinition counter(int counterId, String group, String name,
                                          String rollupType, String unit) {
    return new CounterDefinition()
        .setCounterId(counterId)
        .setGroup(group)
        .setName(name)
        .setRollupType(rollupType)
        .setUnit(unit)
        .setLevel(1);
  }

  public static List<CounterDefinition> standardCounters() {
    return List.of(
        counter(CPU_USAGE_AVG, "cpu", "usage", "average", "percent"),
        counter(MEM_ACTIVE_AVG, "mem", "active", "average", "kiloBytes"),
        counter(DISK_READ_AVG, "datastore", "read", "average", "kiloBytesPerSecond")
    );
  }

  public static CounterCatalog standardCatalog() {
    return CounterCatalog.from(standardCounters());
  }

  /**
   * @return sample info at 20 second steps starting at {@link #T0}
   */
  public static List<SampleInfo> sampleInfo(int count) {
    final List<SampleInfo> info = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      info.add(new SampleInfo(T0.plusSeconds(20L * i), 20));
    }
    return info;
  }

  public static SampleBlock block(String entityId, int timestamps, MetricSeries... series) {
    return new SampleBlock()
        .setEntityId(entityId)
        .setSampleInfo(sampleInfo(timestamps))
        .setValues(Arrays.asList(series));
  }

  public static MetricSeries series(int counterId, String instance, long... values) {
    return new MetricSeries(counterId, instance, values);
  }
}
