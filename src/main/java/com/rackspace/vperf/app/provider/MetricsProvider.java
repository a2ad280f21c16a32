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

import com.rackspace.vperf.app.model.CounterDefinition;
import com.rackspace.vperf.app.model.HistoricalInterval;
import com.rackspace.vperf.app.model.PerfMetricId;
import com.rackspace.vperf.app.model.ProviderQuerySpec;
import com.rackspace.vperf.app.model.SampleBlock;
import java.util.List;

/**
 * The external system that owns counter definitions and computes performance samples.
 * Implementations are expected to be thread-safe.
 */
public interface MetricsProvider {

  List<CounterDefinition> listCounterDefinitions();

  /**
   * @param intervalId sampling period of a historical interval or null for real-time
   */
  List<PerfMetricId> listAvailableMetrics(String entityId, Integer intervalId);

  /**
   * @param intervalIndex 1-based index of the historical interval
   */
  HistoricalInterval historicalIntervalConfig(int intervalIndex);

  /**
   * Fetches samples for all the given specs in one call.
   *
   * @return one block per entity, or null when the provider returned no result at all
   */
  List<SampleBlock> querySamples(List<ProviderQuerySpec> specs);
}
