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

package com.rackspace.vperf.app.model;

import java.time.Instant;
import java.util.List;
import lombok.Data;

@Data
public class ProviderQuerySpec {
  String entityId;
  /**
   * Sampling period in seconds of the historical interval, null for real-time.
   */
  Integer intervalId;
  List<PerfMetricId> metricIds;
  Instant startTime;
  Instant endTime;
  /**
   * Null leaves the sample count unbounded.
   */
  Integer maxSample;
}
