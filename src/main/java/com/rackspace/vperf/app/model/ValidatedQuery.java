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
import java.util.Map;
import lombok.Value;

/**
 * A query that passed validation, carrying the resolved interval, time window and counter ids
 * keyed by stat in request order.
 */
@Value
public class ValidatedQuery {
  List<EntityRef> entities;
  Map<String, Integer> counterIds;
  List<String> instances;
  IntervalClass intervalClass;
  Integer intervalId;
  Instant start;
  Instant finish;
  int maxSamples;
}
