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

/**
 * One sample query as handed to the pipeline. Every optional setting has already been resolved
 * by the caller.
 */
@Data
public class QuerySelector {
  List<EntityRef> entities = List.of();
  List<String> stats = List.of();
  /**
   * Empty selects the aggregate instance, <code>*</code> selects any instance.
   */
  List<String> instances = List.of();
  Instant start;
  Instant finish;
  String interval;
  /**
   * Zero returns all samples.
   */
  int maxSamples;
  /**
   * Null or non-positive uses the default worker count.
   */
  Integer threads;
  boolean skipInstanceCheck;
}
