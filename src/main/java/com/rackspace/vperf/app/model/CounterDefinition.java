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

import lombok.Data;

/**
 * A performance counter as declared by the metrics provider.
 */
@Data
public class CounterDefinition {

  /**
   * Counters at this level are reserved for provider internal use and never exposed.
   */
  public static final int RESERVED_LEVEL = 99;

  int counterId;
  String group;
  String name;
  String rollupType;
  String unit;
  int level;

  /**
   * @return the stat key in the form <code>group.name.rollup</code>
   */
  public String getStatKey() {
    return String.join(".", group, name, rollupType);
  }

  public boolean isReserved() {
    return level == RESERVED_LEVEL;
  }
}
