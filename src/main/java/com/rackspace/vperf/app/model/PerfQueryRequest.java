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

import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class PerfQueryRequest {

  @NotEmpty
  @Valid
  List<Entity> entities;

  List<String> stats;

  List<String> instances;

  /**
   * ISO-8601, epoch seconds, epoch millis or a relative time such as <code>1h-ago</code>.
   */
  String start;

  String finish;

  @NotBlank
  String interval;

  @Min(0)
  Integer maxSamples;

  Integer threads;

  Boolean skipInstanceCheck;

  @Data
  public static class Entity {
    @NotBlank
    String id;
    String name;
    @NotBlank
    String type;
  }
}
