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

package com.rackspace.vperf.app.config;

import java.time.Duration;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("vperf")
@Component
@Data
@Validated
public class AppProperties {

  /**
   * The number of logical cores used to size the flattening work. The default uses the number
   * of available processors reported by the JVM.
   */
  @Min(1)
  int logicalCores = Runtime.getRuntime().availableProcessors();

  /**
   * Size of the shared thread pool that runs flattening workers. Should be at least twice the
   * logical cores since a single query may use that many workers.
   */
  @Min(1)
  int workerPoolSize = 2 * Runtime.getRuntime().availableProcessors();

  /**
   * Worker count applied when a query does not specify one. Null uses twice the logical cores.
   */
  Integer defaultThreads;

  /**
   * Skips the per entity lookup of valid instances when a query does not specify it.
   */
  boolean skipInstanceCheck = false;

  /**
   * Sample cap applied when a query does not specify one. Zero returns everything.
   */
  @Min(0)
  int defaultMaxSamples = 0;

  /**
   * How long a counter catalog built from the provider may be reused. Zero builds a new catalog
   * for every query.
   */
  @NotNull
  Duration catalogCacheTtl = Duration.ZERO;

  @NotNull
  @Valid
  Provider provider = new Provider();

  @Data
  public static class Provider {

    /**
     * Base URL of the metrics provider gateway.
     */
    @NotBlank
    String baseUrl = "http://localhost:8088/api/provider";

    /**
     * Maximum time to wait for any single provider response.
     */
    @NotNull
    Duration timeout = Duration.ofSeconds(60);
  }
}
