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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {
  private final AppProperties appProperties;
  private final MeterRegistry meterRegistry;

  @Autowired
  public ExecutorConfig(AppProperties appProperties, MeterRegistry meterRegistry) {
    this.appProperties = appProperties;
    this.meterRegistry = meterRegistry;
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService flatteningExecutor() {
    final AtomicInteger threadCount = new AtomicInteger();
    final ThreadFactory threadFactory = runnable -> {
      Thread thread = new Thread(runnable, "flatten-" + threadCount.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
    return ExecutorServiceMetrics.monitor(meterRegistry,
        Executors.newFixedThreadPool(appProperties.getWorkerPoolSize(), threadFactory),
        "flatteningExecutor");
  }
}
