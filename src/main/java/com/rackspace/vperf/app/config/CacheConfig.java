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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.rackspace.vperf.app.services.CounterCatalog;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

  private final MeterRegistry meterRegistry;
  private final AppProperties appProperties;

  @Autowired
  public CacheConfig(MeterRegistry meterRegistry, AppProperties appProperties) {
    this.meterRegistry = meterRegistry;
    this.appProperties = appProperties;
  }

  @Bean
  public Cache<String, CounterCatalog> counterCatalogCache() {
    final Cache<String, CounterCatalog> cache = Caffeine
        .newBuilder()
        // one catalog per provider
        .maximumSize(1)
        .expireAfterWrite(appProperties.getCatalogCacheTtl())
        .recordStats()
        .build();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "counterCatalog");
    return cache;
  }
}
