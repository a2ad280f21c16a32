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

import com.github.benmanes.caffeine.cache.Cache;
import com.rackspace.vperf.app.config.AppProperties;
import com.rackspace.vperf.app.provider.MetricsProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class CounterCatalogService {

  private static final String CATALOG_KEY = "catalog";

  private final MetricsProvider metricsProvider;
  private final AppProperties appProperties;
  private final Cache<String, CounterCatalog> counterCatalogCache;

  @Autowired
  public CounterCatalogService(MetricsProvider metricsProvider,
                               AppProperties appProperties,
                               Cache<String, CounterCatalog> counterCatalogCache) {
    this.metricsProvider = metricsProvider;
    this.appProperties = appProperties;
    this.counterCatalogCache = counterCatalogCache;
  }

  /**
   * Returns the counter catalog, reusing a cached one when caching is enabled.
   */
  public CounterCatalog loadCatalog() {
    if (appProperties.getCatalogCacheTtl().isZero()) {
      return buildCatalog();
    }
    return counterCatalogCache.get(CATALOG_KEY, key -> buildCatalog());
  }

  private CounterCatalog buildCatalog() {
    return CounterCatalog.from(metricsProvider.listCounterDefinitions());
  }
}
