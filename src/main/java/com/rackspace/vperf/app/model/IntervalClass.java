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

import com.rackspace.vperf.app.exceptions.InvalidIntervalException;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * The sampling granularity a query is run against. Historical classes map onto the provider's
 * configured historical intervals by their 1-based index.
 */
public enum IntervalClass {
  REALTIME(0),
  HIST_1(1),
  HIST_2(2),
  HIST_3(3),
  HIST_4(4);

  private final int historicalIndex;

  IntervalClass(int historicalIndex) {
    this.historicalIndex = historicalIndex;
  }

  public int getHistoricalIndex() {
    return historicalIndex;
  }

  public boolean isRealtime() {
    return this == REALTIME;
  }

  /**
   * Accepts the enum names case-insensitively, and the historical classes also without the
   * underscore, e.g. <code>hist2</code>.
   */
  public static IntervalClass parse(String token) {
    if (StringUtils.isBlank(token)) {
      throw new InvalidIntervalException(token);
    }
    String normalized = token.trim().toUpperCase(Locale.ROOT);
    if (normalized.matches("HIST[1-4]")) {
      normalized = "HIST_" + normalized.charAt(4);
    }
    for (IntervalClass intervalClass : values()) {
      if (intervalClass.name().equals(normalized)) {
        return intervalClass;
      }
    }
    throw new InvalidIntervalException(token);
  }
}
