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
import lombok.Value;

/**
 * Outcome of a sample query. A result flagged as no-data means the provider reported no values
 * at all, which is distinct from a query that matched nothing.
 */
@Value
public class SampleQueryResult {
  List<FlatRecord> records;
  boolean noData;

  public static SampleQueryResult of(List<FlatRecord> records) {
    return new SampleQueryResult(records, false);
  }

  public static SampleQueryResult noData() {
    return new SampleQueryResult(List.of(), true);
  }

  public int getCount() {
    return records.size();
  }
}
