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
import lombok.Data;
import org.springframework.util.CollectionUtils;

/**
 * The provider's raw result for one entity.
 */
@Data
public class SampleBlock {
  String entityId;
  List<SampleInfo> sampleInfo;
  List<MetricSeries> values;

  public boolean hasValues() {
    return !CollectionUtils.isEmpty(sampleInfo) || !CollectionUtils.isEmpty(values);
  }
}
