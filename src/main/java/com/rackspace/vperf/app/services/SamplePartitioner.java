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

import com.rackspace.vperf.app.config.AppProperties;
import com.rackspace.vperf.app.model.Partition;
import com.rackspace.vperf.app.model.SampleBlock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits sample blocks into contiguous slices so each flattening worker gets a similar amount of
 * work.
 */
@Component
public class SamplePartitioner {

  private final int maxWorkers;

  @Autowired
  public SamplePartitioner(AppProperties appProperties) {
    this.maxWorkers = 2 * appProperties.getLogicalCores();
  }

  /**
   * @param threads the caller's preferred worker count, null or non-positive for the default
   * @return the preferred count capped at twice the logical cores, or that cap by default
   */
  public int workerCount(Integer threads) {
    if (threads == null || threads <= 0) {
      return maxWorkers;
    }
    return Math.min(threads, maxWorkers);
  }

  /**
   * @return exactly <code>workerCount</code> partitions in block order, where trailing
   * partitions may be smaller or empty, or no partitions at all when there are no blocks
   */
  public List<Partition> partition(List<SampleBlock> blocks, int workerCount) {
    if (workerCount < 1) {
      throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
    }
    final List<Partition> partitions = new ArrayList<>(workerCount);
    if (blocks.isEmpty()) {
      return partitions;
    }

    final int perWorker = (blocks.size() + workerCount - 1) / workerCount;
    for (int i = 0; i < workerCount; i++) {
      final int from = Math.min(i * perWorker, blocks.size());
      final int to = Math.min(from + perWorker, blocks.size());
      partitions.add(new Partition(i, blocks.subList(from, to)));
    }
    return partitions;
  }
}
