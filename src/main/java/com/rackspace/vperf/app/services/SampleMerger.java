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

import com.rackspace.vperf.app.model.FlatRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class SampleMerger {

  private static final Comparator<FlatRecord> NEWEST_FIRST =
      Comparator.comparing(FlatRecord::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()));

  /**
   * Concatenates the worker outputs and sorts them newest first. Records with equal timestamps
   * keep the order in which they were emitted.
   *
   * @param maxSamples the number of most recent records to keep, or zero to keep all
   */
  public List<FlatRecord> mergeAndCap(List<List<FlatRecord>> workerOutputs, int maxSamples) {
    final List<FlatRecord> merged = new ArrayList<>(
        workerOutputs.stream().mapToInt(List::size).sum());
    workerOutputs.forEach(merged::addAll);
    merged.sort(NEWEST_FIRST);

    if (maxSamples > 0 && merged.size() > maxSamples) {
      return new ArrayList<>(merged.subList(0, maxSamples));
    }
    return merged;
  }
}
