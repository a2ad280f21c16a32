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

import com.rackspace.vperf.app.exceptions.ProviderContractViolationException;
import com.rackspace.vperf.app.model.EntityRef;
import com.rackspace.vperf.app.model.FlatRecord;
import com.rackspace.vperf.app.model.MetricSeries;
import com.rackspace.vperf.app.model.Partition;
import com.rackspace.vperf.app.model.SampleBlock;
import com.rackspace.vperf.app.model.SampleInfo;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts the column oriented blocks of one partition into flat records. Only reads the shared
 * catalog and entity table, so any number of partitions can be flattened concurrently.
 */
@Component
@Slf4j
public class SampleFlattener {

  /**
   * Value emitted for positions the provider left out of a series.
   */
  public static final long MISSING_VALUE = -1;

  public List<FlatRecord> flatten(Partition partition, CounterCatalog catalog,
                                  Map<String, EntityRef> entitiesById) {
    final List<FlatRecord> records = new ArrayList<>();
    for (SampleBlock block : partition.getBlocks()) {
      flattenBlock(partition.getIndex(), block, catalog, entitiesById, records);
    }
    log.trace("Flattened partition {} with {} blocks into {} records",
        partition.getIndex(), partition.getBlocks().size(), records.size());
    return records;
  }

  private void flattenBlock(int partitionIndex, SampleBlock block, CounterCatalog catalog,
                            Map<String, EntityRef> entitiesById, List<FlatRecord> records) {
    final List<SampleInfo> sampleInfo = block.getSampleInfo() == null ?
        List.of() : block.getSampleInfo();
    final List<MetricSeries> values = block.getValues() == null ?
        List.of() : block.getValues();
    final EntityRef entity = entitiesById.get(block.getEntityId());
    final String entityName = entity != null ? entity.getName() : null;

    for (MetricSeries series : values) {
      final int counterId = series.getCounterId();
      if (!catalog.contains(counterId)) {
        throw new ProviderContractViolationException(
            "Samples reference unknown counter " + counterId, partitionIndex, block.getEntityId());
      }
      final long[] seriesValues = series.getValue();
      if (seriesValues != null && seriesValues.length > sampleInfo.size()) {
        throw new ProviderContractViolationException(
            String.format("Counter %d has %d values for %d timestamps",
                counterId, seriesValues.length, sampleInfo.size()),
            partitionIndex, block.getEntityId());
      }

      final String statKey = catalog.statKey(counterId);
      final String unit = catalog.unit(counterId);
      for (int i = 0; i < sampleInfo.size(); i++) {
        final SampleInfo info = sampleInfo.get(i);
        final long value = seriesValues != null && i < seriesValues.length ?
            seriesValues[i] : MISSING_VALUE;
        records.add(new FlatRecord(
            block.getEntityId(),
            entityName,
            counterId,
            statKey,
            series.getInstance(),
            info.getTimestamp(),
            info.getInterval(),
            value,
            unit
        ));
      }
    }
  }
}
