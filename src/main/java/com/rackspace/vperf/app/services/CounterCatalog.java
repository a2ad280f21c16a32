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

import com.rackspace.vperf.app.model.CounterDefinition;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;

/**
 * Lookup tables between stat keys, counter ids and units, built from the provider's counter
 * definitions. Instances are immutable once built and safe to share between threads.
 * <p>
 * When the provider declares the same stat key more than once, the first definition registered
 * wins and the others are discarded.
 * </p>
 */
@Slf4j
public class CounterCatalog {

  private final Map<String, Integer> countersByStatKey;
  private final Map<Integer, String> statKeysByCounter;
  private final Map<Integer, String> unitsByCounter;
  private final Map<Integer, CounterDefinition> definitionsByCounter;

  private CounterCatalog(Map<String, Integer> countersByStatKey,
                         Map<Integer, String> statKeysByCounter,
                         Map<Integer, String> unitsByCounter,
                         Map<Integer, CounterDefinition> definitionsByCounter) {
    this.countersByStatKey = Collections.unmodifiableMap(countersByStatKey);
    this.statKeysByCounter = Collections.unmodifiableMap(statKeysByCounter);
    this.unitsByCounter = Collections.unmodifiableMap(unitsByCounter);
    this.definitionsByCounter = Collections.unmodifiableMap(definitionsByCounter);
  }

  public static CounterCatalog from(List<CounterDefinition> definitions) {
    final Map<String, Integer> countersByStatKey = new LinkedHashMap<>();
    final Map<Integer, String> statKeysByCounter = new HashMap<>();
    final Map<Integer, String> unitsByCounter = new HashMap<>();
    final Map<Integer, CounterDefinition> definitionsByCounter = new HashMap<>();

    for (CounterDefinition definition : definitions) {
      if (definition.isReserved()) {
        continue;
      }
      final String statKey = definition.getStatKey();
      final Integer existing = countersByStatKey.putIfAbsent(statKey, definition.getCounterId());
      if (existing != null) {
        log.debug("Discarding counter {} for {}, already registered as counter {}",
            definition.getCounterId(), statKey, existing);
        continue;
      }
      statKeysByCounter.put(definition.getCounterId(), statKey);
      unitsByCounter.put(definition.getCounterId(), definition.getUnit());
      definitionsByCounter.put(definition.getCounterId(), definition);
    }

    log.debug("Built counter catalog with {} stats from {} definitions",
        countersByStatKey.size(), definitions.size());
    return new CounterCatalog(
        countersByStatKey, statKeysByCounter, unitsByCounter, definitionsByCounter);
  }

  public OptionalInt resolve(String statKey) {
    final Integer counterId = countersByStatKey.get(statKey);
    return counterId == null ? OptionalInt.empty() : OptionalInt.of(counterId);
  }

  public boolean contains(int counterId) {
    return statKeysByCounter.containsKey(counterId);
  }

  /**
   * @return the stat key of the counter or null if unknown
   */
  public String statKey(int counterId) {
    return statKeysByCounter.get(counterId);
  }

  /**
   * @return the unit of the counter or null if unknown
   */
  public String unit(int counterId) {
    return unitsByCounter.get(counterId);
  }

  public Optional<CounterDefinition> describe(int counterId) {
    return Optional.ofNullable(definitionsByCounter.get(counterId));
  }

  public int size() {
    return countersByStatKey.size();
  }
}
