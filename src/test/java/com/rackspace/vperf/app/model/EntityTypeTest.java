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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.vperf.app.exceptions.UnsupportedEntityTypeException;
import org.junit.jupiter.api.Test;

class EntityTypeTest {

  @Test
  void parsesProviderTypeNames() {
    assertThat(EntityType.parse("HostSystem")).isEqualTo(EntityType.HOST);
    assertThat(EntityType.parse("virtualmachine")).isEqualTo(EntityType.VIRTUAL_MACHINE);
    assertThat(EntityType.parse("ClusterComputeResource")).isEqualTo(EntityType.CLUSTER);
    assertThat(EntityType.parse("Datastore")).isEqualTo(EntityType.DATASTORE);
    assertThat(EntityType.parse("ResourcePool")).isEqualTo(EntityType.RESOURCE_POOL);
  }

  @Test
  void parsesEnumNames() {
    assertThat(EntityType.parse("resource_pool")).isEqualTo(EntityType.RESOURCE_POOL);
  }

  @Test
  void rejectsUnsupported() {
    assertThatThrownBy(() -> EntityType.parse("Folder"))
        .isInstanceOfSatisfying(UnsupportedEntityTypeException.class,
            e -> assertThat(e.getType()).isEqualTo("Folder"));
    assertThatThrownBy(() -> EntityType.parse(null))
        .isInstanceOf(UnsupportedEntityTypeException.class);
  }

  @Test
  void datastoreOnlySupportsLongerHistoricalIntervals() {
    assertThat(EntityType.DATASTORE.getSupportedIntervals())
        .containsExactlyInAnyOrder(IntervalClass.HIST_2, IntervalClass.HIST_3, IntervalClass.HIST_4);
    assertThat(EntityType.VIRTUAL_MACHINE.supports(IntervalClass.REALTIME)).isTrue();
  }
}
