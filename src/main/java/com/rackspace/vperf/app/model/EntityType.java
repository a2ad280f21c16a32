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

import static com.rackspace.vperf.app.model.IntervalClass.HIST_2;
import static com.rackspace.vperf.app.model.IntervalClass.HIST_3;
import static com.rackspace.vperf.app.model.IntervalClass.HIST_4;

import com.rackspace.vperf.app.exceptions.UnsupportedEntityTypeException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * The kinds of inventory objects that can be queried for performance samples.
 */
public enum EntityType {
  HOST("HostSystem", EnumSet.allOf(IntervalClass.class)),
  VIRTUAL_MACHINE("VirtualMachine", EnumSet.allOf(IntervalClass.class)),
  CLUSTER("ClusterComputeResource", EnumSet.allOf(IntervalClass.class)),
  // datastores only collect the longer historical rollups
  DATASTORE("Datastore", EnumSet.of(HIST_2, HIST_3, HIST_4)),
  RESOURCE_POOL("ResourcePool", EnumSet.allOf(IntervalClass.class));

  private final String providerTypeName;
  private final Set<IntervalClass> supportedIntervals;

  EntityType(String providerTypeName, Set<IntervalClass> supportedIntervals) {
    this.providerTypeName = providerTypeName;
    this.supportedIntervals = Collections.unmodifiableSet(supportedIntervals);
  }

  public String getProviderTypeName() {
    return providerTypeName;
  }

  public Set<IntervalClass> getSupportedIntervals() {
    return supportedIntervals;
  }

  public boolean supports(IntervalClass intervalClass) {
    return supportedIntervals.contains(intervalClass);
  }

  /**
   * Resolves either the provider's type name, such as <code>HostSystem</code>, or the enum name,
   * ignoring case.
   */
  public static EntityType parse(String type) {
    if (StringUtils.isNotBlank(type)) {
      final String trimmed = type.trim();
      for (EntityType entityType : values()) {
        if (entityType.providerTypeName.equalsIgnoreCase(trimmed)
            || entityType.name().equalsIgnoreCase(trimmed)) {
          return entityType;
        }
      }
    }
    throw new UnsupportedEntityTypeException(type);
  }
}
