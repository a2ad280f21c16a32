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

package com.rackspace.vperf.app.exceptions;

/**
 * The provider returned samples that are inconsistent with its own counter catalog or with the
 * shape of its result. Aborts the whole query.
 */
public class ProviderContractViolationException extends IllegalStateException {

  private final int partition;
  private final String entityId;

  public ProviderContractViolationException(String message, int partition, String entityId) {
    super(String.format("%s (partition=%d, entity=%s)", message, partition, entityId));
    this.partition = partition;
    this.entityId = entityId;
  }

  public int getPartition() {
    return partition;
  }

  public String getEntityId() {
    return entityId;
  }
}
