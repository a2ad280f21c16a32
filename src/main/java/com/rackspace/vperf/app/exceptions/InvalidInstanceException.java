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

import java.util.List;

public class InvalidInstanceException extends QueryValidationException {

  private final String stat;
  private final List<String> invalidInstances;
  private final List<String> validInstances;

  public InvalidInstanceException(String stat, List<String> invalidInstances,
                                  List<String> validInstances) {
    super(String.format("Invalid instances %s for stat '%s', valid instances are %s",
        invalidInstances, stat, validInstances));
    this.stat = stat;
    this.invalidInstances = List.copyOf(invalidInstances);
    this.validInstances = List.copyOf(validInstances);
  }

  public String getStat() {
    return stat;
  }

  public List<String> getInvalidInstances() {
    return invalidInstances;
  }

  public List<String> getValidInstances() {
    return validInstances;
  }
}
