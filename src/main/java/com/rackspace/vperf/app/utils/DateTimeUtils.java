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

package com.rackspace.vperf.app.utils;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

public class DateTimeUtils {

  private static final Pattern RELATIVE_TIME = Pattern.compile("([0-9]+)(ms|s|m|h|d|w|n|y)-ago");
  private static final Pattern EPOCH_MILLIS = Pattern.compile("\\d{13,}");
  private static final Pattern EPOCH_SECONDS = Pattern.compile("\\d{1,12}");

  private static final Map<String, ChronoUnit> RELATIVE_UNITS = Map.of(
      "ms", ChronoUnit.MILLIS,
      "s", ChronoUnit.SECONDS,
      "m", ChronoUnit.MINUTES,
      "h", ChronoUnit.HOURS,
      "d", ChronoUnit.DAYS,
      "w", ChronoUnit.WEEKS,
      "n", ChronoUnit.MONTHS,
      "y", ChronoUnit.YEARS
  );

  private DateTimeUtils() {
  }

  /**
   * Parses an ISO-8601 instant, epoch millis, epoch seconds or a relative time such as
   * <code>2h-ago</code>.
   *
   * @return the parsed instant or null when the value is blank
   */
  public static Instant parseOptionalInstant(String value, Instant now) {
    if (StringUtils.isBlank(value)) {
      return null;
    }
    final String trimmed = value.trim();
    if (EPOCH_MILLIS.matcher(trimmed).matches()) {
      return Instant.ofEpochMilli(Long.parseLong(trimmed));
    }
    if (EPOCH_SECONDS.matcher(trimmed).matches()) {
      return Instant.ofEpochSecond(Long.parseLong(trimmed));
    }
    final Matcher relative = RELATIVE_TIME.matcher(trimmed);
    if (relative.matches()) {
      try {
        return minus(now, Long.parseLong(relative.group(1)), RELATIVE_UNITS.get(relative.group(2)));
      } catch (ArithmeticException | DateTimeException e) {
        throw new IllegalArgumentException("Invalid time format: " + value, e);
      }
    }
    try {
      return Instant.parse(trimmed);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid time format: " + value, e);
    }
  }

  private static Instant minus(Instant now, long amount, ChronoUnit unit) {
    // Instant only supports units up to days
    if (unit.getDuration().compareTo(ChronoUnit.DAYS.getDuration()) > 0) {
      return now.minus(unit.getDuration().multipliedBy(amount));
    }
    return now.minus(amount, unit);
  }
}
