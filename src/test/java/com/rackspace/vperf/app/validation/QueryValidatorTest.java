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

package com.rackspace.vperf.app.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.rackspace.vperf.app.exceptions.InvalidInstanceException;
import com.rackspace.vperf.app.exceptions.InvalidIntervalException;
import com.rackspace.vperf.app.exceptions.InvalidTimeWindowException;
import com.rackspace.vperf.app.exceptions.QueryValidationException;
import com.rackspace.vperf.app.exceptions.UnknownStatException;
import com.rackspace.vperf.app.exceptions.UnsupportedEntityTypeException;
import com.rackspace.vperf.app.exceptions.UnsupportedIntervalForEntityException;
import com.rackspace.vperf.app.model.EntityRef;
import com.rackspace.vperf.app.model.EntityType;
import com.rackspace.vperf.app.model.HistoricalInterval;
import com.rackspace.vperf.app.model.IntervalClass;
import com.rackspace.vperf.app.model.PerfMetricId;
import com.rackspace.vperf.app.model.QuerySelector;
import com.rackspace.vperf.app.model.ResolvedInterval;
import com.rackspace.vperf.app.model.ValidatedQuery;
import com.rackspace.vperf.app.provider.MetricsProvider;
import com.rackspace.vperf.app.services.CounterCatalog;
import com.rackspace.vperf.app.services.SampleFixtures;
import com.rackspace.vperf.app.services.TimestampProvider;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QueryValidatorTest {

  static final Instant NOW = Instant.parse("2021-03-10T12:00:00Z");

  MetricsProvider metricsProvider = mock(MetricsProvider.class);
  TimestampProvider timestampProvider = mock(TimestampProvider.class);
  QueryValidator validator = new QueryValidator(metricsProvider, timestampProvider);
  CounterCatalog catalog = SampleFixtures.standardCatalog();

  EntityRef host = new EntityRef("host-1", "esx-01", EntityType.HOST);
  EntityRef datastore = new EntityRef("datastore-7", "ds-07", EntityType.DATASTORE);

  @BeforeEach
  void setUp() {
    when(timestampProvider.now()).thenReturn(NOW);
    when(metricsProvider.historicalIntervalConfig(1))
        .thenReturn(new HistoricalInterval().setSamplingPeriodSeconds(300).setRetentionLengthSeconds(86400));
    when(metricsProvider.historicalIntervalConfig(2))
        .thenReturn(new HistoricalInterval().setSamplingPeriodSeconds(1800).setRetentionLengthSeconds(604800));
  }

  private QuerySelector selector(EntityRef entity, String interval) {
    return new QuerySelector()
        .setEntities(List.of(entity))
        .setStats(List.of("cpu.usage.average"))
        .setInterval(interval);
  }

  @Test
  void validRealtimeQuery() {
    final ValidatedQuery query = validator.validate(
        selector(host, "realtime").setMaxSamples(5), catalog);

    assertThat(query.getIntervalClass()).isEqualTo(IntervalClass.REALTIME);
    assertThat(query.getIntervalId()).isNull();
    assertThat(query.getCounterIds()).containsEntry("cpu.usage.average", 2);
    assertThat(query.getInstances()).isEmpty();
    assertThat(query.getMaxSamples()).isEqualTo(5);
    verifyNoInteractions(metricsProvider);
  }

  @Test
  void historicalIntervalIdIsSamplingPeriod() {
    final ValidatedQuery query = validator.validate(selector(host, "hist1"), catalog);

    assertThat(query.getIntervalClass()).isEqualTo(IntervalClass.HIST_1);
    assertThat(query.getIntervalId()).isEqualTo(300);
    assertThat(query.getStart()).isNull();
    assertThat(query.getFinish()).isNull();
  }

  @Test
  void invalidInterval() {
    assertThatThrownBy(() -> validator.validate(selector(host, "hourly"), catalog))
        .isInstanceOf(InvalidIntervalException.class)
        .hasMessageContaining("hourly");
  }

  @Test
  void startNotBeforeFinish() {
    final QuerySelector selector = selector(host, "HIST_1")
        .setStart(NOW)
        .setFinish(NOW);

    assertThatThrownBy(() -> validator.validate(selector, catalog))
        .isInstanceOf(InvalidTimeWindowException.class);
    verifyNoInteractions(metricsProvider);
  }

  @Test
  void unknownStat() {
    final QuerySelector selector = selector(host, "HIST_1")
        .setStats(List.of("cpu.usage.average", "cpu.bogus.none"));

    assertThatThrownBy(() -> validator.validate(selector, catalog))
        .isInstanceOfSatisfying(UnknownStatException.class,
            e -> assertThat(e.getStat()).isEqualTo("cpu.bogus.none"));
    verifyNoInteractions(metricsProvider);
  }

  @Test
  void statsRequired() {
    assertThatThrownBy(() -> validator.validate(selector(host, "HIST_1").setStats(List.of()), catalog))
        .isInstanceOf(QueryValidationException.class);
  }

  @Test
  void entitiesRequired() {
    assertThatThrownBy(() -> validator.validate(
        selector(host, "HIST_1").setEntities(List.of()), catalog))
        .isInstanceOf(QueryValidationException.class);
  }

  @Test
  void entityWithoutType() {
    assertThatThrownBy(() -> validator.validate(
        selector(new EntityRef("x-1", "x", null), "HIST_1"), catalog))
        .isInstanceOf(UnsupportedEntityTypeException.class);
  }

  @Nested
  public class datastoreInterval {
    @Test
    void realtimeRejected() {
      assertThatThrownBy(() -> validator.validate(selector(datastore, "realtime"), catalog))
          .isInstanceOf(UnsupportedIntervalForEntityException.class)
          .hasMessageContaining("datastore-7");
    }

    @Test
    void shortestHistoricalRejected() {
      assertThatThrownBy(() -> validator.validate(selector(datastore, "hist1"), catalog))
          .isInstanceOf(UnsupportedIntervalForEntityException.class);
    }

    @Test
    void derivesDefaultWindow() {
      final ValidatedQuery query = validator.validate(selector(datastore, "hist2"), catalog);

      assertThat(query.getFinish()).isEqualTo(NOW);
      assertThat(query.getStart()).isEqualTo(NOW.minusSeconds(604800 - 1800));
      assertThat(query.getIntervalId()).isEqualTo(1800);
    }

    @Test
    void keepsGivenWindow() {
      final Instant start = NOW.minusSeconds(3600);
      final ValidatedQuery query = validator.validate(
          selector(datastore, "hist2").setStart(start), catalog);

      assertThat(query.getStart()).isEqualTo(start);
      assertThat(query.getFinish()).isNull();
    }
  }

  @Nested
  public class instances {
    @BeforeEach
    void setUp() {
      when(metricsProvider.listAvailableMetrics("host-1", 300)).thenReturn(List.of(
          new PerfMetricId(2, ""),
          new PerfMetricId(2, "0"),
          new PerfMetricId(2, "1"),
          new PerfMetricId(33, "")));
    }

    @Test
    void validInstances() {
      final ValidatedQuery query = validator.validate(
          selector(host, "hist1").setInstances(List.of("0", "1")), catalog);

      assertThat(query.getInstances()).containsExactly("0", "1");
    }

    @Test
    void wildcardAlwaysPasses() {
      when(metricsProvider.listAvailableMetrics("host-1", 300)).thenReturn(List.of());

      final ValidatedQuery query = validator.validate(
          selector(host, "hist1").setInstances(List.of("*")), catalog);

      assertThat(query.getInstances()).containsExactly("*");
    }

    @Test
    void invalidInstanceNamedExactly() {
      final QuerySelector selector = selector(host, "hist1").setInstances(List.of("0", "*", "7"));

      assertThatThrownBy(() -> validator.validate(selector, catalog))
          .isInstanceOfSatisfying(InvalidInstanceException.class, e -> {
            assertThat(e.getStat()).isEqualTo("cpu.usage.average");
            assertThat(e.getInvalidInstances()).containsExactly("7");
            assertThat(e.getValidInstances()).containsExactly("", "0", "1");
          })
          .hasMessageContaining("[7]")
          .hasMessageContaining("[, 0, 1]");
    }

    @Test
    void oneProviderLookupPerEntity() {
      validator.validate(selector(host, "hist1")
          .setStats(List.of("cpu.usage.average", "mem.active.average"))
          .setInstances(List.of("")), catalog);

      verify(metricsProvider, times(1)).listAvailableMetrics("host-1", 300);
    }

    @Test
    void skipped() {
      final ValidatedQuery query = validator.validate(
          selector(host, "hist1").setInstances(List.of("7")).setSkipInstanceCheck(true), catalog);

      assertThat(query.getInstances()).containsExactly("7");
      verify(metricsProvider, never()).listAvailableMetrics(anyString(), any());
    }
  }

  @Test
  void introspectionSkipsWindowAndInstances() {
    final ResolvedInterval resolved = validator.validateIntrospection(List.of(host), "hist1");

    assertThat(resolved.getIntervalClass()).isEqualTo(IntervalClass.HIST_1);
    assertThat(resolved.getIntervalId()).isEqualTo(300);
    verify(metricsProvider, never()).listAvailableMetrics(anyString(), any());
  }

  @Test
  void introspectionChecksDatastoreInterval() {
    assertThatThrownBy(() -> validator.validateIntrospection(List.of(datastore), "realtime"))
        .isInstanceOf(UnsupportedIntervalForEntityException.class);
    verify(metricsProvider, never()).historicalIntervalConfig(anyInt());
  }
}
