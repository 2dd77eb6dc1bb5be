// Copyright (C) 2023 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.tunnelgateway.k8s.operator.metrics;

import static com.google.common.truth.Truth.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class MicrometerMetricsCollectorTest {
  private SimpleMeterRegistry registry;
  private MicrometerMetricsCollector collector;

  @BeforeEach
  public void setup() {
    registry = new SimpleMeterRegistry();
    collector = new MicrometerMetricsCollector(registry);
  }

  @Test
  public void backendRefValidationsAreCountedPerReason() {
    collector.recordBackendRefValidation("http", MetricsCollector.RESULT_SUCCESS, "");
    collector.recordBackendRefValidation("http", MetricsCollector.RESULT_FAILED, "RefNotPermitted");
    collector.recordBackendRefValidation("http", MetricsCollector.RESULT_FAILED, "RefNotPermitted");

    assertThat(
            registry
                .get(MicrometerMetricsCollector.BACKEND_REF_VALIDATION)
                .tags("type", "http", "result", "failed", "reason", "RefNotPermitted")
                .counter()
                .count())
        .isEqualTo(2.0);
    assertThat(
            registry
                .get(MicrometerMetricsCollector.BACKEND_REF_VALIDATION)
                .tags("result", "success")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  public void durationsAreRecordedAsTimers() {
    collector.recordIngressBuildDuration("grpc", Duration.ofMillis(20));
    collector.recordSyncDuration("success", Duration.ofMillis(50));

    assertThat(
            registry
                .get(MicrometerMetricsCollector.INGRESS_BUILD_DURATION)
                .tags("type", "grpc")
                .timer()
                .totalTime(TimeUnit.MILLISECONDS))
        .isEqualTo(20.0);
    assertThat(
            registry
                .get(MicrometerMetricsCollector.SYNC_DURATION)
                .tags("status", "success")
                .timer()
                .count())
        .isEqualTo(1);
  }

  @Test
  public void gaugesReportLatestValue() {
    collector.recordIngressRules(5);
    collector.recordIngressRules(3);
    collector.recordSyncedRoutes("http", 4);
    collector.recordSyncedRoutes("grpc", 1);
    collector.recordFailedBackendRefs("http", 2);

    assertThat(registry.get(MicrometerMetricsCollector.INGRESS_RULES).gauge().value())
        .isEqualTo(3.0);
    assertThat(
            registry
                .get(MicrometerMetricsCollector.SYNCED_ROUTES)
                .tags("type", "http")
                .gauge()
                .value())
        .isEqualTo(4.0);
    assertThat(
            registry
                .get(MicrometerMetricsCollector.SYNCED_ROUTES)
                .tags("type", "grpc")
                .gauge()
                .value())
        .isEqualTo(1.0);
    assertThat(
            registry
                .get(MicrometerMetricsCollector.FAILED_BACKEND_REFS)
                .tags("type", "http")
                .gauge()
                .value())
        .isEqualTo(2.0);
  }

  @Test
  public void syncErrorsAreCountedPerType() {
    collector.recordSyncError("rate_limit");
    collector.recordSyncError("rate_limit");
    collector.recordSyncError("auth");

    assertThat(
            registry
                .get(MicrometerMetricsCollector.SYNC_ERRORS)
                .tags("error_type", "rate_limit")
                .counter()
                .count())
        .isEqualTo(2.0);
  }
}
