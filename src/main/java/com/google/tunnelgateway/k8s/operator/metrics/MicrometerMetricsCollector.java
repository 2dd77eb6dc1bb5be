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

import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Singleton
public class MicrometerMetricsCollector implements MetricsCollector {
  static final String INGRESS_BUILD_DURATION = "cftunnel.ingress.build.duration";
  static final String BACKEND_REF_VALIDATION = "cftunnel.backend.ref.validation";
  static final String SYNC_DURATION = "cftunnel.sync.duration";
  static final String SYNCED_ROUTES = "cftunnel.synced.routes";
  static final String INGRESS_RULES = "cftunnel.ingress.rules";
  static final String FAILED_BACKEND_REFS = "cftunnel.failed.backend.refs";
  static final String SYNC_ERRORS = "cftunnel.sync.errors";

  private final MeterRegistry registry;
  private final AtomicInteger ingressRules = new AtomicInteger();
  private final Map<String, AtomicInteger> syncedRoutes = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> failedBackendRefs = new ConcurrentHashMap<>();

  @Inject
  public MicrometerMetricsCollector(MeterRegistry registry) {
    this.registry = registry;
    Gauge.builder(INGRESS_RULES, ingressRules, AtomicInteger::get)
        .description("Total ingress rules in tunnel config")
        .register(registry);
  }

  @Override
  public void recordIngressBuildDuration(String routeType, Duration duration) {
    Timer.builder(INGRESS_BUILD_DURATION)
        .description("Duration of building ingress rules from routes")
        .tags(Tags.of("type", routeType))
        .register(registry)
        .record(duration);
  }

  @Override
  public void recordBackendRefValidation(String routeType, String result, String reason) {
    Counter.builder(BACKEND_REF_VALIDATION)
        .description("Backend reference validation results")
        .tags(Tags.of("type", routeType, "result", result, "reason", reason))
        .register(registry)
        .increment();
  }

  @Override
  public void recordSyncDuration(String status, Duration duration) {
    Timer.builder(SYNC_DURATION)
        .description("Duration of route synchronization to Cloudflare")
        .tags(Tags.of("status", status))
        .register(registry)
        .record(duration);
  }

  @Override
  public void recordSyncedRoutes(String routeType, int count) {
    gauge(SYNCED_ROUTES, "Number of routes synced by type", syncedRoutes, routeType).set(count);
  }

  @Override
  public void recordIngressRules(int count) {
    ingressRules.set(count);
  }

  @Override
  public void recordFailedBackendRefs(String routeType, int count) {
    gauge(FAILED_BACKEND_REFS, "Number of failed backend references", failedBackendRefs, routeType)
        .set(count);
  }

  @Override
  public void recordSyncError(String errorType) {
    Counter.builder(SYNC_ERRORS)
        .description("Total sync errors by type")
        .tags(Tags.of("error_type", errorType))
        .register(registry)
        .increment();
  }

  private AtomicInteger gauge(
      String name, String description, Map<String, AtomicInteger> values, String routeType) {
    return values.computeIfAbsent(
        routeType,
        type -> {
          AtomicInteger value = new AtomicInteger();
          Gauge.builder(name, value, AtomicInteger::get)
              .description(description)
              .tags(Tags.of("type", type))
              .register(registry);
          return value;
        });
  }
}
