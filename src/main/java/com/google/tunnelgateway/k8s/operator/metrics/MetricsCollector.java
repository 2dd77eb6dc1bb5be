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

import java.time.Duration;

/**
 * Records ingress build and sync metrics. Route types are the short route kind labels {@code
 * http} and {@code grpc}.
 */
public interface MetricsCollector {
  MetricsCollector NOOP = new MetricsCollector() {};

  String RESULT_SUCCESS = "success";
  String RESULT_FAILED = "failed";

  default void recordIngressBuildDuration(String routeType, Duration duration) {}

  default void recordBackendRefValidation(String routeType, String result, String reason) {}

  default void recordSyncDuration(String status, Duration duration) {}

  default void recordSyncedRoutes(String routeType, int count) {}

  default void recordIngressRules(int count) {}

  default void recordFailedBackendRefs(String routeType, int count) {}

  default void recordSyncError(String errorType) {}
}
