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

package com.google.tunnelgateway.k8s.operator.sync;

import com.google.common.collect.ImmutableList;
import com.google.tunnelgateway.k8s.operator.ingress.BackendRefError;
import com.google.tunnelgateway.k8s.operator.ingress.IngressRule;
import com.google.tunnelgateway.k8s.operator.ingress.RuleDiff;
import java.util.List;

public final class SyncResult {
  private final ImmutableList<BackendRefError> httpFailedRefs;
  private final ImmutableList<BackendRefError> grpcFailedRefs;
  private final ImmutableList<IngressRule> rules;
  private final RuleDiff diff;
  private final boolean updated;

  public SyncResult(
      List<BackendRefError> httpFailedRefs,
      List<BackendRefError> grpcFailedRefs,
      List<IngressRule> rules,
      RuleDiff diff,
      boolean updated) {
    this.httpFailedRefs = ImmutableList.copyOf(httpFailedRefs);
    this.grpcFailedRefs = ImmutableList.copyOf(grpcFailedRefs);
    this.rules = ImmutableList.copyOf(rules);
    this.diff = diff;
    this.updated = updated;
  }

  public ImmutableList<BackendRefError> getHttpFailedRefs() {
    return httpFailedRefs;
  }

  public ImmutableList<BackendRefError> getGrpcFailedRefs() {
    return grpcFailedRefs;
  }

  /** Final rules of the tunnel configuration, ending with the catch-all. */
  public ImmutableList<IngressRule> getRules() {
    return rules;
  }

  /** Difference between the live rules and the compiled rules, ignoring order. */
  public RuleDiff getDiff() {
    return diff;
  }

  /** Whether the tunnel configuration was written. */
  public boolean isUpdated() {
    return updated;
  }
}
