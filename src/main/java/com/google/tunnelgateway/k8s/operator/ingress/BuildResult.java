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

package com.google.tunnelgateway.k8s.operator.ingress;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Ordered ingress rules compiled from a set of routes and the backend references that failed. */
public final class BuildResult {
  private final ImmutableList<RouteEntry> entries;
  private final ImmutableList<IngressRule> rules;
  private final ImmutableList<BackendRefError> failedRefs;

  public BuildResult(
      List<RouteEntry> entries, List<IngressRule> rules, List<BackendRefError> failedRefs) {
    this.entries = ImmutableList.copyOf(entries);
    this.rules = ImmutableList.copyOf(rules);
    this.failedRefs = ImmutableList.copyOf(failedRefs);
  }

  /**
   * Sorted routing entries the rules were rendered from. Entries of several route kinds are merged
   * on this level, so that the combined list can be sorted again before rendering.
   */
  public ImmutableList<RouteEntry> getEntries() {
    return entries;
  }

  public ImmutableList<IngressRule> getRules() {
    return rules;
  }

  public ImmutableList<BackendRefError> getFailedRefs() {
    return failedRefs;
  }
}
