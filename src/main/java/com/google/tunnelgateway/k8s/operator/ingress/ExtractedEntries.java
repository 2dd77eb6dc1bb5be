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

import java.util.ArrayList;
import java.util.List;

/** Collects the routing entries and failed backend references of one or more routes. */
public final class ExtractedEntries {
  private final List<RouteEntry> entries = new ArrayList<>();
  private final List<BackendRefError> failedRefs = new ArrayList<>();

  void addEntry(RouteEntry entry) {
    entries.add(entry);
  }

  void addFailedRef(BackendRefError error) {
    failedRefs.add(error);
  }

  public List<RouteEntry> getEntries() {
    return entries;
  }

  public List<BackendRefError> getFailedRefs() {
    return failedRefs;
  }
}
