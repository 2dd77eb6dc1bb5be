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

import com.google.common.collect.ComparisonChain;
import java.util.Comparator;

/**
 * Orders routing entries so that the first matching tunnel rule is the most specific one:
 *
 * <ol>
 *   <li>specific hostnames before the wildcard hostname,
 *   <li>hostnames in ascending order,
 *   <li>exact matches before prefix matches,
 *   <li>longer paths before shorter paths,
 *   <li>paths in ascending order.
 * </ol>
 */
public class RouteEntryComparator implements Comparator<RouteEntry> {
  public static final RouteEntryComparator INSTANCE = new RouteEntryComparator();

  @Override
  public int compare(RouteEntry a, RouteEntry b) {
    return ComparisonChain.start()
        .compareFalseFirst(a.isWildcardHostname(), b.isWildcardHostname())
        .compare(a.getHostname(), b.getHostname())
        .compare(b.getPriority().getValue(), a.getPriority().getValue())
        .compare(b.getPath().length(), a.getPath().length())
        .compare(a.getPath(), b.getPath())
        .result();
  }
}
