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

/** Renders sorted routing entries to tunnel ingress rules. */
public final class IngressRuleRenderer {
  static final String ROOT_PATH = "/";
  static final String PREFIX_WILDCARD = "*";

  private IngressRuleRenderer() {}

  /**
   * Renders one rule per entry, keeping the order of the entries. The wildcard hostname is
   * rendered by omitting the hostname, since the tunnel API rejects an explicit {@code *}
   * hostname followed by other rules. Paths that match everything are omitted, prefix paths get
   * a trailing {@code *}.
   */
  public static ImmutableList<IngressRule> render(List<RouteEntry> entries, boolean addCatchAll) {
    ImmutableList.Builder<IngressRule> rules = ImmutableList.builder();
    for (RouteEntry entry : entries) {
      rules.add(render(entry));
    }
    if (addCatchAll) {
      rules.add(IngressRule.catchAll());
    }
    return rules.build();
  }

  static IngressRule render(RouteEntry entry) {
    String hostname = entry.isWildcardHostname() ? null : entry.getHostname();
    String path = null;
    if (!entry.getPath().isEmpty() && !ROOT_PATH.equals(entry.getPath())) {
      path =
          entry.getPriority() == RoutePriority.PREFIX
              ? entry.getPath() + PREFIX_WILDCARD
              : entry.getPath();
    }
    return new IngressRule(hostname, path, entry.getService());
  }
}
