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

import io.fabric8.kubernetes.api.model.HasMetadata;
import java.util.List;

/**
 * Route kind specific part of the ingress rule compilation. {@link IngressRuleBuilder} uses an
 * adapter to read routes of one kind.
 *
 * @param <R> route resource type
 */
public interface RouteAdapter<R extends HasMetadata> {
  RouteKind getRouteKind();

  /** Hostnames of the route, or the wildcard hostname if the route does not specify any. */
  List<String> getHostnames(R route);

  /** Adds the routing entries and failed backend references of the route to {@code out}. */
  void extractEntries(R route, BackendResolver resolver, ExtractedEntries out);

  /** Whether the compiled rules of this route kind end with the catch-all rule. */
  boolean addCatchAll();
}
