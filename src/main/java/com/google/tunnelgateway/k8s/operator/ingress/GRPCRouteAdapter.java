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

import static com.google.common.base.Strings.nullToEmpty;
import static com.google.tunnelgateway.k8s.operator.ingress.BackendResolver.PARTIALLY_APPLIED;

import com.google.common.flogger.FluentLogger;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.BackendRef;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.GRPCMethodMatch;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.GRPCRoute;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.GRPCRouteMatch;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.GRPCRouteRule;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.RouteFilter;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps gRPC method matches to HTTP/2 request paths. gRPC calls are POST requests to {@code
 * /<package.Service>/<Method>}.
 */
public class GRPCRouteAdapter extends AbstractRouteAdapter<GRPCRoute, GRPCRouteRule> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Override
  public RouteKind getRouteKind() {
    return RouteKind.GRPC;
  }

  /** gRPC rules are merged behind the HTTP rules, which carry the catch-all. */
  @Override
  public boolean addCatchAll() {
    return false;
  }

  @Override
  protected List<String> getSpecHostnames(GRPCRoute route) {
    return route.getSpec() == null ? null : route.getSpec().getHostnames();
  }

  @Override
  protected List<GRPCRouteRule> getRules(GRPCRoute route) {
    return route.getSpec() == null ? new ArrayList<>() : orEmpty(route.getSpec().getRules());
  }

  @Override
  protected List<BackendRef> getBackendRefs(GRPCRouteRule rule) {
    return rule.getBackendRefs();
  }

  @Override
  protected List<RouteFilter> getFilters(GRPCRouteRule rule) {
    return rule.getFilters();
  }

  @Override
  protected List<MatchedPath> extractPaths(String routeKey, GRPCRouteRule rule) {
    List<MatchedPath> paths = new ArrayList<>();
    for (GRPCRouteMatch match : orEmpty(rule.getMatches())) {
      if (match.getHeaders() != null && !match.getHeaders().isEmpty()) {
        logger.atInfo().log(
            "%s: route=%s reason=header matching not supported by Cloudflare Tunnel"
                + " ignored_headers=%d",
            PARTIALLY_APPLIED, routeKey, match.getHeaders().size());
      }
      paths.add(extractPath(match.getMethod()));
    }
    return paths;
  }

  static MatchedPath extractPath(GRPCMethodMatch methodMatch) {
    if (methodMatch == null) {
      return MatchedPath.ALL_PATHS;
    }
    String service = nullToEmpty(methodMatch.getService());
    String method = nullToEmpty(methodMatch.getMethod());

    if (service.isEmpty()) {
      // A method without a service cannot be expressed as a path.
      return MatchedPath.ALL_PATHS;
    }
    if (method.isEmpty()) {
      return new MatchedPath("/" + service + "/", RoutePriority.PREFIX);
    }
    return new MatchedPath("/" + service + "/" + method, RoutePriority.EXACT);
  }
}
