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

import static com.google.tunnelgateway.k8s.operator.ingress.BackendResolver.PARTIALLY_APPLIED;

import com.google.common.flogger.FluentLogger;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.BackendRef;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.HTTPPathMatch;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.HTTPRoute;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.HTTPRouteMatch;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.HTTPRouteRule;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.RouteFilter;
import java.util.ArrayList;
import java.util.List;

public class HTTPRouteAdapter extends AbstractRouteAdapter<HTTPRoute, HTTPRouteRule> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final String DEFAULT_PATH = "/";

  @Override
  public RouteKind getRouteKind() {
    return RouteKind.HTTP;
  }

  @Override
  public boolean addCatchAll() {
    return true;
  }

  @Override
  protected List<String> getSpecHostnames(HTTPRoute route) {
    return route.getSpec() == null ? null : route.getSpec().getHostnames();
  }

  @Override
  protected List<HTTPRouteRule> getRules(HTTPRoute route) {
    return route.getSpec() == null ? new ArrayList<>() : orEmpty(route.getSpec().getRules());
  }

  @Override
  protected List<BackendRef> getBackendRefs(HTTPRouteRule rule) {
    return rule.getBackendRefs();
  }

  @Override
  protected List<RouteFilter> getFilters(HTTPRouteRule rule) {
    return rule.getFilters();
  }

  @Override
  protected List<MatchedPath> extractPaths(String routeKey, HTTPRouteRule rule) {
    List<MatchedPath> paths = new ArrayList<>();
    for (HTTPRouteMatch match : orEmpty(rule.getMatches())) {
      logUnsupportedFeatures(routeKey, match);
      paths.add(extractPath(routeKey, match.getPath()));
    }
    return paths;
  }

  private MatchedPath extractPath(String routeKey, HTTPPathMatch pathMatch) {
    if (pathMatch == null) {
      return MatchedPath.ALL_PATHS;
    }
    String type =
        pathMatch.getType() == null ? HTTPPathMatch.TYPE_PATH_PREFIX : pathMatch.getType();
    String path = pathMatch.getValue() == null ? DEFAULT_PATH : pathMatch.getValue();

    switch (type) {
      case HTTPPathMatch.TYPE_EXACT:
        return new MatchedPath(path, RoutePriority.EXACT);
      case HTTPPathMatch.TYPE_REGULAR_EXPRESSION:
        logger.atInfo().log(
            "%s: route=%s reason=RegularExpression path type treated as PathPrefix path=%s",
            PARTIALLY_APPLIED, routeKey, path);
        return new MatchedPath(path, RoutePriority.PREFIX);
      default:
        return new MatchedPath(path, RoutePriority.PREFIX);
    }
  }

  private static void logUnsupportedFeatures(String routeKey, HTTPRouteMatch match) {
    if (match.getHeaders() != null && !match.getHeaders().isEmpty()) {
      logger.atInfo().log(
          "%s: route=%s reason=header matching not supported by Cloudflare Tunnel"
              + " ignored_headers=%d",
          PARTIALLY_APPLIED, routeKey, match.getHeaders().size());
    }
    if (match.getQueryParams() != null && !match.getQueryParams().isEmpty()) {
      logger.atInfo().log(
          "%s: route=%s reason=query parameter matching not supported by Cloudflare Tunnel"
              + " ignored_params=%d",
          PARTIALLY_APPLIED, routeKey, match.getQueryParams().size());
    }
    if (match.getMethod() != null) {
      logger.atInfo().log(
          "%s: route=%s reason=method matching not supported by Cloudflare Tunnel"
              + " ignored_method=%s",
          PARTIALLY_APPLIED, routeKey, match.getMethod());
    }
  }
}
