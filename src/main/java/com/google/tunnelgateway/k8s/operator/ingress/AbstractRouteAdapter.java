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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.BackendRef;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.RouteFilter;
import io.fabric8.kubernetes.api.model.HasMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks hostnames, rules and matches of a route. Subclasses map the rules and matches of their
 * route kind to paths.
 *
 * @param <R> route resource type
 * @param <T> rule type of the route
 */
public abstract class AbstractRouteAdapter<R extends HasMetadata, T> implements RouteAdapter<R> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  protected abstract List<String> getSpecHostnames(R route);

  protected abstract List<T> getRules(R route);

  protected abstract List<BackendRef> getBackendRefs(T rule);

  protected abstract List<RouteFilter> getFilters(T rule);

  /**
   * Returns one path per match of the rule, or an empty list if the rule has no matches. Logs
   * match features that cannot be expressed as tunnel ingress rules.
   */
  protected abstract List<MatchedPath> extractPaths(String routeKey, T rule);

  @Override
  public List<String> getHostnames(R route) {
    List<String> hostnames = getSpecHostnames(route);
    if (hostnames == null || hostnames.isEmpty()) {
      return ImmutableList.of(RouteEntry.WILDCARD_HOSTNAME);
    }
    return hostnames;
  }

  @Override
  public void extractEntries(R route, BackendResolver resolver, ExtractedEntries out) {
    String namespace = route.getMetadata().getNamespace();
    String name = route.getMetadata().getName();
    String routeKey = String.format("%s/%s", namespace, name);
    List<String> hostnames = getHostnames(route);

    for (T rule : getRules(route)) {
      logFilters(routeKey, getFilters(rule));

      BackendResolution resolution =
          resolver.resolve(getRouteKind(), namespace, name, getBackendRefs(rule));
      resolution.getError().ifPresent(out::addFailedRef);
      Optional<String> service = resolution.getService();
      if (service.isEmpty()) {
        continue;
      }

      List<MatchedPath> paths = extractPaths(routeKey, rule);
      if (paths.isEmpty()) {
        paths = ImmutableList.of(MatchedPath.ALL_PATHS);
      }
      for (String hostname : hostnames) {
        for (MatchedPath path : paths) {
          out.addEntry(
              new RouteEntry(hostname, path.getPath(), service.get(), path.getPriority()));
        }
      }
    }
  }

  protected static <E> List<E> orEmpty(List<E> list) {
    return list == null ? new ArrayList<>() : list;
  }

  private static void logFilters(String routeKey, List<RouteFilter> filters) {
    if (filters != null && !filters.isEmpty()) {
      logger.atInfo().log(
          "%s: route=%s reason=filters not supported by Cloudflare Tunnel ignored_filters=%d",
          PARTIALLY_APPLIED, routeKey, filters.size());
    }
  }
}
