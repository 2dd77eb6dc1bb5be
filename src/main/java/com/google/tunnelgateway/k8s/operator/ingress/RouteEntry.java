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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/**
 * Intermediate representation of a single ingress rule before sorting and rendering.
 *
 * <p>The hostname {@link #WILDCARD_HOSTNAME} matches every host. An empty path matches every
 * path.
 */
public final class RouteEntry {
  public static final String WILDCARD_HOSTNAME = "*";

  private final String hostname;
  private final String path;
  private final String service;
  private final RoutePriority priority;

  public RouteEntry(String hostname, String path, String service, RoutePriority priority) {
    this.hostname = checkNotNull(hostname, "hostname");
    this.path = path == null ? "" : path;
    this.service = checkNotNull(service, "service");
    this.priority = checkNotNull(priority, "priority");
  }

  public String getHostname() {
    return hostname;
  }

  public String getPath() {
    return path;
  }

  public String getService() {
    return service;
  }

  public RoutePriority getPriority() {
    return priority;
  }

  public boolean isWildcardHostname() {
    return WILDCARD_HOSTNAME.equals(hostname);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RouteEntry)) {
      return false;
    }
    RouteEntry other = (RouteEntry) o;
    return hostname.equals(other.hostname)
        && path.equals(other.path)
        && service.equals(other.service)
        && priority == other.priority;
  }

  @Override
  public int hashCode() {
    return Objects.hash(hostname, path, service, priority);
  }

  @Override
  public String toString() {
    return String.format("%s%s -> %s (%s)", hostname, path, service, priority);
  }
}
