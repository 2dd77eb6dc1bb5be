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

import java.util.Objects;

/**
 * Flattened form of an {@link IngressRule} used to compare live and desired configurations.
 * Absent fields are represented by empty strings.
 */
public final class ComparableRule {
  private final String hostname;
  private final String path;
  private final String service;

  public ComparableRule(String hostname, String path, String service) {
    this.hostname = nullToEmpty(hostname);
    this.path = nullToEmpty(path);
    this.service = nullToEmpty(service);
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

  /**
   * Whether this is the terminal 404 rule. Rules without a hostname but with a path belong to
   * wildcard-host routes and are not catch-alls.
   */
  public boolean isCatchAll() {
    return hostname.isEmpty() && path.isEmpty() && IngressRule.CATCH_ALL_SERVICE.equals(service);
  }

  public IngressRule toRule() {
    return new IngressRule(hostname, path, service);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ComparableRule)) {
      return false;
    }
    ComparableRule other = (ComparableRule) o;
    return hostname.equals(other.hostname)
        && path.equals(other.path)
        && service.equals(other.service);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hostname, path, service);
  }

  @Override
  public String toString() {
    return String.format("(%s, %s, %s)", hostname, path, service);
  }
}
