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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;
import java.util.Objects;

/**
 * A Cloudflare Tunnel ingress rule as sent to the tunnel configuration API.
 *
 * <p>An absent hostname matches every host, an absent path matches every path. Rules are
 * evaluated in order and the first matching rule wins.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IngressRule {
  public static final String CATCH_ALL_SERVICE = "http_status:404";

  private final String hostname;
  private final String path;
  private final String service;

  @JsonCreator
  public IngressRule(
      @JsonProperty("hostname") String hostname,
      @JsonProperty("path") String path,
      @JsonProperty("service") String service) {
    this.hostname = Strings.emptyToNull(hostname);
    this.path = Strings.emptyToNull(path);
    this.service = checkNotNull(service, "service");
  }

  public static IngressRule forService(String service) {
    return new IngressRule(null, null, service);
  }

  /** The terminal rule answering every otherwise unmatched request with a 404. */
  public static IngressRule catchAll() {
    return forService(CATCH_ALL_SERVICE);
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

  @JsonIgnore
  public boolean isCatchAll() {
    return toComparable().isCatchAll();
  }

  public ComparableRule toComparable() {
    return new ComparableRule(hostname, path, service);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IngressRule)) {
      return false;
    }
    IngressRule other = (IngressRule) o;
    return Objects.equals(hostname, other.hostname)
        && Objects.equals(path, other.path)
        && service.equals(other.service);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hostname, path, service);
  }

  @Override
  public String toString() {
    return String.format(
        "{hostname=%s, path=%s, service=%s}",
        Strings.nullToEmpty(hostname), Strings.nullToEmpty(path), service);
  }
}
