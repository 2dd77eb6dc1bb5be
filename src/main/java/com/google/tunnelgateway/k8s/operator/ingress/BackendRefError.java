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

import java.util.Objects;

/** A backend reference of a route that could not be resolved. */
public final class BackendRefError {
  /** Reasons as used in the {@code ResolvedRefs} condition of Gateway API route status. */
  public enum Reason {
    REF_NOT_PERMITTED("RefNotPermitted"),
    BACKEND_NOT_FOUND("BackendNotFound"),
    INVALID_KIND("InvalidKind");

    private final String code;

    Reason(String code) {
      this.code = code;
    }

    public String getCode() {
      return code;
    }
  }

  private final String routeNamespace;
  private final String routeName;
  private final String backendName;
  private final String backendNamespace;
  private final Reason reason;
  private final String message;

  public BackendRefError(
      String routeNamespace,
      String routeName,
      String backendName,
      String backendNamespace,
      Reason reason,
      String message) {
    this.routeNamespace = routeNamespace;
    this.routeName = routeName;
    this.backendName = backendName;
    this.backendNamespace = backendNamespace;
    this.reason = reason;
    this.message = message;
  }

  public String getRouteNamespace() {
    return routeNamespace;
  }

  public String getRouteName() {
    return routeName;
  }

  public String getBackendName() {
    return backendName;
  }

  public String getBackendNamespace() {
    return backendNamespace;
  }

  public Reason getReason() {
    return reason;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BackendRefError)) {
      return false;
    }
    BackendRefError other = (BackendRefError) o;
    return Objects.equals(routeNamespace, other.routeNamespace)
        && Objects.equals(routeName, other.routeName)
        && Objects.equals(backendName, other.backendName)
        && Objects.equals(backendNamespace, other.backendNamespace)
        && reason == other.reason
        && Objects.equals(message, other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        routeNamespace, routeName, backendName, backendNamespace, reason, message);
  }

  @Override
  public String toString() {
    return String.format(
        "%s/%s -> %s/%s: %s (%s)",
        routeNamespace, routeName, backendNamespace, backendName, reason.getCode(), message);
  }
}
