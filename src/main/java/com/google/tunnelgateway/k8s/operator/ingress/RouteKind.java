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

import com.google.tunnelgateway.k8s.operator.v1.api.model.route.GRPCRoute;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.HTTPRoute;

public enum RouteKind {
  HTTP(HTTPRoute.KIND, "http"),
  GRPC(GRPCRoute.KIND, "grpc");

  private final String kind;
  private final String label;

  RouteKind(String kind, String label) {
    this.kind = kind;
    this.label = label;
  }

  /** Kubernetes kind of the route resource, e.g. {@code HTTPRoute}. */
  public String getKind() {
    return kind;
  }

  /** Short name used for log and metric labels. */
  public String getLabel() {
    return label;
  }
}
