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

package com.google.tunnelgateway.k8s.operator.v1.api.model.route;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class HTTPRouteRule {
  private List<HTTPRouteMatch> matches = new ArrayList<>();
  private List<RouteFilter> filters = new ArrayList<>();
  private List<BackendRef> backendRefs = new ArrayList<>();

  public List<HTTPRouteMatch> getMatches() {
    return matches;
  }

  public void setMatches(List<HTTPRouteMatch> matches) {
    this.matches = matches;
  }

  public List<RouteFilter> getFilters() {
    return filters;
  }

  public void setFilters(List<RouteFilter> filters) {
    this.filters = filters;
  }

  public List<BackendRef> getBackendRefs() {
    return backendRefs;
  }

  public void setBackendRefs(List<BackendRef> backendRefs) {
    this.backendRefs = backendRefs;
  }
}
