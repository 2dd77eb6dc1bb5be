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
public class HTTPRouteMatch {
  private HTTPPathMatch path;
  private List<HeaderMatch> headers = new ArrayList<>();
  private List<HeaderMatch> queryParams = new ArrayList<>();
  private String method;

  public HTTPPathMatch getPath() {
    return path;
  }

  public void setPath(HTTPPathMatch path) {
    this.path = path;
  }

  public List<HeaderMatch> getHeaders() {
    return headers;
  }

  public void setHeaders(List<HeaderMatch> headers) {
    this.headers = headers;
  }

  public List<HeaderMatch> getQueryParams() {
    return queryParams;
  }

  public void setQueryParams(List<HeaderMatch> queryParams) {
    this.queryParams = queryParams;
  }

  public String getMethod() {
    return method;
  }

  public void setMethod(String method) {
    this.method = method;
  }
}
