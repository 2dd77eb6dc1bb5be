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

import java.util.Optional;

/**
 * Outcome of resolving the backend references of a single route rule: a service URL, a recorded
 * error, or neither if the rule was omitted without an error.
 */
public final class BackendResolution {
  private static final BackendResolution OMITTED = new BackendResolution(null, null);

  private final String service;
  private final BackendRefError error;

  private BackendResolution(String service, BackendRefError error) {
    this.service = service;
    this.error = error;
  }

  public static BackendResolution resolved(String service) {
    return new BackendResolution(service, null);
  }

  public static BackendResolution failed(BackendRefError error) {
    return new BackendResolution(null, error);
  }

  public static BackendResolution omitted() {
    return OMITTED;
  }

  public Optional<String> getService() {
    return Optional.ofNullable(service);
  }

  public Optional<BackendRefError> getError() {
    return Optional.ofNullable(error);
  }
}
