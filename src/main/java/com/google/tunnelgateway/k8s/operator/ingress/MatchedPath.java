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

/** Path and priority derived from a single route match. */
final class MatchedPath {
  static final MatchedPath ALL_PATHS = new MatchedPath("", RoutePriority.PREFIX);

  private final String path;
  private final RoutePriority priority;

  MatchedPath(String path, RoutePriority priority) {
    this.path = path;
    this.priority = priority;
  }

  String getPath() {
    return path;
  }

  RoutePriority getPriority() {
    return priority;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof MatchedPath)) {
      return false;
    }
    MatchedPath other = (MatchedPath) o;
    return path.equals(other.path) && priority == other.priority;
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, priority);
  }

  @Override
  public String toString() {
    return path + " (" + priority + ")";
  }
}
