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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;

/** Settings shared by all ingress rule builders. */
public final class BuilderOptions {
  public static final String DEFAULT_CLUSTER_DOMAIN = "cluster.local";

  private final String clusterDomain;
  private final boolean reportUnsupportedBackends;

  public BuilderOptions(String clusterDomain, boolean reportUnsupportedBackends) {
    checkArgument(!Strings.isNullOrEmpty(clusterDomain), "cluster domain must not be empty");
    this.clusterDomain = clusterDomain;
    this.reportUnsupportedBackends = reportUnsupportedBackends;
  }

  public static BuilderOptions defaults() {
    return new BuilderOptions(DEFAULT_CLUSTER_DOMAIN, false);
  }

  /** Kubernetes cluster domain suffix used for Service DNS names. */
  public String getClusterDomain() {
    return clusterDomain;
  }

  /**
   * Whether backend references of an unsupported group or kind are reported as failed
   * references. If false they are dropped silently.
   */
  public boolean isReportUnsupportedBackends() {
    return reportUnsupportedBackends;
  }
}
