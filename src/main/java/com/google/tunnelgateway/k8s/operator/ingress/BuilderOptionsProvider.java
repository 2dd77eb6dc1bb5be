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

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.google.inject.name.Named;

public class BuilderOptionsProvider implements Provider<BuilderOptions> {
  private final String clusterDomain;
  private final boolean reportUnsupportedBackends;

  @Inject
  public BuilderOptionsProvider(
      @Named("ClusterDomain") String clusterDomain,
      @Named("ReportUnsupportedBackends") boolean reportUnsupportedBackends) {
    this.clusterDomain = clusterDomain;
    this.reportUnsupportedBackends = reportUnsupportedBackends;
  }

  @Override
  public BuilderOptions get() {
    return new BuilderOptions(clusterDomain, reportUnsupportedBackends);
  }
}
