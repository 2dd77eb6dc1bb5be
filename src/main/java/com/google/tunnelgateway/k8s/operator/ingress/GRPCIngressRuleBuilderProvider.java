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
import com.google.tunnelgateway.k8s.operator.metrics.MetricsCollector;
import com.google.tunnelgateway.k8s.operator.referencegrant.ReferenceValidator;
import com.google.tunnelgateway.k8s.operator.service.ServiceReader;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.GRPCRoute;

public class GRPCIngressRuleBuilderProvider implements Provider<IngressRuleBuilder<GRPCRoute>> {
  private final BuilderOptions options;
  private final ReferenceValidator validator;
  private final ServiceReader serviceReader;
  private final MetricsCollector metrics;

  @Inject
  public GRPCIngressRuleBuilderProvider(
      BuilderOptions options,
      ReferenceValidator validator,
      ServiceReader serviceReader,
      MetricsCollector metrics) {
    this.options = options;
    this.validator = validator;
    this.serviceReader = serviceReader;
    this.metrics = metrics;
  }

  @Override
  public IngressRuleBuilder<GRPCRoute> get() {
    return new IngressRuleBuilder<>(
        new GRPCRouteAdapter(), options, validator, serviceReader, metrics);
  }
}
