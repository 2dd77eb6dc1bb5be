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

package com.google.tunnelgateway.k8s.operator;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.google.inject.TypeLiteral;
import com.google.tunnelgateway.k8s.operator.ingress.BuilderOptions;
import com.google.tunnelgateway.k8s.operator.ingress.BuilderOptionsProvider;
import com.google.tunnelgateway.k8s.operator.ingress.GRPCIngressRuleBuilderProvider;
import com.google.tunnelgateway.k8s.operator.ingress.HTTPIngressRuleBuilderProvider;
import com.google.tunnelgateway.k8s.operator.ingress.IngressRuleBuilder;
import com.google.tunnelgateway.k8s.operator.metrics.MetricsCollector;
import com.google.tunnelgateway.k8s.operator.metrics.MicrometerMetricsCollector;
import com.google.tunnelgateway.k8s.operator.referencegrant.ReferenceGrantValidator;
import com.google.tunnelgateway.k8s.operator.referencegrant.ReferenceValidator;
import com.google.tunnelgateway.k8s.operator.service.KubernetesServiceReader;
import com.google.tunnelgateway.k8s.operator.service.ServiceReader;
import com.google.tunnelgateway.k8s.operator.sync.RouteSyncer;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.GRPCRoute;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.HTTPRoute;

/**
 * Binds the ingress rule builders and the route syncer. Requires bindings for {@code
 * KubernetesClient}, {@code MeterRegistry}, {@code TunnelConfigurationClient} and the values bound
 * by {@link EnvModule}.
 */
public class IngressModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(ServiceReader.class).to(KubernetesServiceReader.class);
    bind(ReferenceValidator.class).to(ReferenceGrantValidator.class);
    bind(MetricsCollector.class).to(MicrometerMetricsCollector.class);

    bind(BuilderOptions.class).toProvider(BuilderOptionsProvider.class).in(Singleton.class);
    bind(new TypeLiteral<IngressRuleBuilder<HTTPRoute>>() {})
        .toProvider(HTTPIngressRuleBuilderProvider.class)
        .in(Singleton.class);
    bind(new TypeLiteral<IngressRuleBuilder<GRPCRoute>>() {})
        .toProvider(GRPCIngressRuleBuilderProvider.class)
        .in(Singleton.class);

    bind(RouteSyncer.class);
  }
}
