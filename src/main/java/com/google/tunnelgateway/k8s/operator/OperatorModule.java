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
import com.google.tunnelgateway.k8s.operator.sync.TunnelConfigurationClient;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;

/**
 * Wires the route syncer against the cluster the process runs in. The tunnel configuration
 * client is supplied by the caller.
 */
public class OperatorModule extends AbstractModule {
  private final TunnelConfigurationClient tunnelClient;

  public OperatorModule(TunnelConfigurationClient tunnelClient) {
    this.tunnelClient = tunnelClient;
  }

  @Override
  protected void configure() {
    install(new EnvModule());
    install(new IngressModule());

    bind(KubernetesClient.class).toInstance(getKubernetesClient());
    bind(MeterRegistry.class).toInstance(Metrics.globalRegistry);
    bind(TunnelConfigurationClient.class).toInstance(tunnelClient);
  }

  private KubernetesClient getKubernetesClient() {
    Config config = new ConfigBuilder().withNamespace(null).build();
    return new KubernetesClientBuilder().withConfig(config).build();
  }
}
