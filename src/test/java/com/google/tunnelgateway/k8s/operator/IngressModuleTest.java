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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import com.google.tunnelgateway.k8s.operator.ingress.IngressRule;
import com.google.tunnelgateway.k8s.operator.ingress.IngressRuleBuilder;
import com.google.tunnelgateway.k8s.operator.ingress.RouteKind;
import com.google.tunnelgateway.k8s.operator.sync.RouteSyncer;
import com.google.tunnelgateway.k8s.operator.sync.SyncResult;
import com.google.tunnelgateway.k8s.operator.sync.TunnelConfigurationClient;
import com.google.tunnelgateway.k8s.operator.test.FakeTunnelConfigurationClient;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.GRPCRoute;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.HTTPRoute;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import io.javaoperatorsdk.operator.ReconcilerUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.HttpURLConnection;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@EnableKubernetesMockClient
public class IngressModuleTest {
  KubernetesMockServer server;
  KubernetesClient client;

  private final FakeTunnelConfigurationClient tunnel = new FakeTunnelConfigurationClient();
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private Injector injector;

  @BeforeEach
  public void setup() {
    injector =
        Guice.createInjector(
            new EnvModule(Map.of(EnvModule.CLUSTER_DOMAIN, "cluster.example")),
            new IngressModule(),
            new AbstractModule() {
              @Override
              protected void configure() {
                bind(KubernetesClient.class).toInstance(client);
                bind(MeterRegistry.class).toInstance(registry);
                bind(TunnelConfigurationClient.class).toInstance(tunnel);
              }
            });
  }

  @Test
  public void buildersAreBoundPerRouteKind() {
    IngressRuleBuilder<HTTPRoute> http =
        injector.getInstance(Key.get(new TypeLiteral<IngressRuleBuilder<HTTPRoute>>() {}));
    IngressRuleBuilder<GRPCRoute> grpc =
        injector.getInstance(Key.get(new TypeLiteral<IngressRuleBuilder<GRPCRoute>>() {}));

    assertThat(http.getRouteKind()).isEqualTo(RouteKind.HTTP);
    assertThat(grpc.getRouteKind()).isEqualTo(RouteKind.GRPC);
    assertThat(injector.getInstance(RouteSyncer.class))
        .isSameInstanceAs(injector.getInstance(RouteSyncer.class));
  }

  @Test
  public void syncerResolvesServicesThroughTheCluster() throws Exception {
    server
        .expect()
        .get()
        .withPath("/api/v1/namespaces/default/services/svc")
        .andReturn(
            HttpURLConnection.HTTP_OK,
            new ServiceBuilder()
                .withNewMetadata()
                .withNamespace("default")
                .withName("svc")
                .endMetadata()
                .withNewSpec()
                .withType("ClusterIP")
                .endSpec()
                .build())
        .once();
    HTTPRoute route =
        ReconcilerUtils.loadYaml(HTTPRoute.class, this.getClass(), "httproute_default.yaml");

    SyncResult result =
        injector.getInstance(RouteSyncer.class).sync(ImmutableList.of(route), List.of());

    assertThat(result.getRules())
        .containsExactly(
            new IngressRule("a.example.com", null, "http://svc.default.svc.cluster.example:8080"),
            IngressRule.catchAll())
        .inOrder();
    assertThat(tunnel.getRules()).isEqualTo(result.getRules());
    assertThat(registry.find("cftunnel.ingress.rules").gauge().value()).isEqualTo(2.0);
  }
}
