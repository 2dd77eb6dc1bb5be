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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.tunnelgateway.k8s.operator.referencegrant.Reference;
import com.google.tunnelgateway.k8s.operator.referencegrant.ReferenceValidationException;
import com.google.tunnelgateway.k8s.operator.referencegrant.ReferenceValidator;
import com.google.tunnelgateway.k8s.operator.service.ServiceLookupException;
import com.google.tunnelgateway.k8s.operator.service.ServiceReader;
import com.google.tunnelgateway.k8s.operator.test.LogCapture;
import com.google.tunnelgateway.k8s.operator.test.RecordingMetricsCollector;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.BackendRef;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BackendResolverTest {
  private static final String NAMESPACE = "default";
  private static final String ROUTE = "web";

  private final Map<String, Service> services = new HashMap<>();
  private final List<Reference[]> validatorCalls = new ArrayList<>();
  private RecordingMetricsCollector metrics;
  private boolean referencesAllowed;
  private ServiceLookupException lookupFailure;

  private final ServiceReader serviceReader =
      (namespace, name) -> {
        if (lookupFailure != null) {
          throw lookupFailure;
        }
        return Optional.ofNullable(services.get(namespace + "/" + name));
      };

  private final ReferenceValidator validator =
      (from, to) -> {
        validatorCalls.add(new Reference[] {from, to});
        return referencesAllowed;
      };

  @BeforeEach
  public void setup() {
    metrics = new RecordingMetricsCollector();
    referencesAllowed = false;
    lookupFailure = null;
    addClusterIpService(NAMESPACE, "svc");
  }

  @Test
  public void missingBackendRefsAreOmitted() {
    BackendResolution resolution = resolver().resolve(RouteKind.HTTP, NAMESPACE, ROUTE, null);
    assertThat(resolution.getService()).isEmpty();
    assertThat(resolution.getError()).isEmpty();

    resolution = resolver().resolve(RouteKind.HTTP, NAMESPACE, ROUTE, ImmutableList.of());
    assertThat(resolution.getService()).isEmpty();
    assertThat(resolution.getError()).isEmpty();
    assertThat(metrics.backendRefValidations).isEmpty();
  }

  @Test
  public void disabledBackendsAreOmitted() {
    BackendRef ref = new BackendRef("svc", 8080);
    ref.setWeight(0);

    BackendResolution resolution =
        resolver().resolve(RouteKind.HTTP, NAMESPACE, ROUTE, ImmutableList.of(ref));

    assertThat(resolution.getService()).isEmpty();
    assertThat(resolution.getError()).isEmpty();
  }

  @Test
  public void serviceResolvesToClusterLocalDnsName() {
    BackendResolution resolution = resolve(RouteKind.HTTP, new BackendRef("svc", 8080));

    assertThat(resolution.getService()).hasValue("http://svc.default.svc.cluster.local:8080");
    assertThat(resolution.getError()).isEmpty();
    assertThat(metrics.backendRefValidations).containsExactly("http/success/");
  }

  @Test
  public void portDefaultsTo80() {
    BackendResolution resolution = resolve(RouteKind.GRPC, new BackendRef("svc", null));

    assertThat(resolution.getService()).hasValue("http://svc.default.svc.cluster.local:80");
    assertThat(metrics.backendRefValidations).containsExactly("grpc/success/");
  }

  @Test
  public void port443UsesHttps() {
    BackendResolution resolution = resolve(RouteKind.HTTP, new BackendRef("svc", 443));

    assertThat(resolution.getService()).hasValue("https://svc.default.svc.cluster.local:443");
  }

  @Test
  public void clusterDomainIsConfigurable() {
    BackendResolver resolver =
        new BackendResolver(
            new BuilderOptions("cluster.example", false), validator, serviceReader, metrics);

    BackendResolution resolution =
        resolver.resolve(
            RouteKind.HTTP, NAMESPACE, ROUTE, ImmutableList.of(new BackendRef("svc", 80)));

    assertThat(resolution.getService()).hasValue("http://svc.default.svc.cluster.example:80");
  }

  @Test
  public void externalNameServiceResolvesToExternalName() {
    services.put(
        NAMESPACE + "/external",
        new ServiceBuilder()
            .withNewMetadata()
            .withNamespace(NAMESPACE)
            .withName("external")
            .endMetadata()
            .withNewSpec()
            .withType(ServiceReader.TYPE_EXTERNAL_NAME)
            .withExternalName("api.example.net")
            .endSpec()
            .build());

    BackendResolution resolution = resolve(RouteKind.HTTP, new BackendRef("external", 443));

    assertThat(resolution.getService()).hasValue("https://api.example.net:443");
  }

  @Test
  public void externalNameServiceWithoutTargetFallsBackToClusterLocalDns() {
    services.put(
        NAMESPACE + "/external",
        new ServiceBuilder()
            .withNewMetadata()
            .withNamespace(NAMESPACE)
            .withName("external")
            .endMetadata()
            .withNewSpec()
            .withType(ServiceReader.TYPE_EXTERNAL_NAME)
            .endSpec()
            .build());

    try (LogCapture log = new LogCapture(BackendResolver.class)) {
      BackendResolution resolution = resolve(RouteKind.HTTP, new BackendRef("external", 443));

      assertThat(resolution.getService())
          .hasValue("https://external.default.svc.cluster.local:443");
      assertThat(log.getLog())
          .contains("ExternalName Service default/external has no externalName");
    }
  }

  @Test
  public void missingServiceIsReportedAsBackendNotFound() {
    BackendResolution resolution = resolve(RouteKind.HTTP, new BackendRef("gone", 80));

    assertThat(resolution.getService()).isEmpty();
    assertThat(resolution.getError())
        .hasValue(
            new BackendRefError(
                NAMESPACE,
                ROUTE,
                "gone",
                NAMESPACE,
                BackendRefError.Reason.BACKEND_NOT_FOUND,
                "Service default/gone not found"));
    assertThat(metrics.backendRefValidations).containsExactly("http/failed/BackendNotFound");
  }

  @Test
  public void lookupFailureFallsBackToClusterLocalDns() {
    lookupFailure =
        new ServiceLookupException("lookup failed", new KubernetesClientException("timeout"));

    try (LogCapture log = new LogCapture(BackendResolver.class)) {
      BackendResolution resolution = resolve(RouteKind.HTTP, new BackendRef("svc", 80));

      assertThat(resolution.getService()).hasValue("http://svc.default.svc.cluster.local:80");
      assertThat(resolution.getError()).isEmpty();
      assertThat(log.getLog()).contains("using cluster-local DNS");
    }
  }

  @Test
  public void sameNamespaceReferenceIsNotValidated() {
    BackendRef ref = new BackendRef("svc", 80);
    ref.setNamespace(NAMESPACE);

    resolver().resolve(RouteKind.HTTP, NAMESPACE, ROUTE, ImmutableList.of(ref));

    assertThat(validatorCalls).isEmpty();
  }

  @Test
  public void crossNamespaceReferenceIsValidatedOnce() {
    addClusterIpService("backend", "billing");
    referencesAllowed = true;
    BackendRef ref = new BackendRef("billing", 8080);
    ref.setNamespace("backend");

    BackendResolution resolution =
        resolver().resolve(RouteKind.GRPC, "frontend", "shared", ImmutableList.of(ref));

    assertThat(resolution.getService()).hasValue("http://billing.backend.svc.cluster.local:8080");
    assertThat(validatorCalls).hasSize(1);
    assertThat(validatorCalls.get(0)[0])
        .isEqualTo(new Reference("gateway.networking.k8s.io", "GRPCRoute", "frontend", "shared"));
    assertThat(validatorCalls.get(0)[1])
        .isEqualTo(new Reference("", "Service", "backend", "billing"));
  }

  @Test
  public void deniedCrossNamespaceReferenceIsReported() {
    addClusterIpService("backend", "billing");
    BackendRef ref = new BackendRef("billing", 8080);
    ref.setNamespace("backend");

    try (LogCapture log = new LogCapture(BackendResolver.class)) {
      BackendResolution resolution =
          resolver().resolve(RouteKind.HTTP, "frontend", "shared", ImmutableList.of(ref));

      assertThat(resolution.getService()).isEmpty();
      assertThat(resolution.getError().get().getReason())
          .isEqualTo(BackendRefError.Reason.REF_NOT_PERMITTED);
      assertThat(resolution.getError().get().getMessage())
          .isEqualTo(
              "cross-namespace backend reference to backend/billing not permitted by"
                  + " ReferenceGrant");
      assertThat(log.getLog())
          .contains("cross-namespace backend reference not permitted by ReferenceGrant");
    }
    assertThat(validatorCalls).hasSize(1);
    assertThat(metrics.backendRefValidations).containsExactly("http/failed/RefNotPermitted");
  }

  @Test
  public void validatorFailureIsReportedAsRefNotPermitted() {
    ReferenceValidator failing =
        (from, to) -> {
          throw new ReferenceValidationException("list failed", new KubernetesClientException("x"));
        };
    BackendRef ref = new BackendRef("billing", 8080);
    ref.setNamespace("backend");

    BackendResolution resolution =
        new BackendResolver(BuilderOptions.defaults(), failing, serviceReader, metrics)
            .resolve(RouteKind.HTTP, "frontend", "shared", ImmutableList.of(ref));

    assertThat(resolution.getService()).isEmpty();
    assertThat(resolution.getError().get().getReason())
        .isEqualTo(BackendRefError.Reason.REF_NOT_PERMITTED);
  }

  @Test
  public void unsupportedBackendKindIsOmittedSilently() {
    BackendRef ref = new BackendRef("assets", null);
    ref.setGroup("storage.example.com");
    ref.setKind("Bucket");

    BackendResolution resolution =
        resolver().resolve(RouteKind.HTTP, NAMESPACE, ROUTE, ImmutableList.of(ref));

    assertThat(resolution.getService()).isEmpty();
    assertThat(resolution.getError()).isEmpty();
    assertThat(metrics.backendRefValidations).isEmpty();
  }

  @Test
  public void unsupportedBackendKindIsReportedIfEnabled() {
    BackendRef ref = new BackendRef("assets", null);
    ref.setGroup("storage.example.com");
    ref.setKind("Bucket");

    BackendResolution resolution =
        new BackendResolver(
                new BuilderOptions(BuilderOptions.DEFAULT_CLUSTER_DOMAIN, true),
                validator,
                serviceReader,
                metrics)
            .resolve(RouteKind.HTTP, NAMESPACE, ROUTE, ImmutableList.of(ref));

    assertThat(resolution.getService()).isEmpty();
    assertThat(resolution.getError().get().getReason())
        .isEqualTo(BackendRefError.Reason.INVALID_KIND);
    assertThat(metrics.backendRefValidations).containsExactly("http/failed/InvalidKind");
  }

  @Test
  public void coreGroupAliasIsAccepted() {
    BackendRef ref = new BackendRef("svc", 80);
    ref.setGroup("core");
    ref.setKind("Service");

    BackendResolution resolution =
        resolver().resolve(RouteKind.HTTP, NAMESPACE, ROUTE, ImmutableList.of(ref));

    assertThat(resolution.getService()).hasValue("http://svc.default.svc.cluster.local:80");
  }

  @Test
  public void onlyHighestWeightBackendIsUsed() {
    addClusterIpService(NAMESPACE, "svc-a");
    addClusterIpService(NAMESPACE, "svc-c");
    BackendRef a = new BackendRef("svc-a", 80);
    a.setWeight(10);
    BackendRef b = new BackendRef("svc-b", 80);
    b.setWeight(0);
    BackendRef c = new BackendRef("svc-c", 80);
    c.setWeight(90);

    try (LogCapture log = new LogCapture(BackendResolver.class)) {
      BackendResolution resolution =
          resolver().resolve(RouteKind.HTTP, NAMESPACE, ROUTE, ImmutableList.of(a, b, c));

      assertThat(resolution.getService()).hasValue("http://svc-c.default.svc.cluster.local:80");
      assertThat(log.getLog())
          .contains("multiple backendRefs specified, using only highest weight");
      assertThat(log.getLog())
          .contains("backendRef weight ignored, traffic splitting not supported");
      assertThat(log.getLog()).contains("backend=svc-a backend_index=0 weight=10");
      assertThat(log.getLog()).contains("backend=svc-c backend_index=2 weight=90");
      assertThat(log.getLog()).doesNotContain("backend=svc-b");
    }
  }

  private BackendResolution resolve(RouteKind routeKind, BackendRef ref) {
    return resolver().resolve(routeKind, NAMESPACE, ROUTE, ImmutableList.of(ref));
  }

  private BackendResolver resolver() {
    return new BackendResolver(BuilderOptions.defaults(), validator, serviceReader, metrics);
  }

  private void addClusterIpService(String namespace, String name) {
    services.put(
        namespace + "/" + name,
        new ServiceBuilder()
            .withNewMetadata()
            .withNamespace(namespace)
            .withName(name)
            .endMetadata()
            .withNewSpec()
            .withType(ServiceReader.TYPE_CLUSTER_IP)
            .endSpec()
            .build());
  }
}
