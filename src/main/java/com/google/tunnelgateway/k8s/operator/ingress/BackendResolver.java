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

import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.flogger.FluentLogger;
import com.google.tunnelgateway.k8s.operator.metrics.MetricsCollector;
import com.google.tunnelgateway.k8s.operator.referencegrant.Reference;
import com.google.tunnelgateway.k8s.operator.referencegrant.ReferenceValidationException;
import com.google.tunnelgateway.k8s.operator.referencegrant.ReferenceValidator;
import com.google.tunnelgateway.k8s.operator.service.ServiceLookupException;
import com.google.tunnelgateway.k8s.operator.service.ServiceReader;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.BackendRef;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.HTTPRoute;
import io.fabric8.kubernetes.api.model.Service;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Resolves the backend references of a route rule to the URL of a single backend Service.
 *
 * <p>Services resolve to their cluster-local DNS name, {@code
 * <scheme>://<name>.<namespace>.svc.<cluster-domain>:<port>}, ExternalName Services to {@code
 * <scheme>://<external-name>:<port>}. The scheme is https for port 443 and http otherwise.
 */
public class BackendResolver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String PARTIALLY_APPLIED = "route configuration partially applied";

  public static final int DEFAULT_HTTP_PORT = 80;
  public static final int DEFAULT_HTTPS_PORT = 443;

  private static final String GROUP_CORE = "";
  private static final String GROUP_CORE_ALIAS = "core";
  private static final String KIND_SERVICE = "Service";

  private final BuilderOptions options;
  private final ReferenceValidator validator;
  private final ServiceReader serviceReader;
  private final MetricsCollector metrics;

  public BackendResolver(
      BuilderOptions options,
      ReferenceValidator validator,
      ServiceReader serviceReader,
      MetricsCollector metrics) {
    this.options = options;
    this.validator = validator;
    this.serviceReader = serviceReader;
    this.metrics = metrics;
  }

  public BackendResolution resolve(
      RouteKind routeKind, String routeNamespace, String routeName, List<BackendRef> refs) {
    if (refs == null || refs.isEmpty()) {
      return BackendResolution.omitted();
    }
    String routeKey = String.format("%s/%s", routeNamespace, routeName);
    logMultipleBackends(routeKey, refs.size());
    logBackendWeights(routeKey, refs);

    OptionalInt selected = WeightSelector.selectHighestWeightIndex(refs, BackendRef::getWeight);
    if (selected.isEmpty()) {
      logger.atFine().log("All backendRefs of route %s are disabled", routeKey);
      return BackendResolution.omitted();
    }
    BackendRef ref = refs.get(selected.getAsInt());
    String backendNamespace =
        isNullOrEmpty(ref.getNamespace()) ? routeNamespace : ref.getNamespace();

    if (!isServiceRef(ref)) {
      if (!options.isReportUnsupportedBackends()) {
        return BackendResolution.omitted();
      }
      return failed(
          routeKind,
          new BackendRefError(
              routeNamespace,
              routeName,
              ref.getName(),
              backendNamespace,
              BackendRefError.Reason.INVALID_KIND,
              String.format(
                  "unsupported backend %s/%s, only core Services are supported",
                  ref.getGroup(), ref.getKind())));
    }

    int port = ref.getPort() == null ? DEFAULT_HTTP_PORT : ref.getPort();

    if (!routeNamespace.equals(backendNamespace)
        && !isCrossNamespaceRefAllowed(
            routeKind, routeNamespace, routeName, backendNamespace, ref.getName())) {
      return failed(
          routeKind,
          new BackendRefError(
              routeNamespace,
              routeName,
              ref.getName(),
              backendNamespace,
              BackendRefError.Reason.REF_NOT_PERMITTED,
              String.format(
                  "cross-namespace backend reference to %s/%s not permitted by ReferenceGrant",
                  backendNamespace, ref.getName())));
    }

    String scheme = port == DEFAULT_HTTPS_PORT ? "https" : "http";
    Optional<Service> service;
    try {
      service = serviceReader.get(backendNamespace, ref.getName());
    } catch (ServiceLookupException e) {
      logger.atWarning().withCause(e).log(
          "failed to fetch Service %s/%s, using cluster-local DNS",
          backendNamespace, ref.getName());
      return succeeded(routeKind, clusterLocalUrl(scheme, ref.getName(), backendNamespace, port));
    }

    if (service.isEmpty()) {
      return failed(
          routeKind,
          new BackendRefError(
              routeNamespace,
              routeName,
              ref.getName(),
              backendNamespace,
              BackendRefError.Reason.BACKEND_NOT_FOUND,
              String.format("Service %s/%s not found", backendNamespace, ref.getName())));
    }

    if (isExternalName(service.get())) {
      String externalName = service.get().getSpec().getExternalName();
      if (!isNullOrEmpty(externalName)) {
        return succeeded(routeKind, String.format("%s://%s:%d", scheme, externalName, port));
      }
      logger.atWarning().log(
          "ExternalName Service %s/%s has no externalName, using cluster-local DNS",
          backendNamespace, ref.getName());
    }
    return succeeded(routeKind, clusterLocalUrl(scheme, ref.getName(), backendNamespace, port));
  }

  private boolean isCrossNamespaceRefAllowed(
      RouteKind routeKind,
      String routeNamespace,
      String routeName,
      String backendNamespace,
      String backendName) {
    String routeKey = String.format("%s/%s", routeNamespace, routeName);
    String target = String.format("%s/%s", backendNamespace, backendName);
    Reference from = new Reference(HTTPRoute.GROUP, routeKind.getKind(), routeNamespace, routeName);
    Reference to = new Reference(GROUP_CORE, KIND_SERVICE, backendNamespace, backendName);
    boolean allowed;
    try {
      allowed = validator.isReferenceAllowed(from, to);
    } catch (ReferenceValidationException e) {
      logger.atInfo().withCause(e).log(
          "%s: route=%s reason=failed to validate cross-namespace reference target=%s",
          PARTIALLY_APPLIED, routeKey, target);
      return false;
    }
    if (!allowed) {
      logger.atInfo().log(
          "%s: route=%s reason=cross-namespace backend reference not permitted by ReferenceGrant"
              + " target=%s",
          PARTIALLY_APPLIED, routeKey, target);
    }
    return allowed;
  }

  private String clusterLocalUrl(String scheme, String name, String namespace, int port) {
    return String.format(
        "%s://%s.%s.svc.%s:%d", scheme, name, namespace, options.getClusterDomain(), port);
  }

  private BackendResolution succeeded(RouteKind routeKind, String url) {
    metrics.recordBackendRefValidation(routeKind.getLabel(), MetricsCollector.RESULT_SUCCESS, "");
    return BackendResolution.resolved(url);
  }

  private BackendResolution failed(RouteKind routeKind, BackendRefError error) {
    metrics.recordBackendRefValidation(
        routeKind.getLabel(), MetricsCollector.RESULT_FAILED, error.getReason().getCode());
    return BackendResolution.failed(error);
  }

  private static boolean isServiceRef(BackendRef ref) {
    String group = ref.getGroup();
    if (!isNullOrEmpty(group) && !GROUP_CORE_ALIAS.equals(group)) {
      return false;
    }
    return isNullOrEmpty(ref.getKind()) || KIND_SERVICE.equals(ref.getKind());
  }

  private static boolean isExternalName(Service service) {
    return service.getSpec() != null
        && ServiceReader.TYPE_EXTERNAL_NAME.equals(service.getSpec().getType());
  }

  private static void logMultipleBackends(String routeKey, int totalBackends) {
    if (totalBackends > 1) {
      logger.atInfo().log(
          "%s: route=%s reason=multiple backendRefs specified, using only highest weight"
              + " total_backends=%d ignored_backends=%d",
          PARTIALLY_APPLIED, routeKey, totalBackends, totalBackends - 1);
    }
  }

  private static void logBackendWeights(String routeKey, List<BackendRef> refs) {
    for (int i = 0; i < refs.size(); i++) {
      BackendRef ref = refs.get(i);
      Integer weight = ref.getWeight();
      if (weight != null && weight != 0 && weight != WeightSelector.DEFAULT_WEIGHT) {
        logger.atInfo().log(
            "%s: route=%s reason=backendRef weight ignored, traffic splitting not supported"
                + " backend=%s backend_index=%d weight=%d",
            PARTIALLY_APPLIED, routeKey, ref.getName(), i, weight);
      }
    }
  }
}
