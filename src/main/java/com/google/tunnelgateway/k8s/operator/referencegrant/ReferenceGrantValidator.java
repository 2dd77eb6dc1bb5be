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

package com.google.tunnelgateway.k8s.operator.referencegrant;

import static com.google.common.base.Strings.isNullOrEmpty;
import static com.google.common.base.Strings.nullToEmpty;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.tunnelgateway.k8s.operator.v1beta1.api.model.referencegrant.ReferenceGrant;
import com.google.tunnelgateway.k8s.operator.v1beta1.api.model.referencegrant.ReferenceGrantFrom;
import com.google.tunnelgateway.k8s.operator.v1beta1.api.model.referencegrant.ReferenceGrantTo;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.util.List;

/**
 * Validates cross-namespace references against the ReferenceGrants in the namespace of the
 * referenced object.
 *
 * <p>A reference is allowed if at least one grant lists the referrer's group, kind and namespace
 * in {@code spec.from} and the target's group and kind in {@code spec.to}. A {@code to} entry
 * without a name matches every object of that kind.
 */
@Singleton
public class ReferenceGrantValidator implements ReferenceValidator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final KubernetesClient client;

  @Inject
  public ReferenceGrantValidator(KubernetesClient client) {
    this.client = client;
  }

  @Override
  public boolean isReferenceAllowed(Reference from, Reference to)
      throws ReferenceValidationException {
    if (from.getNamespace().equals(to.getNamespace())) {
      return true;
    }

    List<ReferenceGrant> grants;
    try {
      grants =
          client.resources(ReferenceGrant.class).inNamespace(to.getNamespace()).list().getItems();
    } catch (KubernetesClientException e) {
      throw new ReferenceValidationException(
          String.format("Failed to list ReferenceGrants in namespace %s", to.getNamespace()), e);
    }

    for (ReferenceGrant grant : grants) {
      if (grant.getSpec() == null) {
        continue;
      }
      if (permitsFrom(grant.getSpec().getFrom(), from)
          && permitsTo(grant.getSpec().getTo(), to)) {
        logger.atFine().log(
            "Reference from %s to %s permitted by ReferenceGrant %s/%s",
            from, to, grant.getMetadata().getNamespace(), grant.getMetadata().getName());
        return true;
      }
    }
    return false;
  }

  private static boolean permitsFrom(List<ReferenceGrantFrom> entries, Reference from) {
    if (entries == null) {
      return false;
    }
    return entries.stream()
        .anyMatch(
            f ->
                nullToEmpty(f.getGroup()).equals(from.getGroup())
                    && from.getKind().equals(f.getKind())
                    && from.getNamespace().equals(f.getNamespace()));
  }

  private static boolean permitsTo(List<ReferenceGrantTo> entries, Reference to) {
    if (entries == null) {
      return false;
    }
    return entries.stream()
        .anyMatch(
            t ->
                nullToEmpty(t.getGroup()).equals(to.getGroup())
                    && to.getKind().equals(t.getKind())
                    && (isNullOrEmpty(t.getName()) || t.getName().equals(to.getName())));
  }
}
