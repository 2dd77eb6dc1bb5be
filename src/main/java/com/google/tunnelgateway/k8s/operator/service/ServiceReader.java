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

package com.google.tunnelgateway.k8s.operator.service;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import java.util.Optional;

/** Reads backend Services. */
public interface ServiceReader {
  String TYPE_CLUSTER_IP = "ClusterIP";
  String TYPE_EXTERNAL_NAME = "ExternalName";

  /**
   * Reader used when no Kubernetes client is available. Every Service is assumed to exist as a
   * ClusterIP Service, so all backends resolve to cluster-local DNS names.
   */
  ServiceReader CLUSTER_DNS_ONLY =
      (namespace, name) ->
          Optional.of(
              new ServiceBuilder()
                  .withNewMetadata()
                  .withNamespace(namespace)
                  .withName(name)
                  .endMetadata()
                  .withNewSpec()
                  .withType(TYPE_CLUSTER_IP)
                  .endSpec()
                  .build());

  /**
   * Returns the Service, or an empty optional if it does not exist.
   *
   * @throws ServiceLookupException if the Service could not be read
   */
  Optional<Service> get(String namespace, String name) throws ServiceLookupException;
}
