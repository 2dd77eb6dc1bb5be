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

import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.util.Optional;

@Singleton
public class KubernetesServiceReader implements ServiceReader {
  private final KubernetesClient client;

  @Inject
  public KubernetesServiceReader(KubernetesClient client) {
    this.client = client;
  }

  @Override
  public Optional<Service> get(String namespace, String name) throws ServiceLookupException {
    try {
      return Optional.ofNullable(client.services().inNamespace(namespace).withName(name).get());
    } catch (KubernetesClientException e) {
      throw new ServiceLookupException(
          String.format("Failed to get Service %s/%s", namespace, name), e);
    }
  }
}
