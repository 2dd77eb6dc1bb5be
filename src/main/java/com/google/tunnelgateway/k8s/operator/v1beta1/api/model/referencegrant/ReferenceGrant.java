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

package com.google.tunnelgateway.k8s.operator.v1beta1.api.model.referencegrant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Grants routes in other namespaces the right to reference objects in the namespace of this
 * grant.
 */
@Group("gateway.networking.k8s.io")
@Version("v1beta1")
@JsonIgnoreProperties(value = "status", ignoreUnknown = true)
public class ReferenceGrant extends CustomResource<ReferenceGrantSpec, Void> implements Namespaced {
  private static final long serialVersionUID = 1L;

  @Override
  protected ReferenceGrantSpec initSpec() {
    return new ReferenceGrantSpec();
  }
}
