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

package com.google.tunnelgateway.k8s.operator.sync;

import com.google.tunnelgateway.k8s.operator.ingress.IngressRule;
import java.util.List;

/** Access to the ingress rules of the remotely managed tunnel configuration. */
public interface TunnelConfigurationClient {
  List<IngressRule> getIngressRules() throws TunnelConfigurationException;

  /** Replaces the ingress rules of the tunnel configuration. */
  void updateIngressRules(List<IngressRule> rules) throws TunnelConfigurationException;
}
