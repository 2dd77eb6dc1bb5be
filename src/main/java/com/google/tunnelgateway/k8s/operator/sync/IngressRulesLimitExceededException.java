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

/** The compiled configuration has more ingress rules than a tunnel accepts. */
public class IngressRulesLimitExceededException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int ruleCount;
  private final int maxRules;
  private final transient SyncResult result;

  public IngressRulesLimitExceededException(int ruleCount, int maxRules, SyncResult result) {
    super(String.format("ingress rules limit exceeded: %d rules (max %d)", ruleCount, maxRules));
    this.ruleCount = ruleCount;
    this.maxRules = maxRules;
    this.result = result;
  }

  public int getRuleCount() {
    return ruleCount;
  }

  public int getMaxRules() {
    return maxRules;
  }

  /** Outcome of the rejected pass. Nothing was written, failed references are still reported. */
  public SyncResult getResult() {
    return result;
  }
}
