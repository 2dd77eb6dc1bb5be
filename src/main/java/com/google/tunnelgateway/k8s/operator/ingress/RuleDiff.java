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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Rules to add to and remove from a live tunnel configuration. */
public final class RuleDiff {
  private final ImmutableList<IngressRule> toAdd;
  private final ImmutableList<ComparableRule> toRemove;

  public RuleDiff(List<IngressRule> toAdd, List<ComparableRule> toRemove) {
    this.toAdd = ImmutableList.copyOf(toAdd);
    this.toRemove = ImmutableList.copyOf(toRemove);
  }

  public ImmutableList<IngressRule> getToAdd() {
    return toAdd;
  }

  public ImmutableList<ComparableRule> getToRemove() {
    return toRemove;
  }

  public boolean isEmpty() {
    return toAdd.isEmpty() && toRemove.isEmpty();
  }

  @Override
  public String toString() {
    return String.format("toAdd=%s toRemove=%s", toAdd, toRemove);
  }
}
