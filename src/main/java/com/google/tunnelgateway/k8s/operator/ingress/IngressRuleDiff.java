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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Compares live and desired tunnel ingress rules. Comparison ignores the catch-all rule and the
 * order of the rules.
 */
public final class IngressRuleDiff {
  private IngressRuleDiff() {}

  public static RuleDiff diffRules(List<IngressRule> current, List<IngressRule> desired) {
    Set<ComparableRule> currentSet = comparableSet(current);
    Set<ComparableRule> desiredSet = comparableSet(desired);

    List<IngressRule> toAdd = new ArrayList<>();
    for (IngressRule rule : desired) {
      if (!rule.isCatchAll() && !currentSet.contains(rule.toComparable())) {
        toAdd.add(rule);
      }
    }
    List<ComparableRule> toRemove = new ArrayList<>();
    for (IngressRule rule : current) {
      ComparableRule comparable = rule.toComparable();
      if (!comparable.isCatchAll() && !desiredSet.contains(comparable)) {
        toRemove.add(comparable);
      }
    }
    return new RuleDiff(toAdd, toRemove);
  }

  /**
   * Removes {@code toRemove} and the catch-all from {@code current}, keeping the order of the
   * remaining rules, and appends {@code toAdd}.
   */
  public static ImmutableList<IngressRule> applyDiff(
      List<IngressRule> current, List<IngressRule> toAdd, List<ComparableRule> toRemove) {
    Set<ComparableRule> removed = ImmutableSet.copyOf(toRemove);
    ImmutableList.Builder<IngressRule> merged = ImmutableList.builder();
    for (IngressRule rule : current) {
      ComparableRule comparable = rule.toComparable();
      if (!comparable.isCatchAll() && !removed.contains(comparable)) {
        merged.add(rule);
      }
    }
    return merged.addAll(toAdd).build();
  }

  public static ImmutableList<IngressRule> applyDiff(List<IngressRule> current, RuleDiff diff) {
    return applyDiff(current, diff.getToAdd(), diff.getToRemove());
  }

  /** Moves a single catch-all rule to the end of the rules, dropping any other catch-all. */
  public static ImmutableList<IngressRule> ensureCatchAll(List<IngressRule> rules) {
    return ImmutableList.<IngressRule>builder()
        .addAll(withoutCatchAll(rules))
        .add(IngressRule.catchAll())
        .build();
  }

  public static ImmutableList<IngressRule> withoutCatchAll(List<IngressRule> rules) {
    return rules.stream().filter(r -> !r.isCatchAll()).collect(toImmutableList());
  }

  private static Set<ComparableRule> comparableSet(List<IngressRule> rules) {
    return rules.stream()
        .map(IngressRule::toComparable)
        .filter(r -> !r.isCatchAll())
        .collect(ImmutableSet.toImmutableSet());
  }
}
