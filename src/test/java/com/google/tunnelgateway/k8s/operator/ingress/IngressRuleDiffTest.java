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
import java.util.List;
import org.junit.jupiter.api.Test;

public class IngressRuleDiffTest {
  private static final IngressRule A_S1 = new IngressRule("a", null, "s1");
  private static final IngressRule B_S2 = new IngressRule("b", null, "s2");
  private static final IngressRule C_API = new IngressRule("c", "/api*", "s3");
  private static final IngressRule WILDCARD_API = new IngressRule(null, "/api*", "s4");

  @Test
  public void identicalRulesProduceEmptyDiff() {
    RuleDiff diff = IngressRuleDiff.diffRules(List.of(A_S1), List.of(A_S1));

    assertThat(diff.getToAdd()).isEmpty();
    assertThat(diff.getToRemove()).isEmpty();
    assertThat(diff.isEmpty()).isTrue();
  }

  @Test
  public void diffIgnoresOrderAndCatchAll() {
    List<IngressRule> current = List.of(IngressRule.catchAll(), B_S2, A_S1, C_API);
    List<IngressRule> desired = List.of(A_S1, B_S2, C_API, IngressRule.catchAll());

    assertThat(IngressRuleDiff.diffRules(current, desired).isEmpty()).isTrue();
    assertThat(IngressRuleDiff.diffRules(desired, current).isEmpty()).isTrue();
  }

  @Test
  public void diffReportsAddedAndRemovedRules() {
    List<IngressRule> current = List.of(A_S1, B_S2, IngressRule.catchAll());
    List<IngressRule> desired = List.of(A_S1, C_API, IngressRule.catchAll());

    RuleDiff diff = IngressRuleDiff.diffRules(current, desired);

    assertThat(diff.getToAdd()).containsExactly(C_API);
    assertThat(diff.getToRemove()).containsExactly(B_S2.toComparable());
  }

  @Test
  public void diffComparesServiceExactly() {
    IngressRule changedService = new IngressRule("a", null, "s1-new");

    RuleDiff diff = IngressRuleDiff.diffRules(List.of(A_S1), List.of(changedService));

    assertThat(diff.getToAdd()).containsExactly(changedService);
    assertThat(diff.getToRemove()).containsExactly(A_S1.toComparable());
  }

  @Test
  public void wildcardHostRuleIsNotTreatedAsCatchAll() {
    assertThat(WILDCARD_API.isCatchAll()).isFalse();
    assertThat(IngressRule.forService("http://web.default.svc.cluster.local:80").isCatchAll())
        .isFalse();

    RuleDiff diff = IngressRuleDiff.diffRules(List.of(WILDCARD_API), List.of());

    assertThat(diff.getToRemove()).containsExactly(WILDCARD_API.toComparable());
  }

  @Test
  public void hostlessRulesTakePartInDiff() {
    IngressRule anyHostPath = new IngressRule(null, "/x*", "svc");
    IngressRule anyHostService = IngressRule.forService("svc");

    RuleDiff diff = IngressRuleDiff.diffRules(List.of(anyHostPath, anyHostService), List.of());

    assertThat(diff.getToRemove())
        .containsExactly(anyHostPath.toComparable(), anyHostService.toComparable());
    assertThat(IngressRuleDiff.ensureCatchAll(List.of(anyHostService)))
        .containsExactly(anyHostService, IngressRule.catchAll())
        .inOrder();
  }

  @Test
  public void applyDiffKeepsCurrentOrderAndAppendsNewRules() {
    List<IngressRule> current = List.of(C_API, IngressRule.catchAll(), A_S1, B_S2);

    ImmutableList<IngressRule> merged =
        IngressRuleDiff.applyDiff(current, List.of(WILDCARD_API), List.of(A_S1.toComparable()));

    assertThat(merged).containsExactly(C_API, B_S2, WILDCARD_API).inOrder();
  }

  @Test
  public void applyDiffDoesNotReorderExistingRules() {
    List<IngressRule> current = List.of(B_S2, A_S1);
    List<IngressRule> desired = List.of(A_S1, B_S2);

    RuleDiff diff = IngressRuleDiff.diffRules(current, desired);

    assertThat(IngressRuleDiff.applyDiff(current, diff)).containsExactly(B_S2, A_S1).inOrder();
  }

  @Test
  public void ensureCatchAllMovesSingleCatchAllToEnd() {
    List<IngressRule> rules =
        List.of(IngressRule.catchAll(), A_S1, IngressRule.catchAll(), B_S2, IngressRule.catchAll());

    ImmutableList<IngressRule> normalized = IngressRuleDiff.ensureCatchAll(rules);

    assertThat(normalized).containsExactly(A_S1, B_S2, IngressRule.catchAll()).inOrder();
    assertThat(IngressRuleDiff.ensureCatchAll(normalized)).isEqualTo(normalized);
  }

  @Test
  public void ensureCatchAllAddsCatchAllToEmptyRules() {
    assertThat(IngressRuleDiff.ensureCatchAll(List.of())).containsExactly(IngressRule.catchAll());
  }

  @Test
  public void comparableRuleConvertsBackToRule() {
    assertThat(C_API.toComparable().toRule()).isEqualTo(C_API);
    assertThat(IngressRule.catchAll().toComparable().toRule()).isEqualTo(IngressRule.catchAll());
  }
}
