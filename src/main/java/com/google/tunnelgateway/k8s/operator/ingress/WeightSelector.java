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

import java.util.List;
import java.util.OptionalInt;
import java.util.function.Function;

/** Selects a single backend out of a weighted list. Traffic splitting is not supported. */
public final class WeightSelector {
  public static final int DEFAULT_WEIGHT = 1;

  private WeightSelector() {}

  /**
   * Returns the index of the candidate with the highest weight.
   *
   * <p>A missing weight counts as {@link #DEFAULT_WEIGHT}. Candidates with weight 0 are disabled
   * and never selected. Ties resolve to the first candidate. Returns an empty result if the list
   * is empty or every candidate is disabled.
   */
  public static <T> OptionalInt selectHighestWeightIndex(
      List<T> candidates, Function<T, Integer> weightOf) {
    int selected = -1;
    int highestWeight = 0;
    for (int i = 0; i < candidates.size(); i++) {
      int weight = weightOrDefault(candidates.get(i), weightOf);
      if (weight == 0) {
        continue;
      }
      if (selected == -1 || weight > highestWeight) {
        selected = i;
        highestWeight = weight;
      }
    }
    return selected == -1 ? OptionalInt.empty() : OptionalInt.of(selected);
  }

  private static <T> int weightOrDefault(T candidate, Function<T, Integer> weightOf) {
    Integer weight = weightOf.apply(candidate);
    return weight == null ? DEFAULT_WEIGHT : weight;
  }
}
