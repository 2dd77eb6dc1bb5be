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

package com.google.tunnelgateway.k8s.operator;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.name.Names;
import com.google.tunnelgateway.k8s.operator.sync.RouteSyncer;
import com.google.tunnelgateway.k8s.operator.sync.SyncStrategy;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class EnvModuleTest {

  @Test
  public void defaultsAreBoundWithoutEnvironment() {
    Injector injector = Guice.createInjector(new EnvModule(Map.of()));

    assertThat(injector.getInstance(Key.get(String.class, Names.named("ClusterDomain"))))
        .isEqualTo("cluster.local");
    assertThat(injector.getInstance(Key.get(SyncStrategy.class, Names.named("SyncStrategy"))))
        .isEqualTo(SyncStrategy.REPLACE_ON_CHANGE);
    assertThat(
            injector.getInstance(Key.get(Boolean.class, Names.named("ReportUnsupportedBackends"))))
        .isFalse();
    assertThat(injector.getInstance(Key.get(Integer.class, Names.named("MaxIngressRules"))))
        .isEqualTo(RouteSyncer.DEFAULT_MAX_INGRESS_RULES);
  }

  @Test
  public void environmentOverridesDefaults() {
    Injector injector =
        Guice.createInjector(
            new EnvModule(
                Map.of(
                    EnvModule.CLUSTER_DOMAIN, "cluster.example",
                    EnvModule.SYNC_STRATEGY, "minimal_patch",
                    EnvModule.REPORT_UNSUPPORTED_BACKENDS, "TRUE",
                    EnvModule.MAX_INGRESS_RULES, "50")));

    assertThat(injector.getInstance(Key.get(String.class, Names.named("ClusterDomain"))))
        .isEqualTo("cluster.example");
    assertThat(injector.getInstance(Key.get(SyncStrategy.class, Names.named("SyncStrategy"))))
        .isEqualTo(SyncStrategy.MINIMAL_PATCH);
    assertThat(
            injector.getInstance(Key.get(Boolean.class, Names.named("ReportUnsupportedBackends"))))
        .isTrue();
    assertThat(injector.getInstance(Key.get(Integer.class, Names.named("MaxIngressRules"))))
        .isEqualTo(50);
  }

  @ParameterizedTest
  @MethodSource("provideInvalidEnvironments")
  public void invalidValuesAreRejected(Map<String, String> env) {
    assertThrows(CreationException.class, () -> Guice.createInjector(new EnvModule(env)));
  }

  private static Stream<Arguments> provideInvalidEnvironments() {
    return Stream.of(
        Arguments.of(Map.of(EnvModule.SYNC_STRATEGY, "sometimes")),
        Arguments.of(Map.of(EnvModule.REPORT_UNSUPPORTED_BACKENDS, "yes")),
        Arguments.of(Map.of(EnvModule.MAX_INGRESS_RULES, "many")),
        Arguments.of(Map.of(EnvModule.MAX_INGRESS_RULES, "0")));
  }
}
