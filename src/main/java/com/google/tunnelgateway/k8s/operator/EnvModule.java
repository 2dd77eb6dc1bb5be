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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.inject.AbstractModule;
import com.google.inject.name.Names;
import com.google.tunnelgateway.k8s.operator.ingress.BuilderOptions;
import com.google.tunnelgateway.k8s.operator.sync.RouteSyncer;
import com.google.tunnelgateway.k8s.operator.sync.SyncStrategy;
import java.util.Locale;
import java.util.Map;

/** Binds configuration values read from environment variables. */
public class EnvModule extends AbstractModule {
  static final String CLUSTER_DOMAIN = "CLUSTER_DOMAIN";
  static final String SYNC_STRATEGY = "SYNC_STRATEGY";
  static final String REPORT_UNSUPPORTED_BACKENDS = "REPORT_UNSUPPORTED_BACKENDS";
  static final String MAX_INGRESS_RULES = "MAX_INGRESS_RULES";

  private final Map<String, String> env;

  public EnvModule() {
    this(System.getenv());
  }

  public EnvModule(Map<String, String> env) {
    this.env = ImmutableMap.copyOf(env);
  }

  @Override
  protected void configure() {
    bind(String.class)
        .annotatedWith(Names.named("ClusterDomain"))
        .toInstance(getOrDefault(CLUSTER_DOMAIN, BuilderOptions.DEFAULT_CLUSTER_DOMAIN));
    bind(SyncStrategy.class)
        .annotatedWith(Names.named("SyncStrategy"))
        .toInstance(getSyncStrategy());
    bind(Boolean.class)
        .annotatedWith(Names.named("ReportUnsupportedBackends"))
        .toInstance(getBoolean(REPORT_UNSUPPORTED_BACKENDS));
    bind(Integer.class)
        .annotatedWith(Names.named("MaxIngressRules"))
        .toInstance(getMaxIngressRules());
  }

  private String getOrDefault(String name, String defaultValue) {
    String value = env.get(name);
    return Strings.isNullOrEmpty(value) ? defaultValue : value.trim();
  }

  private SyncStrategy getSyncStrategy() {
    String value = getOrDefault(SYNC_STRATEGY, SyncStrategy.REPLACE_ON_CHANGE.name());
    try {
      return SyncStrategy.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(
          String.format("Invalid value for %s: %s", SYNC_STRATEGY, value), e);
    }
  }

  private boolean getBoolean(String name) {
    String value = getOrDefault(name, "false");
    if (value.equalsIgnoreCase("true")) {
      return true;
    }
    if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalStateException(String.format("Invalid value for %s: %s", name, value));
  }

  private int getMaxIngressRules() {
    String value =
        getOrDefault(MAX_INGRESS_RULES, String.valueOf(RouteSyncer.DEFAULT_MAX_INGRESS_RULES));
    int max;
    try {
      max = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException(
          String.format("Invalid value for %s: %s", MAX_INGRESS_RULES, value), e);
    }
    if (max <= 0) {
      throw new IllegalStateException(
          String.format("%s must be positive: %d", MAX_INGRESS_RULES, max));
    }
    return max;
  }
}
