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

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.tunnelgateway.k8s.operator.metrics.MetricsCollector;
import com.google.tunnelgateway.k8s.operator.referencegrant.ReferenceValidator;
import com.google.tunnelgateway.k8s.operator.service.ServiceReader;
import io.fabric8.kubernetes.api.model.HasMetadata;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles routes of one kind to an ordered list of Cloudflare Tunnel ingress rules.
 *
 * <p>Instances hold no mutable state and can be shared between threads, as long as the injected
 * collaborators can.
 *
 * @param <R> route resource type
 */
public class IngressRuleBuilder<R extends HasMetadata> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final RouteAdapter<R> adapter;
  private final BackendResolver resolver;
  private final MetricsCollector metrics;

  public IngressRuleBuilder(
      RouteAdapter<R> adapter,
      BuilderOptions options,
      ReferenceValidator validator,
      ServiceReader serviceReader,
      MetricsCollector metrics) {
    this.adapter = adapter;
    this.metrics = metrics;
    this.resolver = new BackendResolver(options, validator, serviceReader, metrics);
  }

  public IngressRuleBuilder(RouteAdapter<R> adapter, BuilderOptions options) {
    this(
        adapter,
        options,
        ReferenceValidator.ALLOW_ALL,
        ServiceReader.CLUSTER_DNS_ONLY,
        MetricsCollector.NOOP);
  }

  public RouteKind getRouteKind() {
    return adapter.getRouteKind();
  }

  public BuildResult build(List<R> routes) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    ExtractedEntries extracted = new ExtractedEntries();
    if (routes != null) {
      for (R route : routes) {
        adapter.extractEntries(route, resolver, extracted);
      }
    }

    List<RouteEntry> entries = new ArrayList<>(extracted.getEntries());
    entries.sort(RouteEntryComparator.INSTANCE);
    ImmutableList<IngressRule> rules = IngressRuleRenderer.render(entries, adapter.addCatchAll());

    metrics.recordIngressBuildDuration(adapter.getRouteKind().getLabel(), stopwatch.elapsed());
    logger.atFine().log(
        "Built %d %s ingress rules, %d failed backend references",
        rules.size(), adapter.getRouteKind().getLabel(), extracted.getFailedRefs().size());
    return new BuildResult(entries, rules, extracted.getFailedRefs());
  }
}
