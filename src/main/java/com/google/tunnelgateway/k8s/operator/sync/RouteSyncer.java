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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import com.google.tunnelgateway.k8s.operator.ingress.BuildResult;
import com.google.tunnelgateway.k8s.operator.ingress.IngressRule;
import com.google.tunnelgateway.k8s.operator.ingress.IngressRuleBuilder;
import com.google.tunnelgateway.k8s.operator.ingress.IngressRuleDiff;
import com.google.tunnelgateway.k8s.operator.ingress.IngressRuleRenderer;
import com.google.tunnelgateway.k8s.operator.ingress.RouteEntry;
import com.google.tunnelgateway.k8s.operator.ingress.RouteEntryComparator;
import com.google.tunnelgateway.k8s.operator.ingress.RouteKind;
import com.google.tunnelgateway.k8s.operator.ingress.RuleDiff;
import com.google.tunnelgateway.k8s.operator.metrics.MetricsCollector;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.GRPCRoute;
import com.google.tunnelgateway.k8s.operator.v1.api.model.route.HTTPRoute;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles all HTTPRoutes and GRPCRoutes attached to the tunnel and writes the resulting ingress
 * rules to the tunnel configuration.
 */
@Singleton
public class RouteSyncer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final int DEFAULT_MAX_INGRESS_RULES = 1000;

  private final IngressRuleBuilder<HTTPRoute> httpBuilder;
  private final IngressRuleBuilder<GRPCRoute> grpcBuilder;
  private final TunnelConfigurationClient tunnelClient;
  private final MetricsCollector metrics;
  private final SyncStrategy strategy;
  private final int maxIngressRules;

  @Inject
  public RouteSyncer(
      IngressRuleBuilder<HTTPRoute> httpBuilder,
      IngressRuleBuilder<GRPCRoute> grpcBuilder,
      TunnelConfigurationClient tunnelClient,
      MetricsCollector metrics,
      @Named("SyncStrategy") SyncStrategy strategy,
      @Named("MaxIngressRules") int maxIngressRules) {
    checkArgument(maxIngressRules > 0, "maxIngressRules must be positive: %s", maxIngressRules);
    this.httpBuilder = httpBuilder;
    this.grpcBuilder = grpcBuilder;
    this.tunnelClient = tunnelClient;
    this.metrics = metrics;
    this.strategy = strategy;
    this.maxIngressRules = maxIngressRules;
  }

  public SyncResult sync(List<HTTPRoute> httpRoutes, List<GRPCRoute> grpcRoutes)
      throws TunnelConfigurationException, IngressRulesLimitExceededException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    logger.atInfo().log(
        "Syncing routes to Cloudflare Tunnel: httpRoutes=%d grpcRoutes=%d",
        httpRoutes.size(), grpcRoutes.size());

    BuildResult httpResult = httpBuilder.build(httpRoutes);
    BuildResult grpcResult = grpcBuilder.build(grpcRoutes);
    metrics.recordSyncedRoutes(RouteKind.HTTP.getLabel(), httpRoutes.size());
    metrics.recordSyncedRoutes(RouteKind.GRPC.getLabel(), grpcRoutes.size());
    metrics.recordFailedBackendRefs(RouteKind.HTTP.getLabel(), httpResult.getFailedRefs().size());
    metrics.recordFailedBackendRefs(RouteKind.GRPC.getLabel(), grpcResult.getFailedRefs().size());

    ImmutableList<IngressRule> desired = mergeRouteKinds(httpResult, grpcResult);

    List<IngressRule> live;
    try {
      live = tunnelClient.getIngressRules();
    } catch (TunnelConfigurationException e) {
      recordFailure(stopwatch, e);
      logger.atSevere().withCause(e).log("Failed to get current tunnel configuration");
      throw e;
    }

    RuleDiff diff = IngressRuleDiff.diffRules(live, desired);
    logger.atInfo().log(
        "Computed diff: toAdd=%d toRemove=%d", diff.getToAdd().size(), diff.getToRemove().size());

    ImmutableList<IngressRule> merged = IngressRuleDiff.ensureCatchAll(merge(live, desired, diff));

    if (merged.size() > maxIngressRules) {
      logger.atSevere().log(
          "Ingress rules limit exceeded: count=%d max=%d", merged.size(), maxIngressRules);
      metrics.recordSyncDuration(MetricsCollector.RESULT_FAILED, stopwatch.elapsed());
      throw new IngressRulesLimitExceededException(
          merged.size(),
          maxIngressRules,
          new SyncResult(
              httpResult.getFailedRefs(), grpcResult.getFailedRefs(), live, diff, false));
    }

    boolean updated = !merged.equals(live);
    if (updated) {
      try {
        tunnelClient.updateIngressRules(merged);
      } catch (TunnelConfigurationException e) {
        recordFailure(stopwatch, e);
        logger.atSevere().withCause(e).log("Failed to update tunnel configuration");
        throw e;
      }
      logger.atInfo().log("Successfully updated tunnel configuration: rules=%d", merged.size());
    } else {
      logger.atInfo().log("Tunnel configuration is up to date: rules=%d", merged.size());
    }

    metrics.recordIngressRules(merged.size());
    metrics.recordSyncDuration(MetricsCollector.RESULT_SUCCESS, stopwatch.elapsed());
    return new SyncResult(
        httpResult.getFailedRefs(), grpcResult.getFailedRefs(), merged, diff, updated);
  }

  /**
   * Sorts the entries of both route kinds as one list, so that wildcard-host entries of either kind
   * follow every entry with a specific hostname.
   */
  private static ImmutableList<IngressRule> mergeRouteKinds(
      BuildResult httpResult, BuildResult grpcResult) {
    List<RouteEntry> entries = new ArrayList<>(httpResult.getEntries());
    entries.addAll(grpcResult.getEntries());
    entries.sort(RouteEntryComparator.INSTANCE);
    return IngressRuleRenderer.render(entries, false);
  }

  private List<IngressRule> merge(
      List<IngressRule> live, List<IngressRule> desired, RuleDiff diff) {
    switch (strategy) {
      case MINIMAL_PATCH:
        return IngressRuleDiff.applyDiff(live, diff);
      case REPLACE_ON_CHANGE:
      default:
        ImmutableList<IngressRule> liveRules = IngressRuleDiff.withoutCatchAll(live);
        return liveRules.equals(desired) ? liveRules : desired;
    }
  }

  private void recordFailure(Stopwatch stopwatch, TunnelConfigurationException e) {
    metrics.recordSyncError(e.getErrorType().getLabel());
    metrics.recordSyncDuration(MetricsCollector.RESULT_FAILED, stopwatch.elapsed());
  }
}
