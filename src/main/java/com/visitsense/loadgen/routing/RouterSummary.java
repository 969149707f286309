package com.visitsense.loadgen.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rapport agrégé du routeur, tolérant une légère incohérence entre compteurs.
 */
public class RouterSummary {
    private final int totalTargets;
    private final int enabledTargets;
    private final String strategy;
    private final long totalRequests;
    private final long totalSuccesses;
    private final long totalFailures;
    private final double overallSuccessRate;
    private final Map<String, TargetMetrics.Snapshot> perTargetMetrics;

    public RouterSummary(int totalTargets, int enabledTargets, String strategy,
                         Map<String, TargetMetrics.Snapshot> perTargetMetrics) {
        this.totalTargets = totalTargets;
        this.enabledTargets = enabledTargets;
        this.strategy = strategy;
        this.perTargetMetrics = Collections.unmodifiableMap(new LinkedHashMap<>(perTargetMetrics));

        long requests = 0;
        long successes = 0;
        long failures = 0;
        for (TargetMetrics.Snapshot snapshot : perTargetMetrics.values()) {
            requests += snapshot.getRequests();
            successes += snapshot.getSuccesses();
            failures += snapshot.getFailures();
        }
        this.totalRequests = requests;
        this.totalSuccesses = successes;
        this.totalFailures = failures;
        this.overallSuccessRate = requests > 0 ? (double) successes / requests : 0.0;
    }

    public int getTotalTargets() { return totalTargets; }
    public int getEnabledTargets() { return enabledTargets; }
    public String getStrategy() { return strategy; }
    public long getTotalRequests() { return totalRequests; }
    public long getTotalSuccesses() { return totalSuccesses; }
    public long getTotalFailures() { return totalFailures; }
    public double getOverallSuccessRate() { return overallSuccessRate; }
    public Map<String, TargetMetrics.Snapshot> getPerTargetMetrics() { return perTargetMetrics; }

    @Override
    public String toString() {
        return String.format(
            "RouterSummary{targets=%d/%d, strategy=%s, requests=%d, ok=%d, failed=%d, rate=%.1f%%}",
            enabledTargets, totalTargets, strategy, totalRequests, totalSuccesses, totalFailures,
            overallSuccessRate * 100
        );
    }
}
