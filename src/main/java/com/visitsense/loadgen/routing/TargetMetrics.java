package com.visitsense.loadgen.routing;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Compteurs d'exécution d'une cible, mis à jour par plusieurs workers en parallèle.
 * Jamais remis à zéro.
 */
public class TargetMetrics {
    public static final double HEALTHY_THRESHOLD = 0.95;
    public static final double DEGRADED_THRESHOLD = 0.70;

    private final String targetName;
    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong successfulRequests = new AtomicLong(0);
    private final AtomicLong failedRequests = new AtomicLong(0);
    private final DoubleAdder totalLatencyMs = new DoubleAdder();

    private volatile String lastError;
    private volatile Instant lastSuccess;
    private volatile Instant lastFailure;

    public TargetMetrics(String targetName) {
        this.targetName = targetName;
    }

    public void recordSuccess(double latencyMs) {
        totalLatencyMs.add(latencyMs);
        successfulRequests.incrementAndGet();
        totalRequests.incrementAndGet();
        lastSuccess = Instant.now();
    }

    public void recordFailure(String error) {
        lastError = error;
        failedRequests.incrementAndGet();
        totalRequests.incrementAndGet();
        lastFailure = Instant.now();
    }

    /**
     * Latence moyenne sur les seuls succès.
     * @return null tant qu'aucun succès n'a été enregistré
     */
    public Double getAvgLatencyMs() {
        long successes = successfulRequests.get();
        if (successes == 0) {
            return null;
        }
        return totalLatencyMs.sum() / successes;
    }

    public double getSuccessRate() {
        long total = totalRequests.get();
        if (total == 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) successfulRequests.get() / total);
    }

    public TargetStatus getStatus() {
        if (totalRequests.get() == 0) {
            return TargetStatus.UNKNOWN;
        }
        double rate = getSuccessRate();
        if (rate >= HEALTHY_THRESHOLD) {
            return TargetStatus.HEALTHY;
        } else if (rate >= DEGRADED_THRESHOLD) {
            return TargetStatus.DEGRADED;
        }
        return TargetStatus.FAILED;
    }

    public Snapshot snapshot() {
        return new Snapshot(totalRequests.get(), successfulRequests.get(), failedRequests.get(),
            getSuccessRate(), getAvgLatencyMs(), getStatus().getLabel(), lastError);
    }

    public String getTargetName() { return targetName; }
    public long getTotalRequests() { return totalRequests.get(); }
    public long getSuccessfulRequests() { return successfulRequests.get(); }
    public long getFailedRequests() { return failedRequests.get(); }
    public double getTotalLatencyMs() { return totalLatencyMs.sum(); }
    public String getLastError() { return lastError; }
    public Instant getLastSuccess() { return lastSuccess; }
    public Instant getLastFailure() { return lastFailure; }

    public enum TargetStatus {
        HEALTHY("healthy"),
        DEGRADED("degraded"),
        FAILED("failed"),
        UNKNOWN("unknown");

        private final String label;

        TargetStatus(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    /**
     * Vue figée des compteurs, sérialisée telle quelle dans les rapports.
     */
    public static class Snapshot {
        private final long requests;
        private final long successes;
        private final long failures;
        private final double successRate;
        private final Double avgLatencyMs;
        private final String status;
        private final String lastError;

        public Snapshot(long requests, long successes, long failures, double successRate,
                        Double avgLatencyMs, String status, String lastError) {
            this.requests = requests;
            this.successes = successes;
            this.failures = failures;
            this.successRate = successRate;
            this.avgLatencyMs = avgLatencyMs;
            this.status = status;
            this.lastError = lastError;
        }

        public long getRequests() { return requests; }
        public long getSuccesses() { return successes; }
        public long getFailures() { return failures; }
        public double getSuccessRate() { return successRate; }
        public Double getAvgLatencyMs() { return avgLatencyMs; }
        public String getStatus() { return status; }
        public String getLastError() { return lastError; }

        @Override
        public String toString() {
            return String.format("requests=%d, ok=%d, failed=%d, rate=%.1f%%, latency=%s, status=%s",
                requests, successes, failures, successRate * 100,
                avgLatencyMs == null ? "n/a" : String.format("%.1fms", avgLatencyMs), status);
        }
    }
}
