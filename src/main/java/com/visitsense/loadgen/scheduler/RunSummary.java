package com.visitsense.loadgen.scheduler;

/**
 * Bilan d'une exécution temps réel.
 */
public class RunSummary {
    private final long totalVisits;
    private final double elapsedSeconds;
    private final double impliedDailyRate;

    public RunSummary(long totalVisits, double elapsedSeconds) {
        this.totalVisits = totalVisits;
        this.elapsedSeconds = elapsedSeconds;
        this.impliedDailyRate = elapsedSeconds > 0 ? totalVisits / elapsedSeconds * 86400.0 : 0.0;
    }

    public long getTotalVisits() { return totalVisits; }
    public double getElapsedSeconds() { return elapsedSeconds; }
    public double getImpliedDailyRate() { return impliedDailyRate; }

    @Override
    public String toString() {
        return String.format("RunSummary{total_visits=%d, elapsed=%.1fs, implied_daily_rate=%.0f}",
            totalVisits, elapsedSeconds, impliedDailyRate);
    }
}
