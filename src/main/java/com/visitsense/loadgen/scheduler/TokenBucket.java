package com.visitsense.loadgen.scheduler;

/**
 * Budget de débit du producteur : un jeton par visite admise.
 * Non thread-safe, appartient au seul thread producteur.
 */
public class TokenBucket {
    private final double ratePerSecond;
    private final double capacity;
    private double tokens;
    private long lastRefillNanos;

    /**
     * Le seau démarre avec un jeton pour que la première visite parte immédiatement.
     */
    public TokenBucket(double ratePerSecond, double capacity, long nowNanos) {
        if (ratePerSecond <= 0) {
            throw new IllegalArgumentException("Rate must be > 0, got " + ratePerSecond);
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be >= 1, got " + capacity);
        }
        this.ratePerSecond = ratePerSecond;
        this.capacity = capacity;
        this.tokens = 1.0;
        this.lastRefillNanos = nowNanos;
    }

    public void refill(long nowNanos) {
        long elapsed = nowNanos - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + ratePerSecond * elapsed / 1_000_000_000.0);
        lastRefillNanos = nowNanos;
    }

    public boolean tryTake() {
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    public double getTokens() { return tokens; }
    public double getRatePerSecond() { return ratePerSecond; }
    public double getCapacity() { return capacity; }
}
