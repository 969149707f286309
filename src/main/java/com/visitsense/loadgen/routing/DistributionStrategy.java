package com.visitsense.loadgen.routing;

import com.visitsense.loadgen.config.ConfigurationException;

/**
 * Stratégie de répartition des hits entre cibles.
 */
public enum DistributionStrategy {
    ROUND_ROBIN("round-robin"),
    WEIGHTED("weighted"),
    RANDOM("random");

    private final String label;

    DistributionStrategy(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static DistributionStrategy fromLabel(String label) {
        for (DistributionStrategy strategy : values()) {
            if (strategy.label.equalsIgnoreCase(label)) {
                return strategy;
            }
        }
        throw new ConfigurationException("Unknown distribution strategy: " + label
            + " (expected round-robin, weighted or random)");
    }

    @Override
    public String toString() {
        return label;
    }
}
