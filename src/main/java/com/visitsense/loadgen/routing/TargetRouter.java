package com.visitsense.loadgen.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.math3.distribution.EnumeratedDistribution;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.config.ConfigurationException;

/**
 * Répartit les hits entre plusieurs cibles et tient leurs métriques.
 *
 * <ul>
 *   <li>round-robin : index monotone modulo le nombre de cibles actives (ignore les poids)</li>
 *   <li>weighted : probabilité proportionnelle au poids</li>
 *   <li>random : tirage uniforme</li>
 * </ul>
 * Les cibles désactivées ne sont jamais choisies mais gardent leurs métriques (à zéro).
 */
public class TargetRouter {
    private static final Logger logger = LoggerFactory.getLogger(TargetRouter.class);

    private final List<Target> allTargets;
    private final List<Target> enabledTargets;
    private final DistributionStrategy strategy;
    private final Random random;
    private final AtomicLong roundRobinIndex;
    private final Map<String, TargetMetrics> metrics;
    private final EnumeratedDistribution<Target> weightedDistribution;

    public TargetRouter(List<Target> targets) {
        this(targets, DistributionStrategy.ROUND_ROBIN);
    }

    public TargetRouter(List<Target> targets, DistributionStrategy strategy) {
        this(targets, strategy, new Random());
    }

    /**
     * @throws ConfigurationException si aucune cible n'est active, si un nom est dupliqué,
     *         ou si une cible active a un poids inférieur à 1 en mode weighted
     */
    public TargetRouter(List<Target> targets, DistributionStrategy strategy, Random random) {
        this.allTargets = Collections.unmodifiableList(new ArrayList<>(targets));
        this.strategy = strategy;
        this.random = random;
        this.roundRobinIndex = new AtomicLong(0);
        this.metrics = new LinkedHashMap<>();

        List<Target> enabled = new ArrayList<>();
        for (Target target : allTargets) {
            if (metrics.containsKey(target.getName())) {
                throw new ConfigurationException("Duplicate target name: " + target.getName());
            }
            metrics.put(target.getName(), new TargetMetrics(target.getName()));
            if (target.isEnabled()) {
                enabled.add(target);
            }
        }
        this.enabledTargets = Collections.unmodifiableList(enabled);

        if (enabledTargets.isEmpty()) {
            throw new ConfigurationException("At least one target must be enabled");
        }

        if (strategy == DistributionStrategy.WEIGHTED) {
            List<Pair<Target, Double>> pmf = new ArrayList<>();
            for (Target target : enabledTargets) {
                if (target.getWeight() < 1) {
                    throw new ConfigurationException("Target '" + target.getName()
                        + "' has weight " + target.getWeight()
                        + "; all enabled targets must have weight >= 1 for weighted distribution");
                }
                pmf.add(new Pair<>(target, (double) target.getWeight()));
            }
            this.weightedDistribution = new EnumeratedDistribution<>(
                RandomGeneratorFactory.createRandomGenerator(random), pmf);
        } else {
            this.weightedDistribution = null;
        }

        logger.info("Target router initialized: {} target(s), {} enabled, strategy={}",
                   allTargets.size(), enabledTargets.size(), strategy);
    }

    /**
     * Choisit la cible du prochain hit.
     */
    public Target nextTarget() {
        switch (strategy) {
            case WEIGHTED:
                synchronized (weightedDistribution) {
                    return weightedDistribution.sample();
                }
            case RANDOM:
                return enabledTargets.get(random.nextInt(enabledTargets.size()));
            case ROUND_ROBIN:
            default:
                long index = roundRobinIndex.getAndIncrement();
                return enabledTargets.get((int) Math.floorMod(index, (long) enabledTargets.size()));
        }
    }

    public void recordSuccess(Target target, double latencyMs) {
        metricsFor(target).recordSuccess(latencyMs);
    }

    public void recordFailure(Target target, String error) {
        metricsFor(target).recordFailure(error);
    }

    private TargetMetrics metricsFor(Target target) {
        TargetMetrics m = metrics.get(target.getName());
        if (m == null) {
            throw new IllegalArgumentException("Unknown target: " + target.getName());
        }
        return m;
    }

    public TargetMetrics getMetrics(String targetName) {
        return metrics.get(targetName);
    }

    public Map<String, TargetMetrics> getAllMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public RouterSummary getSummary() {
        Map<String, TargetMetrics.Snapshot> snapshots = new LinkedHashMap<>();
        for (Map.Entry<String, TargetMetrics> entry : metrics.entrySet()) {
            snapshots.put(entry.getKey(), entry.getValue().snapshot());
        }
        return new RouterSummary(allTargets.size(), enabledTargets.size(), strategy.getLabel(), snapshots);
    }

    /**
     * Journalise l'état de chaque cible (appelé en fin d'exécution).
     */
    public void logReport() {
        RouterSummary summary = getSummary();
        logger.info("=== Target Report: {} ===", summary);
        for (Map.Entry<String, TargetMetrics.Snapshot> entry : summary.getPerTargetMetrics().entrySet()) {
            logger.info("  {}: {}", entry.getKey(), entry.getValue());
        }
    }

    public List<Target> getAllTargets() { return allTargets; }
    public List<Target> getEnabledTargets() { return enabledTargets; }
    public DistributionStrategy getStrategy() { return strategy; }
}
