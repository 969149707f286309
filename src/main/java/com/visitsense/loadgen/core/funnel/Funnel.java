package com.visitsense.loadgen.core.funnel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.visitsense.loadgen.config.ConfigurationException;

/**
 * Parcours scripté : une suite ordonnée d'étapes, déclenchée avec une probabilité donnée.
 * Les funnels de priorité plus basse sont essayés en premier.
 */
public final class Funnel {
    private final String name;
    private final String description;
    private final double probability;
    private final int priority;
    private final boolean enabled;
    private final boolean exitAfterCompletion;
    private final List<FunnelStep> steps;

    public Funnel(String name, double probability, List<FunnelStep> steps) {
        this(name, null, probability, 0, true, true, steps);
    }

    /**
     * @throws ConfigurationException si le nom manque, si la probabilité sort de [0, 1],
     *         si la liste d'étapes est vide ou si la première étape n'est pas une page vue
     */
    public Funnel(String name, String description, double probability, int priority,
                  boolean enabled, boolean exitAfterCompletion, List<FunnelStep> steps) {
        if (name == null || name.trim().isEmpty()) {
            throw new ConfigurationException("Funnel name is required");
        }
        if (probability < 0.0 || probability > 1.0) {
            throw new ConfigurationException("Funnel '" + name + "' probability must be between 0 and 1");
        }
        if (steps == null || steps.isEmpty()) {
            throw new ConfigurationException("Funnel '" + name + "' has no steps");
        }
        if (steps.get(0).getType() != StepType.PAGEVIEW) {
            throw new ConfigurationException("Funnel '" + name + "' must start with a pageview step, got "
                + steps.get(0).getType());
        }
        this.name = name.trim();
        this.description = description;
        this.probability = probability;
        this.priority = priority;
        this.enabled = enabled;
        this.exitAfterCompletion = exitAfterCompletion;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public double getProbability() { return probability; }
    public int getPriority() { return priority; }
    public boolean isEnabled() { return enabled; }
    public boolean isExitAfterCompletion() { return exitAfterCompletion; }
    public List<FunnelStep> getSteps() { return steps; }

    @Override
    public String toString() {
        return String.format("Funnel{name=%s, probability=%.2f, priority=%d, steps=%d, exit=%b}",
            name, probability, priority, steps.size(), exitAfterCompletion);
    }
}
