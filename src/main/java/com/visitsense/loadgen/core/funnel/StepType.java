package com.visitsense.loadgen.core.funnel;

/**
 * Types d'étapes d'un funnel.
 */
public enum StepType {
    PAGEVIEW("pageview"),
    EVENT("event"),
    SITE_SEARCH("site_search"),
    OUTLINK("outlink"),
    DOWNLOAD("download"),
    ECOMMERCE("ecommerce");

    private final String label;

    StepType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @throws IllegalArgumentException pour un type inconnu
     */
    public static StepType fromLabel(String label) {
        if (label != null) {
            for (StepType type : values()) {
                if (type.label.equalsIgnoreCase(label.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown step type: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
