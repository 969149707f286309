package com.visitsense.loadgen.scheduler;

import java.util.Random;

import com.visitsense.loadgen.core.TimeWindow;

/**
 * Unité de travail de la file : une visite à produire.
 * {@link #POISON} demande à un worker de s'arrêter.
 */
public final class VisitJob {
    public static final VisitJob POISON = new VisitJob(null, null, true);

    private static final VisitJob REALTIME = new VisitJob(null, null, false);

    private final TimeWindow window;
    private final Long seed;
    private final boolean poison;

    private VisitJob(TimeWindow window, Long seed, boolean poison) {
        this.window = window;
        this.seed = seed;
        this.poison = poison;
    }

    public static VisitJob realtime() {
        return REALTIME;
    }

    public static VisitJob within(TimeWindow window) {
        return new VisitJob(window, null, false);
    }

    /**
     * @param seed graine de la visite, tirée par le producteur dans l'ordre d'admission
     */
    public static VisitJob within(TimeWindow window, Long seed) {
        return new VisitJob(window, seed, false);
    }

    /**
     * @return la fenêtre de backfill, ou null en temps réel
     */
    public TimeWindow getWindow() {
        return window;
    }

    public Long getSeed() {
        return seed;
    }

    /**
     * @return un générateur propre à la visite, ou null sans graine
     */
    public Random newRandom() {
        return seed != null ? new Random(seed) : null;
    }

    public boolean isPoison() {
        return poison;
    }
}
