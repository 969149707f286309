package com.visitsense.loadgen.scheduler;

/**
 * Plafond glissant de visites admises par fenêtre de 24 h (MAX_VISITS_PER_DAY).
 * La fenêtre repart de zéro dès qu'elle a duré 24 h ; un plafond à 0 désactive le contrôle.
 * Utilisé par le seul thread producteur.
 */
public class DailyCapGate {
    public static final long WINDOW_SECONDS = 86_400L;

    private final long cap;
    private long windowStartSeconds;
    private long admitted;
    private volatile boolean paused;

    public DailyCapGate(long cap, long nowSeconds) {
        this.cap = cap;
        this.windowStartSeconds = nowSeconds;
        this.admitted = 0;
    }

    /**
     * Règle de décision pure.
     *
     * @return la décision et l'état de fenêtre éventuellement réinitialisé
     */
    public static Decision check(long nowSeconds, long windowStartSeconds, long visits, long cap) {
        if (cap <= 0) {
            return new Decision(false, windowStartSeconds, visits);
        }
        if (nowSeconds - windowStartSeconds >= WINDOW_SECONDS) {
            return new Decision(false, nowSeconds, 0);
        }
        return new Decision(visits >= cap, windowStartSeconds, visits);
    }

    /**
     * @return true si une nouvelle visite peut être admise maintenant
     */
    public boolean allows(long nowSeconds) {
        Decision decision = check(nowSeconds, windowStartSeconds, admitted, cap);
        windowStartSeconds = decision.getWindowStartSeconds();
        admitted = decision.getVisits();
        paused = decision.isPause();
        return !paused;
    }

    public void recordAdmission() {
        admitted++;
    }

    public long getAdmitted() { return admitted; }
    public long getWindowStartSeconds() { return windowStartSeconds; }
    public long getCap() { return cap; }
    public boolean isPaused() { return paused; }

    /**
     * Résultat de {@link #check}.
     */
    public static final class Decision {
        private final boolean pause;
        private final long windowStartSeconds;
        private final long visits;

        public Decision(boolean pause, long windowStartSeconds, long visits) {
            this.pause = pause;
            this.windowStartSeconds = windowStartSeconds;
            this.visits = visits;
        }

        public boolean isPause() { return pause; }
        public long getWindowStartSeconds() { return windowStartSeconds; }
        public long getVisits() { return visits; }
    }
}
