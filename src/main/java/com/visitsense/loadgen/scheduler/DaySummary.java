package com.visitsense.loadgen.scheduler;

import java.time.LocalDate;

/**
 * Résultat d'une journée de backfill.
 */
public class DaySummary {
    private final LocalDate date;
    private final long sent;
    private final long target;
    private final boolean skipped;

    public DaySummary(LocalDate date, long sent, long target, boolean skipped) {
        this.date = date;
        this.sent = sent;
        this.target = target;
        this.skipped = skipped;
    }

    public static DaySummary skipped(LocalDate date) {
        return new DaySummary(date, 0, 0, true);
    }

    public LocalDate getDate() { return date; }
    public long getSent() { return sent; }
    public long getTarget() { return target; }
    public boolean isSkipped() { return skipped; }

    @Override
    public String toString() {
        return String.format("DaySummary{date=%s, sent=%d, target=%d, skipped=%b}", date, sent, target, skipped);
    }
}
