package com.visitsense.loadgen.scheduler;

import java.util.List;
import java.util.Random;

import com.visitsense.loadgen.core.PageUrl;
import com.visitsense.loadgen.core.TimeWindow;

/**
 * Exécute la rafale d'une journée de backfill.
 */
public interface BackfillDayRunner {

    /**
     * @param seedSource générateur réensemencé pour ce jour, null sans BACKFILL_SEED
     * @return le nombre de visites réellement produites
     */
    long runDay(List<PageUrl> urls, TimeWindow day, long visitsTarget, double rpsLimit, Random seedSource)
        throws InterruptedException;

    /**
     * Interrompt la journée en cours.
     */
    default void cancel() {
    }
}
