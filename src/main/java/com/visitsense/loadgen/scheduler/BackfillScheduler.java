package com.visitsense.loadgen.scheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.config.LoadGeneratorConfig;
import com.visitsense.loadgen.core.PageUrl;
import com.visitsense.loadgen.core.TimeWindow;

/**
 * Reconstitue un historique jour par jour.
 *
 * Les jours sont traités séquentiellement ; chacun reçoit min(plafond journalier, budget restant)
 * visites horodatées entre minuit et minuit (heure locale du fuseau configuré).
 * Avec BACKFILL_SEED, chaque jour reçoit un générateur ensemencé avec seed + index du jour,
 * dont le producteur tire une graine par visite : le jour est rejouable quel que soit
 * l'ordre d'exécution des workers.
 */
public class BackfillScheduler {
    private static final Logger logger = LoggerFactory.getLogger(BackfillScheduler.class);

    private final LoadGeneratorConfig config;
    private final BackfillDayRunner dayRunner;
    private final Clock clock;
    private final AtomicBoolean cancelled;

    private volatile List<DaySummary> progress;

    public BackfillScheduler(LoadGeneratorConfig config, BackfillDayRunner dayRunner) {
        this(config, dayRunner, Clock.system(config.getTimezone()));
    }

    public BackfillScheduler(LoadGeneratorConfig config, BackfillDayRunner dayRunner, Clock clock) {
        this.config = config;
        this.dayRunner = dayRunner;
        this.clock = clock;
        this.cancelled = new AtomicBoolean(false);
        this.progress = Collections.emptyList();
    }

    /**
     * Valide la fenêtre (échec immédiat si elle est invalide) puis traite chaque jour.
     */
    public List<DaySummary> runBackfill(List<PageUrl> urls) {
        LocalDate today = LocalDate.now(clock.withZone(config.getTimezone()));
        BackfillWindow window = BackfillWindow.resolve(config, today);

        long perDayCap = config.getBackfillMaxVisitsPerDay() > 0
            ? config.getBackfillMaxVisitsPerDay()
            : Math.round(config.getTargetVisitsPerDay());
        long totalCap = config.getBackfillMaxVisitsTotal();
        long remaining = totalCap > 0 ? totalCap : Long.MAX_VALUE;
        double rps = config.getBackfillRpsLimit() != null
            ? config.getBackfillRpsLimit()
            : config.getVisitsPerSecond();
        Long seed = config.getBackfillSeed();

        logger.info("=== Backfill started: {} | per-day cap {} | total cap {} | {} visits/s{} ===",
                   window, perDayCap, totalCap > 0 ? totalCap : "unlimited",
                   String.format("%.2f", rps), seed != null ? " | seed " + seed : "");

        List<DaySummary> summaries = new ArrayList<>();
        List<LocalDate> dates = window.getDates();
        for (int dayIndex = 0; dayIndex < dates.size(); dayIndex++) {
            LocalDate date = dates.get(dayIndex);
            if (cancelled.get() || remaining <= 0) {
                summaries.add(DaySummary.skipped(date));
                logger.info("Backfill day {} skipped ({})", date, cancelled.get() ? "cancelled" : "total cap reached");
                continue;
            }

            long target = Math.min(perDayCap, remaining);
            Random daySeeds = seed != null ? new Random(seed + dayIndex) : null;
            TimeWindow dayWindow = dayWindow(date);
            long sent;
            try {
                sent = dayRunner.runDay(urls, dayWindow, target, rps, daySeeds);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelled.set(true);
                summaries.add(new DaySummary(date, 0, target, true));
                logger.warn("Backfill interrupted on {}", date);
                continue;
            }

            remaining -= sent;
            DaySummary summary = new DaySummary(date, sent, target, false);
            summaries.add(summary);
            progress = Collections.unmodifiableList(new ArrayList<>(summaries));
            logger.info("Backfill day {} done: {}/{} visits", date, sent, target);
        }

        progress = Collections.unmodifiableList(new ArrayList<>(summaries));
        long total = 0;
        for (DaySummary s : summaries) {
            total += s.getSent();
        }
        logger.info("=== Backfill finished: {} visits over {} day(s) ===", total, summaries.size());
        return summaries;
    }

    /**
     * Journée locale complète, tronquée à l'instant présent pour aujourd'hui.
     */
    private TimeWindow dayWindow(LocalDate date) {
        TimeWindow day = TimeWindow.ofDay(date, config.getTimezone());
        Instant now = clock.instant();
        if (day.getEnd().isAfter(now)) {
            return new TimeWindow(day.getStart(), now);
        }
        return day;
    }

    /**
     * Arrête le jour en cours ; les jours restants sont marqués comme ignorés.
     */
    public void stop() {
        if (cancelled.compareAndSet(false, true)) {
            logger.info("Backfill cancellation requested");
            dayRunner.cancel();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Jours déjà traités (instantané).
     */
    public List<DaySummary> getProgress() {
        return progress;
    }
}
