package com.visitsense.loadgen.scheduler;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.config.LoadGeneratorConfig;
import com.visitsense.loadgen.core.PageUrl;

/**
 * Génération continue au débit TARGET_VISITS_PER_DAY.
 *
 * S'arrête sur AUTO_STOP_AFTER_HOURS, MAX_TOTAL_VISITS ou {@link #stop()}.
 * MAX_VISITS_PER_DAY suspend l'admission jusqu'à la fin de la fenêtre de 24 h.
 */
public class RealtimeScheduler {
    private static final Logger logger = LoggerFactory.getLogger(RealtimeScheduler.class);

    static final long SUPERVISOR_TICK_MS = 500;
    private static final long PROGRESS_LOG_INTERVAL_MS = 60_000;

    private final LoadGeneratorConfig config;
    private final VisitRunner runner;
    private final List<PageUrl> urls;

    private final AtomicBoolean running;
    private final AtomicBoolean cancelled;
    private final CountDownLatch finished;

    private volatile VisitPipeline pipeline;
    private volatile DailyCapGate dailyCap;
    private volatile long startTime;

    public RealtimeScheduler(LoadGeneratorConfig config, VisitRunner runner, List<PageUrl> urls) {
        this.config = config;
        this.runner = runner;
        this.urls = urls;
        this.running = new AtomicBoolean(false);
        this.cancelled = new AtomicBoolean(false);
        this.finished = new CountDownLatch(1);
    }

    /**
     * Bloque jusqu'à la condition d'arrêt puis renvoie le bilan.
     */
    public RunSummary run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Realtime scheduler already running");
        }
        startTime = System.currentTimeMillis();
        dailyCap = config.getMaxVisitsPerDay() > 0
            ? new DailyCapGate(config.getMaxVisitsPerDay(), startTime / 1000)
            : null;
        pipeline = new VisitPipeline("realtime", runner, urls, config.getConcurrency(),
            config.getVisitsPerSecond(), config.getMaxTotalVisits(), null, dailyCap);

        logger.info("=== Realtime generation started: {} visits/day ({} visits/s), concurrency={} ===",
                   String.format("%.0f", config.getTargetVisitsPerDay()),
                   String.format("%.3f", config.getVisitsPerSecond()), config.getConcurrency());
        if (config.getAutoStopAfterHours() > 0) {
            logger.info("Auto-stop after {} hour(s)", config.getAutoStopAfterHours());
        }
        if (config.getMaxTotalVisits() > 0) {
            logger.info("Stopping after {} visits", config.getMaxTotalVisits());
        }
        if (dailyCap != null) {
            logger.info("Daily cap: {} visits per 24h window", config.getMaxVisitsPerDay());
        }

        pipeline.start();
        try {
            supervise();
        } finally {
            pipeline.stop();
            running.set(false);
            finished.countDown();
        }

        RunSummary summary = new RunSummary(pipeline.getCompleted(),
            (System.currentTimeMillis() - startTime) / 1000.0);
        logger.info("=== Realtime generation finished: {} ===", summary);
        return summary;
    }

    private void supervise() {
        long autoStopMs = (long) (config.getAutoStopAfterHours() * 3_600_000L);
        long maxTotal = config.getMaxTotalVisits();
        long lastLog = System.currentTimeMillis();
        boolean capLogged = false;

        while (!cancelled.get()) {
            long now = System.currentTimeMillis();
            if (autoStopMs > 0 && now - startTime >= autoStopMs) {
                logger.info("Auto-stop reached after {} hour(s)", config.getAutoStopAfterHours());
                return;
            }
            if (maxTotal > 0 && pipeline.getCompleted() >= maxTotal) {
                logger.info("Max total visits reached: {}", pipeline.getCompleted());
                return;
            }
            if (dailyCap != null && dailyCap.isPaused()) {
                if (!capLogged) {
                    logger.info("Daily cap of {} visits reached, pausing until the window resets",
                               dailyCap.getCap());
                    capLogged = true;
                }
            } else {
                capLogged = false;
            }
            if (now - lastLog >= PROGRESS_LOG_INTERVAL_MS) {
                logger.info("Visits so far: {} (queued {}, failed {})",
                           pipeline.getCompleted(), pipeline.getQueueSize(), pipeline.getFailed());
                lastLog = now;
            }
            try {
                TimeUnit.MILLISECONDS.sleep(SUPERVISOR_TICK_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        logger.info("Realtime generation cancelled");
    }

    /**
     * Annulation externe ; {@link #run()} rend la main après l'arrêt des workers.
     */
    public void stop() {
        cancelled.set(true);
    }

    /**
     * Attend la fin de {@link #run()} (utilisé par le hook d'arrêt).
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    public boolean isRunning() {
        return running.get();
    }

    public RealtimeStatistics getStatistics() {
        VisitPipeline p = pipeline;
        long uptime = startTime > 0 ? System.currentTimeMillis() - startTime : 0;
        return new RealtimeStatistics(
            running.get(),
            p != null ? p.getScheduled() : 0,
            p != null ? p.getCompleted() : 0,
            p != null ? p.getFailed() : 0,
            p != null ? p.getQueueSize() : 0,
            uptime,
            config.getTargetVisitsPerDay(),
            dailyCap != null && dailyCap.isPaused()
        );
    }

    /**
     * Statistiques du planificateur temps réel
     */
    public static class RealtimeStatistics {
        private final boolean running;
        private final long visitsScheduled;
        private final long visitsCompleted;
        private final long visitsFailed;
        private final int queueSize;
        private final long uptimeMs;
        private final double targetVisitsPerDay;
        private final boolean dailyCapPaused;

        public RealtimeStatistics(boolean running, long visitsScheduled, long visitsCompleted,
                                  long visitsFailed, int queueSize, long uptimeMs,
                                  double targetVisitsPerDay, boolean dailyCapPaused) {
            this.running = running;
            this.visitsScheduled = visitsScheduled;
            this.visitsCompleted = visitsCompleted;
            this.visitsFailed = visitsFailed;
            this.queueSize = queueSize;
            this.uptimeMs = uptimeMs;
            this.targetVisitsPerDay = targetVisitsPerDay;
            this.dailyCapPaused = dailyCapPaused;
        }

        public boolean isRunning() { return running; }
        public long getVisitsScheduled() { return visitsScheduled; }
        public long getVisitsCompleted() { return visitsCompleted; }
        public long getVisitsFailed() { return visitsFailed; }
        public int getQueueSize() { return queueSize; }
        public long getUptimeMs() { return uptimeMs; }
        public double getTargetVisitsPerDay() { return targetVisitsPerDay; }
        public boolean isDailyCapPaused() { return dailyCapPaused; }

        public double getImpliedDailyRate() {
            return uptimeMs > 0 ? visitsCompleted * 86_400_000.0 / uptimeMs : 0.0;
        }

        @Override
        public String toString() {
            return String.format("RealtimeStats{completed=%d, failed=%d, queued=%d, implied=%.0f/day}",
                visitsCompleted, visitsFailed, queueSize, getImpliedDailyRate());
        }
    }
}
