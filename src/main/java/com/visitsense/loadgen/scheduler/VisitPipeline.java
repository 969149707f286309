package com.visitsense.loadgen.scheduler;

import java.util.List;
import java.util.Random;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.core.PageUrl;
import com.visitsense.loadgen.core.TimeWindow;

/**
 * Producteur unique + pool fixe de workers reliés par une file bornée (2 x concurrence).
 *
 * Le producteur se réveille toutes les 250 ms, recharge le seau de jetons, consulte le
 * plafond journalier et enfile autant de visites que jetons et place le permettent.
 * Les workers consomment la file jusqu'à recevoir un {@link VisitJob#POISON}.
 */
public class VisitPipeline {
    private static final Logger logger = LoggerFactory.getLogger(VisitPipeline.class);

    static final long PRODUCER_TICK_MS = 250;
    private static final long WORKER_SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final String name;
    private final VisitRunner runner;
    private final List<PageUrl> urls;
    private final int concurrency;
    private final double ratePerSecond;
    private final long maxJobs;
    private final TimeWindow window;
    private final DailyCapGate dailyCap;
    private final Random seedSource;
    // propre au thread producteur
    private Long carriedSeed;

    private final BlockingQueue<VisitJob> queue;
    private final AtomicBoolean admitting;
    private final AtomicBoolean stopped;
    private final AtomicLong scheduled;
    private final AtomicLong completed;
    private final AtomicLong failed;

    private volatile ExecutorService producerExecutor;
    private volatile ExecutorService workerPool;

    /**
     * @param maxJobs nombre de visites à admettre au plus (0 = illimité)
     * @param window  fenêtre de backfill, null en temps réel
     * @param dailyCap plafond journalier, null si aucun
     */
    public VisitPipeline(String name, VisitRunner runner, List<PageUrl> urls, int concurrency,
                         double ratePerSecond, long maxJobs, TimeWindow window, DailyCapGate dailyCap) {
        this(name, runner, urls, concurrency, ratePerSecond, maxJobs, window, dailyCap, null);
    }

    /**
     * @param seedSource générateur dont le producteur tire une graine par visite admise,
     *                   null pour des visites non rejouables
     */
    public VisitPipeline(String name, VisitRunner runner, List<PageUrl> urls, int concurrency,
                         double ratePerSecond, long maxJobs, TimeWindow window, DailyCapGate dailyCap,
                         Random seedSource) {
        this.name = name;
        this.runner = runner;
        this.urls = urls;
        this.concurrency = concurrency;
        this.ratePerSecond = ratePerSecond;
        this.maxJobs = maxJobs;
        this.window = window;
        this.dailyCap = dailyCap;
        this.seedSource = seedSource;
        this.queue = new ArrayBlockingQueue<>(2 * concurrency);
        this.admitting = new AtomicBoolean(false);
        this.stopped = new AtomicBoolean(false);
        this.scheduled = new AtomicLong(0);
        this.completed = new AtomicLong(0);
        this.failed = new AtomicLong(0);
    }

    /**
     * @return false si le pipeline a déjà été démarré ou arrêté
     */
    public synchronized boolean start() {
        if (stopped.get()) {
            logger.debug("Pipeline {} stopped before start, nothing to run", name);
            return false;
        }
        if (!admitting.compareAndSet(false, true)) {
            logger.warn("Pipeline {} already started", name);
            return false;
        }
        workerPool = Executors.newFixedThreadPool(concurrency);
        for (int i = 0; i < concurrency; i++) {
            workerPool.submit(this::workerLoop);
        }
        producerExecutor = Executors.newSingleThreadExecutor();
        producerExecutor.submit(this::produce);
        logger.debug("Pipeline {} started: {} workers, {} visits/s, max {}",
                    name, concurrency, String.format("%.3f", ratePerSecond), maxJobs);
        return true;
    }

    private void produce() {
        TokenBucket bucket = new TokenBucket(ratePerSecond, concurrency, System.nanoTime());

        while (admitting.get() && !quotaReached()) {
            bucket.refill(System.nanoTime());
            boolean open = dailyCap == null || dailyCap.allows(System.currentTimeMillis() / 1000);

            while (open && admitting.get() && !quotaReached()
                    && bucket.getTokens() >= 1.0 && queue.remainingCapacity() > 0) {
                VisitJob job = nextJob();
                if (!queue.offer(job)) {
                    carriedSeed = job.getSeed();
                    break;
                }
                bucket.tryTake();
                scheduled.incrementAndGet();
                if (dailyCap != null) {
                    dailyCap.recordAdmission();
                    open = dailyCap.allows(System.currentTimeMillis() / 1000);
                }
            }

            try {
                TimeUnit.MILLISECONDS.sleep(PRODUCER_TICK_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.debug("Pipeline {} producer finished after scheduling {} visits", name, scheduled.get());
    }

    /**
     * Une graine tirée pour un job refusé par la file est reprise par le job suivant,
     * de sorte que la n-ième visite admise reçoit toujours la n-ième graine.
     */
    private VisitJob nextJob() {
        if (seedSource == null) {
            return window == null ? VisitJob.realtime() : VisitJob.within(window);
        }
        Long seed = carriedSeed != null ? carriedSeed : seedSource.nextLong();
        carriedSeed = null;
        return VisitJob.within(window, seed);
    }

    private boolean quotaReached() {
        return maxJobs > 0 && scheduled.get() >= maxJobs;
    }

    private void workerLoop() {
        while (true) {
            VisitJob job;
            try {
                job = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (job.isPoison()) {
                return;
            }
            try {
                runner.run(urls, job.getWindow(), job.newRandom());
            } catch (RuntimeException e) {
                failed.incrementAndGet();
                logger.warn("Visit failed in pipeline {}: {}", name, e.toString());
                logger.debug("Visit failure details", e);
            } finally {
                completed.incrementAndGet();
            }
        }
    }

    /**
     * Attend que le producteur ait admis toutes les visites prévues, puis laisse les workers
     * vider la file avant de les arrêter.
     *
     * @return le nombre de visites terminées (0 si le pipeline a été arrêté avant de démarrer)
     */
    public long runToCompletion() throws InterruptedException {
        if (!start()) {
            return completed.get();
        }
        producerExecutor.shutdown();
        while (!producerExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
            if (stopped.get()) {
                break;
            }
        }
        if (stopped.compareAndSet(false, true)) {
            admitting.set(false);
            shutdownWorkers();
        }
        return completed.get();
    }

    /**
     * Arrêt coopératif : plus d'admission, file vidée, un sentinelle par worker,
     * attente des workers puis du producteur.
     */
    public void stop() {
        synchronized (this) {
            if (!stopped.compareAndSet(false, true)) {
                return;
            }
            admitting.set(false);
            if (workerPool == null) {
                return;
            }
        }
        queue.clear();
        shutdownWorkers();
        producerExecutor.shutdown();
        try {
            if (!producerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                producerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            producerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void shutdownWorkers() {
        try {
            for (int i = 0; i < concurrency; i++) {
                queue.put(VisitJob.POISON);
            }
            workerPool.shutdown();
            if (!workerPool.awaitTermination(WORKER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Pipeline {} workers did not finish in time, interrupting", name);
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @return true tant que le producteur admet des visites
     */
    public boolean isAdmitting() {
        return admitting.get() && !quotaReached();
    }

    public String getName() { return name; }
    public long getScheduled() { return scheduled.get(); }
    public long getCompleted() { return completed.get(); }
    public long getFailed() { return failed.get(); }
    public int getQueueSize() { return queue.size(); }
    public double getRatePerSecond() { return ratePerSecond; }
}
