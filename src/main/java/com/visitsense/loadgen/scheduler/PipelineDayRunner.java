package com.visitsense.loadgen.scheduler;

import java.util.List;
import java.util.Random;

import com.visitsense.loadgen.core.PageUrl;
import com.visitsense.loadgen.core.TimeWindow;

/**
 * Journée de backfill exécutée par un {@link VisitPipeline} borné au quota du jour.
 */
public class PipelineDayRunner implements BackfillDayRunner {
    private final VisitRunner runner;
    private final int concurrency;
    private volatile VisitPipeline current;

    public PipelineDayRunner(VisitRunner runner, int concurrency) {
        this.runner = runner;
        this.concurrency = concurrency;
    }

    @Override
    public long runDay(List<PageUrl> urls, TimeWindow day, long visitsTarget, double rpsLimit,
                       Random seedSource) throws InterruptedException {
        if (visitsTarget <= 0) {
            return 0;
        }
        VisitPipeline pipeline = new VisitPipeline("backfill", runner, urls, concurrency,
            rpsLimit, visitsTarget, day, null, seedSource);
        current = pipeline;
        try {
            return pipeline.runToCompletion();
        } finally {
            current = null;
        }
    }

    @Override
    public void cancel() {
        VisitPipeline pipeline = current;
        if (pipeline != null) {
            pipeline.stop();
        }
    }
}
