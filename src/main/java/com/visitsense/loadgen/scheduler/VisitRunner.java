package com.visitsense.loadgen.scheduler;

import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.core.PageUrl;
import com.visitsense.loadgen.core.TimeWindow;
import com.visitsense.loadgen.core.funnel.Funnel;
import com.visitsense.loadgen.core.funnel.FunnelEngine;
import com.visitsense.loadgen.generator.VisitComposer;

/**
 * Exécute une visite : un funnel s'il en est tiré un, sinon une navigation aléatoire.
 * Un funnel qui ne termine pas la visite est suivi d'une navigation aléatoire.
 */
public class VisitRunner {
    private static final Logger logger = LoggerFactory.getLogger(VisitRunner.class);

    private final VisitComposer composer;
    private final FunnelEngine funnelEngine;

    public VisitRunner(VisitComposer composer) {
        this(composer, null);
    }

    /**
     * @param funnelEngine null pour n'envoyer que des visites aléatoires
     */
    public VisitRunner(VisitComposer composer, FunnelEngine funnelEngine) {
        this.composer = composer;
        this.funnelEngine = funnelEngine;
    }

    public void run(List<PageUrl> urls, TimeWindow window) {
        run(urls, window, null);
    }

    /**
     * @param visitRandom générateur propre à la visite, null pour les générateurs partagés
     */
    public void run(List<PageUrl> urls, TimeWindow window, Random visitRandom) {
        Funnel funnel = null;
        if (funnelEngine != null) {
            funnel = visitRandom != null ? funnelEngine.selectFunnel(visitRandom) : funnelEngine.selectFunnel();
        }
        if (funnel == null) {
            composer.composeAndSend(urls, window, visitRandom);
            return;
        }
        boolean exit = funnelEngine.execute(funnel, urls, window, visitRandom);
        if (!exit) {
            logger.debug("Funnel '{}' completed, continuing with random browsing", funnel.getName());
            composer.composeAndSend(urls, window, visitRandom);
        }
    }

    public VisitComposer getComposer() { return composer; }
    public FunnelEngine getFunnelEngine() { return funnelEngine; }
}
