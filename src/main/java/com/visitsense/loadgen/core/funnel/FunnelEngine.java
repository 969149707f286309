package com.visitsense.loadgen.core.funnel;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.core.PageUrl;
import com.visitsense.loadgen.core.TimeWindow;
import com.visitsense.loadgen.core.TrackingHit;
import com.visitsense.loadgen.core.VisitContext;
import com.visitsense.loadgen.generator.EcommerceOrder;
import com.visitsense.loadgen.generator.EcommerceOrderGenerator;
import com.visitsense.loadgen.generator.HitFactory;
import com.visitsense.loadgen.generator.VisitTimeline;
import com.visitsense.loadgen.transport.HitSender;

/**
 * Sélectionne et exécute les funnels du registre.
 */
public class FunnelEngine {
    private static final Logger logger = LoggerFactory.getLogger(FunnelEngine.class);

    private final FunnelRegistry registry;
    private final HitSender sender;
    private final HitFactory hitFactory;
    private final EcommerceOrderGenerator orderGenerator;
    private final Clock clock;
    private final Random random;
    private final Map<String, AtomicLong> executions;

    public FunnelEngine(FunnelRegistry registry, HitSender sender, HitFactory hitFactory,
                        EcommerceOrderGenerator orderGenerator, Clock clock) {
        this.registry = registry;
        this.sender = sender;
        this.hitFactory = hitFactory;
        this.orderGenerator = orderGenerator;
        this.clock = clock;
        this.random = hitFactory.getRandom();
        this.executions = new ConcurrentHashMap<>();
    }

    /**
     * Essaie chaque funnel par priorité croissante, avec un tirage indépendant à chaque fois.
     * La probabilité d'un funnel est donc conditionnelle à l'échec de tous ceux qui le précèdent.
     *
     * @return le premier funnel retenu, ou null
     */
    public Funnel selectFunnel() {
        return selectFunnel(random);
    }

    public Funnel selectFunnel(Random random) {
        for (Funnel funnel : registry.getFunnels()) {
            if (random.nextDouble() < funnel.getProbability()) {
                return funnel;
            }
        }
        return null;
    }

    /**
     * Envoie les étapes du funnel dans l'ordre.
     * L'étape k est horodatée à base + somme des délais des étapes précédentes ; la séquence
     * se termine maintenant, ou tient dans {@code window} si elle est fournie.
     *
     * @return true si la visite doit s'arrêter là, false pour enchaîner sur une navigation aléatoire
     */
    public boolean execute(Funnel funnel, List<PageUrl> urls, TimeWindow window) {
        return execute(funnel, urls, window, null);
    }

    /**
     * @param visitRandom générateur propre à la visite, null pour le générateur partagé
     */
    public boolean execute(Funnel funnel, List<PageUrl> urls, TimeWindow window, Random visitRandom) {
        Random random = visitRandom != null ? visitRandom : this.random;
        HitFactory hitFactory = visitRandom != null ? this.hitFactory.withRandom(visitRandom) : this.hitFactory;
        EcommerceOrderGenerator orderGenerator = visitRandom != null
            ? this.orderGenerator.withRandom(visitRandom) : this.orderGenerator;

        List<FunnelStep> steps = funnel.getSteps();
        double[] gaps = new double[steps.size() - 1];
        for (int k = 0; k < gaps.length; k++) {
            FunnelStep step = steps.get(k);
            gaps[k] = step.getDelaySecondsMin()
                + random.nextDouble() * (step.getDelaySecondsMax() - step.getDelaySecondsMin());
        }
        Instant[] timeline = VisitTimeline.layout(random, gaps, window, clock.instant());

        VisitContext context = hitFactory.newVisitContext();
        String previousUrl = context.getReferrer();
        logger.debug("Executing funnel '{}' ({} steps) for visitor {}",
                    funnel.getName(), steps.size(), context.getVisitorId());

        for (int k = 0; k < steps.size(); k++) {
            FunnelStep step = steps.get(k);
            Instant ts = timeline[k];
            TrackingHit hit = buildHit(hitFactory, orderGenerator, funnel, step, k, context, urls, ts);
            if (hit.getKind() != TrackingHit.Kind.OUTLINK && hit.getKind() != TrackingHit.Kind.DOWNLOAD) {
                hit.param("urlref", previousUrl);
            }
            if (k == 0) {
                hit.param("new_visit", 1);
            }
            sender.send(hit);

            // les liens sortants et téléchargements laissent la page courante inchangée
            previousUrl = context.getLastPageUrl();
        }

        executions.computeIfAbsent(funnel.getName(), name -> new AtomicLong()).incrementAndGet();
        return funnel.isExitAfterCompletion();
    }

    private static TrackingHit buildHit(HitFactory hitFactory, EcommerceOrderGenerator orderGenerator,
                                        Funnel funnel, FunnelStep step, int index, VisitContext context,
                                        List<PageUrl> urls, Instant ts) {
        String current = step.getUrl() != null ? step.getUrl() : context.getLastPageUrl();

        switch (step.getType()) {
            case PAGEVIEW: {
                String title = null;
                if (step.getUrl() == null) {
                    PageUrl page = hitFactory.pick(urls);
                    current = page.getUrl();
                    title = page.getTitle();
                }
                String actionName = step.getActionName() != null ? step.getActionName()
                    : title != null ? title
                    : String.format("%s - Step %d", funnel.getName(), index + 1);
                context.setLastPageUrl(current);
                return hitFactory.pageview(context, current, actionName, hitFactory.newPageviewId(), ts);
            }
            case EVENT:
                context.setLastPageUrl(current);
                return hitFactory.event(context, current, step.getEventCategory(), step.getEventAction(),
                    step.getEventName(), step.getEventValue(), ts);
            case SITE_SEARCH:
                context.setLastPageUrl(current);
                return hitFactory.siteSearch(context, current, step.getSearchKeyword(),
                    step.getSearchCategory(), step.getSearchResults(), hitFactory.newPageviewId(), ts);
            case OUTLINK:
                context.setLastPageUrl(current);
                return hitFactory.outlink(context, current, step.getTargetUrl(), ts);
            case DOWNLOAD:
                context.setLastPageUrl(current);
                return hitFactory.download(context, current,
                    HitFactory.resolveDownload(current, step.getTargetUrl()), ts);
            case ECOMMERCE:
            default: {
                EcommerceOrder order = orderGenerator.generateWithOverrides(
                    step.getEcommerceRevenue(), step.getEcommerceSubtotal(), step.getEcommerceTax(),
                    step.getEcommerceShipping(), step.getEcommerceCurrency());
                context.setLastPageUrl(current);
                return hitFactory.ecommerce(context, current, order, ts);
            }
        }
    }

    public long getExecutions(String funnelName) {
        AtomicLong count = executions.get(funnelName);
        return count != null ? count.get() : 0L;
    }

    public Map<String, Long> getExecutionCounts() {
        Map<String, Long> counts = new TreeMap<>();
        for (Map.Entry<String, AtomicLong> entry : executions.entrySet()) {
            counts.put(entry.getKey(), entry.getValue().get());
        }
        return counts;
    }

    public FunnelRegistry getRegistry() {
        return registry;
    }
}
