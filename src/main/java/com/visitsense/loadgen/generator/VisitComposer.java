package com.visitsense.loadgen.generator;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.config.LoadGeneratorConfig;
import com.visitsense.loadgen.core.PageUrl;
import com.visitsense.loadgen.core.TimeWindow;
import com.visitsense.loadgen.core.TrackingHit;
import com.visitsense.loadgen.core.VisitContext;
import com.visitsense.loadgen.transport.HitSender;

/**
 * Compose et envoie une visite aléatoire complète.
 *
 * Une visite compte N pages vues ; recherche interne, clic sortant, téléchargement,
 * événement de clic et événement divers peuvent chacun remplacer une page d'index 2..N
 * (priorité dans cet ordre en cas de collision). Une commande e-commerce peut suivre la
 * dernière page, puis un ping clôt la visite à la fin de la durée tirée.
 */
public class VisitComposer {
    private static final Logger logger = LoggerFactory.getLogger(VisitComposer.class);

    private static final int SEARCH = 0;
    private static final int OUTLINK = 1;
    private static final int DOWNLOAD = 2;
    private static final int CLICK_EVENT = 3;
    private static final int RANDOM_EVENT = 4;

    private static final long ECOMMERCE_DELAY_MAX_MS = 5000;

    private final LoadGeneratorConfig config;
    private final HitSender sender;
    private final HitFactory hitFactory;
    private final EventCatalog eventCatalog;
    private final EcommerceOrderGenerator orderGenerator;
    private final Random random;
    private final Clock clock;

    private final AtomicLong visitsComposed;
    private final AtomicLong hitsAttempted;

    public VisitComposer(LoadGeneratorConfig config, HitSender sender, Random random) {
        this(config, sender, random, new EventCatalog());
    }

    public VisitComposer(LoadGeneratorConfig config, HitSender sender, Random random, EventCatalog eventCatalog) {
        this(config, sender, new HitFactory(config, random), eventCatalog,
             new EcommerceOrderGenerator(config, random), Clock.systemUTC());
    }

    public VisitComposer(LoadGeneratorConfig config, HitSender sender, HitFactory hitFactory,
                         EventCatalog eventCatalog, EcommerceOrderGenerator orderGenerator, Clock clock) {
        this.config = config;
        this.sender = sender;
        this.hitFactory = hitFactory;
        this.eventCatalog = eventCatalog;
        this.orderGenerator = orderGenerator;
        this.random = hitFactory.getRandom();
        this.clock = clock;
        this.visitsComposed = new AtomicLong(0);
        this.hitsAttempted = new AtomicLong(0);
    }

    /**
     * Génère et envoie une visite.
     *
     * @param window null en temps réel (la visite se termine maintenant, avec des pauses
     *               entre les pages) ; sinon tous les horodatages tombent dans la fenêtre
     *               et aucun délai n'est observé
     */
    public void composeAndSend(List<PageUrl> urls, TimeWindow window) {
        composeAndSend(urls, window, null);
    }

    /**
     * @param visitRandom générateur propre à la visite (backfill avec graine), null pour
     *                    le générateur partagé
     */
    public void composeAndSend(List<PageUrl> urls, TimeWindow window, Random visitRandom) {
        Random random = visitRandom != null ? visitRandom : this.random;
        HitFactory hitFactory = visitRandom != null ? this.hitFactory.withRandom(visitRandom) : this.hitFactory;
        EcommerceOrderGenerator orderGenerator = visitRandom != null
            ? this.orderGenerator.withRandom(visitRandom) : this.orderGenerator;

        VisitContext context = hitFactory.newVisitContext();
        int numPageviews = uniformInt(random, config.getPageviewsMin(), config.getPageviewsMax());

        int[] actionPages = ActionPlacement.choose(random, numPageviews,
            random.nextDouble() < config.getSiteSearchProbability(),
            random.nextDouble() < config.getOutlinksProbability(),
            random.nextDouble() < config.getDownloadsProbability(),
            random.nextDouble() < config.getClickEventsProbability(),
            random.nextDouble() < config.getRandomEventsProbability());
        boolean wantsEcommerce = random.nextDouble() < config.getEcommerceProbability();

        double dwellSeconds = uniform(random, config.getVisitDurationMin(), config.getVisitDurationMax()) * 60.0;
        double[] shares = VisitTimeline.apportion(random, dwellSeconds, numPageviews);
        Instant[] timeline = VisitTimeline.layout(random, shares, window, clock.instant());
        boolean realtime = window == null;

        visitsComposed.incrementAndGet();
        logger.debug("Visit {}: {} pageviews, dwell {}s, referrer={}, country={}",
                    context.getVisitorId(), numPageviews, Math.round(dwellSeconds),
                    context.isDirect() ? "direct" : context.getReferrer(), context.getCountry());

        String lastPageviewId = null;
        for (int i = 1; i <= numPageviews; i++) {
            PageUrl page = hitFactory.pick(urls);
            String pageUrl = page.getUrl();
            Instant ts = timeline[i - 1];
            String referrer = i == 1 ? context.getReferrer() : context.getLastPageUrl();

            TrackingHit hit;
            if (i == actionPages[SEARCH]) {
                lastPageviewId = hitFactory.newPageviewId();
                hit = hitFactory.siteSearch(context, pageUrl,
                    hitFactory.pick(TrafficCatalog.SEARCH_TERMS),
                    random.nextDouble() < 0.3 ? hitFactory.pick(TrafficCatalog.SEARCH_CATEGORIES) : null,
                    random.nextInt(26), lastPageviewId, ts);
                hit.param("urlref", referrer);
            } else if (i == actionPages[OUTLINK]) {
                hit = hitFactory.outlink(context, pageUrl, hitFactory.pick(TrafficCatalog.OUTLINKS), ts);
            } else if (i == actionPages[DOWNLOAD]) {
                String downloadUrl = HitFactory.resolveDownload(pageUrl, hitFactory.pick(TrafficCatalog.DOWNLOADS));
                hit = hitFactory.download(context, pageUrl, downloadUrl, ts);
            } else if (i == actionPages[CLICK_EVENT]) {
                hit = hitFactory.event(context, pageUrl, eventCatalog.randomClickEvent(random), ts);
                hit.param("urlref", referrer);
            } else if (i == actionPages[RANDOM_EVENT]) {
                hit = hitFactory.event(context, pageUrl, eventCatalog.randomOtherEvent(random), ts);
                hit.param("urlref", referrer);
            } else {
                lastPageviewId = hitFactory.newPageviewId();
                String actionName = page.hasTitle()
                    ? page.getTitle()
                    : String.format("LoadTest PV %d/%d", i, numPageviews);
                hit = hitFactory.pageview(context, pageUrl, actionName, lastPageviewId, ts);
                hit.param("urlref", referrer);
            }

            if (i == 1) {
                hit.param("new_visit", 1);
            }

            send(context, hit);
            // la page contenant un lien sortant reste la page courante
            context.setLastPageUrl(pageUrl);

            if (realtime && i < numPageviews) {
                if (!pause(random)) {
                    return;
                }
            }
        }

        String lastPage = context.getLastPageUrl();
        if (wantsEcommerce) {
            EcommerceOrder order = orderGenerator.generate();
            Instant orderTime = between(timeline[numPageviews - 1], timeline[numPageviews]);
            TrackingHit hit = hitFactory.ecommerce(context, lastPage, order, orderTime);
            hit.param("urlref", lastPage);
            logger.debug("Ecommerce order for visitor {}: {}", context.getVisitorId(), order);
            send(context, hit);
        }

        send(context, hitFactory.ping(context, lastPage, lastPageviewId, timeline[numPageviews]));
    }

    private void send(VisitContext context, TrackingHit hit) {
        switch (hit.getKind()) {
            case DOWNLOAD:
                logger.info("Sending download hit: visitor={} file={} referer={}",
                           context.getVisitorId(), hit.get("download"), hit.get("urlref"));
                break;
            case OUTLINK:
                logger.info("Sending outlink hit: visitor={} link={} referer={}",
                           context.getVisitorId(), hit.get("link"), hit.get("urlref"));
                break;
            default:
                logger.debug("Sending {}: visitor={} url={} cdt={}",
                            hit.getKind(), context.getVisitorId(), hit.get("url"), hit.get("cdt"));
        }
        hitsAttempted.incrementAndGet();
        sender.send(hit);
    }

    /**
     * Instant situé peu après {@code from}, sans dépasser le milieu de l'intervalle.
     */
    private static Instant between(Instant from, Instant to) {
        long gap = to.toEpochMilli() - from.toEpochMilli();
        return from.plusMillis(Math.min(ECOMMERCE_DELAY_MAX_MS, gap / 2));
    }

    /**
     * @return false si le thread a été interrompu pendant la pause
     */
    private boolean pause(Random random) {
        double seconds = uniform(random, config.getPauseBetweenPvsMin(), config.getPauseBetweenPvsMax());
        if (seconds <= 0) {
            return true;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(Math.round(seconds * 1000));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static int uniformInt(Random random, int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    private static double uniform(Random random, double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    public HitFactory getHitFactory() { return hitFactory; }
    public EcommerceOrderGenerator getOrderGenerator() { return orderGenerator; }
    public Clock getClock() { return clock; }
    public HitSender getSender() { return sender; }
    public long getVisitsComposed() { return visitsComposed.get(); }
    public long getHitsAttempted() { return hitsAttempted.get(); }
}
