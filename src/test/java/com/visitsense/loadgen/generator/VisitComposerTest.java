package com.visitsense.loadgen.generator;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;

import com.visitsense.loadgen.config.LoadGeneratorConfig;
import com.visitsense.loadgen.core.PageUrl;
import com.visitsense.loadgen.core.TimeWindow;
import com.visitsense.loadgen.core.TrackingHit;
import com.visitsense.loadgen.generator.EventCatalog.EventDefinition;
import com.visitsense.loadgen.transport.CapturingHitSender;

import static org.junit.Assert.*;

/**
 * Tests de la composition d'une visite complète
 */
public class VisitComposerTest {

    private static final Instant NOW = Instant.parse("2024-10-05T10:00:00Z");

    private LoadGeneratorConfig config;
    private CapturingHitSender sender;
    private Random random;
    private List<PageUrl> urls;

    @Before
    public void setUp() {
        config = new LoadGeneratorConfig();
        config.setPageviewsMin(5);
        config.setPageviewsMax(5);
        config.setPauseBetweenPvsMin(0);
        config.setPauseBetweenPvsMax(0);
        config.setSiteSearchProbability(0);
        config.setOutlinksProbability(0);
        config.setDownloadsProbability(0);
        config.setClickEventsProbability(0);
        config.setRandomEventsProbability(0);
        config.setEcommerceProbability(0);
        config.setDirectTrafficProbability(0);

        sender = new CapturingHitSender();
        random = new Random(17);
        urls = Arrays.asList(
            new PageUrl("https://shop.example.com/", "Home"),
            new PageUrl("https://shop.example.com/products"),
            new PageUrl("https://shop.example.com/about")
        );
    }

    private VisitComposer composer() {
        return new VisitComposer(config, sender, new HitFactory(config, random), new EventCatalog(),
            new EcommerceOrderGenerator(config, random), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static final DateTimeFormatter CDT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static Instant cdt(TrackingHit hit) {
        return LocalDateTime.parse(hit.get("cdt"), CDT).toInstant(ZoneOffset.UTC);
    }

    @Test
    public void testPlainVisitShape() {
        VisitComposer composer = composer();
        composer.composeAndSend(urls, null);

        List<TrackingHit> hits = sender.getHits();
        assertEquals("5 pageviews and a ping", 6, hits.size());
        assertEquals(1, composer.getVisitsComposed());
        assertEquals(6, composer.getHitsAttempted());

        TrackingHit first = hits.get(0);
        assertEquals(TrackingHit.Kind.PAGEVIEW, first.getKind());
        assertEquals("1", first.get("new_visit"));
        assertTrue("External referrer expected", TrafficCatalog.EXTERNAL_REFERRERS.contains(first.get("urlref")));

        String visitorId = first.get("_id");
        for (int i = 1; i < hits.size(); i++) {
            assertFalse("Only the first hit starts the visit", hits.get(i).has("new_visit"));
            assertEquals("All hits share the visitor id", visitorId, hits.get(i).get("_id"));
        }
        for (int i = 1; i < 5; i++) {
            assertEquals("Each pageview should refer to the previous page",
                        hits.get(i - 1).get("url"), hits.get(i).get("urlref"));
        }

        TrackingHit ping = hits.get(5);
        assertEquals(TrackingHit.Kind.PING, ping.getKind());
        assertEquals("Ping should reference the last pageview", hits.get(4).get("pv_id"), ping.get("pv_id"));
        assertEquals(hits.get(4).get("url"), ping.get("url"));
        assertEquals("Realtime visit should end now", NOW, cdt(ping));
    }

    @Test
    public void testDirectVisitHasNoReferrer() {
        config.setDirectTrafficProbability(1.0);
        composer().composeAndSend(urls, null);

        TrackingHit first = sender.getHits().get(0);
        assertFalse("Direct visits carry no urlref", first.has("urlref"));
        assertEquals("1", first.get("new_visit"));
    }

    @Test
    public void testTitlesUsedAsActionNames() {
        composer().composeAndSend(Arrays.asList(new PageUrl("https://shop.example.com/", "Home")), null);

        for (TrackingHit pageview : sender.getHits(TrackingHit.Kind.PAGEVIEW)) {
            assertEquals("Home", pageview.get("action_name"));
        }
    }

    @Test
    public void testBackfillTimestampsInsideWindow() {
        TimeWindow day = TimeWindow.ofDay(LocalDate.of(2024, 10, 1), ZoneId.of("CET"));
        config.setEcommerceProbability(1.0);
        VisitComposer composer = composer();

        for (int visit = 0; visit < 50; visit++) {
            sender.clear();
            composer.composeAndSend(urls, day);

            List<TrackingHit> hits = sender.getHits();
            Instant previous = null;
            for (TrackingHit hit : hits) {
                Instant ts = cdt(hit);
                assertTrue("Timestamp " + ts + " should be inside " + day, day.contains(ts));
                if (previous != null) {
                    assertFalse("Timestamps should not go backwards", ts.isBefore(previous));
                }
                previous = ts;
            }
            assertEquals(TrackingHit.Kind.ECOMMERCE, hits.get(hits.size() - 2).getKind());
            assertEquals(TrackingHit.Kind.PING, hits.get(hits.size() - 1).getKind());
        }
    }

    @Test
    public void testEcommerceHit() {
        config.setEcommerceProbability(1.0);
        composer().composeAndSend(urls, null);

        List<TrackingHit> orders = sender.getHits(TrackingHit.Kind.ECOMMERCE);
        assertEquals(1, orders.size());
        TrackingHit order = orders.get(0);
        assertEquals("0", order.get("idgoal"));
        assertTrue(order.has("ec_id"));
        assertTrue(order.has("ec_items"));
        double revenue = Double.parseDouble(order.get("revenue"));
        double sum = Double.parseDouble(order.get("ec_st")) + Double.parseDouble(order.get("ec_tx"))
            + Double.parseDouble(order.get("ec_sh"));
        assertEquals(revenue, sum, 0.01);
        assertEquals("SEK", order.get("ec_currency"));
    }

    @Test
    public void testActionsNeverOnFirstPage() {
        config.setSiteSearchProbability(1.0);
        config.setOutlinksProbability(1.0);
        config.setDownloadsProbability(1.0);
        config.setClickEventsProbability(1.0);
        config.setRandomEventsProbability(1.0);
        VisitComposer composer = composer();

        boolean sawAction = false;
        for (int visit = 0; visit < 30; visit++) {
            sender.clear();
            composer.composeAndSend(urls, null);
            List<TrackingHit> hits = sender.getHits();

            assertEquals("One hit per pageview slot plus the ping", 6, hits.size());
            assertEquals(TrackingHit.Kind.PAGEVIEW, hits.get(0).getKind());
            assertTrue("Search always wins at least one slot",
                      !sender.getHits(TrackingHit.Kind.SITE_SEARCH).isEmpty());
            for (TrackingHit hit : hits.subList(1, 5)) {
                if (hit.getKind() != TrackingHit.Kind.PAGEVIEW) {
                    sawAction = true;
                }
                if (hit.getKind() == TrackingHit.Kind.OUTLINK) {
                    assertEquals(hit.get("link"), hit.get("url"));
                    assertTrue(TrafficCatalog.OUTLINKS.contains(hit.get("link")));
                }
                if (hit.getKind() == TrackingHit.Kind.DOWNLOAD) {
                    assertTrue(hit.get("download").startsWith("https://shop.example.com/"));
                }
            }
            TrackingHit ping = hits.get(5);
            assertNotNull("Ping should always carry a pv_id", ping.get("pv_id"));
        }
        assertTrue(sawAction);
    }

    /**
     * Deux pages vues et toutes les actions tirées : toutes tombent sur la page 2,
     * une seule y est émise.
     */
    private TrackingHit secondHitWithAllActionsOnPageTwo() {
        config.setPageviewsMin(2);
        config.setPageviewsMax(2);
        EventCatalog catalog = new EventCatalog(
            Collections.singletonList(new EventDefinition("click", "tap", "button", null)),
            Collections.singletonList(new EventDefinition("other", "scroll", "page", null)));
        VisitComposer composer = new VisitComposer(config, sender, new HitFactory(config, random), catalog,
            new EcommerceOrderGenerator(config, random), Clock.fixed(NOW, ZoneOffset.UTC));
        sender.clear();
        composer.composeAndSend(urls, null);

        List<TrackingHit> hits = sender.getHits();
        assertEquals("Entry pageview, one action and the ping", 3, hits.size());
        assertEquals(TrackingHit.Kind.PAGEVIEW, hits.get(0).getKind());
        assertEquals(TrackingHit.Kind.PING, hits.get(2).getKind());
        return hits.get(1);
    }

    @Test
    public void testActionTieBreakOrder() {
        config.setSiteSearchProbability(1.0);
        config.setOutlinksProbability(1.0);
        config.setDownloadsProbability(1.0);
        config.setClickEventsProbability(1.0);
        config.setRandomEventsProbability(1.0);
        assertEquals("Search wins a shared page", TrackingHit.Kind.SITE_SEARCH,
                    secondHitWithAllActionsOnPageTwo().getKind());

        config.setSiteSearchProbability(0);
        assertEquals("Outlink comes after search", TrackingHit.Kind.OUTLINK,
                    secondHitWithAllActionsOnPageTwo().getKind());

        config.setOutlinksProbability(0);
        assertEquals("Download comes after outlink", TrackingHit.Kind.DOWNLOAD,
                    secondHitWithAllActionsOnPageTwo().getKind());

        config.setDownloadsProbability(0);
        TrackingHit click = secondHitWithAllActionsOnPageTwo();
        assertEquals(TrackingHit.Kind.EVENT, click.getKind());
        assertEquals("Click events come before other events", "click", click.get("e_c"));

        config.setClickEventsProbability(0);
        assertEquals("other", secondHitWithAllActionsOnPageTwo().get("e_c"));
    }

    @Test
    public void testSameVisitRandomSameHits() {
        config.setPageviewsMin(2);
        config.setPageviewsMax(8);
        config.setSiteSearchProbability(0.5);
        config.setEcommerceProbability(0.5);
        config.setRandomizeVisitorCountries(true);
        TimeWindow day = TimeWindow.ofDay(LocalDate.of(2024, 10, 1), ZoneOffset.UTC);
        VisitComposer composer = composer();

        composer.composeAndSend(urls, day, new Random(1234));
        List<String> first = new ArrayList<>();
        for (TrackingHit hit : sender.getHits()) {
            first.add(hit.getParams().toString());
        }
        sender.clear();
        // un tirage sur le générateur partagé ne doit rien changer
        random.nextLong();
        composer.composeAndSend(urls, day, new Random(1234));
        List<String> second = new ArrayList<>();
        for (TrackingHit hit : sender.getHits()) {
            second.add(hit.getParams().toString());
        }

        assertEquals(first, second);
    }
}
