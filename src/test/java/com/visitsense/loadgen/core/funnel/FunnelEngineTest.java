package com.visitsense.loadgen.core.funnel;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;

import com.visitsense.loadgen.core.PageUrl;
import com.visitsense.loadgen.core.TimeWindow;
import com.visitsense.loadgen.core.TrackingHit;
import com.visitsense.loadgen.generator.EcommerceOrderGenerator;
import com.visitsense.loadgen.generator.HitFactory;
import com.visitsense.loadgen.transport.CapturingHitSender;

import static org.junit.Assert.*;

/**
 * Tests de la sélection et de l'exécution des funnels
 */
public class FunnelEngineTest {

    private static final Instant NOW = Instant.parse("2024-10-05T10:00:00Z");
    private static final DateTimeFormatter CDT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private CapturingHitSender sender;
    private HitFactory hitFactory;
    private EcommerceOrderGenerator orderGenerator;
    private List<PageUrl> urls;

    @Before
    public void setUp() {
        Random random = new Random(8);
        sender = new CapturingHitSender();
        hitFactory = new HitFactory(random, null, 1.0);
        orderGenerator = new EcommerceOrderGenerator(random, 20.0, 200.0, 1, 3, 0.25,
            Arrays.asList(0.0, 49.0), "SEK");
        urls = Collections.singletonList(new PageUrl("https://shop.example.com/random", "Random page"));
    }

    private FunnelEngine engine(Funnel... funnels) {
        return new FunnelEngine(new FunnelRegistry(Arrays.asList(funnels)), sender, hitFactory,
            orderGenerator, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Instant cdt(TrackingHit hit) {
        return LocalDateTime.parse(hit.get("cdt"), CDT).toInstant(ZoneOffset.UTC);
    }

    private static Funnel checkout(boolean exit) {
        return new Funnel("Checkout", "Cart to payment", 1.0, 0, true, exit, Arrays.asList(
            FunnelStep.builder(StepType.PAGEVIEW).url("https://shop.example.com/cart").delay(10, 10).build(),
            FunnelStep.builder(StepType.SITE_SEARCH).search("gift", null, 7).delay(20, 20).build(),
            FunnelStep.builder(StepType.EVENT).event("Cart", "Submit", "Pay", 3.0).delay(5, 5).build(),
            FunnelStep.builder(StepType.OUTLINK).targetUrl("https://pay.example.net/").delay(0, 0).build(),
            FunnelStep.builder(StepType.ECOMMERCE).ecommerce(150.0, null, null, null, "EUR").delay(99, 99).build()
        ));
    }

    private static Funnel single(String name, double probability) {
        return new Funnel(name, probability, Arrays.asList(FunnelStep.builder(StepType.PAGEVIEW).build()));
    }

    @Test
    public void testProbabilityOneAlwaysSelected() {
        FunnelEngine engine = engine(single("Always", 1.0));
        for (int i = 0; i < 200; i++) {
            assertEquals("Always", engine.selectFunnel().getName());
        }
    }

    @Test
    public void testProbabilityZeroNeverSelected() {
        FunnelEngine engine = engine(single("Never", 0.0));
        for (int i = 0; i < 200; i++) {
            assertNull(engine.selectFunnel());
        }
    }

    @Test
    public void testSelectionFollowsPriority() {
        FunnelEngine engine = engine(single("Skipped", 0.0), single("Second", 1.0), single("Third", 1.0));
        assertEquals("Second", engine.selectFunnel().getName());
    }

    @Test
    public void testExecuteSendsEveryStep() {
        FunnelEngine engine = engine(checkout(true));

        boolean exit = engine.execute(checkout(true), urls, null);

        assertTrue(exit);
        assertEquals(1, engine.getExecutions("Checkout"));

        List<TrackingHit> hits = sender.getHits();
        assertEquals("One hit per step, no ping", 5, hits.size());

        TrackingHit landing = hits.get(0);
        assertEquals(TrackingHit.Kind.PAGEVIEW, landing.getKind());
        assertEquals("1", landing.get("new_visit"));
        assertFalse("Direct visit has no referrer", landing.has("urlref"));
        assertEquals("Checkout - Step 1", landing.get("action_name"));

        TrackingHit search = hits.get(1);
        assertEquals("gift", search.get("search"));
        assertEquals("https://shop.example.com/cart", search.get("url"));
        assertEquals("https://shop.example.com/cart", search.get("urlref"));

        TrackingHit event = hits.get(2);
        assertEquals("Pay", event.get("e_n"));
        assertEquals("3", event.get("e_v"));

        TrackingHit outlink = hits.get(3);
        assertEquals("https://pay.example.net/", outlink.get("link"));
        assertEquals("Outlink keeps its source page as referrer", "https://shop.example.com/cart", outlink.get("urlref"));

        TrackingHit purchase = hits.get(4);
        assertEquals("150.00", purchase.get("revenue"));
        assertEquals("EUR", purchase.get("ec_currency"));

        for (int i = 1; i < hits.size(); i++) {
            assertFalse(hits.get(i).has("new_visit"));
        }

        assertEquals("Last step is stamped now", NOW, cdt(purchase));
        assertEquals(NOW.minusSeconds(35), cdt(landing));
        assertEquals(NOW.minusSeconds(25), cdt(search));
    }

    @Test
    public void testExitFlagReturned() {
        FunnelEngine engine = engine(checkout(false));
        assertFalse(engine.execute(checkout(false), urls, null));
    }

    @Test
    public void testPageviewWithoutUrlPicksRandomPage() {
        FunnelEngine engine = engine(single("Browse", 1.0));
        engine.execute(single("Browse", 1.0), urls, null);

        TrackingHit hit = sender.getHits().get(0);
        assertEquals("https://shop.example.com/random", hit.get("url"));
        assertEquals("Page title used as action name", "Random page", hit.get("action_name"));
    }

    @Test
    public void testBackfillTimestampsInsideDay() {
        TimeWindow day = TimeWindow.ofDay(LocalDate.of(2024, 9, 30), ZoneId.of("CET"));
        FunnelEngine engine = engine(checkout(true));

        for (int i = 0; i < 20; i++) {
            sender.clear();
            engine.execute(checkout(true), urls, day);
            for (TrackingHit hit : sender.getHits()) {
                assertTrue(day.contains(cdt(hit)));
            }
        }
        assertEquals(20, engine.getExecutionCounts().get("Checkout").longValue());
    }
}
