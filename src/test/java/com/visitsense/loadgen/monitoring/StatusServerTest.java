package com.visitsense.loadgen.monitoring;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.util.Collections;
import java.util.Random;

import org.json.JSONObject;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.visitsense.loadgen.config.LoadGeneratorConfig;
import com.visitsense.loadgen.core.funnel.FunnelEngine;
import com.visitsense.loadgen.core.funnel.FunnelRegistry;
import com.visitsense.loadgen.generator.EcommerceOrderGenerator;
import com.visitsense.loadgen.generator.EventCatalog;
import com.visitsense.loadgen.generator.HitFactory;
import com.visitsense.loadgen.generator.VisitComposer;
import com.visitsense.loadgen.routing.Target;
import com.visitsense.loadgen.routing.TargetRouter;
import com.visitsense.loadgen.transport.CapturingHitSender;

import static org.junit.Assert.*;

/**
 * Tests du serveur d'état JSON
 */
public class StatusServerTest {

    private static final String FUNNEL = "{\"name\":\"%s\",\"probability\":0.5,\"steps\":[{\"type\":\"pageview\"}]}";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private LoadGeneratorConfig config;
    private TargetRouter router;
    private VisitComposer composer;
    private HitFactory hitFactory;
    private EcommerceOrderGenerator orderGenerator;
    private CapturingHitSender sender;
    private StatusServer server;

    @Before
    public void setUp() {
        config = new LoadGeneratorConfig();
        Random random = new Random(5);
        sender = new CapturingHitSender();
        router = new TargetRouter(Collections.singletonList(
            new Target("primary", "https://stats.example.org/matomo.php", 1)));
        hitFactory = new HitFactory(config, random);
        orderGenerator = new EcommerceOrderGenerator(config, random);
        composer = new VisitComposer(config, sender, hitFactory, new EventCatalog(), orderGenerator,
            Clock.systemUTC());
    }

    @After
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private void start(FunnelEngine funnelEngine) throws IOException {
        server = new StatusServer(0, router, composer, funnelEngine);
        server.start();
    }

    private HttpURLConnection open(String path, String method) throws IOException {
        URL url = new URL("http://127.0.0.1:" + server.getPort() + path);
        HttpURLConnection connection = (HttpURLConnection) url.openConnection();
        connection.setRequestMethod(method);
        connection.setConnectTimeout(2000);
        connection.setReadTimeout(5000);
        return connection;
    }

    private static JSONObject body(HttpURLConnection connection) throws IOException {
        InputStream in = connection.getResponseCode() >= 400
            ? connection.getErrorStream() : connection.getInputStream();
        try (InputStream stream = in) {
            return new JSONObject(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    public void testHealth() throws IOException {
        start(null);
        HttpURLConnection connection = open("/api/health", "GET");

        assertEquals(200, connection.getResponseCode());
        assertEquals("application/json", connection.getHeaderField("Content-Type"));
        JSONObject health = body(connection);
        assertEquals("UP", health.getString("status"));
        assertFalse(health.getBoolean("realtime_running"));
        assertEquals(0, health.getInt("backfill_days_done"));
    }

    @Test
    public void testTargetsSummary() throws IOException {
        router.recordSuccess(router.nextTarget(), 12.0);
        start(null);

        HttpURLConnection connection = open("/api/targets", "GET");

        assertEquals(200, connection.getResponseCode());
        JSONObject summary = body(connection);
        assertEquals(1, summary.getInt("total_targets"));
        assertEquals(1, summary.getLong("total_requests"));
        assertTrue(summary.getJSONObject("per_target_metrics").has("primary"));
    }

    @Test
    public void testStatisticsReportComposerCounters() throws IOException {
        start(null);

        HttpURLConnection connection = open("/api/statistics", "GET");

        assertEquals(200, connection.getResponseCode());
        JSONObject composerStats = body(connection).getJSONObject("composer");
        assertEquals(0, composerStats.getLong("visits_composed"));
        assertEquals(0, composerStats.getLong("hits_sent"));
    }

    @Test
    public void testWrongMethodRejected() throws IOException {
        start(null);
        HttpURLConnection connection = open("/api/health", "POST");

        assertEquals(405, connection.getResponseCode());
        assertEquals("GET", connection.getHeaderField("Allow"));
    }

    @Test
    public void testReloadWithoutFunnelFile() throws IOException {
        start(null);
        HttpURLConnection connection = open("/api/funnels/reload", "POST");

        assertEquals(409, connection.getResponseCode());
        assertTrue(body(connection).has("error"));
    }

    @Test
    public void testReloadPicksUpFileChanges() throws IOException {
        File file = folder.newFile("funnels.json");
        Files.write(file.toPath(), ("[" + String.format(FUNNEL, "One") + "]").getBytes(StandardCharsets.UTF_8));
        FunnelRegistry registry = new FunnelRegistry(file.toPath());
        assertEquals(1, registry.getFunnels().size());
        start(new FunnelEngine(registry, sender, hitFactory, orderGenerator, Clock.systemUTC()));

        Files.write(file.toPath(), ("[" + String.format(FUNNEL, "One") + "," + String.format(FUNNEL, "Two") + "]")
            .getBytes(StandardCharsets.UTF_8));
        HttpURLConnection connection = open("/api/funnels/reload", "POST");

        assertEquals(200, connection.getResponseCode());
        assertEquals(2, body(connection).getInt("loaded"));
        assertEquals(2, registry.getFunnels().size());
    }
}
