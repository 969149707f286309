package com.visitsense.loadgen.transport;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.sun.net.httpserver.HttpServer;
import com.visitsense.loadgen.core.TrackingHit;
import com.visitsense.loadgen.routing.DistributionStrategy;
import com.visitsense.loadgen.routing.Target;
import com.visitsense.loadgen.routing.TargetMetrics;
import com.visitsense.loadgen.routing.TargetRouter;

import static org.junit.Assert.*;

/**
 * Tests de l'envoi HTTP des hits contre un serveur local
 */
public class HttpHitSenderTest {

    private HttpServer server;
    private volatile int responseStatus;
    private final List<String> queries = new CopyOnWriteArrayList<>();
    private final List<String> userAgents = new CopyOnWriteArrayList<>();

    @Before
    public void setUp() throws IOException {
        responseStatus = 204;
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/matomo.php", exchange -> {
            queries.add(exchange.getRequestURI().getRawQuery());
            userAgents.add(exchange.getRequestHeaders().getFirst("User-Agent"));
            int status = responseStatus;
            if (status == 204) {
                exchange.sendResponseHeaders(204, -1);
            } else {
                byte[] body = "error".getBytes();
                exchange.sendResponseHeaders(status, body.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(body);
                }
            }
            exchange.close();
        });
        server.start();
    }

    @After
    public void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private TrackingHit pageview() {
        return new TrackingHit(TrackingHit.Kind.PAGEVIEW, "Mozilla/5.0 (TestAgent)")
            .param("rec", 1)
            .param("url", "https://shop.example.com/a b?x=1")
            .param("action_name", "Home");
    }

    @Test
    public void testSuccessfulHit() {
        Target target = new Target("local", baseUrl(), 7, "tok", 1, true);
        TargetRouter router = new TargetRouter(Arrays.asList(target));
        HttpHitSender sender = new HttpHitSender(router, 2.0);

        assertTrue("2xx should be a success", sender.send(pageview()));

        assertEquals(1, queries.size());
        String query = queries.get(0);
        assertTrue("idsite should come first", query.startsWith("idsite=7&"));
        assertTrue("Hit parameters should be forwarded", query.contains("rec=1"));
        assertTrue("Values should be URL-encoded", query.contains("url=https%3A%2F%2Fshop.example.com%2Fa+b%3Fx%3D1"));
        assertTrue("Token should be appended", query.endsWith("token_auth=tok"));
        assertEquals("Mozilla/5.0 (TestAgent)", userAgents.get(0));

        TargetMetrics metrics = router.getMetrics("local");
        assertEquals(1, metrics.getSuccessfulRequests());
        assertNotNull(metrics.getAvgLatencyMs());
        assertEquals(1, sender.getSentCount());
        assertEquals(0, sender.getFailedCount());
    }

    @Test
    public void testServerErrorCountsAsFailure() {
        responseStatus = 500;
        TargetRouter router = new TargetRouter(Arrays.asList(new Target("local", baseUrl(), 1)));
        HttpHitSender sender = new HttpHitSender(router, 2.0);

        assertFalse("HTTP 500 should be a failure", sender.send(pageview()));

        TargetMetrics metrics = router.getMetrics("local");
        assertEquals(1, metrics.getFailedRequests());
        assertEquals("HTTP 500", metrics.getLastError());
        assertEquals(1, sender.getFailedCount());
        assertFalse("No token should be sent", queries.get(0).contains("token_auth"));
    }

    @Test
    public void testUnreachableTargetCountsAsFailure() throws IOException {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        TargetRouter router = new TargetRouter(Arrays.asList(
            new Target("down", "http://127.0.0.1:" + freePort, 1)));
        HttpHitSender sender = new HttpHitSender(router, 1.0);

        assertFalse(sender.send(pageview()));
        assertEquals(1, router.getMetrics("down").getFailedRequests());
        assertNotNull(router.getMetrics("down").getLastError());
    }

    @Test
    public void testRejectedRequestCountsAsFailure() {
        TargetRouter router = new TargetRouter(Arrays.asList(new Target("local", baseUrl(), 1)));
        HttpHitSender sender = new HttpHitSender(router, 2.0);
        // le client HTTP refuse un en-tête contenant un saut de ligne
        TrackingHit hit = new TrackingHit(TrackingHit.Kind.PAGEVIEW, "Mozilla/5.0\r\nX-Injected: 1")
            .param("rec", 1);

        assertFalse("A request the client refuses should be a failure", sender.send(hit));

        TargetMetrics metrics = router.getMetrics("local");
        assertEquals(1, metrics.getFailedRequests());
        assertTrue(metrics.getLastError().startsWith("IllegalArgumentException"));
        assertEquals(1, sender.getFailedCount());
        assertEquals(0, sender.getSentCount());
        assertTrue("Nothing should reach the server", queries.isEmpty());
    }

    @Test
    public void testRoundRobinAcrossTargets() {
        TargetRouter router = new TargetRouter(Arrays.asList(
            new Target("one", baseUrl(), 1),
            new Target("two", baseUrl(), 2)
        ), DistributionStrategy.ROUND_ROBIN);
        HttpHitSender sender = new HttpHitSender(router, 2.0);

        for (int i = 0; i < 4; i++) {
            assertTrue(sender.send(pageview()));
        }

        assertEquals(2, router.getMetrics("one").getSuccessfulRequests());
        assertEquals(2, router.getMetrics("two").getSuccessfulRequests());
        assertTrue(queries.get(0).startsWith("idsite=1&"));
        assertTrue(queries.get(1).startsWith("idsite=2&"));
    }

    @Test
    public void testRequestUrlForScriptEndpoint() {
        Target target = new Target("t", "https://stats.example.org/js/tracker.php", 3);
        TrackingHit hit = new TrackingHit(TrackingHit.Kind.PING, "UA").param("ping", 1).param("pv_id", "abc123");

        assertEquals("https://stats.example.org/js/tracker.php?idsite=3&ping=1&pv_id=abc123",
                    HttpHitSender.buildRequestUrl(target, hit));
    }
}
