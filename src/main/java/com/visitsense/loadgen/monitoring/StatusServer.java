package com.visitsense.loadgen.monitoring;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.visitsense.loadgen.core.funnel.FunnelEngine;
import com.visitsense.loadgen.generator.VisitComposer;
import com.visitsense.loadgen.routing.TargetRouter;
import com.visitsense.loadgen.scheduler.BackfillScheduler;
import com.visitsense.loadgen.scheduler.RealtimeScheduler;

/**
 * Serveur d'état en JSON : santé, statistiques de génération, métriques des cibles
 * et rechargement des funnels.
 */
public class StatusServer {
    private static final Logger logger = LoggerFactory.getLogger(StatusServer.class);

    private final int port;
    private final TargetRouter router;
    private final VisitComposer composer;
    private final FunnelEngine funnelEngine;
    private final Gson gson;

    private volatile RealtimeScheduler realtimeScheduler;
    private volatile BackfillScheduler backfillScheduler;

    private HttpServer server;
    private ExecutorService executor;

    public StatusServer(int port, TargetRouter router, VisitComposer composer, FunnelEngine funnelEngine) {
        this.port = port;
        this.router = router;
        this.composer = composer;
        this.funnelEngine = funnelEngine;
        this.gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .registerTypeAdapter(LocalDate.class,
                (JsonSerializer<LocalDate>) (date, type, ctx) -> new JsonPrimitive(date.toString()))
            .serializeNulls()
            .create();
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/api/health", this::handleHealth);
        server.createContext("/api/statistics", this::handleStatistics);
        server.createContext("/api/targets", this::handleTargets);
        server.createContext("/api/funnels/reload", this::handleFunnelReload);

        executor = Executors.newFixedThreadPool(2);
        server.setExecutor(executor);
        server.start();

        logger.info("Status server started on port {}", getPort());
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            executor.shutdownNow();
            logger.info("Status server stopped");
        }
    }

    /**
     * Port effectif (utile quand le serveur est démarré sur le port 0).
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    public void setRealtimeScheduler(RealtimeScheduler realtimeScheduler) {
        this.realtimeScheduler = realtimeScheduler;
    }

    public void setBackfillScheduler(BackfillScheduler backfillScheduler) {
        this.backfillScheduler = backfillScheduler;
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        RealtimeScheduler realtime = realtimeScheduler;
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("timestamp", System.currentTimeMillis());
        health.put("realtime_running", realtime != null && realtime.isRunning());
        BackfillScheduler backfill = backfillScheduler;
        health.put("backfill_days_done", backfill != null ? backfill.getProgress().size() : 0);
        sendJson(exchange, 200, health);
    }

    private void handleStatistics(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> stats = new LinkedHashMap<>();

        Map<String, Object> composerMap = new LinkedHashMap<>();
        composerMap.put("visits_composed", composer.getVisitsComposed());
        composerMap.put("hits_attempted", composer.getHitsAttempted());
        composerMap.put("hits_sent", composer.getSender().getSentCount());
        composerMap.put("hits_failed", composer.getSender().getFailedCount());
        stats.put("composer", composerMap);

        RealtimeScheduler realtime = realtimeScheduler;
        if (realtime != null) {
            stats.put("realtime", realtime.getStatistics());
        }

        BackfillScheduler backfill = backfillScheduler;
        if (backfill != null) {
            stats.put("backfill_days", backfill.getProgress());
        }

        if (funnelEngine != null) {
            stats.put("funnel_executions", funnelEngine.getExecutionCounts());
        }

        sendJson(exchange, 200, stats);
    }

    private void handleTargets(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        sendJson(exchange, 200, router.getSummary());
    }

    private void handleFunnelReload(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        Map<String, Object> result = new LinkedHashMap<>();
        if (funnelEngine == null || funnelEngine.getRegistry().getSource() == null) {
            result.put("error", "No funnel definitions file configured");
            sendJson(exchange, 409, result);
            return;
        }
        int loaded = funnelEngine.getRegistry().reload();
        logger.info("Funnels reloaded via status server: {} active", loaded);
        result.put("loaded", loaded);
        sendJson(exchange, 200, result);
    }

    private boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", "Method not allowed");
        exchange.getResponseHeaders().set("Allow", method);
        sendJson(exchange, 405, error);
        return false;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object payload) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");

        byte[] bytes = gson.toJson(payload).getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, bytes.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
