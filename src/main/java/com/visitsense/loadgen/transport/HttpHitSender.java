package com.visitsense.loadgen.transport;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.core.TrackingHit;
import com.visitsense.loadgen.routing.Target;
import com.visitsense.loadgen.routing.TargetRouter;

/**
 * Envoie les hits en HTTP GET vers la cible choisie par le routeur.
 * {@code idsite} et {@code token_auth} viennent de la cible, le reste du hit.
 */
public class HttpHitSender implements HitSender {
    private static final Logger logger = LoggerFactory.getLogger(HttpHitSender.class);

    private final TargetRouter router;
    private final int timeoutMs;
    private final AtomicLong sentCount;
    private final AtomicLong failedCount;

    public HttpHitSender(TargetRouter router) {
        this(router, 10.0);
    }

    public HttpHitSender(TargetRouter router, double timeoutSeconds) {
        this.router = router;
        this.timeoutMs = (int) Math.max(1, Math.round(timeoutSeconds * 1000));
        this.sentCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
    }

    @Override
    public boolean send(TrackingHit hit) {
        Target target = router.nextTarget();
        String requestUrl = buildRequestUrl(target, hit);
        long start = System.nanoTime();
        HttpURLConnection conn = null;

        try {
            conn = (HttpURLConnection) new URL(requestUrl).openConnection();
            conn.setRequestMethod("GET");
            conn.setConnectTimeout(timeoutMs);
            conn.setReadTimeout(timeoutMs);
            if (hit.getUserAgent() != null) {
                conn.setRequestProperty("User-Agent", hit.getUserAgent());
            }

            int status = conn.getResponseCode();
            drain(conn, status);
            double latencyMs = (System.nanoTime() - start) / 1_000_000.0;

            if (status >= 200 && status < 300) {
                router.recordSuccess(target, latencyMs);
                sentCount.incrementAndGet();
                logger.debug("Hit {} -> {} [{}] in {} ms", hit.getKind(), target.getName(), status,
                            String.format("%.1f", latencyMs));
                return true;
            }

            router.recordFailure(target, "HTTP " + status);
            failedCount.incrementAndGet();
            logger.debug("Hit {} -> {} rejected with HTTP {}", hit.getKind(), target.getName(), status);
            return false;

        } catch (IOException | RuntimeException e) {
            // un hit mal formé ne doit pas faire tomber le worker
            String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
            router.recordFailure(target, reason);
            failedCount.incrementAndGet();
            logger.debug("Hit {} -> {} failed: {}", hit.getKind(), target.getName(), reason);
            return false;
        } finally {
            if (conn != null) {
                conn.disconnect();
            }
        }
    }

    private void drain(HttpURLConnection conn, int status) throws IOException {
        InputStream in = status >= 400 ? conn.getErrorStream() : conn.getInputStream();
        if (in == null) {
            return;
        }
        try (InputStream body = in) {
            byte[] buffer = new byte[1024];
            while (body.read(buffer) != -1) {
                // réponse ignorée
            }
        }
    }

    /**
     * Construit l'URL complète de la requête de tracking.
     */
    static String buildRequestUrl(Target target, TrackingHit hit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("idsite", String.valueOf(target.getSiteId()));
        params.putAll(hit.getParams());
        if (target.hasTokenAuth()) {
            params.put("token_auth", target.getTokenAuth());
        }

        StringBuilder sb = new StringBuilder(target.getTrackingEndpoint());
        sb.append('?');
        boolean first = true;
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (!first) {
                sb.append('&');
            }
            sb.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
              .append('=')
              .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
            first = false;
        }
        return sb.toString();
    }

    @Override
    public long getSentCount() {
        return sentCount.get();
    }

    @Override
    public long getFailedCount() {
        return failedCount.get();
    }

    public TargetRouter getRouter() {
        return router;
    }
}
