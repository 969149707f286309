package com.visitsense.loadgen.generator;

import java.time.Instant;
import java.util.Random;

import com.visitsense.loadgen.core.TimeWindow;

/**
 * Calcule les horodatages d'une séquence de hits à partir des écarts entre eux.
 *
 * Sans fenêtre, la séquence se termine à {@code now}. Avec une fenêtre, son début est tiré
 * uniformément pour qu'elle y tienne entièrement ; une séquence plus longue que la fenêtre
 * est comprimée proportionnellement.
 */
public final class VisitTimeline {

    private VisitTimeline() {
    }

    /**
     * @param gapsSeconds écarts successifs (n écarts donnent n + 1 instants)
     * @return les instants, croissants au sens large
     */
    public static Instant[] layout(Random random, double[] gapsSeconds, TimeWindow window, Instant now) {
        long[] gapsMs = new long[gapsSeconds.length];
        long totalMs = 0;
        for (int i = 0; i < gapsSeconds.length; i++) {
            gapsMs[i] = Math.max(0L, Math.round(gapsSeconds[i] * 1000));
            totalMs += gapsMs[i];
        }

        long baseMs;
        if (window == null) {
            baseMs = now.toEpochMilli() - totalMs;
        } else {
            long startMs = window.getStart().toEpochMilli();
            long endMs = window.getEnd().toEpochMilli();
            long lengthMs = endMs - startMs;
            if (totalMs > lengthMs) {
                compress(gapsMs, totalMs, lengthMs);
                totalMs = sum(gapsMs);
            }
            long slack = lengthMs - totalMs;
            baseMs = startMs + (slack > 0 ? (long) (random.nextDouble() * (slack + 1)) : 0);
            baseMs = Math.min(baseMs, endMs - totalMs);
        }

        Instant[] points = new Instant[gapsMs.length + 1];
        long cursor = baseMs;
        points[0] = Instant.ofEpochMilli(cursor);
        for (int i = 0; i < gapsMs.length; i++) {
            cursor += gapsMs[i];
            points[i + 1] = Instant.ofEpochMilli(cursor);
        }
        return points;
    }

    /**
     * Répartit une durée totale entre {@code parts} pages selon des poids tirés dans [0.5, 1.5].
     */
    public static double[] apportion(Random random, double totalSeconds, int parts) {
        double[] weights = new double[parts];
        double sum = 0;
        for (int i = 0; i < parts; i++) {
            weights[i] = 0.5 + random.nextDouble();
            sum += weights[i];
        }
        double[] shares = new double[parts];
        for (int i = 0; i < parts; i++) {
            shares[i] = totalSeconds * weights[i] / sum;
        }
        return shares;
    }

    private static void compress(long[] gapsMs, long totalMs, long lengthMs) {
        double factor = (double) lengthMs / totalMs;
        for (int i = 0; i < gapsMs.length; i++) {
            gapsMs[i] = (long) Math.floor(gapsMs[i] * factor);
        }
    }

    private static long sum(long[] values) {
        long total = 0;
        for (long v : values) {
            total += v;
        }
        return total;
    }
}
