package com.visitsense.loadgen.core;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Intervalle fermé [start, end] dans lequel doivent tomber tous les horodatages d'une visite.
 */
public final class TimeWindow {
    private final Instant start;
    private final Instant end;

    public TimeWindow(Instant start, Instant end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
        this.start = start;
        this.end = end;
    }

    /**
     * Journée locale complète : minuit jusqu'au minuit suivant moins une seconde.
     */
    public static TimeWindow ofDay(LocalDate date, ZoneId zone) {
        Instant dayStart = date.atStartOfDay(zone).toInstant();
        Instant nextDay = date.plusDays(1).atStartOfDay(zone).toInstant();
        return new TimeWindow(dayStart, nextDay.minusSeconds(1));
    }

    public Instant getStart() { return start; }
    public Instant getEnd() { return end; }

    public Duration length() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    @Override
    public String toString() {
        return "[" + start + " .. " + end + "]";
    }
}
