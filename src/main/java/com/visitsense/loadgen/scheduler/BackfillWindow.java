package com.visitsense.loadgen.scheduler;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.visitsense.loadgen.config.ConfigurationException;
import com.visitsense.loadgen.config.LoadGeneratorConfig;

/**
 * Jours calendaires à reconstituer, en ordre croissant.
 *
 * Deux formes exclusives : absolue (BACKFILL_START_DATE + BACKFILL_END_DATE) ou relative
 * (BACKFILL_DAYS_BACK, BACKFILL_DURATION_DAYS optionnel, par défaut jusqu'à hier).
 * La fin ne dépasse jamais aujourd'hui et la fenêtre compte au plus 180 jours.
 */
public final class BackfillWindow {
    public static final int MAX_DAYS = 180;

    private final List<LocalDate> dates;

    private BackfillWindow(List<LocalDate> dates) {
        this.dates = Collections.unmodifiableList(dates);
    }

    public static BackfillWindow resolve(LoadGeneratorConfig config, LocalDate today) {
        return resolve(config.getBackfillStartDate(), config.getBackfillEndDate(),
            config.getBackfillDaysBack(), config.getBackfillDurationDays(), today);
    }

    /**
     * @throws ConfigurationException si la fenêtre est absente, ambiguë ou invalide
     */
    public static BackfillWindow resolve(String startDate, String endDate, Integer daysBack,
                                         Integer durationDays, LocalDate today) {
        boolean absolute = startDate != null || endDate != null;
        boolean relative = daysBack != null || durationDays != null;

        if (absolute && relative) {
            throw new ConfigurationException(
                "Use either BACKFILL_START_DATE/BACKFILL_END_DATE or BACKFILL_DAYS_BACK/BACKFILL_DURATION_DAYS, not both");
        }

        LocalDate start;
        LocalDate end;
        if (absolute) {
            if (startDate == null || endDate == null) {
                throw new ConfigurationException("Both BACKFILL_START_DATE and BACKFILL_END_DATE are required");
            }
            start = parseDate("BACKFILL_START_DATE", startDate);
            end = parseDate("BACKFILL_END_DATE", endDate);
        } else if (relative) {
            if (daysBack == null) {
                throw new ConfigurationException("BACKFILL_DAYS_BACK is required with BACKFILL_DURATION_DAYS");
            }
            if (daysBack < 1) {
                throw new ConfigurationException("BACKFILL_DAYS_BACK must be >= 1");
            }
            int duration = durationDays != null ? durationDays : daysBack;
            if (duration < 1) {
                throw new ConfigurationException("BACKFILL_DURATION_DAYS must be >= 1");
            }
            start = today.minusDays(daysBack);
            end = start.plusDays(duration - 1L);
        } else {
            throw new ConfigurationException(
                "Backfill requires BACKFILL_START_DATE/BACKFILL_END_DATE or BACKFILL_DAYS_BACK");
        }

        if (start.isAfter(end)) {
            throw new ConfigurationException("Backfill start " + start + " is after end " + end);
        }
        if (end.isAfter(today)) {
            throw new ConfigurationException("Backfill end " + end + " is in the future (today is " + today + ")");
        }

        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            dates.add(d);
            if (dates.size() > MAX_DAYS) {
                throw new ConfigurationException("Backfill window exceeds " + MAX_DAYS + " days");
            }
        }
        return new BackfillWindow(dates);
    }

    private static LocalDate parseDate(String key, String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(key + " must use yyyy-MM-dd, got '" + value + "'", e);
        }
    }

    public List<LocalDate> getDates() { return dates; }
    public LocalDate getStart() { return dates.get(0); }
    public LocalDate getEnd() { return dates.get(dates.size() - 1); }
    public int size() { return dates.size(); }

    @Override
    public String toString() {
        return getStart() + ".." + getEnd() + " (" + size() + " days)";
    }
}
