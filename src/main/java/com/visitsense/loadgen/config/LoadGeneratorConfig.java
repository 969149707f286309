package com.visitsense.loadgen.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Configuration typée du générateur, construite une seule fois au démarrage.
 * Les valeurs par défaut reprennent celles de {@code loadgen.properties}.
 */
public class LoadGeneratorConfig {

    // Cible unique (ignorée si MULTI_TARGET_CONFIG est fourni)
    private String matomoUrl = "https://matomo.example.com/matomo.php";
    private int siteId = 1;
    private String tokenAuth;
    private String multiTargetConfig;

    // Entrées
    private String urlsFile = "/config/urls.txt";
    private String funnelConfigPath;
    private String eventsConfigPath;

    // Débit et parallélisme
    private double targetVisitsPerDay = 20000;
    private int concurrency = 50;
    private double autoStopAfterHours = 0;
    private long maxTotalVisits = 0;
    private long maxVisitsPerDay = 0;

    // Forme des visites
    private int pageviewsMin = 3;
    private int pageviewsMax = 6;
    private double pauseBetweenPvsMin = 0.5;
    private double pauseBetweenPvsMax = 2.0;
    private double visitDurationMin = 1.0;
    private double visitDurationMax = 8.0;

    // Probabilités
    private double siteSearchProbability = 0.15;
    private double outlinksProbability = 0.10;
    private double downloadsProbability = 0.08;
    private double clickEventsProbability = 0.25;
    private double randomEventsProbability = 0.12;
    private double directTrafficProbability = 0.30;
    private double ecommerceProbability = 0.05;

    // E-commerce
    private double ecommerceOrderValueMin = 15.99;
    private double ecommerceOrderValueMax = 299.99;
    private int ecommerceItemsMin = 1;
    private int ecommerceItemsMax = 5;
    private double ecommerceTaxRate = 0.25;
    private List<Double> ecommerceShippingRates = new ArrayList<>(Arrays.asList(0.0, 49.0, 99.0));
    private String ecommerceCurrency = "SEK";

    private boolean randomizeVisitorCountries = true;
    private ZoneId timezone = ZoneId.of("CET");

    // Backfill
    private boolean backfillEnabled = false;
    private boolean backfillRunOnce = true;
    private String backfillStartDate;
    private String backfillEndDate;
    private Integer backfillDaysBack;
    private Integer backfillDurationDays;
    private long backfillMaxVisitsPerDay = 2000;
    private long backfillMaxVisitsTotal = 200000;
    private Double backfillRpsLimit;
    private Long backfillSeed;

    // Démarrage, réseau, supervision
    private boolean autoStart = true;
    private String startSignalFile = "/tmp/loadgen.start";
    private double startCheckIntervalSeconds = 1.0;
    private double requestTimeoutSeconds = 10.0;
    private boolean statusServerEnabled = false;
    private int statusServerPort = 8090;

    /**
     * Lit toutes les clés connues puis valide l'ensemble.
     */
    public static LoadGeneratorConfig fromConfiguration(ConfigurationManager cm) {
        LoadGeneratorConfig c = new LoadGeneratorConfig();

        c.matomoUrl = stripTrailingSlash(cm.getString("MATOMO_URL", c.matomoUrl));
        c.siteId = cm.getInt("MATOMO_SITE_ID", c.siteId);
        c.tokenAuth = cm.getString("MATOMO_TOKEN_AUTH", null);
        c.multiTargetConfig = cm.getString("MULTI_TARGET_CONFIG", null);

        c.urlsFile = cm.getString("URLS_FILE", c.urlsFile);
        c.funnelConfigPath = cm.getString("FUNNEL_CONFIG_PATH", null);
        c.eventsConfigPath = cm.getString("EVENTS_CONFIG_PATH", null);

        c.targetVisitsPerDay = cm.getDouble("TARGET_VISITS_PER_DAY", c.targetVisitsPerDay);
        c.concurrency = cm.getInt("CONCURRENCY", c.concurrency);
        c.autoStopAfterHours = cm.getDouble("AUTO_STOP_AFTER_HOURS", c.autoStopAfterHours);
        c.maxTotalVisits = cm.getLong("MAX_TOTAL_VISITS", c.maxTotalVisits);
        c.maxVisitsPerDay = cm.getLong("MAX_VISITS_PER_DAY", c.maxVisitsPerDay);

        c.pageviewsMin = cm.getInt("PAGEVIEWS_MIN", c.pageviewsMin);
        c.pageviewsMax = cm.getInt("PAGEVIEWS_MAX", c.pageviewsMax);
        c.pauseBetweenPvsMin = cm.getDouble("PAUSE_BETWEEN_PVS_MIN", c.pauseBetweenPvsMin);
        c.pauseBetweenPvsMax = cm.getDouble("PAUSE_BETWEEN_PVS_MAX", c.pauseBetweenPvsMax);
        c.visitDurationMin = cm.getDouble("VISIT_DURATION_MIN", c.visitDurationMin);
        c.visitDurationMax = cm.getDouble("VISIT_DURATION_MAX", c.visitDurationMax);

        c.siteSearchProbability = cm.getDouble("SITESEARCH_PROBABILITY", c.siteSearchProbability);
        c.outlinksProbability = cm.getDouble("OUTLINKS_PROBABILITY", c.outlinksProbability);
        c.downloadsProbability = cm.getDouble("DOWNLOADS_PROBABILITY", c.downloadsProbability);
        c.clickEventsProbability = cm.getDouble("CLICK_EVENTS_PROBABILITY", c.clickEventsProbability);
        c.randomEventsProbability = cm.getDouble("RANDOM_EVENTS_PROBABILITY", c.randomEventsProbability);
        c.directTrafficProbability = cm.getDouble("DIRECT_TRAFFIC_PROBABILITY", c.directTrafficProbability);
        c.ecommerceProbability = cm.getDouble("ECOMMERCE_PROBABILITY", c.ecommerceProbability);

        c.ecommerceOrderValueMin = cm.getDouble("ECOMMERCE_ORDER_VALUE_MIN", c.ecommerceOrderValueMin);
        c.ecommerceOrderValueMax = cm.getDouble("ECOMMERCE_ORDER_VALUE_MAX", c.ecommerceOrderValueMax);
        c.ecommerceItemsMin = cm.getInt("ECOMMERCE_ITEMS_MIN", c.ecommerceItemsMin);
        c.ecommerceItemsMax = cm.getInt("ECOMMERCE_ITEMS_MAX", c.ecommerceItemsMax);
        c.ecommerceTaxRate = cm.getDouble("ECOMMERCE_TAX_RATE", c.ecommerceTaxRate);
        if (cm.has("ECOMMERCE_SHIPPING_RATES")) {
            c.ecommerceShippingRates = parseRates(cm.getRaw("ECOMMERCE_SHIPPING_RATES"));
        }
        c.ecommerceCurrency = cm.getString("ECOMMERCE_CURRENCY", c.ecommerceCurrency);

        c.randomizeVisitorCountries = cm.getBoolean("RANDOMIZE_VISITOR_COUNTRIES", c.randomizeVisitorCountries);
        c.timezone = parseZone(cm.getString("TIMEZONE", "CET"));

        c.backfillEnabled = cm.getBoolean("BACKFILL_ENABLED", c.backfillEnabled);
        c.backfillRunOnce = cm.getBoolean("BACKFILL_RUN_ONCE", c.backfillRunOnce);
        c.backfillStartDate = cm.getString("BACKFILL_START_DATE", null);
        c.backfillEndDate = cm.getString("BACKFILL_END_DATE", null);
        c.backfillDaysBack = cm.getOptionalInt("BACKFILL_DAYS_BACK");
        c.backfillDurationDays = cm.getOptionalInt("BACKFILL_DURATION_DAYS");
        c.backfillMaxVisitsPerDay = cm.getLong("BACKFILL_MAX_VISITS_PER_DAY", c.backfillMaxVisitsPerDay);
        c.backfillMaxVisitsTotal = cm.getLong("BACKFILL_MAX_VISITS_TOTAL", c.backfillMaxVisitsTotal);
        c.backfillRpsLimit = cm.getOptionalDouble("BACKFILL_RPS_LIMIT");
        c.backfillSeed = cm.getOptionalLong("BACKFILL_SEED");

        c.autoStart = cm.getBoolean("AUTO_START", c.autoStart);
        c.startSignalFile = cm.getString("START_SIGNAL_FILE", c.startSignalFile);
        c.startCheckIntervalSeconds = cm.getDouble("START_CHECK_INTERVAL", c.startCheckIntervalSeconds);
        c.requestTimeoutSeconds = cm.getDouble("REQUEST_TIMEOUT_SECONDS", c.requestTimeoutSeconds);
        c.statusServerEnabled = cm.getBoolean("STATUS_SERVER_ENABLED", c.statusServerEnabled);
        c.statusServerPort = cm.getInt("STATUS_SERVER_PORT", c.statusServerPort);

        c.validate();
        return c;
    }

    /**
     * Vérifie les bornes et les paires min/max.
     * La fenêtre de backfill est validée séparément (elle dépend de la date du jour).
     *
     * @throws ConfigurationException à la première incohérence
     */
    public void validate() {
        validateUrl(matomoUrl);
        requireAtLeast("MATOMO_SITE_ID", siteId, 1);
        if (targetVisitsPerDay < 1) {
            throw new ConfigurationException("TARGET_VISITS_PER_DAY must be >= 1");
        }
        requireRange("CONCURRENCY", concurrency, 1, 500);
        requireRange("PAGEVIEWS_MIN", pageviewsMin, 1, 100);
        requireRange("PAGEVIEWS_MAX", pageviewsMax, 1, 100);
        requireOrdered("PAGEVIEWS", pageviewsMin, pageviewsMax);
        requireNonNegative("PAUSE_BETWEEN_PVS_MIN", pauseBetweenPvsMin);
        requireOrdered("PAUSE_BETWEEN_PVS", pauseBetweenPvsMin, pauseBetweenPvsMax);
        if (visitDurationMin <= 0) {
            throw new ConfigurationException("VISIT_DURATION_MIN must be > 0");
        }
        requireOrdered("VISIT_DURATION", visitDurationMin, visitDurationMax);
        requireNonNegative("AUTO_STOP_AFTER_HOURS", autoStopAfterHours);
        requireNonNegative("MAX_TOTAL_VISITS", maxTotalVisits);
        requireNonNegative("MAX_VISITS_PER_DAY", maxVisitsPerDay);

        requireProbability("SITESEARCH_PROBABILITY", siteSearchProbability);
        requireProbability("OUTLINKS_PROBABILITY", outlinksProbability);
        requireProbability("DOWNLOADS_PROBABILITY", downloadsProbability);
        requireProbability("CLICK_EVENTS_PROBABILITY", clickEventsProbability);
        requireProbability("RANDOM_EVENTS_PROBABILITY", randomEventsProbability);
        requireProbability("DIRECT_TRAFFIC_PROBABILITY", directTrafficProbability);
        requireProbability("ECOMMERCE_PROBABILITY", ecommerceProbability);

        if (ecommerceOrderValueMin <= 0) {
            throw new ConfigurationException("ECOMMERCE_ORDER_VALUE_MIN must be > 0");
        }
        requireOrdered("ECOMMERCE_ORDER_VALUE", ecommerceOrderValueMin, ecommerceOrderValueMax);
        requireAtLeast("ECOMMERCE_ITEMS_MIN", ecommerceItemsMin, 1);
        requireOrdered("ECOMMERCE_ITEMS", ecommerceItemsMin, ecommerceItemsMax);
        requireProbability("ECOMMERCE_TAX_RATE", ecommerceTaxRate);
        if (ecommerceShippingRates.isEmpty()) {
            throw new ConfigurationException("ECOMMERCE_SHIPPING_RATES must list at least one rate");
        }
        double cheapestShipping = Double.MAX_VALUE;
        for (double rate : ecommerceShippingRates) {
            requireNonNegative("ECOMMERCE_SHIPPING_RATES", rate);
            cheapestShipping = Math.min(cheapestShipping, rate);
        }
        // une commande d'un article à 0,01 doit pouvoir tenir sous le maximum
        if ((cheapestShipping + 0.01) * (1 + ecommerceTaxRate) + 0.01 > ecommerceOrderValueMax) {
            throw new ConfigurationException("ECOMMERCE_ORDER_VALUE_MAX " + ecommerceOrderValueMax
                + " is below the cheapest shipping rate " + cheapestShipping + " plus tax");
        }
        if (ecommerceCurrency == null || !ecommerceCurrency.matches("[A-Z]{3}")) {
            throw new ConfigurationException("ECOMMERCE_CURRENCY must be 3 uppercase letters (e.g. SEK, EUR)");
        }

        requireNonNegative("BACKFILL_MAX_VISITS_PER_DAY", backfillMaxVisitsPerDay);
        requireNonNegative("BACKFILL_MAX_VISITS_TOTAL", backfillMaxVisitsTotal);
        if (backfillMaxVisitsTotal > 0 && backfillMaxVisitsPerDay > 0
                && backfillMaxVisitsTotal < backfillMaxVisitsPerDay) {
            throw new ConfigurationException("BACKFILL_MAX_VISITS_TOTAL must be >= BACKFILL_MAX_VISITS_PER_DAY");
        }
        if (backfillRpsLimit != null && backfillRpsLimit <= 0) {
            throw new ConfigurationException("BACKFILL_RPS_LIMIT must be > 0");
        }
        if (backfillSeed != null && backfillSeed < 0) {
            throw new ConfigurationException("BACKFILL_SEED must be >= 0");
        }

        if (startCheckIntervalSeconds <= 0) {
            throw new ConfigurationException("START_CHECK_INTERVAL must be > 0");
        }
        if (requestTimeoutSeconds <= 0) {
            throw new ConfigurationException("REQUEST_TIMEOUT_SECONDS must be > 0");
        }
        requireRange("STATUS_SERVER_PORT", statusServerPort, 1, 65535);
    }

    private static void validateUrl(String url) {
        if (url == null || url.isEmpty()) {
            throw new ConfigurationException("MATOMO_URL is required");
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equals("http") || scheme.equals("https"))) {
                throw new ConfigurationException("MATOMO_URL must use http:// or https://");
            }
            if (uri.getHost() == null) {
                throw new ConfigurationException("MATOMO_URL must include a valid host");
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException("MATOMO_URL is not a valid URL: " + url, e);
        }
    }

    private static void requireProbability(String key, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new ConfigurationException(key + " must be between 0 and 1, got " + value);
        }
    }

    private static void requireRange(String key, int value, int min, int max) {
        if (value < min || value > max) {
            throw new ConfigurationException(key + " must be between " + min + " and " + max + ", got " + value);
        }
    }

    private static void requireAtLeast(String key, long value, long min) {
        if (value < min) {
            throw new ConfigurationException(key + " must be >= " + min + ", got " + value);
        }
    }

    private static void requireNonNegative(String key, double value) {
        if (value < 0) {
            throw new ConfigurationException(key + " must be >= 0, got " + value);
        }
    }

    private static void requireOrdered(String prefix, double min, double max) {
        if (min > max) {
            throw new ConfigurationException(prefix + "_MIN cannot be greater than " + prefix + "_MAX");
        }
    }

    static List<Double> parseRates(String raw) {
        List<Double> rates = new ArrayList<>();
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                rates.add(Double.parseDouble(trimmed));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("ECOMMERCE_SHIPPING_RATES contains a non-numeric rate: " + trimmed, e);
            }
        }
        return rates;
    }

    private static ZoneId parseZone(String zone) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("TIMEZONE is not a valid zone id: " + zone, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result != null && result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    /**
     * Débit cible en visites par seconde.
     */
    public double getVisitsPerSecond() {
        return targetVisitsPerDay / 86400.0;
    }

    // Getters et Setters
    public String getMatomoUrl() { return matomoUrl; }
    public void setMatomoUrl(String matomoUrl) { this.matomoUrl = stripTrailingSlash(matomoUrl); }

    public int getSiteId() { return siteId; }
    public void setSiteId(int siteId) { this.siteId = siteId; }

    public String getTokenAuth() { return tokenAuth; }
    public void setTokenAuth(String tokenAuth) { this.tokenAuth = tokenAuth; }

    public String getMultiTargetConfig() { return multiTargetConfig; }
    public void setMultiTargetConfig(String multiTargetConfig) { this.multiTargetConfig = multiTargetConfig; }

    public String getUrlsFile() { return urlsFile; }
    public void setUrlsFile(String urlsFile) { this.urlsFile = urlsFile; }

    public String getFunnelConfigPath() { return funnelConfigPath; }
    public void setFunnelConfigPath(String funnelConfigPath) { this.funnelConfigPath = funnelConfigPath; }

    public String getEventsConfigPath() { return eventsConfigPath; }
    public void setEventsConfigPath(String eventsConfigPath) { this.eventsConfigPath = eventsConfigPath; }

    public double getTargetVisitsPerDay() { return targetVisitsPerDay; }
    public void setTargetVisitsPerDay(double targetVisitsPerDay) { this.targetVisitsPerDay = targetVisitsPerDay; }

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

    public double getAutoStopAfterHours() { return autoStopAfterHours; }
    public void setAutoStopAfterHours(double autoStopAfterHours) { this.autoStopAfterHours = autoStopAfterHours; }

    public long getMaxTotalVisits() { return maxTotalVisits; }
    public void setMaxTotalVisits(long maxTotalVisits) { this.maxTotalVisits = maxTotalVisits; }

    public long getMaxVisitsPerDay() { return maxVisitsPerDay; }
    public void setMaxVisitsPerDay(long maxVisitsPerDay) { this.maxVisitsPerDay = maxVisitsPerDay; }

    public int getPageviewsMin() { return pageviewsMin; }
    public void setPageviewsMin(int pageviewsMin) { this.pageviewsMin = pageviewsMin; }

    public int getPageviewsMax() { return pageviewsMax; }
    public void setPageviewsMax(int pageviewsMax) { this.pageviewsMax = pageviewsMax; }

    public double getPauseBetweenPvsMin() { return pauseBetweenPvsMin; }
    public void setPauseBetweenPvsMin(double pauseBetweenPvsMin) { this.pauseBetweenPvsMin = pauseBetweenPvsMin; }

    public double getPauseBetweenPvsMax() { return pauseBetweenPvsMax; }
    public void setPauseBetweenPvsMax(double pauseBetweenPvsMax) { this.pauseBetweenPvsMax = pauseBetweenPvsMax; }

    public double getVisitDurationMin() { return visitDurationMin; }
    public void setVisitDurationMin(double visitDurationMin) { this.visitDurationMin = visitDurationMin; }

    public double getVisitDurationMax() { return visitDurationMax; }
    public void setVisitDurationMax(double visitDurationMax) { this.visitDurationMax = visitDurationMax; }

    public double getSiteSearchProbability() { return siteSearchProbability; }
    public void setSiteSearchProbability(double siteSearchProbability) { this.siteSearchProbability = siteSearchProbability; }

    public double getOutlinksProbability() { return outlinksProbability; }
    public void setOutlinksProbability(double outlinksProbability) { this.outlinksProbability = outlinksProbability; }

    public double getDownloadsProbability() { return downloadsProbability; }
    public void setDownloadsProbability(double downloadsProbability) { this.downloadsProbability = downloadsProbability; }

    public double getClickEventsProbability() { return clickEventsProbability; }
    public void setClickEventsProbability(double clickEventsProbability) { this.clickEventsProbability = clickEventsProbability; }

    public double getRandomEventsProbability() { return randomEventsProbability; }
    public void setRandomEventsProbability(double randomEventsProbability) { this.randomEventsProbability = randomEventsProbability; }

    public double getDirectTrafficProbability() { return directTrafficProbability; }
    public void setDirectTrafficProbability(double directTrafficProbability) { this.directTrafficProbability = directTrafficProbability; }

    public double getEcommerceProbability() { return ecommerceProbability; }
    public void setEcommerceProbability(double ecommerceProbability) { this.ecommerceProbability = ecommerceProbability; }

    public double getEcommerceOrderValueMin() { return ecommerceOrderValueMin; }
    public void setEcommerceOrderValueMin(double ecommerceOrderValueMin) { this.ecommerceOrderValueMin = ecommerceOrderValueMin; }

    public double getEcommerceOrderValueMax() { return ecommerceOrderValueMax; }
    public void setEcommerceOrderValueMax(double ecommerceOrderValueMax) { this.ecommerceOrderValueMax = ecommerceOrderValueMax; }

    public int getEcommerceItemsMin() { return ecommerceItemsMin; }
    public void setEcommerceItemsMin(int ecommerceItemsMin) { this.ecommerceItemsMin = ecommerceItemsMin; }

    public int getEcommerceItemsMax() { return ecommerceItemsMax; }
    public void setEcommerceItemsMax(int ecommerceItemsMax) { this.ecommerceItemsMax = ecommerceItemsMax; }

    public double getEcommerceTaxRate() { return ecommerceTaxRate; }
    public void setEcommerceTaxRate(double ecommerceTaxRate) { this.ecommerceTaxRate = ecommerceTaxRate; }

    public List<Double> getEcommerceShippingRates() { return Collections.unmodifiableList(ecommerceShippingRates); }
    public void setEcommerceShippingRates(List<Double> rates) { this.ecommerceShippingRates = new ArrayList<>(rates); }

    public String getEcommerceCurrency() { return ecommerceCurrency; }
    public void setEcommerceCurrency(String ecommerceCurrency) { this.ecommerceCurrency = ecommerceCurrency; }

    public boolean isRandomizeVisitorCountries() { return randomizeVisitorCountries; }
    public void setRandomizeVisitorCountries(boolean randomizeVisitorCountries) { this.randomizeVisitorCountries = randomizeVisitorCountries; }

    public ZoneId getTimezone() { return timezone; }
    public void setTimezone(ZoneId timezone) { this.timezone = timezone; }

    public boolean isBackfillEnabled() { return backfillEnabled; }
    public void setBackfillEnabled(boolean backfillEnabled) { this.backfillEnabled = backfillEnabled; }

    public boolean isBackfillRunOnce() { return backfillRunOnce; }
    public void setBackfillRunOnce(boolean backfillRunOnce) { this.backfillRunOnce = backfillRunOnce; }

    public String getBackfillStartDate() { return backfillStartDate; }
    public void setBackfillStartDate(String backfillStartDate) { this.backfillStartDate = backfillStartDate; }

    public String getBackfillEndDate() { return backfillEndDate; }
    public void setBackfillEndDate(String backfillEndDate) { this.backfillEndDate = backfillEndDate; }

    public Integer getBackfillDaysBack() { return backfillDaysBack; }
    public void setBackfillDaysBack(Integer backfillDaysBack) { this.backfillDaysBack = backfillDaysBack; }

    public Integer getBackfillDurationDays() { return backfillDurationDays; }
    public void setBackfillDurationDays(Integer backfillDurationDays) { this.backfillDurationDays = backfillDurationDays; }

    public long getBackfillMaxVisitsPerDay() { return backfillMaxVisitsPerDay; }
    public void setBackfillMaxVisitsPerDay(long backfillMaxVisitsPerDay) { this.backfillMaxVisitsPerDay = backfillMaxVisitsPerDay; }

    public long getBackfillMaxVisitsTotal() { return backfillMaxVisitsTotal; }
    public void setBackfillMaxVisitsTotal(long backfillMaxVisitsTotal) { this.backfillMaxVisitsTotal = backfillMaxVisitsTotal; }

    public Double getBackfillRpsLimit() { return backfillRpsLimit; }
    public void setBackfillRpsLimit(Double backfillRpsLimit) { this.backfillRpsLimit = backfillRpsLimit; }

    public Long getBackfillSeed() { return backfillSeed; }
    public void setBackfillSeed(Long backfillSeed) { this.backfillSeed = backfillSeed; }

    public boolean isAutoStart() { return autoStart; }
    public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

    public String getStartSignalFile() { return startSignalFile; }
    public void setStartSignalFile(String startSignalFile) { this.startSignalFile = startSignalFile; }

    public double getStartCheckIntervalSeconds() { return startCheckIntervalSeconds; }
    public void setStartCheckIntervalSeconds(double startCheckIntervalSeconds) { this.startCheckIntervalSeconds = startCheckIntervalSeconds; }

    public double getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(double requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }

    public boolean isStatusServerEnabled() { return statusServerEnabled; }
    public void setStatusServerEnabled(boolean statusServerEnabled) { this.statusServerEnabled = statusServerEnabled; }

    public int getStatusServerPort() { return statusServerPort; }
    public void setStatusServerPort(int statusServerPort) { this.statusServerPort = statusServerPort; }

    @Override
    public String toString() {
        return String.format(
            "LoadGeneratorConfig{url=%s, site=%d, visits/day=%.0f, concurrency=%d, pageviews=%d-%d, backfill=%b}",
            matomoUrl, siteId, targetVisitsPerDay, concurrency, pageviewsMin, pageviewsMax, backfillEnabled
        );
    }
}
