package com.visitsense.loadgen.generator;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Random;

import com.visitsense.loadgen.config.LoadGeneratorConfig;
import com.visitsense.loadgen.core.TrackingHit;
import com.visitsense.loadgen.core.VisitContext;
import com.visitsense.loadgen.generator.EventCatalog.EventDefinition;

/**
 * Crée les visiteurs et les paramètres communs à tous les hits d'une visite.
 */
public class HitFactory {
    public static final DateTimeFormatter CDT_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private static final String HEX = "0123456789abcdef";
    private static final String ALNUM = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final Random random;
    private final GeoIpSelector geoIpSelector;
    private final double directTrafficProbability;

    public HitFactory(LoadGeneratorConfig config, Random random) {
        this(random,
             config.isRandomizeVisitorCountries() ? new GeoIpSelector(random) : null,
             config.getDirectTrafficProbability());
    }

    /**
     * @param geoIpSelector null pour ne pas envoyer de {@code cip}
     */
    public HitFactory(Random random, GeoIpSelector geoIpSelector, double directTrafficProbability) {
        this.random = random;
        this.geoIpSelector = geoIpSelector;
        this.directTrafficProbability = directTrafficProbability;
    }

    /**
     * Copie liée à un autre générateur aléatoire (une visite rejouable à partir de sa graine).
     */
    public HitFactory withRandom(Random visitRandom) {
        return new HitFactory(visitRandom,
            geoIpSelector != null ? new GeoIpSelector(visitRandom) : null,
            directTrafficProbability);
    }

    public VisitContext newVisitContext() {
        String visitorId = randomHex(16);
        String userAgent = pick(TrafficCatalog.USER_AGENTS);
        String referrer = random.nextDouble() < directTrafficProbability
            ? null
            : pick(TrafficCatalog.EXTERNAL_REFERRERS);

        String country = null;
        String ip = null;
        if (geoIpSelector != null) {
            GeoIpSelector.Selection selection = geoIpSelector.select();
            country = selection.getCountry();
            ip = selection.getIpAddress();
        }
        return new VisitContext(visitorId, userAgent, referrer, country, ip);
    }

    /**
     * Hit avec les paramètres communs : rec, _id, rand, cdt, url et cip le cas échéant.
     */
    public TrackingHit newHit(TrackingHit.Kind kind, VisitContext context, String url, Instant timestamp) {
        return new TrackingHit(kind, context.getUserAgent())
            .param("rec", 1)
            .param("_id", context.getVisitorId())
            .param("rand", random.nextInt(Integer.MAX_VALUE))
            .param("cdt", CDT_FORMAT.format(timestamp))
            .param("url", url)
            .param("cip", context.getIpAddress());
    }

    public TrackingHit pageview(VisitContext context, String url, String actionName,
                                String pageviewId, Instant timestamp) {
        return newHit(TrackingHit.Kind.PAGEVIEW, context, url, timestamp)
            .param("action_name", actionName)
            .param("pv_id", pageviewId);
    }

    public TrackingHit siteSearch(VisitContext context, String url, String keyword, String category,
                                  Integer resultCount, String pageviewId, Instant timestamp) {
        return newHit(TrackingHit.Kind.SITE_SEARCH, context, url, timestamp)
            .param("action_name", "Search: " + keyword)
            .param("pv_id", pageviewId)
            .param("search", keyword)
            .param("search_cat", category)
            .param("search_count", resultCount);
    }

    /**
     * Clic sortant : {@code url} et {@code link} portent la destination,
     * {@code urlref} la page qui contenait le lien.
     */
    public TrackingHit outlink(VisitContext context, String pageUrl, String link, Instant timestamp) {
        return newHit(TrackingHit.Kind.OUTLINK, context, link, timestamp)
            .param("link", link)
            .param("urlref", pageUrl)
            .param("action_name", "Outlink: " + link);
    }

    public TrackingHit download(VisitContext context, String pageUrl, String downloadUrl, Instant timestamp) {
        return newHit(TrackingHit.Kind.DOWNLOAD, context, downloadUrl, timestamp)
            .param("download", downloadUrl)
            .param("urlref", pageUrl)
            .param("action_name", "Download: " + fileName(downloadUrl));
    }

    public TrackingHit event(VisitContext context, String url, EventDefinition event, Instant timestamp) {
        return event(context, url, event.getCategory(), event.getAction(), event.getName(),
                     event.getValue(), timestamp);
    }

    public TrackingHit event(VisitContext context, String url, String category, String action,
                             String name, Number value, Instant timestamp) {
        return newHit(TrackingHit.Kind.EVENT, context, url, timestamp)
            .param("e_c", category)
            .param("e_a", action)
            .param("e_n", name)
            .param("e_v", value == null ? null : formatNumber(value));
    }

    /**
     * Conversion e-commerce (objectif 0) rattachée à la dernière page.
     */
    public TrackingHit ecommerce(VisitContext context, String url, EcommerceOrder order, Instant timestamp) {
        return newHit(TrackingHit.Kind.ECOMMERCE, context, url, timestamp)
            .param("idgoal", 0)
            .param("ec_id", order.getOrderId())
            .param("ec_items", order.itemsJson())
            .param("revenue", formatAmount(order.getRevenue()))
            .param("ec_st", formatAmount(order.getSubtotal()))
            .param("ec_tx", formatAmount(order.getTax()))
            .param("ec_sh", formatAmount(order.getShipping()))
            .param("ec_currency", order.getCurrency());
    }

    /**
     * Signal "toujours sur la page" qui prolonge la durée de la dernière page vue.
     */
    public TrackingHit ping(VisitContext context, String url, String pageviewId, Instant timestamp) {
        return newHit(TrackingHit.Kind.PING, context, url, timestamp)
            .param("ping", 1)
            .param("pv_id", pageviewId);
    }

    /**
     * Résout un chemin de téléchargement relatif contre le schéma et l'hôte de la page courante.
     */
    public static String resolveDownload(String pageUrl, String file) {
        if (file.startsWith("http://") || file.startsWith("https://")) {
            return file;
        }
        try {
            URI page = new URI(pageUrl);
            if (page.getScheme() == null || page.getRawAuthority() == null) {
                return file;
            }
            String path = file.startsWith("/") ? file : "/" + file;
            return page.getScheme() + "://" + page.getRawAuthority() + path;
        } catch (URISyntaxException e) {
            return file;
        }
    }

    static String fileName(String url) {
        int slash = url.lastIndexOf('/');
        return slash >= 0 ? url.substring(slash + 1) : url;
    }

    static String formatNumber(Number value) {
        double d = value.doubleValue();
        if (d == Math.rint(d) && !Double.isInfinite(d)) {
            return String.valueOf((long) d);
        }
        return String.valueOf(d);
    }

    static String formatAmount(double amount) {
        return EcommerceOrderGenerator.money(amount).toPlainString();
    }

    public String randomHex(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(HEX.charAt(random.nextInt(HEX.length())));
        }
        return sb.toString();
    }

    /**
     * Identifiant de page vue (6 caractères), repris par le ping final.
     */
    public String newPageviewId() {
        StringBuilder sb = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            sb.append(ALNUM.charAt(random.nextInt(ALNUM.length())));
        }
        return sb.toString();
    }

    public <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    public Random getRandom() {
        return random;
    }
}
