package com.visitsense.loadgen.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Une requête de tracking prête à l'envoi.
 * Les paramètres gardent leur ordre d'insertion (utile pour les logs et les tests).
 */
public class TrackingHit {

    public enum Kind {
        PAGEVIEW, SITE_SEARCH, OUTLINK, DOWNLOAD, EVENT, ECOMMERCE, PING
    }

    private final Kind kind;
    private final String userAgent;
    private final Map<String, String> params;

    public TrackingHit(Kind kind, String userAgent) {
        this.kind = kind;
        this.userAgent = userAgent;
        this.params = new LinkedHashMap<>();
    }

    /**
     * Ajoute un paramètre ; une valeur null est ignorée.
     */
    public TrackingHit param(String name, Object value) {
        if (value != null) {
            params.put(name, String.valueOf(value));
        }
        return this;
    }

    public String get(String name) {
        return params.get(name);
    }

    public boolean has(String name) {
        return params.containsKey(name);
    }

    public Kind getKind() {
        return kind;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Map<String, String> getParams() {
        return Collections.unmodifiableMap(params);
    }

    @Override
    public String toString() {
        return String.format("TrackingHit{kind=%s, url=%s, cdt=%s}", kind, params.get("url"), params.get("cdt"));
    }
}
