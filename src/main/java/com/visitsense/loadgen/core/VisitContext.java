package com.visitsense.loadgen.core;

/**
 * État d'un visiteur simulé pendant une visite.
 * Seule la dernière page visitée évolue au fil des hits.
 */
public class VisitContext {
    private final String visitorId;
    private final String userAgent;
    private final String referrer;
    private final String country;
    private final String ipAddress;
    private String lastPageUrl;

    public VisitContext(String visitorId, String userAgent, String referrer,
                        String country, String ipAddress) {
        this.visitorId = visitorId;
        this.userAgent = userAgent;
        this.referrer = referrer;
        this.country = country;
        this.ipAddress = ipAddress;
    }

    public String getVisitorId() { return visitorId; }
    public String getUserAgent() { return userAgent; }

    /**
     * @return le référent externe, ou null pour un accès direct
     */
    public String getReferrer() { return referrer; }

    public boolean isDirect() { return referrer == null; }

    public String getCountry() { return country; }
    public String getIpAddress() { return ipAddress; }

    public String getLastPageUrl() { return lastPageUrl; }
    public void setLastPageUrl(String lastPageUrl) { this.lastPageUrl = lastPageUrl; }

    @Override
    public String toString() {
        return String.format("VisitContext{id=%s, direct=%b, country=%s}", visitorId, isDirect(), country);
    }
}
