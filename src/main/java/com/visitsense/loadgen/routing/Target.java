package com.visitsense.loadgen.routing;

import java.util.Objects;

/**
 * Une destination de tracking (instance Matomo + site).
 */
public final class Target {
    private static final String TRACKER_SCRIPT = "matomo.php";

    private final String name;
    private final String url;
    private final int siteId;
    private final String tokenAuth;
    private final int weight;
    private final boolean enabled;

    public Target(String name, String url, int siteId) {
        this(name, url, siteId, null, 1, true);
    }

    public Target(String name, String url, int siteId, String tokenAuth, int weight, boolean enabled) {
        this.name = Objects.requireNonNull(name, "name");
        this.url = stripTrailingSlash(Objects.requireNonNull(url, "url"));
        this.siteId = siteId;
        this.tokenAuth = (tokenAuth == null || tokenAuth.isEmpty()) ? null : tokenAuth;
        this.weight = weight;
        this.enabled = enabled;
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    /**
     * URL du script de tracking : l'URL elle-même si elle désigne déjà un script PHP,
     * sinon {@code <url>/matomo.php}.
     */
    public String getTrackingEndpoint() {
        if (url.endsWith(".php")) {
            return url;
        }
        return url + "/" + TRACKER_SCRIPT;
    }

    public String getName() { return name; }
    public String getUrl() { return url; }
    public int getSiteId() { return siteId; }
    public String getTokenAuth() { return tokenAuth; }
    public boolean hasTokenAuth() { return tokenAuth != null; }
    public int getWeight() { return weight; }
    public boolean isEnabled() { return enabled; }

    @Override
    public String toString() {
        return String.format("Target{name=%s, url=%s, site=%d, weight=%d, enabled=%b}",
            name, url, siteId, weight, enabled);
    }
}
