package com.visitsense.loadgen.core.funnel;

import com.visitsense.loadgen.config.ConfigurationException;

/**
 * Étape typée d'un funnel. Seuls les champs propres au type sont renseignés.
 * Le délai [delayMin, delayMax] (secondes) s'applique après l'étape.
 */
public final class FunnelStep {
    private final StepType type;
    private final String url;
    private final String actionName;
    private final double delaySecondsMin;
    private final double delaySecondsMax;

    // event
    private final String eventCategory;
    private final String eventAction;
    private final String eventName;
    private final Double eventValue;

    // site_search
    private final String searchKeyword;
    private final String searchCategory;
    private final Integer searchResults;

    // outlink / download
    private final String targetUrl;

    // ecommerce
    private final Double ecommerceRevenue;
    private final Double ecommerceSubtotal;
    private final Double ecommerceTax;
    private final Double ecommerceShipping;
    private final String ecommerceCurrency;

    private FunnelStep(Builder b) {
        this.type = b.type;
        this.url = blankToNull(b.url);
        this.actionName = blankToNull(b.actionName);
        this.delaySecondsMin = b.delaySecondsMin;
        this.delaySecondsMax = b.delaySecondsMax;
        this.eventCategory = blankToNull(b.eventCategory);
        this.eventAction = blankToNull(b.eventAction);
        this.eventName = blankToNull(b.eventName);
        this.eventValue = b.eventValue;
        this.searchKeyword = blankToNull(b.searchKeyword);
        this.searchCategory = blankToNull(b.searchCategory);
        this.searchResults = b.searchResults;
        this.targetUrl = blankToNull(b.targetUrl);
        this.ecommerceRevenue = b.ecommerceRevenue;
        this.ecommerceSubtotal = b.ecommerceSubtotal;
        this.ecommerceTax = b.ecommerceTax;
        this.ecommerceShipping = b.ecommerceShipping;
        this.ecommerceCurrency = blankToNull(b.ecommerceCurrency);
        validate();
    }

    private void validate() {
        if (type == null) {
            throw new ConfigurationException("Step type is required");
        }
        if (delaySecondsMin < 0 || delaySecondsMax < delaySecondsMin) {
            throw new ConfigurationException(String.format(
                "Invalid delay window [%s, %s] for %s step", delaySecondsMin, delaySecondsMax, type));
        }
        switch (type) {
            case EVENT:
                if (eventCategory == null || eventAction == null || eventName == null) {
                    throw new ConfigurationException("Event step requires event_category, event_action and event_name");
                }
                break;
            case SITE_SEARCH:
                if (searchKeyword == null) {
                    throw new ConfigurationException("Site search step requires search_keyword");
                }
                if (searchResults != null && searchResults < 0) {
                    throw new ConfigurationException("search_results must be >= 0");
                }
                break;
            case OUTLINK:
            case DOWNLOAD:
                if (targetUrl == null) {
                    throw new ConfigurationException(type + " step requires target_url");
                }
                break;
            default:
                break;
        }
    }

    private static String blankToNull(String value) {
        return (value == null || value.trim().isEmpty()) ? null : value.trim();
    }

    public static Builder builder(StepType type) {
        return new Builder(type);
    }

    public StepType getType() { return type; }
    public String getUrl() { return url; }
    public String getActionName() { return actionName; }
    public double getDelaySecondsMin() { return delaySecondsMin; }
    public double getDelaySecondsMax() { return delaySecondsMax; }
    public String getEventCategory() { return eventCategory; }
    public String getEventAction() { return eventAction; }
    public String getEventName() { return eventName; }
    public Double getEventValue() { return eventValue; }
    public String getSearchKeyword() { return searchKeyword; }
    public String getSearchCategory() { return searchCategory; }
    public Integer getSearchResults() { return searchResults; }
    public String getTargetUrl() { return targetUrl; }
    public Double getEcommerceRevenue() { return ecommerceRevenue; }
    public Double getEcommerceSubtotal() { return ecommerceSubtotal; }
    public Double getEcommerceTax() { return ecommerceTax; }
    public Double getEcommerceShipping() { return ecommerceShipping; }
    public String getEcommerceCurrency() { return ecommerceCurrency; }

    @Override
    public String toString() {
        return String.format("FunnelStep{type=%s, url=%s, delay=[%.1f, %.1f]}",
            type, url, delaySecondsMin, delaySecondsMax);
    }

    public static final class Builder {
        private final StepType type;
        private String url;
        private String actionName;
        private double delaySecondsMin;
        private double delaySecondsMax;
        private String eventCategory;
        private String eventAction;
        private String eventName;
        private Double eventValue;
        private String searchKeyword;
        private String searchCategory;
        private Integer searchResults;
        private String targetUrl;
        private Double ecommerceRevenue;
        private Double ecommerceSubtotal;
        private Double ecommerceTax;
        private Double ecommerceShipping;
        private String ecommerceCurrency;

        private Builder(StepType type) {
            this.type = type;
        }

        public Builder url(String url) { this.url = url; return this; }
        public Builder actionName(String actionName) { this.actionName = actionName; return this; }

        public Builder delay(double min, double max) {
            this.delaySecondsMin = min;
            this.delaySecondsMax = max;
            return this;
        }

        public Builder event(String category, String action, String name, Double value) {
            this.eventCategory = category;
            this.eventAction = action;
            this.eventName = name;
            this.eventValue = value;
            return this;
        }

        public Builder search(String keyword, String category, Integer results) {
            this.searchKeyword = keyword;
            this.searchCategory = category;
            this.searchResults = results;
            return this;
        }

        public Builder targetUrl(String targetUrl) { this.targetUrl = targetUrl; return this; }

        public Builder ecommerce(Double revenue, Double subtotal, Double tax, Double shipping, String currency) {
            this.ecommerceRevenue = revenue;
            this.ecommerceSubtotal = subtotal;
            this.ecommerceTax = tax;
            this.ecommerceShipping = shipping;
            this.ecommerceCurrency = currency;
            return this;
        }

        /**
         * @throws ConfigurationException si l'étape est incohérente
         */
        public FunnelStep build() {
            return new FunnelStep(this);
        }
    }
}
