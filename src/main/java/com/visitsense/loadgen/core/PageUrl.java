package com.visitsense.loadgen.core;

import java.util.Objects;

/**
 * Une entrée de la liste d'URLs : l'adresse et un titre optionnel.
 */
public final class PageUrl {
    private final String url;
    private final String title;

    public PageUrl(String url) {
        this(url, null);
    }

    public PageUrl(String url, String title) {
        this.url = Objects.requireNonNull(url, "url");
        this.title = (title == null || title.trim().isEmpty()) ? null : title.trim();
    }

    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public boolean hasTitle() { return title != null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageUrl)) return false;
        PageUrl other = (PageUrl) o;
        return url.equals(other.url) && Objects.equals(title, other.title);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, title);
    }

    @Override
    public String toString() {
        return title != null ? url + " (" + title + ")" : url;
    }
}
