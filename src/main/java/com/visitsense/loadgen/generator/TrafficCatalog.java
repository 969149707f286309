package com.visitsense.loadgen.generator;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Données statiques utilisées pour habiller les visites.
 */
public final class TrafficCatalog {

    public static final List<String> USER_AGENTS = Collections.unmodifiableList(Arrays.asList(
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/116.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:117.0) Gecko/20100101 Firefox/117.0",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36",
        "Mozilla/5.0 (iPhone; CPU iPhone OS 14_4 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/14.0 Mobile/15E148 Safari/604.1",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0 Safari/537.36 Edg/121.0",
        "Mozilla/5.0 (Linux; Android 13; Pixel 7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Mobile Safari/537.36"
    ));

    public static final List<String> SEARCH_TERMS = Collections.unmodifiableList(Arrays.asList(
        "product", "service", "contact", "about", "help", "support", "pricing", "features",
        "login", "register", "download", "documentation", "tutorial", "guide", "faq",
        "news", "blog", "updates", "announcement", "release", "version", "security",
        "privacy", "terms", "policy", "legal", "careers", "jobs", "team", "company",
        "analytics", "tracking", "dashboard", "report", "statistics", "metrics", "data"
    ));

    public static final List<String> SEARCH_CATEGORIES = Collections.unmodifiableList(Arrays.asList(
        "Products", "Support", "Documentation"
    ));

    public static final List<String> OUTLINKS = Collections.unmodifiableList(Arrays.asList(
        "https://github.com", "https://stackoverflow.com", "https://developer.mozilla.org",
        "https://www.w3.org", "https://nodejs.org", "https://reactjs.org", "https://vuejs.org",
        "https://angular.io", "https://jquery.com", "https://getbootstrap.com",
        "https://tailwindcss.com", "https://fontawesome.com", "https://unsplash.com",
        "https://fonts.google.com", "https://codepen.io", "https://jsfiddle.net",
        "https://wikipedia.org", "https://youtube.com", "https://twitter.com",
        "https://linkedin.com", "https://facebook.com", "https://instagram.com",
        "https://reddit.com", "https://medium.com", "https://dev.to"
    ));

    // Chemins relatifs résolus contre la page courante
    public static final List<String> DOWNLOADS = Collections.unmodifiableList(Arrays.asList(
        "/downloads/user-manual.pdf", "/downloads/getting-started-guide.pdf",
        "/downloads/api-documentation.pdf", "/downloads/whitepaper.pdf",
        "/downloads/case-study.pdf", "/downloads/technical-specs.pdf",
        "/files/product-brochure.pdf", "/files/pricing-sheet.pdf",
        "/assets/company-presentation.pptx", "/assets/logo-pack.zip",
        "/downloads/software-v2.1.0.zip", "/downloads/mobile-app.apk",
        "/files/dataset.csv", "/files/report-2024.xlsx",
        "/downloads/template.docx", "/downloads/configuration.json",
        "/files/backup.tar.gz", "/downloads/installer.exe",
        "/assets/images.zip", "/downloads/source-code.zip"
    ));

    public static final List<String> EXTERNAL_REFERRERS = Collections.unmodifiableList(Arrays.asList(
        "https://www.google.com/", "https://www.bing.com/", "https://duckduckgo.com/",
        "https://search.yahoo.com/", "https://www.ecosia.org/", "https://www.facebook.com/",
        "https://t.co/", "https://www.linkedin.com/", "https://www.reddit.com/",
        "https://news.ycombinator.com/", "https://medium.com/", "https://github.com/"
    ));

    private TrafficCatalog() {
    }
}
