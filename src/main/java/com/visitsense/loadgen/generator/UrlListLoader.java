package com.visitsense.loadgen.generator;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.config.ConfigurationException;
import com.visitsense.loadgen.core.PageUrl;

/**
 * Lit la liste des pages à visiter : une URL par ligne, titre optionnel après une tabulation.
 * Les lignes vides et celles commençant par # sont ignorées.
 */
public final class UrlListLoader {
    private static final Logger logger = LoggerFactory.getLogger(UrlListLoader.class);

    private UrlListLoader() {
    }

    public static List<PageUrl> load(Path path) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        List<PageUrl> urls = parse(lines);
        if (urls.isEmpty()) {
            throw new ConfigurationException("No URLs found in " + path);
        }
        logger.info("Loaded {} URLs from {}", urls.size(), path);
        return urls;
    }

    static List<PageUrl> parse(List<String> lines) {
        List<PageUrl> urls = new ArrayList<>();
        for (String line : lines) {
            String s = line.trim();
            if (s.isEmpty() || s.startsWith("#")) {
                continue;
            }
            String title = null;
            int tab = s.indexOf('\t');
            if (tab >= 0) {
                title = s.substring(tab + 1).trim();
                s = s.substring(0, tab).trim();
            }
            // seul le premier mot compte comme URL
            String url = s.split("\\s+")[0];
            urls.add(new PageUrl(url, title));
        }
        return Collections.unmodifiableList(urls);
    }
}
