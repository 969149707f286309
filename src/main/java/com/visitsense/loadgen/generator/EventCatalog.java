package com.visitsense.loadgen.generator;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Catalogue des événements personnalisés : les clics d'interface et les événements divers.
 * Un fichier {@code {"click_events": [...], "random_events": [...]}} peut remplacer
 * chacune des deux listes intégrées.
 */
public class EventCatalog {
    private static final Logger logger = LoggerFactory.getLogger(EventCatalog.class);

    public static final List<EventDefinition> DEFAULT_CLICK_EVENTS = Collections.unmodifiableList(Arrays.asList(
        new EventDefinition("Navigation", "Menu Click", "Main Menu", null),
        new EventDefinition("Navigation", "Button Click", "Get Started", null),
        new EventDefinition("Navigation", "Link Click", "Learn More", null),
        new EventDefinition("UI", "Tab Click", "Product Features", null),
        new EventDefinition("UI", "Accordion Click", "FAQ Section", null),
        new EventDefinition("UI", "Modal Open", "Contact Form", null),
        new EventDefinition("UI", "Image Click", "Product Gallery", null),
        new EventDefinition("Social", "Share Click", "Twitter Share", null),
        new EventDefinition("Social", "Share Click", "Facebook Share", null),
        new EventDefinition("Social", "Like Click", "Article Like", null),
        new EventDefinition("Form", "Submit", "Newsletter Signup", null),
        new EventDefinition("Form", "Focus", "Search Input", null),
        new EventDefinition("Video", "Play", "Tutorial Video", null),
        new EventDefinition("Video", "Pause", "Product Demo", null),
        new EventDefinition("CTA", "Click", "Free Trial", null),
        new EventDefinition("CTA", "Click", "Request Quote", null)
    ));

    public static final List<EventDefinition> DEFAULT_RANDOM_EVENTS = Collections.unmodifiableList(Arrays.asList(
        new EventDefinition("Engagement", "Scroll", "Page Bottom", 100),
        new EventDefinition("Engagement", "Time on Page", "Long Read", 300),
        new EventDefinition("Performance", "Load Time", "Page Load", 1200),
        new EventDefinition("Error", "404 Error", "Broken Link", null),
        new EventDefinition("Error", "Form Error", "Validation Failed", null),
        new EventDefinition("Feature", "Tool Usage", "Calculator", 1),
        new EventDefinition("Feature", "Filter Applied", "Product Filter", null),
        new EventDefinition("Feature", "Sort Applied", "Price Sort", null),
        new EventDefinition("Content", "Print", "Article Print", null),
        new EventDefinition("Content", "Bookmark", "Page Bookmark", null),
        new EventDefinition("Mobile", "Swipe", "Image Gallery", null),
        new EventDefinition("Mobile", "Tap", "Phone Number", null),
        new EventDefinition("Analytics", "Conversion", "Goal Complete", 50),
        new EventDefinition("Analytics", "Exit Intent", "Modal Trigger", null),
        new EventDefinition("User", "Login", "User Login", null),
        new EventDefinition("User", "Logout", "User Logout", null)
    ));

    private final List<EventDefinition> clickEvents;
    private final List<EventDefinition> randomEvents;

    public EventCatalog() {
        this(DEFAULT_CLICK_EVENTS, DEFAULT_RANDOM_EVENTS);
    }

    public EventCatalog(List<EventDefinition> clickEvents, List<EventDefinition> randomEvents) {
        this.clickEvents = Collections.unmodifiableList(new ArrayList<>(clickEvents));
        this.randomEvents = Collections.unmodifiableList(new ArrayList<>(randomEvents));
    }

    /**
     * Charge le catalogue depuis un fichier JSON. Une liste absente, vide ou entièrement
     * invalide est remplacée par la liste intégrée correspondante.
     */
    public static EventCatalog load(Path path) throws IOException {
        JsonObject root;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonElement element = JsonParser.parseReader(reader);
            if (!element.isJsonObject()) {
                throw new IOException("Events file " + path + " must contain a JSON object");
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Events file " + path + " is not valid JSON", e);
        }

        List<EventDefinition> click = parseList(root, "click_events");
        List<EventDefinition> other = parseList(root, "random_events");
        EventCatalog catalog = new EventCatalog(
            click.isEmpty() ? DEFAULT_CLICK_EVENTS : click,
            other.isEmpty() ? DEFAULT_RANDOM_EVENTS : other
        );
        logger.info("Loaded events from {}: {} click events, {} random events",
                   path, catalog.clickEvents.size(), catalog.randomEvents.size());
        return catalog;
    }

    private static List<EventDefinition> parseList(JsonObject root, String key) {
        List<EventDefinition> events = new ArrayList<>();
        if (!root.has(key) || !root.get(key).isJsonArray()) {
            return events;
        }
        JsonArray array = root.getAsJsonArray(key);
        for (int i = 0; i < array.size(); i++) {
            try {
                events.add(parseEvent(array.get(i)));
            } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
                logger.warn("Skipping invalid entry {} in {}: {}", i, key, e.getMessage());
            }
        }
        return events;
    }

    private static EventDefinition parseEvent(JsonElement element) {
        if (!element.isJsonObject()) {
            throw new IllegalArgumentException("event must be an object");
        }
        JsonObject obj = element.getAsJsonObject();
        String category = requireText(obj, "category");
        String action = requireText(obj, "action");
        String name = requireText(obj, "name");
        Integer value = null;
        if (obj.has("value") && !obj.get("value").isJsonNull()) {
            try {
                value = obj.get("value").getAsInt();
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("value must be a number", e);
            }
        }
        return new EventDefinition(category, action, name, value);
    }

    private static String requireText(JsonObject obj, String field) {
        if (!obj.has(field) || obj.get(field).isJsonNull()) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        String text = obj.get(field).getAsString().trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("field '" + field + "' is empty");
        }
        return text;
    }

    public EventDefinition randomClickEvent(Random random) {
        return clickEvents.get(random.nextInt(clickEvents.size()));
    }

    public EventDefinition randomOtherEvent(Random random) {
        return randomEvents.get(random.nextInt(randomEvents.size()));
    }

    public List<EventDefinition> getClickEvents() { return clickEvents; }
    public List<EventDefinition> getRandomEvents() { return randomEvents; }

    /**
     * Un événement Matomo (e_c / e_a / e_n / e_v).
     */
    public static final class EventDefinition {
        private final String category;
        private final String action;
        private final String name;
        private final Integer value;

        public EventDefinition(String category, String action, String name, Integer value) {
            this.category = category;
            this.action = action;
            this.name = name;
            this.value = value;
        }

        public String getCategory() { return category; }
        public String getAction() { return action; }
        public String getName() { return name; }
        public Integer getValue() { return value; }

        @Override
        public String toString() {
            return category + "/" + action + "/" + name + (value != null ? "=" + value : "");
        }
    }
}
