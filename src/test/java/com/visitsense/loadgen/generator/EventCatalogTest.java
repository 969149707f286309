package com.visitsense.loadgen.generator;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Random;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

/**
 * Tests du catalogue d'événements personnalisés
 */
public class EventCatalogTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private File write(String json) throws IOException {
        File file = folder.newFile("events.json");
        Files.write(file.toPath(), json.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testDefaults() {
        EventCatalog catalog = new EventCatalog();
        assertEquals(16, catalog.getClickEvents().size());
        assertEquals(16, catalog.getRandomEvents().size());
        assertNotNull(catalog.randomClickEvent(new Random(1)));
    }

    @Test
    public void testInvalidEntriesSkipped() throws IOException {
        File file = write("{\"click_events\": ["
            + "{\"category\":\"CTA\",\"action\":\"Click\",\"name\":\"Hero\",\"value\":3},"
            + "{\"category\":\"CTA\",\"action\":\"Click\"},"
            + "\"not an object\","
            + "{\"category\":\"CTA\",\"action\":\"Click\",\"name\":\"Footer\",\"value\":\"many\"},"
            + "{\"category\":\"Nav\",\"action\":\"Open\",\"name\":\"Menu\"}"
            + "]}");

        EventCatalog catalog = EventCatalog.load(file.toPath());

        assertEquals("Only the two valid entries should load", 2, catalog.getClickEvents().size());
        assertEquals(Integer.valueOf(3), catalog.getClickEvents().get(0).getValue());
        assertNull(catalog.getClickEvents().get(1).getValue());
        assertEquals("Missing list should use defaults",
                    EventCatalog.DEFAULT_RANDOM_EVENTS.size(), catalog.getRandomEvents().size());
    }

    @Test
    public void testAllInvalidFallsBackToDefaults() throws IOException {
        File file = write("{\"click_events\": [{\"category\":\"\"}], \"random_events\": []}");

        EventCatalog catalog = EventCatalog.load(file.toPath());

        assertEquals(EventCatalog.DEFAULT_CLICK_EVENTS, catalog.getClickEvents());
        assertEquals(EventCatalog.DEFAULT_RANDOM_EVENTS, catalog.getRandomEvents());
    }

    @Test(expected = IOException.class)
    public void testMalformedFileRejected() throws IOException {
        EventCatalog.load(write("[1, 2, 3]").toPath());
    }
}
