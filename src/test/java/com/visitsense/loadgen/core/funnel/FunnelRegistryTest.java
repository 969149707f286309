package com.visitsense.loadgen.core.funnel;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

/**
 * Tests du chargement des définitions de funnels
 */
public class FunnelRegistryTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static final String CHECKOUT = "{\"name\":\"Checkout\",\"probability\":0.2,\"priority\":5,"
        + "\"exit_after_completion\":false,\"steps\":["
        + "{\"type\":\"pageview\",\"url\":\"https://shop.example.com/cart\",\"delay_seconds_min\":1.5},"
        + "{\"type\":\"event\",\"event_category\":\"Cart\",\"event_action\":\"Submit\",\"event_name\":\"Pay\",\"event_value\":2},"
        + "{\"type\":\"ecommerce\",\"ecommerce_revenue\":99.5,\"ecommerce_currency\":\"EUR\"}]}";

    private File write(String name, String json) throws IOException {
        File file = new File(folder.getRoot(), name);
        Files.write(file.toPath(), json.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testInvalidEntriesSkipped() throws IOException {
        String json = "[" + CHECKOUT + ","
            + "{\"name\":\"EventFirst\",\"probability\":0.1,\"steps\":["
            + "{\"type\":\"event\",\"event_category\":\"a\",\"event_action\":\"b\",\"event_name\":\"c\"}]},"
            + "{\"name\":\"Teleport\",\"probability\":0.1,\"steps\":[{\"type\":\"teleport\"}]}"
            + "]";

        List<Funnel> funnels = FunnelRegistry.parse(json);

        assertEquals("Only the valid funnel should load", 1, funnels.size());
        Funnel checkout = funnels.get(0);
        assertEquals("Checkout", checkout.getName());
        assertEquals(0.2, checkout.getProbability(), 1e-9);
        assertEquals(5, checkout.getPriority());
        assertFalse(checkout.isExitAfterCompletion());
        assertTrue("Enabled by default", checkout.isEnabled());

        FunnelStep first = checkout.getSteps().get(0);
        assertEquals(1.5, first.getDelaySecondsMin(), 1e-9);
        assertEquals("Max delay should default to min", 1.5, first.getDelaySecondsMax(), 1e-9);

        FunnelStep event = checkout.getSteps().get(1);
        assertEquals(StepType.EVENT, event.getType());
        assertEquals(Double.valueOf(2.0), event.getEventValue());

        FunnelStep purchase = checkout.getSteps().get(2);
        assertEquals(Double.valueOf(99.5), purchase.getEcommerceRevenue());
        assertEquals("EUR", purchase.getEcommerceCurrency());
    }

    @Test
    public void testDefaults() throws IOException {
        List<Funnel> funnels = FunnelRegistry.parse(
            "[{\"name\":\"Minimal\",\"steps\":[{\"type\":\"pageview\"}]}]");

        Funnel funnel = funnels.get(0);
        assertEquals(0.0, funnel.getProbability(), 0.0);
        assertEquals(0, funnel.getPriority());
        assertTrue(funnel.isEnabled());
        assertTrue(funnel.isExitAfterCompletion());
    }

    @Test
    public void testRegistrySortsAndFiltersDisabled() throws IOException {
        File file = write("funnels.json", "["
                + "{\"name\":\"Late\",\"priority\":9,\"probability\":0.5,\"steps\":[{\"type\":\"pageview\"}]},"
                + "{\"name\":\"Off\",\"priority\":0,\"enabled\":false,\"probability\":0.5,\"steps\":[{\"type\":\"pageview\"}]},"
                + "{\"name\":\"Early\",\"priority\":1,\"probability\":0.5,\"steps\":[{\"type\":\"pageview\"}]},"
                + "{\"name\":\"AlsoEarly\",\"priority\":1,\"probability\":0.5,\"steps\":[{\"type\":\"pageview\"}]}"
                + "]");

        FunnelRegistry registry = new FunnelRegistry(file.toPath());
        List<Funnel> funnels = registry.getFunnels();

        assertEquals(3, funnels.size());
        assertEquals("Early", funnels.get(0).getName());
        assertEquals("Equal priorities keep file order", "AlsoEarly", funnels.get(1).getName());
        assertEquals("Late", funnels.get(2).getName());
    }

    @Test
    public void testReloadPicksUpChanges() throws IOException {
        File file = write("funnels.json", "[" + CHECKOUT + "]");
        FunnelRegistry registry = new FunnelRegistry(file.toPath());
        assertEquals(1, registry.getFunnels().size());

        write("funnels.json", "[" + CHECKOUT + "," + CHECKOUT.replace("Checkout", "Checkout2") + "]");
        assertEquals(2, registry.reload());
        assertEquals(2, registry.getFunnels().size());
    }

    @Test
    public void testMissingFileGivesEmptyRegistry() {
        FunnelRegistry registry = new FunnelRegistry(new File(folder.getRoot(), "absent.json").toPath());
        assertTrue(registry.isEmpty());
        assertEquals(0, registry.reload());
    }

    @Test(expected = IOException.class)
    public void testNonArrayRejected() throws IOException {
        FunnelRegistry.parse("{\"name\":\"x\"}");
    }
}
