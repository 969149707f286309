package com.visitsense.loadgen.generator;

import java.util.Arrays;
import java.util.Collections;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;

import static org.junit.Assert.*;

/**
 * Tests de la génération des commandes e-commerce
 */
public class EcommerceOrderGeneratorTest {

    private EcommerceOrderGenerator generator;

    @Before
    public void setUp() {
        generator = new EcommerceOrderGenerator(new Random(5), 50.0, 150.0, 1, 2, 0.05,
            Collections.singletonList(0.0), "EUR");
    }

    @Test
    public void testTotalsAreConsistent() {
        for (int i = 0; i < 500; i++) {
            EcommerceOrder order = generator.generate();

            double sum = order.getSubtotal() + order.getShipping() + order.getTax();
            assertEquals("subtotal + shipping + tax should equal revenue", order.getRevenue(), sum, 0.01);
            assertTrue("Revenue " + order.getRevenue() + " should be within bounds",
                      order.getRevenue() >= 50.0 && order.getRevenue() <= 150.0);
            assertTrue("Item count should respect bounds",
                      order.getItems().size() >= 1 && order.getItems().size() <= 2);
            assertEquals(0.0, order.getShipping(), 0.0);
            assertEquals("EUR", order.getCurrency());
        }
    }

    @Test
    public void testShippingPickedFromRates() {
        EcommerceOrderGenerator withShipping = new EcommerceOrderGenerator(new Random(9), 100.0, 400.0, 1, 5, 0.25,
            Arrays.asList(0.0, 49.0, 99.0), "SEK");
        for (int i = 0; i < 200; i++) {
            double shipping = withShipping.generate().getShipping();
            assertTrue("Unexpected shipping " + shipping,
                      shipping == 0.0 || shipping == 49.0 || shipping == 99.0);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShippingAboveMaximumRejected() {
        // 49 de port plus 25 % de taxe dépasse déjà 40
        new EcommerceOrderGenerator(new Random(1), 15.99, 40.0, 1, 2, 0.25,
            Collections.singletonList(49.0), "SEK");
    }

    @Test
    public void testUnaffordableShippingIgnored() {
        EcommerceOrderGenerator small = new EcommerceOrderGenerator(new Random(1), 15.99, 40.0, 1, 2, 0.25,
            Arrays.asList(0.0, 49.0), "SEK");
        for (int i = 0; i < 200; i++) {
            EcommerceOrder order = small.generate();
            assertEquals("Only the free rate fits under 40", 0.0, order.getShipping(), 0.0);
            assertTrue("Revenue " + order.getRevenue() + " should stay within bounds",
                      order.getRevenue() >= 15.99 && order.getRevenue() <= 40.0);
        }
    }

    @Test
    public void testSameRandomSameOrder() {
        EcommerceOrder first = generator.withRandom(new Random(99)).generate();
        EcommerceOrder second = generator.withRandom(new Random(99)).generate();

        assertEquals(first.getRevenue(), second.getRevenue(), 0.0);
        assertEquals(first.itemsJson(), second.itemsJson());
    }

    @Test
    public void testItemsJsonShape() {
        EcommerceOrder order = generator.generate();
        JsonArray rows = JsonParser.parseString(order.itemsJson()).getAsJsonArray();

        assertEquals(order.getItems().size(), rows.size());
        JsonArray first = rows.get(0).getAsJsonArray();
        assertEquals("Each item should be [sku, name, category, price, qty]", 5, first.size());
        assertEquals(order.getItems().get(0).getSku(), first.get(0).getAsString());
        assertEquals(order.getItems().get(0).getQuantity(), first.get(4).getAsInt());
    }

    @Test
    public void testOrderIdFormat() {
        assertTrue(generator.generate().getOrderId().matches("[A-Z0-9]{8}"));
    }

    @Test
    public void testOverridesAreKept() {
        EcommerceOrder order = generator.generateWithOverrides(null, 80.0, null, 5.0, "USD");

        assertEquals(80.0, order.getSubtotal(), 0.0);
        assertEquals(5.0, order.getShipping(), 0.0);
        assertEquals("Tax should be recomputed", 4.25, order.getTax(), 1e-9);
        assertEquals("Revenue should be recomputed", 89.25, order.getRevenue(), 1e-9);
        assertEquals("USD", order.getCurrency());

        EcommerceOrder fixed = generator.generateWithOverrides(120.0, null, null, null, null);
        assertEquals(120.0, fixed.getRevenue(), 0.0);
        assertEquals("EUR", fixed.getCurrency());
    }
}
