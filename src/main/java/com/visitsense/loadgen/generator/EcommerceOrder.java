package com.visitsense.loadgen.generator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.gson.Gson;

/**
 * Commande e-commerce envoyée comme conversion (idgoal=0).
 */
public class EcommerceOrder {
    private static final Gson GSON = new Gson();

    private final String orderId;
    private final List<Item> items;
    private final double subtotal;
    private final double tax;
    private final double shipping;
    private final double revenue;
    private final String currency;

    public EcommerceOrder(String orderId, List<Item> items, double subtotal, double tax,
                          double shipping, double revenue, String currency) {
        this.orderId = orderId;
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.subtotal = subtotal;
        this.tax = tax;
        this.shipping = shipping;
        this.revenue = revenue;
        this.currency = currency;
    }

    /**
     * Articles au format attendu par {@code ec_items} : {@code [[sku,name,category,price,qty],...]}.
     */
    public String itemsJson() {
        List<List<Object>> rows = new ArrayList<>();
        for (Item item : items) {
            rows.add(Arrays.<Object>asList(item.sku, item.name, item.category, item.price, item.quantity));
        }
        return GSON.toJson(rows);
    }

    public String getOrderId() { return orderId; }
    public List<Item> getItems() { return items; }
    public double getSubtotal() { return subtotal; }
    public double getTax() { return tax; }
    public double getShipping() { return shipping; }
    public double getRevenue() { return revenue; }
    public String getCurrency() { return currency; }

    @Override
    public String toString() {
        return String.format("EcommerceOrder{id=%s, items=%d, subtotal=%.2f, shipping=%.2f, tax=%.2f, revenue=%.2f %s}",
            orderId, items.size(), subtotal, shipping, tax, revenue, currency);
    }

    /**
     * Ligne de commande.
     */
    public static final class Item {
        private final String sku;
        private final String name;
        private final String category;
        private final double price;
        private final int quantity;

        public Item(String sku, String name, String category, double price, int quantity) {
            this.sku = sku;
            this.name = name;
            this.category = category;
            this.price = price;
            this.quantity = quantity;
        }

        public String getSku() { return sku; }
        public String getName() { return name; }
        public String getCategory() { return category; }
        public double getPrice() { return price; }
        public int getQuantity() { return quantity; }
    }
}
