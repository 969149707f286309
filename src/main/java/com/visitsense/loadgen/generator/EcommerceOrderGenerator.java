package com.visitsense.loadgen.generator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.visitsense.loadgen.config.LoadGeneratorConfig;

/**
 * Génère des commandes plausibles dont le total reste dans [ECOMMERCE_ORDER_VALUE_MIN, MAX].
 *
 * Invariants : {@code tax = round((subtotal + shipping) * taxRate, 2)} et
 * {@code revenue = round(subtotal + shipping + tax, 2)}.
 */
public class EcommerceOrderGenerator {
    private static final Logger logger = LoggerFactory.getLogger(EcommerceOrderGenerator.class);

    private static final int MAX_ATTEMPTS = 10;
    private static final String ORDER_ID_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    static final List<Product> PRODUCTS = Collections.unmodifiableList(Arrays.asList(
        new Product("ELEC-001", "Wireless Headphones", "Electronics", 89.99),
        new Product("ELEC-002", "USB-C Charger", "Electronics", 24.99),
        new Product("ELEC-003", "Bluetooth Speaker", "Electronics", 59.99),
        new Product("ELEC-004", "Smart Watch", "Electronics", 199.99),
        new Product("CLTH-001", "Cotton T-Shirt", "Clothing", 19.99),
        new Product("CLTH-002", "Denim Jacket", "Clothing", 79.99),
        new Product("CLTH-003", "Running Shoes", "Clothing", 119.99),
        new Product("BOOK-001", "Java Concurrency Handbook", "Books", 44.99),
        new Product("BOOK-002", "Web Analytics Explained", "Books", 29.99),
        new Product("HOME-001", "Ceramic Mug", "Home", 12.99),
        new Product("HOME-002", "Desk Lamp", "Home", 39.99),
        new Product("HOME-003", "Throw Blanket", "Home", 34.99),
        new Product("SPRT-001", "Yoga Mat", "Sports", 27.99),
        new Product("SPRT-002", "Water Bottle", "Sports", 15.99)
    ));

    private final Random random;
    private final double orderValueMin;
    private final double orderValueMax;
    private final int itemsMin;
    private final int itemsMax;
    private final double taxRate;
    private final List<Double> shippingRates;
    private final String currency;

    public EcommerceOrderGenerator(LoadGeneratorConfig config, Random random) {
        this(random, config.getEcommerceOrderValueMin(), config.getEcommerceOrderValueMax(),
             config.getEcommerceItemsMin(), config.getEcommerceItemsMax(),
             config.getEcommerceTaxRate(), config.getEcommerceShippingRates(),
             config.getEcommerceCurrency());
    }

    public EcommerceOrderGenerator(Random random, double orderValueMin, double orderValueMax,
                                   int itemsMin, int itemsMax, double taxRate,
                                   List<Double> shippingRates, String currency) {
        this.random = random;
        this.orderValueMin = orderValueMin;
        this.orderValueMax = orderValueMax;
        this.itemsMin = itemsMin;
        this.itemsMax = itemsMax;
        this.taxRate = taxRate;
        this.shippingRates = affordableRates(shippingRates, orderValueMax, taxRate);
        this.currency = currency;
    }

    /**
     * Copie liée à un autre générateur aléatoire (une visite rejouable à partir de sa graine).
     */
    public EcommerceOrderGenerator withRandom(Random visitRandom) {
        return new EcommerceOrderGenerator(visitRandom, orderValueMin, orderValueMax,
            itemsMin, itemsMax, taxRate, shippingRates, currency);
    }

    /**
     * Total le plus bas possible avec ce port : un article à 0,01 plus le port, taxes comprises,
     * arrondi au centime supérieur.
     */
    public static double minimumRevenue(double shipping, double taxRate) {
        return (shipping + 0.01) * (1 + taxRate) + 0.01;
    }

    /**
     * Ne garde que les frais de port compatibles avec le total maximal.
     *
     * @throws IllegalArgumentException si aucun frais de port ne permet de rester sous le maximum
     */
    static List<Double> affordableRates(List<Double> rates, double orderValueMax, double taxRate) {
        List<Double> affordable = new ArrayList<>();
        for (Double rate : rates) {
            if (minimumRevenue(rate, taxRate) <= orderValueMax) {
                affordable.add(rate);
            }
        }
        if (affordable.isEmpty()) {
            throw new IllegalArgumentException("No shipping rate in " + rates
                + " keeps an order under " + orderValueMax + " with tax rate " + taxRate);
        }
        if (affordable.size() < rates.size()) {
            logger.warn("Ignoring shipping rates that exceed the order maximum {}: keeping {} of {}",
                       orderValueMax, affordable, rates);
        }
        return affordable;
    }

    /**
     * Tire un total cible, répartit le sous-total entre les articles puis recalcule taxe et total.
     * Après {@value #MAX_ATTEMPTS} essais hors bornes, bascule sur une commande à un seul article.
     */
    public EcommerceOrder generate() {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            EcommerceOrder order = tryGenerate();
            if (order != null && withinBounds(order.getRevenue())) {
                return order;
            }
        }
        logger.debug("Falling back to single-item order after {} attempts", MAX_ATTEMPTS);
        return singleItemOrder();
    }

    private EcommerceOrder tryGenerate() {
        double targetRevenue = uniform(orderValueMin, orderValueMax);
        double shipping = shippingRates.get(random.nextInt(shippingRates.size()));
        double targetSubtotal = targetRevenue / (1 + taxRate) - shipping;

        int itemCount = itemsMin + random.nextInt(itemsMax - itemsMin + 1);
        if (targetSubtotal < 0.01 * itemCount) {
            return null;
        }

        List<Product> picked = new ArrayList<>();
        List<Integer> quantities = new ArrayList<>();
        double rawSubtotal = 0;
        for (int i = 0; i < itemCount; i++) {
            Product product = PRODUCTS.get(random.nextInt(PRODUCTS.size()));
            int qty = 1 + random.nextInt(2);
            picked.add(product);
            quantities.add(qty);
            rawSubtotal += product.basePrice * qty;
        }

        double factor = targetSubtotal / rawSubtotal;
        List<EcommerceOrder.Item> items = new ArrayList<>();
        BigDecimal subtotal = BigDecimal.ZERO;
        for (int i = 0; i < picked.size(); i++) {
            Product product = picked.get(i);
            BigDecimal price = money(Math.max(0.01, product.basePrice * factor));
            int qty = quantities.get(i);
            subtotal = subtotal.add(price.multiply(BigDecimal.valueOf(qty)));
            items.add(new EcommerceOrder.Item(product.sku, product.name, product.category,
                price.doubleValue(), qty));
        }
        return assemble(items, subtotal, shipping);
    }

    private EcommerceOrder singleItemOrder() {
        double targetRevenue = (orderValueMin + orderValueMax) / 2;
        double shipping = Collections.min(shippingRates);
        Product product = PRODUCTS.get(random.nextInt(PRODUCTS.size()));
        BigDecimal price = money(Math.max(0.01, targetRevenue / (1 + taxRate) - shipping));
        List<EcommerceOrder.Item> items = Collections.singletonList(
            new EcommerceOrder.Item(product.sku, product.name, product.category, price.doubleValue(), 1));
        return assemble(items, price, shipping);
    }

    private EcommerceOrder assemble(List<EcommerceOrder.Item> items, BigDecimal subtotal, double shipping) {
        BigDecimal sub = subtotal.setScale(2, RoundingMode.HALF_UP);
        BigDecimal ship = money(shipping);
        BigDecimal tax = sub.add(ship).multiply(BigDecimal.valueOf(taxRate)).setScale(2, RoundingMode.HALF_UP);
        BigDecimal revenue = sub.add(ship).add(tax).setScale(2, RoundingMode.HALF_UP);
        return new EcommerceOrder(newOrderId(), items, sub.doubleValue(), tax.doubleValue(),
            ship.doubleValue(), revenue.doubleValue(), currency);
    }

    /**
     * Commande dont certains montants sont imposés (étape e-commerce d'un funnel).
     * Les montants absents sont générés ; le total manquant est recalculé.
     */
    public EcommerceOrder generateWithOverrides(Double revenue, Double subtotal, Double tax,
                                                Double shipping, String currencyOverride) {
        EcommerceOrder base = generate();
        double sub = subtotal != null ? subtotal : base.getSubtotal();
        double ship = shipping != null ? shipping : base.getShipping();
        double tx = tax != null ? tax : money((sub + ship) * taxRate).doubleValue();
        double total = revenue != null ? revenue : money(sub + ship + tx).doubleValue();
        String cur = currencyOverride != null ? currencyOverride : currency;
        return new EcommerceOrder(base.getOrderId(), base.getItems(), sub, tx, ship, total, cur);
    }

    private boolean withinBounds(double revenue) {
        return revenue >= orderValueMin && revenue <= orderValueMax;
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    private String newOrderId() {
        StringBuilder sb = new StringBuilder(8);
        for (int i = 0; i < 8; i++) {
            sb.append(ORDER_ID_CHARS.charAt(random.nextInt(ORDER_ID_CHARS.length())));
        }
        return sb.toString();
    }

    static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    static final class Product {
        final String sku;
        final String name;
        final String category;
        final double basePrice;

        Product(String sku, String name, String category, double basePrice) {
            this.sku = sku;
            this.name = name;
            this.category = category;
            this.basePrice = basePrice;
        }
    }
}
