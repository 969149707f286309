package com.visitsense.loadgen.generator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.distribution.EnumeratedDistribution;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.apache.commons.math3.util.Pair;

/**
 * Tire un pays selon une répartition pondérée puis une IPv4 dans l'une de ses plages.
 * L'IP est transmise via {@code cip} pour que la géolocalisation du visiteur varie.
 */
public class GeoIpSelector {

    private static final List<CountryRange> COUNTRIES = Collections.unmodifiableList(Arrays.asList(
        new CountryRange("United States", 0.35, "173.252.0.0/16", "74.125.0.0/16", "208.67.0.0/16",
            "192.30.252.0/22", "199.232.0.0/16", "23.0.0.0/8", "104.16.0.0/12", "142.250.0.0/15"),
        new CountryRange("Germany", 0.10, "78.46.0.0/15", "5.9.0.0/16", "136.243.0.0/16",
            "88.198.0.0/16", "46.4.0.0/16", "80.156.0.0/16"),
        new CountryRange("United Kingdom", 0.08, "81.2.69.0/24", "51.140.0.0/14", "86.128.0.0/10"),
        new CountryRange("France", 0.07, "90.0.0.0/9", "163.172.0.0/16", "51.15.0.0/16"),
        new CountryRange("India", 0.06, "49.32.0.0/11", "117.192.0.0/10"),
        new CountryRange("Canada", 0.05, "24.48.0.0/14", "99.224.0.0/11"),
        new CountryRange("Netherlands", 0.05, "145.0.0.0/11", "185.107.56.0/22"),
        new CountryRange("Japan", 0.05, "126.0.0.0/8", "153.120.0.0/13"),
        new CountryRange("Brazil", 0.04, "177.0.0.0/10", "189.0.0.0/11"),
        new CountryRange("Australia", 0.04, "1.120.0.0/13", "203.2.218.0/23"),
        new CountryRange("Spain", 0.04, "83.32.0.0/11", "88.0.0.0/11"),
        new CountryRange("Italy", 0.04, "79.0.0.0/10", "151.0.0.0/12"),
        new CountryRange("Sweden", 0.03, "194.47.0.0/16", "81.230.0.0/16", "78.72.0.0/15"),
        new CountryRange("Norway", 0.02, "84.208.0.0/13", "129.240.0.0/15")
    ));

    private final Random random;
    private final EnumeratedDistribution<CountryRange> distribution;

    public GeoIpSelector(Random random) {
        this.random = random;
        List<Pair<CountryRange, Double>> pmf = new ArrayList<>();
        for (CountryRange country : COUNTRIES) {
            pmf.add(new Pair<>(country, country.probability));
        }
        this.distribution = new EnumeratedDistribution<>(
            RandomGeneratorFactory.createRandomGenerator(random), pmf);
    }

    /**
     * @return le pays et une IP de l'une de ses plages
     */
    public Selection select() {
        CountryRange country;
        synchronized (distribution) {
            country = distribution.sample();
        }
        String cidr = country.ranges.get(random.nextInt(country.ranges.size()));
        return new Selection(country.name, randomAddressIn(cidr, random));
    }

    /**
     * Adresse hôte aléatoire dans un bloc CIDR (hors adresse réseau et broadcast quand c'est possible).
     */
    static String randomAddressIn(String cidr, Random random) {
        String[] parts = cidr.split("/");
        int prefix = Integer.parseInt(parts[1]);
        long base = toLong(parts[0]);
        long size = 1L << (32 - prefix);
        long network = base & ~(size - 1) & 0xFFFFFFFFL;

        long offset;
        if (size > 2) {
            offset = 1 + (long) (random.nextDouble() * (size - 2));
        } else {
            offset = (long) (random.nextDouble() * size);
        }
        return fromLong(network + offset);
    }

    private static long toLong(String address) {
        String[] octets = address.split("\\.");
        long value = 0;
        for (String octet : octets) {
            value = (value << 8) | Integer.parseInt(octet);
        }
        return value;
    }

    private static String fromLong(long value) {
        return String.format("%d.%d.%d.%d",
            (value >> 24) & 0xFF,
            (value >> 16) & 0xFF,
            (value >> 8) & 0xFF,
            value & 0xFF
        );
    }

    public static List<String> countryNames() {
        List<String> names = new ArrayList<>();
        for (CountryRange country : COUNTRIES) {
            names.add(country.name);
        }
        return names;
    }

    private static final class CountryRange {
        private final String name;
        private final double probability;
        private final List<String> ranges;

        private CountryRange(String name, double probability, String... ranges) {
            this.name = name;
            this.probability = probability;
            this.ranges = Arrays.asList(ranges);
        }
    }

    /**
     * Résultat d'un tirage.
     */
    public static final class Selection {
        private final String country;
        private final String ipAddress;

        public Selection(String country, String ipAddress) {
            this.country = country;
            this.ipAddress = ipAddress;
        }

        public String getCountry() { return country; }
        public String getIpAddress() { return ipAddress; }
    }
}
