package com.visitsense.loadgen.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Source clé/valeur de la configuration.
 *
 * Ordre de résolution d'une clé : variables d'environnement, propriétés système,
 * fichier externe optionnel, puis valeurs par défaut embarquées
 * ({@code loadgen.properties}).
 */
public class ConfigurationManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationManager.class);

    public static final String DEFAULTS_RESOURCE = "loadgen.properties";

    private final Map<String, String> environment;
    private final Properties systemProperties;
    private final Properties fileProperties;
    private final Properties defaults;

    public ConfigurationManager() throws IOException {
        this(null);
    }

    public ConfigurationManager(Path externalFile) throws IOException {
        this(System.getenv(), System.getProperties(), loadFile(externalFile), loadDefaults());
    }

    /**
     * Constructeur explicite, utilisé par les tests pour isoler l'environnement.
     */
    public ConfigurationManager(Map<String, String> environment, Properties systemProperties,
                                Properties fileProperties, Properties defaults) {
        this.environment = environment != null ? new HashMap<>(environment) : Collections.emptyMap();
        this.systemProperties = systemProperties != null ? systemProperties : new Properties();
        this.fileProperties = fileProperties != null ? fileProperties : new Properties();
        this.defaults = defaults != null ? defaults : new Properties();
    }

    /**
     * Configuration construite uniquement à partir d'une map (tests).
     */
    public static ConfigurationManager fromMap(Map<String, String> values) {
        return new ConfigurationManager(values, new Properties(), new Properties(), new Properties());
    }

    private static Properties loadDefaults() throws IOException {
        Properties props = new Properties();
        try (InputStream in = ConfigurationManager.class.getClassLoader()
                .getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.warn("Default configuration {} not found on classpath", DEFAULTS_RESOURCE);
            }
        }
        return props;
    }

    private static Properties loadFile(Path file) throws IOException {
        Properties props = new Properties();
        if (file == null) {
            return props;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        logger.info("Loaded configuration file {}", file);
        return props;
    }

    /**
     * Retourne la valeur brute, ou null si la clé est absente ou vide partout.
     */
    public String getRaw(String key) {
        String value = environment.get(key);
        if (isBlank(value)) {
            value = systemProperties.getProperty(key);
        }
        if (isBlank(value)) {
            value = fileProperties.getProperty(key);
        }
        if (isBlank(value)) {
            value = defaults.getProperty(key);
        }
        return isBlank(value) ? null : value.trim();
    }

    public boolean has(String key) {
        return getRaw(key) != null;
    }

    public String getString(String key, String defaultValue) {
        String value = getRaw(key);
        return value != null ? value : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = getRaw(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getRaw(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = getRaw(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be a number, got '" + value + "'", e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getRaw(key);
        if (value == null) {
            return defaultValue;
        }
        switch (value.toLowerCase()) {
            case "true":
            case "1":
            case "yes":
            case "on":
                return true;
            case "false":
            case "0":
            case "no":
            case "off":
                return false;
            default:
                throw new ConfigurationException(key + " must be a boolean, got '" + value + "'");
        }
    }

    /**
     * Entier optionnel : null si absent.
     */
    public Integer getOptionalInt(String key) {
        return has(key) ? getInt(key, 0) : null;
    }

    public Double getOptionalDouble(String key) {
        return has(key) ? getDouble(key, 0.0) : null;
    }

    public Long getOptionalLong(String key) {
        return has(key) ? getLong(key, 0L) : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
