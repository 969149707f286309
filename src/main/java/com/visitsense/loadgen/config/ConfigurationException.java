package com.visitsense.loadgen.config;

/**
 * Erreur de configuration détectée au démarrage.
 * Jamais réessayée : le générateur refuse de démarrer.
 */
public class ConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
