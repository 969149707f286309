package com.visitsense.loadgen.scheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attente du signal de démarrage quand AUTO_START est désactivé :
 * le fichier signal est sondé périodiquement puis supprimé une fois vu.
 */
public class StartGate {
    private static final Logger logger = LoggerFactory.getLogger(StartGate.class);

    private final boolean autoStart;
    private final Path signalFile;
    private final long checkIntervalMs;

    public StartGate(boolean autoStart, Path signalFile, double checkIntervalSeconds) {
        this.autoStart = autoStart;
        this.signalFile = signalFile;
        this.checkIntervalMs = Math.max(1, Math.round(checkIntervalSeconds * 1000));
    }

    /**
     * @param cancelled interrompt l'attente lorsqu'il renvoie true
     * @return true si la génération peut démarrer, false si l'attente a été annulée
     */
    public boolean await(BooleanSupplier cancelled) throws InterruptedException {
        if (autoStart) {
            return true;
        }
        logger.info("AUTO_START disabled, waiting for start signal file {}", signalFile);
        while (!cancelled.getAsBoolean()) {
            if (Files.exists(signalFile)) {
                try {
                    Files.deleteIfExists(signalFile);
                } catch (IOException e) {
                    logger.warn("Could not delete start signal file {}: {}", signalFile, e.getMessage());
                }
                logger.info("Start signal received");
                return true;
            }
            TimeUnit.MILLISECONDS.sleep(checkIntervalMs);
        }
        return false;
    }
}
