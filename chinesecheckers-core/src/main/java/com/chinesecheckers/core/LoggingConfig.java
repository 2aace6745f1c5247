package com.chinesecheckers.core;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Loads {@code logging.properties} from the classpath unless a configuration file was given with
 * {@code -Djava.util.logging.config.file}.
 */
public final class LoggingConfig {

    private static final Logger LOGGER = Logger.getLogger(LoggingConfig.class.getName());
    private static final String RESOURCE = "/logging.properties";

    private LoggingConfig() {
    }

    public static void configure() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = LoggingConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                LOGGER.warning(() -> "Logging configuration " + RESOURCE + " not found on the classpath");
                return;
            }
            LogManager.getLogManager().readConfiguration(in);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to read logging configuration", ex);
        }
    }
}
