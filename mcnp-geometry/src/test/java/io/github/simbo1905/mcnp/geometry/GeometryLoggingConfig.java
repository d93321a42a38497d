package io.github.simbo1905.mcnp.geometry;

import org.junit.jupiter.api.BeforeAll;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Base class for geometry tests that configures logging from the
/// `java.util.logging.ConsoleHandler.level` system property.
abstract class GeometryLoggingConfig {

    @BeforeAll
    static void configureLogging() {
        final var level = Level.parse(System.getProperty("java.util.logging.ConsoleHandler.level", "INFO"));
        final var rootLogger = Logger.getLogger("");
        rootLogger.setLevel(level);
        for (final var handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        Logger.getLogger("io.github.simbo1905.mcnp.geometry").setLevel(level);
    }
}
