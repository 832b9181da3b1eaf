package com.playgrounds.apptool;

import org.junit.jupiter.api.BeforeAll;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for tests that want JUL output at the level given by the
 * {@code java.util.logging.ConsoleHandler.level} system property.
 */
public abstract class ManifestLoggingConfig {

    @BeforeAll
    static void configureLogging() {
        var levelStr = System.getProperty("java.util.logging.ConsoleHandler.level", "INFO");
        var level = Level.parse(levelStr);

        var rootLogger = Logger.getLogger("");
        rootLogger.setLevel(level);

        for (var handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }

        Logger.getLogger("com.playgrounds.apptool").setLevel(level);
    }
}
