// file: runner/src/main/java/io/fastlist/runner/LoggingSetup.java
package io.fastlist.runner;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * java.util.logging setup for the CLI.
 * <p>
 * Loads logging.properties from the classpath, then:
 *  - FASTLIST_LOG_LEVEL (e.g. FINE, WARNING) overrides the root level,
 *  - with a log file, console handlers are replaced by an appending FileHandler.
 */
public final class LoggingSetup {

    static final String LEVEL_ENV = "FASTLIST_LOG_LEVEL";

    private LoggingSetup() {
        // utility
    }

    public static void configure(Path logFile) {
        try (InputStream in = LoggingSetup.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to read logging.properties: " + e.getMessage());
        }

        Logger root = Logger.getLogger("");
        Level level = levelFromEnv(System.getenv(LEVEL_ENV));
        if (level != null) {
            root.setLevel(level);
        }

        if (logFile != null) {
            FileHandler file;
            try {
                file = new FileHandler(logFile.toString(), true);
            } catch (IOException e) {
                throw new RuntimeException("Failed to open log file " + logFile, e);
            }
            file.setFormatter(new SimpleFormatter());
            file.setLevel(Level.ALL);
            for (Handler h : root.getHandlers()) {
                root.removeHandler(h);
            }
            root.addHandler(file);
        }
    }

    /** @return the parsed level, or null when unset or unparseable. */
    static Level levelFromEnv(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Level.parse(raw.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            System.err.println("Ignoring invalid " + LEVEL_ENV + ": " + raw);
            return null;
        }
    }
}
