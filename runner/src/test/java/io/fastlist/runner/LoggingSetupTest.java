// file: runner/src/test/java/io/fastlist/runner/LoggingSetupTest.java
package io.fastlist.runner;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

class LoggingSetupTest {

    @Test
    void level_env_value_is_parsed_leniently() {
        assertEquals(Level.FINE, LoggingSetup.levelFromEnv("fine"));
        assertEquals(Level.WARNING, LoggingSetup.levelFromEnv(" WARNING "));
        assertNull(LoggingSetup.levelFromEnv(null));
        assertNull(LoggingSetup.levelFromEnv(""));
        assertNull(LoggingSetup.levelFromEnv("chatty"));
    }
}
