// file: runner/src/test/java/io/fastlist/runner/EngineSettingsJsonTest.java
package io.fastlist.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for loading EngineSettings from JSON.
 */
class EngineSettingsJsonTest {

    @TempDir
    Path tmp;

    @Test
    void partial_file_overrides_only_what_it_names() throws Exception {
        String json = """
            {
              "pageSize": 500,
              "delimiter": "",
              "maxAttempts": 8,
              "monitorIntervalMillis": 250
            }
            """;
        Path file = tmp.resolve("settings.json");
        Files.writeString(file, json);

        EngineSettings s = EngineSettings.fromJsonFile(file);
        EngineSettings d = EngineSettings.defaults();

        assertEquals(500, s.pageSize());
        assertEquals("", s.delimiter());
        assertEquals(8, s.maxAttempts());
        assertEquals(Duration.ofMillis(250), s.monitorInterval());

        assertEquals(d.baseBackoff(), s.baseBackoff());
        assertEquals(d.maxBackoff(), s.maxBackoff());
        assertEquals(d.requestTimeout(), s.requestTimeout());
        assertEquals(d.hintSampleSize(), s.hintSampleSize());
        assertEquals(8, s.retryPolicy().maxAttempts());
    }

    @Test
    void unknown_fields_are_rejected() throws Exception {
        Path file = tmp.resolve("typo.json");
        Files.writeString(file, """
            { "pagesize": 10 }
            """);

        RuntimeException e = assertThrows(RuntimeException.class, () -> EngineSettings.fromJsonFile(file));
        assertTrue(e.getMessage().contains("typo.json"));
    }

    @Test
    void out_of_range_values_are_rejected() throws Exception {
        Path file = tmp.resolve("big.json");
        Files.writeString(file, """
            { "pageSize": 5000 }
            """);

        assertThrows(IllegalArgumentException.class, () -> EngineSettings.fromJsonFile(file));
    }

    @Test
    void defaults_match_the_documented_values() {
        EngineSettings d = EngineSettings.defaults();

        assertEquals(1000, d.pageSize());
        assertEquals("/", d.delimiter());
        assertEquals(5, d.maxAttempts());
        assertEquals(Duration.ofMillis(100), d.baseBackoff());
        assertEquals(Duration.ofSeconds(5), d.maxBackoff());
    }
}
