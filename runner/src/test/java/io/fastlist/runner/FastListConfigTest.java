// file: runner/src/test/java/io/fastlist/runner/FastListConfigTest.java
package io.fastlist.runner;

import io.fastlist.core.RunMode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for CLI parsing and default file names.
 */
class FastListConfigTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 9, 14, 5, 7);

    private static FastListConfig parse(String... args) {
        return FastListConfig.parse(args, NOW);
    }

    @Test
    void list_mode_defaults() {
        FastListConfig cfg = parse("list", "--bucket", "photos", "--region", "us-west-2");

        assertEquals(RunMode.LIST, cfg.mode());
        assertEquals("", cfg.prefix(), "'/' means the bucket root");
        assertEquals(10, cfg.threads());
        assertEquals(100, cfg.concurrency());
        assertFalse(cfg.logToFile());
        assertNull(cfg.logFile());
        assertNull(cfg.rightTarget());
        assertEquals("us-west-2/photos", cfg.leftTarget().describe());

        assertEquals(Path.of("us-west-2_photos_ks_hints.input"), cfg.hintsFile());
        assertEquals(Path.of("us-west-2_photos_20240309140507.ks"), cfg.keySpaceOutput());
        assertEquals(Path.of("us-west-2_photos_20240309140507.csv"), cfg.resultOutput());
    }

    @Test
    void region_parts_are_omitted_when_unset() {
        FastListConfig cfg = parse("diff", "--bucket", "src", "--target-bucket", "dst", "--target-region", "eu-west-1");

        assertEquals(RunMode.DIFF, cfg.mode());
        assertEquals(Path.of("src_ks_hints.input"), cfg.hintsFile());
        assertEquals(Path.of("src_eu-west-1_dst_20240309140507.csv"), cfg.resultOutput());
        assertEquals("eu-west-1/dst", cfg.rightTarget().describe());
        assertNull(cfg.leftTarget().region());
    }

    @Test
    void global_options_may_come_before_or_after_the_command() {
        FastListConfig cfg = parse(
                "-t", "4", "-p", "logs/", "-f", "glob:**.gz",
                "list", "--bucket", "b",
                "-c", "250", "-k", "hints.txt", "--settings", "tune.json"
        );

        assertEquals(4, cfg.threads());
        assertEquals(250, cfg.concurrency());
        assertEquals("logs/", cfg.prefix());
        assertEquals("glob:**.gz", cfg.filter());
        assertEquals(Path.of("hints.txt"), cfg.hintsFile());
        assertEquals("tune.json", cfg.settingsPath());
    }

    @Test
    void endpoint_forces_path_style() {
        FastListConfig cfg = parse("list", "--bucket", "b", "--endpoint-url", "http://localhost:9000");

        assertTrue(cfg.forcePathStyle());
        assertTrue(cfg.leftTarget().pathStyle());
        assertEquals("http://localhost:9000", cfg.leftTarget().endpoint());
    }

    @Test
    void output_log_file_implies_logging() {
        FastListConfig cfg = parse("list", "--bucket", "b", "--output-log-file", "run.log",
                "--output-ks-file", "k.ks", "--output-file", "r.csv");

        assertTrue(cfg.logToFile());
        assertEquals(Path.of("run.log"), cfg.logFile());
        assertEquals(Path.of("k.ks"), cfg.keySpaceOutput());
        assertEquals(Path.of("r.csv"), cfg.resultOutput());

        FastListConfig plain = parse("list", "--bucket", "b", "-l");
        assertEquals(Path.of("fastlist_20240309140507.log"), plain.logFile());
    }

    @Test
    void bad_input_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> parse("--bucket", "b"));
        assertThrows(IllegalArgumentException.class, () -> parse("list"));
        assertThrows(IllegalArgumentException.class, () -> parse("diff", "--bucket", "b"));
        assertThrows(IllegalArgumentException.class, () -> parse("list", "--bucket", "b", "--target-bucket", "t"));
        assertThrows(IllegalArgumentException.class, () -> parse("list", "--bucket", "b", "-t", "0"));
        assertThrows(IllegalArgumentException.class, () -> parse("list", "--bucket", "b", "-c", "many"));
        assertThrows(IllegalArgumentException.class, () -> parse("list", "--bucket"));
        assertThrows(IllegalArgumentException.class, () -> parse("list", "--bucket", "b", "--frobnicate"));
        assertThrows(IllegalArgumentException.class, () -> parse("list", "diff", "--bucket", "b"));
    }
}
