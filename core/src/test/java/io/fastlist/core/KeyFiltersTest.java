// file: core/src/test/java/io/fastlist/core/KeyFiltersTest.java
package io.fastlist.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyFiltersTest {

    @Test
    void blank_expression_matches_everything() {
        assertSame(KeyFilter.ALL, KeyFilters.compile(null));
        assertSame(KeyFilter.ALL, KeyFilters.compile("  "));
    }

    @Test
    void prefix_filter() {
        KeyFilter f = KeyFilters.compile("prefix:logs/2024/");

        assertTrue(f.matches("logs/2024/01/a.gz"));
        assertFalse(f.matches("logs/2023/12/a.gz"));
    }

    @Test
    void glob_filter_single_star_stops_at_slash() {
        KeyFilter f = KeyFilters.compile("glob:logs/*.gz");

        assertTrue(f.matches("logs/a.gz"));
        assertFalse(f.matches("logs/2024/a.gz"));
        assertFalse(f.matches("logs/a.gzip"));
    }

    @Test
    void glob_filter_double_star_crosses_slashes() {
        KeyFilter f = KeyFilters.compile("glob:logs/**.gz");

        assertTrue(f.matches("logs/2024/01/a.gz"));
        assertFalse(f.matches("data/a.gz"));
    }

    @Test
    void bare_expression_is_a_regex_find() {
        KeyFilter f = KeyFilters.compile("\\.parquet$");

        assertTrue(f.matches("tables/t1/part-0001.parquet"));
        assertFalse(f.matches("tables/t1/_SUCCESS"));
        assertTrue(KeyFilters.compile("regex:^a").matches("abc"));
    }

    @Test
    void invalid_regex_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> KeyFilters.compile("regex:(unclosed"));
    }
}
