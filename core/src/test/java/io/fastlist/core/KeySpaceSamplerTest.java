// file: core/src/test/java/io/fastlist/core/KeySpaceSamplerTest.java
package io.fastlist.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class KeySpaceSamplerTest {

    @Test
    void keeps_everything_below_capacity_sorted() {
        KeySpaceSampler sampler = new KeySpaceSampler(10, new Random(1));
        for (String k : List.of("c", "a", "b")) {
            sampler.offer(k);
        }

        assertEquals(List.of("a", "b", "c"), sampler.sortedSample());
        assertEquals(3, sampler.seen());
    }

    @Test
    void never_exceeds_capacity() {
        KeySpaceSampler sampler = new KeySpaceSampler(50, new Random(7));
        for (int i = 0; i < 10_000; i++) {
            sampler.offer(String.format("key-%05d", i));
        }

        List<String> sample = sampler.sortedSample();
        assertEquals(50, sample.size());
        assertEquals(10_000, sampler.seen());
    }

    @Test
    void sample_spreads_across_the_key_space() {
        KeySpaceSampler sampler = new KeySpaceSampler(100, new Random(42));
        for (int i = 0; i < 10_000; i++) {
            sampler.offer(String.format("key-%05d", i));
        }

        List<String> sample = sampler.sortedSample();
        assertTrue(sample.get(0).compareTo("key-02000") < 0, "lowest sample should come from the first fifth");
        assertTrue(sample.get(sample.size() - 1).compareTo("key-08000") > 0, "highest sample should come from the last fifth");
    }

    @Test
    void zero_capacity_disables_sampling() {
        KeySpaceSampler sampler = new KeySpaceSampler(0);
        sampler.offer("a");

        assertTrue(sampler.sortedSample().isEmpty());
    }
}
