// file: core/src/main/java/io/fastlist/core/KeySpaceSampler.java
package io.fastlist.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

/**
 * Bounded uniform sample of listed keys (reservoir sampling, Algorithm R).
 * <p>
 * The sorted sample approximates key-space quantiles, so writing it out and
 * loading it as hints on the next run yields partitions of roughly equal size.
 * <p>
 * Not thread-safe: owned by the single aggregation task.
 */
public final class KeySpaceSampler {

    private final int capacity;
    private final Random random;
    private final List<String> reservoir;
    private long seen = 0;

    public KeySpaceSampler(int capacity) {
        this(capacity, new Random());
    }

    public KeySpaceSampler(int capacity, Random random) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        this.capacity = capacity;
        this.random = random;
        this.reservoir = new ArrayList<>(Math.min(capacity, 1 << 16));
    }

    public void offer(String key) {
        if (capacity == 0) {
            return;
        }
        seen++;
        if (reservoir.size() < capacity) {
            reservoir.add(key);
            return;
        }
        long slot = (long) (random.nextDouble() * seen);
        if (slot < capacity) {
            reservoir.set((int) slot, key);
        }
    }

    public long seen() {
        return seen;
    }

    /** Distinct sampled keys in {@link KeyOrder}. */
    public List<String> sortedSample() {
        TreeSet<String> sorted = new TreeSet<>(KeyOrder.COMPARATOR);
        sorted.addAll(reservoir);
        return new ArrayList<>(sorted);
    }
}
