// file: core/src/main/java/io/fastlist/core/KeySpaceHints.java
package io.fastlist.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Immutable partition boundaries for one listing run, built from a flat list
 * of "interesting" key-space positions (prefixes or sampled keys).
 * <p>
 * Pairing rule for N sorted, distinct hints h0..h(N-1):
 *  - N <= 1: one full-range partition.
 *  - N >= 2: N-1 partitions (h0,h1], (h1,h2], ... (h(N-2),h(N-1)], where the
 *            first lower bound and the last upper bound are opened up to the
 *            absolute start and end of the key space.
 * <p>
 * The resulting ranges never overlap and together cover the whole key space.
 * Listing tasks may subdivide them further at runtime.
 */
public final class KeySpaceHints {

    private final List<String> hints;
    private final List<KeyRange> ranges;

    private KeySpaceHints(List<String> hints, List<KeyRange> ranges) {
        this.hints = hints;
        this.ranges = ranges;
    }

    /**
     * Build from hints that are already sorted (by {@link KeyOrder}) and distinct.
     *
     * @throws IllegalArgumentException if the input is out of order or has duplicates.
     */
    public static KeySpaceHints build(List<String> sortedDistinct) {
        List<String> copy = List.copyOf(sortedDistinct);
        for (int i = 1; i < copy.size(); i++) {
            if (KeyOrder.compare(copy.get(i - 1), copy.get(i)) >= 0) {
                throw new IllegalArgumentException(
                        "hints must be sorted and distinct; offending entry at index " + i + ": " + copy.get(i));
            }
        }

        if (copy.size() <= 1) {
            return new KeySpaceHints(copy, List.of(KeyRange.full()));
        }

        int n = copy.size();
        List<KeyRange> out = new ArrayList<>(n - 1);
        for (int i = 0; i < n - 1; i++) {
            String start = (i == 0) ? null : copy.get(i);
            String end = (i == n - 2) ? null : copy.get(i + 1);
            out.add(new KeyRange(start, end));
        }
        return new KeySpaceHints(copy, Collections.unmodifiableList(out));
    }

    /** Sort and dedup arbitrary input first, then {@link #build(List)}. */
    public static KeySpaceHints fromUnsorted(Collection<String> hints) {
        TreeSet<String> sorted = new TreeSet<>(KeyOrder.COMPARATOR);
        sorted.addAll(hints);
        return build(new ArrayList<>(sorted));
    }

    public static KeySpaceHints none() {
        return build(List.of());
    }

    public List<KeyRange> ranges() {
        return ranges;
    }

    /** The sorted, distinct hints this structure was built from. */
    public List<String> hints() {
        return hints;
    }

    public int size() {
        return ranges.size();
    }

    public boolean isEmpty() {
        return hints.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeySpaceHints other)) return false;
        return ranges.equals(other.ranges);
    }

    @Override
    public int hashCode() {
        return ranges.hashCode();
    }

    @Override
    public String toString() {
        return "KeySpaceHints[hints=" + hints.size() + ", ranges=" + ranges.size() + "]";
    }
}
