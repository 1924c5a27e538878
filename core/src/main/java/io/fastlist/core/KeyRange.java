// file: core/src/main/java/io/fastlist/core/KeyRange.java
package io.fastlist.core;

import java.util.Objects;

/**
 * Half-open slice of the key space: (startAfter, endInclusive].
 * <p>
 * Either bound may be null, meaning unbounded on that side:
 *  - (null, null)  covers the whole key space,
 *  - (null, e]     covers every key up to and including e,
 *  - (s, null)     covers every key strictly after s.
 * <p>
 * The lower bound is exclusive so it maps directly onto the provider's
 * "start after" request parameter. Comparisons use {@link KeyOrder}.
 */
public final class KeyRange {

    private static final KeyRange FULL = new KeyRange(null, null);

    private final String startAfter;
    private final String endInclusive;

    public KeyRange(String startAfter, String endInclusive) {
        if (startAfter != null && endInclusive != null
                && KeyOrder.compare(startAfter, endInclusive) >= 0) {
            throw new IllegalArgumentException(
                    "empty range: startAfter=" + startAfter + " endInclusive=" + endInclusive);
        }
        this.startAfter = startAfter;
        this.endInclusive = endInclusive;
    }

    public static KeyRange full() {
        return FULL;
    }

    /** Exclusive lower bound, or null when unbounded. */
    public String startAfter() {
        return startAfter;
    }

    /** Inclusive upper bound, or null when unbounded. */
    public String endInclusive() {
        return endInclusive;
    }

    public boolean isFull() {
        return startAfter == null && endInclusive == null;
    }

    public boolean contains(String key) {
        Objects.requireNonNull(key, "key");
        if (startAfter != null && KeyOrder.compare(key, startAfter) <= 0) {
            return false;
        }
        return !isPastEnd(key);
    }

    /**
     * True if 'key' sorts after the upper bound. Since listings come back in
     * key order, the first such key means the rest of the listing is out of range.
     */
    public boolean isPastEnd(String key) {
        return endInclusive != null && KeyOrder.compare(key, endInclusive) > 0;
    }

    /**
     * True if at least one key starting with 'prefix' can fall inside this range.
     * Keys under a prefix p form the interval [p, p + max-suffix].
     */
    public boolean intersectsPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (endInclusive != null && KeyOrder.compare(prefix, endInclusive) > 0) {
            return false;
        }
        if (startAfter != null
                && KeyOrder.compare(prefix, startAfter) < 0
                && !startAfter.startsWith(prefix)) {
            // every key under 'prefix' sorts before startAfter
            return false;
        }
        return true;
    }

    /**
     * Sub-range for keys under 'prefix'. A bound is kept only when it falls
     * inside the prefix; otherwise the whole prefix lies on the open side of it.
     */
    public KeyRange narrowTo(String prefix) {
        if (!intersectsPrefix(prefix)) {
            throw new IllegalArgumentException("prefix " + prefix + " lies outside " + this);
        }
        String s = (startAfter != null && startAfter.startsWith(prefix)) ? startAfter : null;
        String e = (endInclusive != null && endInclusive.startsWith(prefix)) ? endInclusive : null;
        if (s == null && e == null) {
            return FULL;
        }
        return new KeyRange(s, e);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyRange other)) return false;
        return Objects.equals(startAfter, other.startAfter)
                && Objects.equals(endInclusive, other.endInclusive);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startAfter, endInclusive);
    }

    @Override
    public String toString() {
        return "KeyRange(" + (startAfter == null ? "-inf" : "'" + startAfter + "'")
                + "," + (endInclusive == null ? "+inf" : "'" + endInclusive + "'") + "]";
    }
}
