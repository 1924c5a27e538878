// file: runner/src/main/java/io/fastlist/runner/listing/RetryPolicy.java
package io.fastlist.runner.listing;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Per-page retry limits for transient provider failures.
 * <p>
 * The backoff ceiling doubles per attempt from 'base' and is capped at 'max';
 * the actual sleep is drawn uniformly from the upper half of the ceiling so
 * that workers hitting the same throttled prefix spread out.
 *
 * @param maxAttempts total attempts per page, including the first.
 * @param base        ceiling after the first failure.
 * @param max         cap for the ceiling.
 */
public record RetryPolicy(int maxAttempts, Duration base, Duration max) {

    public RetryPolicy {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(max, "max");
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (base.isNegative()) throw new IllegalArgumentException("base must be >= 0");
        if (max.compareTo(base) < 0) throw new IllegalArgumentException("max must be >= base");
    }

    /** Ceiling of the sleep after failed attempt number 'attempt' (1-based). */
    public Duration backoffCeiling(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        long baseMillis = base.toMillis();
        int shift = Math.min(attempt - 1, 30);
        long millis = baseMillis << shift;
        if (millis < baseMillis || millis > max.toMillis()) {
            millis = max.toMillis();
        }
        return Duration.ofMillis(millis);
    }

    public Duration jitteredBackoff(int attempt) {
        long ceiling = backoffCeiling(attempt).toMillis();
        if (ceiling <= 1) {
            return Duration.ofMillis(ceiling);
        }
        long half = ceiling / 2;
        return Duration.ofMillis(half + ThreadLocalRandom.current().nextLong(ceiling - half + 1));
    }
}
