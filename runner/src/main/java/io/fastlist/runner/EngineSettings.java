// file: runner/src/main/java/io/fastlist/runner/EngineSettings.java
package io.fastlist.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fastlist.runner.dto.JsonSettings;
import io.fastlist.runner.listing.RetryPolicy;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Engine tuning knobs that are not worth a CLI flag.
 *
 * @param pageSize        max keys per list request (S3 caps this at 1000).
 * @param delimiter       path separator for prefix discovery; "" lists every unit flat.
 * @param maxAttempts     attempts per page before the unit is skipped.
 * @param baseBackoff     first retry backoff ceiling.
 * @param maxBackoff      cap for the retry backoff ceiling.
 * @param requestTimeout  per-attempt timeout of one list call.
 * @param monitorInterval progress report period.
 * @param hintSampleSize  keys kept for the key-space output file.
 * @param drainTimeout    how long an operator interrupt waits for tasks to wind down.
 */
public record EngineSettings(
        int pageSize,
        String delimiter,
        int maxAttempts,
        Duration baseBackoff,
        Duration maxBackoff,
        Duration requestTimeout,
        Duration monitorInterval,
        int hintSampleSize,
        Duration drainTimeout
) {

    public EngineSettings {
        Objects.requireNonNull(delimiter, "delimiter");
        Objects.requireNonNull(baseBackoff, "baseBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(monitorInterval, "monitorInterval");
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        if (pageSize <= 0 || pageSize > 1000) throw new IllegalArgumentException("pageSize must be in 1..1000");
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (maxBackoff.compareTo(baseBackoff) < 0) throw new IllegalArgumentException("maxBackoff must be >= baseBackoff");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) throw new IllegalArgumentException("requestTimeout must be > 0");
        if (monitorInterval.isZero() || monitorInterval.isNegative()) throw new IllegalArgumentException("monitorInterval must be > 0");
        if (hintSampleSize < 0) throw new IllegalArgumentException("hintSampleSize must be >= 0");
        if (drainTimeout.isNegative()) throw new IllegalArgumentException("drainTimeout must be >= 0");
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                1000,
                "/",
                5,
                Duration.ofMillis(100),
                Duration.ofSeconds(5),
                Duration.ofSeconds(30),
                Duration.ofSeconds(1),
                1000,
                Duration.ofSeconds(10)
        );
    }

    /**
     * Load a JSON tuning file; fields missing from the file keep their defaults.
     * Unknown fields are rejected so that typos do not go unnoticed.
     */
    public static EngineSettings fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonSettings json = mapper.readValue(path.toFile(), JsonSettings.class);
            return defaults().overriddenBy(json);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load EngineSettings from " + path, e);
        }
    }

    EngineSettings overriddenBy(JsonSettings json) {
        return new EngineSettings(
                json.pageSize != null ? json.pageSize : pageSize,
                json.delimiter != null ? json.delimiter : delimiter,
                json.maxAttempts != null ? json.maxAttempts : maxAttempts,
                json.baseBackoffMillis != null ? Duration.ofMillis(json.baseBackoffMillis) : baseBackoff,
                json.maxBackoffMillis != null ? Duration.ofMillis(json.maxBackoffMillis) : maxBackoff,
                json.requestTimeoutMillis != null ? Duration.ofMillis(json.requestTimeoutMillis) : requestTimeout,
                json.monitorIntervalMillis != null ? Duration.ofMillis(json.monitorIntervalMillis) : monitorInterval,
                json.hintSampleSize != null ? json.hintSampleSize : hintSampleSize,
                json.drainTimeoutMillis != null ? Duration.ofMillis(json.drainTimeoutMillis) : drainTimeout
        );
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxAttempts, baseBackoff, maxBackoff);
    }
}
