// file: storage/src/main/java/io/fastlist/storage/BucketTarget.java
package io.fastlist.storage;

import java.util.Objects;

/**
 * Where one side of a run lists from.
 *
 * @param bucket    bucket name.
 * @param region    provider region; null to use the SDK default chain.
 * @param endpoint  custom endpoint URL (S3-compatible stores); may be null.
 * @param pathStyle use path-style instead of virtual-host addressing.
 */
public record BucketTarget(String bucket, String region, String endpoint, boolean pathStyle) {

    public BucketTarget {
        Objects.requireNonNull(bucket, "bucket");
        if (bucket.isBlank()) throw new IllegalArgumentException("bucket must not be blank");
    }

    /** "region/bucket" or just "bucket", for log lines. */
    public String describe() {
        return region == null ? bucket : region + "/" + bucket;
    }
}
