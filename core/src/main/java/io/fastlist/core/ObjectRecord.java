// file: core/src/main/java/io/fastlist/core/ObjectRecord.java
package io.fastlist.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One discovered object. Immutable; handed by value from a listing task to
 * the aggregation task.
 *
 * @param key          full object key.
 * @param size         object size in bytes.
 * @param etag         provider entity tag, quotes stripped; may be null.
 * @param lastModified provider modification time; may be null.
 * @param storageClass provider storage class; may be null.
 * @param direction    side of the run this record belongs to.
 */
public record ObjectRecord(
        String key,
        long size,
        String etag,
        Instant lastModified,
        String storageClass,
        Direction direction
) {
    public ObjectRecord {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(direction, "direction");
        if (size < 0) throw new IllegalArgumentException("size must be >= 0");
    }

    /**
     * Same object metadata, ignoring direction and modification time. Copies
     * of one object in two buckets always differ in last-modified, so it does
     * not take part in the comparison.
     */
    public boolean sameContentAs(ObjectRecord other) {
        if (size != other.size) {
            return false;
        }
        if (etag == null || other.etag == null) {
            return true;
        }
        return etag.equals(other.etag);
    }
}
