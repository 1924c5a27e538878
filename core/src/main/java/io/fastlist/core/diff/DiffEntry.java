// file: core/src/main/java/io/fastlist/core/diff/DiffEntry.java
package io.fastlist.core.diff;

import io.fastlist.core.ObjectRecord;

import java.util.Objects;

/**
 * One reported difference between the two sides.
 *
 * @param kind  classification.
 * @param key   object key.
 * @param left  left-side record, null for RIGHT_ONLY.
 * @param right right-side record, null for LEFT_ONLY.
 */
public record DiffEntry(DiffKind kind, String key, ObjectRecord left, ObjectRecord right) {

    public DiffEntry {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(key, "key");
        switch (kind) {
            case LEFT_ONLY -> {
                if (left == null || right != null) throw new IllegalArgumentException("LEFT_ONLY needs only a left record");
            }
            case RIGHT_ONLY -> {
                if (left != null || right == null) throw new IllegalArgumentException("RIGHT_ONLY needs only a right record");
            }
            case MISMATCH -> {
                if (left == null || right == null) throw new IllegalArgumentException("MISMATCH needs both records");
            }
        }
    }
}
