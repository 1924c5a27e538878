// file: core/src/main/java/io/fastlist/core/diff/DiffKind.java
package io.fastlist.core.diff;

/**
 * Classification of one key in diff mode. Keys present on both sides with
 * equal metadata have no kind: they are never reported.
 */
public enum DiffKind {
    LEFT_ONLY,
    RIGHT_ONLY,
    MISMATCH
}
