// file: core/src/main/java/io/fastlist/core/RunMode.java
package io.fastlist.core;

/**
 * LIST enumerates one bucket; DIFF lists two buckets and classifies the differences.
 */
public enum RunMode {
    LIST,
    DIFF
}
