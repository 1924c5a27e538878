// file: core/src/main/java/io/fastlist/core/Direction.java
package io.fastlist.core;

/**
 * Which side of a run a record came from. List mode only ever uses LEFT.
 */
public enum Direction {
    LEFT,
    RIGHT;

    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
