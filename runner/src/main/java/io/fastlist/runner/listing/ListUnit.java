// file: runner/src/main/java/io/fastlist/runner/listing/ListUnit.java
package io.fastlist.runner.listing;

import io.fastlist.core.KeyRange;

import java.util.Objects;

/**
 * One unit of listing work: list keys under 'prefix' that fall inside 'range'.
 */
public record ListUnit(String prefix, KeyRange range) {

    public ListUnit {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(range, "range");
    }
}
