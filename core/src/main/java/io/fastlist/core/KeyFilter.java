// file: core/src/main/java/io/fastlist/core/KeyFilter.java
package io.fastlist.core;

/**
 * Boolean predicate over object keys. Compiled once from the operator's
 * filter expression by {@link KeyFilters}.
 */
@FunctionalInterface
public interface KeyFilter {

    KeyFilter ALL = key -> true;

    boolean matches(String key);
}
