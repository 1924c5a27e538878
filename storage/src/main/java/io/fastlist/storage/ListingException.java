// file: storage/src/main/java/io/fastlist/storage/ListingException.java
package io.fastlist.storage;

/**
 * Base type for provider listing failures. Unchecked; listing tasks catch the
 * two concrete subtypes and never let them cross a task boundary.
 */
public abstract class ListingException extends RuntimeException {

    protected ListingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean retryable();
}
