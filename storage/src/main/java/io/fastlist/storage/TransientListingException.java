// file: storage/src/main/java/io/fastlist/storage/TransientListingException.java
package io.fastlist.storage;

/**
 * Throttling, timeouts, dropped connections, provider 5xx: retry the same request later.
 */
public class TransientListingException extends ListingException {

    public TransientListingException(String message) {
        super(message, null);
    }

    public TransientListingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
