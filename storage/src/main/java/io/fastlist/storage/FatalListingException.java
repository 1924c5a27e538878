// file: storage/src/main/java/io/fastlist/storage/FatalListingException.java
package io.fastlist.storage;

/**
 * Bad bucket, region, credentials or endpoint. Retrying cannot help; the
 * owning listing task gives up.
 */
public class FatalListingException extends ListingException {

    public FatalListingException(String message) {
        super(message, null);
    }

    public FatalListingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
