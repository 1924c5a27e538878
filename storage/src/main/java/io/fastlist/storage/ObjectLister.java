// file: storage/src/main/java/io/fastlist/storage/ObjectLister.java
package io.fastlist.storage;

/**
 * Storage-provider listing capability the engine depends on:
 * "list keys under a prefix, optionally delimited at one path separator, paginated".
 * <p>
 * Contract:
 *  - Entries and common prefixes of one page come back in key order
 *    (UTF-8 binary order, see io.fastlist.core.KeyOrder).
 *  - startAfter is exclusive and only honoured on the first page; later pages
 *    are driven by the continuation token.
 *  - Implementations must be safe for concurrent use by many workers.
 *  - Failures are reported as {@link TransientListingException} (worth retrying)
 *    or {@link FatalListingException} (configuration / auth, never retried).
 */
public interface ObjectLister extends AutoCloseable {

    ListPage list(ListRequest request);

    @Override
    default void close() {
        // nothing to release by default
    }
}
