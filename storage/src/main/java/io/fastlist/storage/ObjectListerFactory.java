// file: storage/src/main/java/io/fastlist/storage/ObjectListerFactory.java
package io.fastlist.storage;

/**
 * Opens an {@link ObjectLister} for one bucket side.
 * Throws {@link FatalListingException} when the target cannot be reached at all
 * (missing region, unusable endpoint, no credentials).
 */
@FunctionalInterface
public interface ObjectListerFactory {

    ObjectLister open(BucketTarget target);
}
