// file: storage/src/main/java/io/fastlist/storage/ListRequest.java
package io.fastlist.storage;

import java.util.Objects;

/**
 * One page request.
 *
 * @param bucket            bucket to list.
 * @param prefix            key prefix, "" for the bucket root.
 * @param delimiter         path separator to group on; null or "" for a flat listing.
 * @param startAfter        exclusive lower bound for the first page; may be null.
 * @param continuationToken token from the previous page; null for the first page.
 * @param maxKeys           page size hint.
 */
public record ListRequest(
        String bucket,
        String prefix,
        String delimiter,
        String startAfter,
        String continuationToken,
        int maxKeys
) {
    public ListRequest {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(prefix, "prefix");
        if (maxKeys <= 0) throw new IllegalArgumentException("maxKeys must be > 0");
    }

    public boolean delimited() {
        return delimiter != null && !delimiter.isEmpty();
    }

    public ListRequest nextPage(String token) {
        return new ListRequest(bucket, prefix, delimiter, startAfter, token, maxKeys);
    }
}
