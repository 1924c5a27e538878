// file: storage/src/main/java/io/fastlist/storage/ListPage.java
package io.fastlist.storage;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One page of listing results.
 *
 * @param objects        objects directly under the requested prefix (all of them, when flat).
 * @param commonPrefixes deeper path segments rolled up by the delimiter.
 * @param nextToken      continuation token, or null when this was the last page.
 */
public record ListPage(List<Entry> objects, List<String> commonPrefixes, String nextToken) {

    public ListPage {
        objects = List.copyOf(Objects.requireNonNull(objects, "objects"));
        commonPrefixes = List.copyOf(Objects.requireNonNull(commonPrefixes, "commonPrefixes"));
    }

    public boolean hasMore() {
        return nextToken != null;
    }

    /** Provider-side view of one object. */
    public record Entry(String key, long size, String etag, Instant lastModified, String storageClass) {
        public Entry {
            Objects.requireNonNull(key, "key");
        }
    }
}
