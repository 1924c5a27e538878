// file: storage/src/main/java/io/fastlist/storage/s3/S3ObjectLister.java
package io.fastlist.storage.s3;

import io.fastlist.storage.BucketTarget;
import io.fastlist.storage.ListPage;
import io.fastlist.storage.ListRequest;
import io.fastlist.storage.ObjectLister;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link ObjectLister} over S3 ListObjectsV2.
 * <p>
 * One instance per bucket side, shared by all listing workers of that side
 * (S3Client is thread-safe). SDK failures are translated by {@link S3Errors}.
 */
public final class S3ObjectLister implements ObjectLister {

    private final S3Client client;
    private final String describe;

    public S3ObjectLister(S3Client client, String describe) {
        this.client = Objects.requireNonNull(client, "client");
        this.describe = Objects.requireNonNull(describe, "describe");
    }

    /**
     * Factory method matching {@link io.fastlist.storage.ObjectListerFactory}.
     */
    public static S3ObjectLister open(BucketTarget target, Duration requestTimeout, int maxConnections) {
        return new S3ObjectLister(S3Clients.create(target, requestTimeout, maxConnections), target.describe());
    }

    @Override
    public ListPage list(ListRequest request) {
        ListObjectsV2Request.Builder b = ListObjectsV2Request.builder()
                .bucket(request.bucket())
                .maxKeys(request.maxKeys());

        if (!request.prefix().isEmpty()) {
            b.prefix(request.prefix());
        }
        if (request.delimited()) {
            b.delimiter(request.delimiter());
        }
        if (request.continuationToken() != null) {
            b.continuationToken(request.continuationToken());
        } else if (request.startAfter() != null) {
            b.startAfter(request.startAfter());
        }

        ListObjectsV2Response resp;
        try {
            resp = client.listObjectsV2(b.build());
        } catch (SdkException e) {
            throw S3Errors.translate(e, describe + " prefix='" + request.prefix() + "'");
        }
        return toPage(resp);
    }

    static ListPage toPage(ListObjectsV2Response resp) {
        List<ListPage.Entry> objects = new ArrayList<>(resp.contents().size());
        for (S3Object o : resp.contents()) {
            objects.add(new ListPage.Entry(
                    o.key(),
                    o.size() == null ? 0L : o.size(),
                    stripQuotes(o.eTag()),
                    o.lastModified(),
                    o.storageClassAsString()
            ));
        }

        List<String> prefixes = new ArrayList<>(resp.commonPrefixes().size());
        for (CommonPrefix cp : resp.commonPrefixes()) {
            prefixes.add(cp.prefix());
        }

        String next = Boolean.TRUE.equals(resp.isTruncated()) ? resp.nextContinuationToken() : null;
        return new ListPage(objects, prefixes, next);
    }

    static String stripQuotes(String etag) {
        if (etag == null || etag.length() < 2) {
            return etag;
        }
        if (etag.charAt(0) == '"' && etag.charAt(etag.length() - 1) == '"') {
            return etag.substring(1, etag.length() - 1);
        }
        return etag;
    }

    @Override
    public void close() {
        client.close();
    }
}
