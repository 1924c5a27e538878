// file: storage/src/main/java/io/fastlist/storage/s3/S3Clients.java
package io.fastlist.storage.s3;

import io.fastlist.storage.BucketTarget;
import io.fastlist.storage.FatalListingException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * Builds AWS SDK v2 S3 clients for one {@link BucketTarget}.
 * <p>
 * - Region: explicit when given, otherwise the SDK default provider chain.
 * - Endpoint: optional override for S3-compatible stores.
 * - Path-style addressing: when requested.
 * - SDK retries are disabled; the listing task retries at range granularity
 *   and owns the backoff.
 * - Each attempt is bounded by 'requestTimeout'; expiry surfaces as a transient error.
 */
public final class S3Clients {

    private S3Clients() {
        // utility
    }

    public static S3Client create(BucketTarget target, Duration requestTimeout, int maxConnections) {
        try {
            S3ClientBuilder builder = S3Client.builder()
                    .httpClientBuilder(ApacheHttpClient.builder().maxConnections(maxConnections))
                    .forcePathStyle(target.pathStyle())
                    .overrideConfiguration(ClientOverrideConfiguration.builder()
                            .apiCallAttemptTimeout(requestTimeout)
                            .retryPolicy(RetryPolicy.none())
                            .build());

            if (target.region() != null && !target.region().isBlank()) {
                builder.region(Region.of(target.region()));
            }
            if (target.endpoint() != null && !target.endpoint().isBlank()) {
                builder.endpointOverride(URI.create(target.endpoint()));
            }
            return builder.build();
        } catch (SdkClientException | IllegalArgumentException e) {
            throw new FatalListingException(
                    "cannot build S3 client for " + target.describe() + ": " + e.getMessage(), e);
        }
    }
}
