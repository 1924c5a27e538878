// file: storage/src/main/java/io/fastlist/storage/s3/S3Errors.java
package io.fastlist.storage.s3;

import io.fastlist.storage.FatalListingException;
import io.fastlist.storage.ListingException;
import io.fastlist.storage.TransientListingException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

import java.net.UnknownHostException;
import java.util.Set;

/**
 * Maps AWS SDK failures onto the transient / fatal split the listing task acts on.
 * <p>
 * Transient: throttling, 5xx, request timeouts, connection-level client errors.
 * Fatal:     redirects (wrong region), 400/401/403/404 (bad bucket, malformed
 *            auth, denied, missing bucket), missing credentials, unknown endpoint host.
 */
public final class S3Errors {

    private static final Set<String> TRANSIENT_CODES = Set.of(
            "SlowDown",
            "RequestTimeout",
            "InternalError",
            "ServiceUnavailable",
            "Throttling",
            "ThrottlingException"
    );

    private S3Errors() {
        // utility
    }

    public static ListingException translate(SdkException e, String context) {
        if (e instanceof AwsServiceException service) {
            return translateService(service, context);
        }
        if (e instanceof ApiCallTimeoutException || e instanceof ApiCallAttemptTimeoutException) {
            return new TransientListingException("timeout listing " + context, e);
        }
        if (e instanceof SdkClientException) {
            if (hasCause(e, UnknownHostException.class)) {
                return new FatalListingException("unknown endpoint host listing " + context + ": " + e.getMessage(), e);
            }
            String msg = String.valueOf(e.getMessage());
            if (msg.contains("Unable to load credentials") || msg.contains("Unable to load region")) {
                return new FatalListingException("client configuration error listing " + context + ": " + msg, e);
            }
            return new TransientListingException("client error listing " + context + ": " + msg, e);
        }
        return e.retryable()
                ? new TransientListingException("error listing " + context + ": " + e.getMessage(), e)
                : new FatalListingException("error listing " + context + ": " + e.getMessage(), e);
    }

    private static ListingException translateService(AwsServiceException e, String context) {
        int status = e.statusCode();
        String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        String detail = "status=" + status + (code != null ? " code=" + code : "") + " listing " + context;

        if (e.isThrottlingException() || status == 429 || status >= 500
                || (code != null && TRANSIENT_CODES.contains(code))) {
            return new TransientListingException(detail, e);
        }
        if (status == 301 || status == 307 || status == 400 || status == 401 || status == 403 || status == 404) {
            return new FatalListingException(detail, e);
        }
        return e.retryable()
                ? new TransientListingException(detail, e)
                : new FatalListingException(detail, e);
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (type.isInstance(c)) {
                return true;
            }
            if (c.getCause() == c) {
                break;
            }
        }
        return false;
    }
}
