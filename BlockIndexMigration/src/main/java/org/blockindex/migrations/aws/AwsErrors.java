package org.blockindex.migrations.aws;

import java.util.concurrent.CompletionException;

import org.blockindex.migrations.pipeline.common.TransientStoreException;

import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;

/**
 * Classifies AWS SDK failures for the pipeline's retry policy.
 */
public final class AwsErrors {

    private AwsErrors() {}

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Network and timeout failures on the client side, throttling and 5xx responses on the service side.
     */
    public static boolean isTransient(Throwable error) {
        var cause = unwrap(error);
        if (cause instanceof SdkClientException) {
            return true;
        }
        if (cause instanceof SdkServiceException) {
            var serviceException = (SdkServiceException) cause;
            return serviceException.isThrottlingException() || serviceException.statusCode() >= 500;
        }
        return false;
    }

    public static TransientStoreException asTransient(String operation, Throwable error) {
        var cause = unwrap(error);
        return new TransientStoreException(operation + " failed: " + cause.getMessage(), cause);
    }
}
