package org.blockindex.migrations.pipeline.common;

/**
 * A failure talking to a store or queue that may succeed if tried again (throttling, timeouts, 5xx).
 * Only this type is retried by {@link TransientRetry}.
 */
public class TransientStoreException extends RuntimeException {
    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
