package org.blockindex.migrations.pipeline.common;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

/**
 * Bounded exponential backoff for {@link TransientStoreException}s. With the default settings the retry
 * budget is spread over roughly a minute and a half; once it is spent the last failure is rethrown as is.
 */
@Slf4j
public final class TransientRetry {

    private TransientRetry() {}

    public static RetryBackoffSpec spec(PipelineSettings settings, String operation) {
        return Retry.backoff(settings.getMaxRetries(), settings.getInitialBackoff())
            .maxBackoff(settings.getMaxBackoff())
            .filter(TransientStoreException.class::isInstance)
            .doBeforeRetry(signal -> log.atWarn()
                .setMessage("Retrying {} after transient failure (attempt {}): {}")
                .addArgument(operation)
                .addArgument(signal.totalRetries() + 1)
                .addArgument(() -> signal.failure().getMessage())
                .log())
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public static <T> Mono<T> withRetry(Mono<T> operation, PipelineSettings settings, String description) {
        return operation.retryWhen(spec(settings, description));
    }
}
