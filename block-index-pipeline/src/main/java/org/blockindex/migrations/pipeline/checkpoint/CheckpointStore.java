package org.blockindex.migrations.pipeline.checkpoint;

import java.util.Optional;

import reactor.core.publisher.Mono;

/**
 * Durable small-value key/value store for scan progress and the stop signal.
 */
public interface CheckpointStore {

    /** The value stored at {@code key}, or empty when nothing has been stored there yet. */
    Mono<Optional<String>> get(String key);

    /** Store {@code value} at {@code key}, replacing any previous value. */
    Mono<Void> put(String key, String value);
}
