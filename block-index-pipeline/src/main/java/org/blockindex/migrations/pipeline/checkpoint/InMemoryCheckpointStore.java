package org.blockindex.migrations.pipeline.checkpoint;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import reactor.core.publisher.Mono;

/**
 * A CheckpointStore backed by a map. Records every write so tests can check what was persisted and when.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final List<String> writes = new CopyOnWriteArrayList<>();

    @Override
    public Mono<Optional<String>> get(String key) {
        return Mono.fromSupplier(() -> Optional.ofNullable(values.get(key)));
    }

    @Override
    public Mono<Void> put(String key, String value) {
        return Mono.fromRunnable(() -> {
            values.put(key, value);
            writes.add(key);
        });
    }

    public Optional<String> peek(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public List<String> getWrites() {
        return Collections.unmodifiableList(writes);
    }
}
