package org.blockindex.migrations.pipeline.sink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

import org.blockindex.migrations.pipeline.ir.DestinationKey;
import org.blockindex.migrations.pipeline.ir.DestinationRecord;
import org.blockindex.migrations.pipeline.ir.ExistenceResponse;

import reactor.core.publisher.Mono;

/**
 * A DestinationStore held in memory, for exercising the consumer side without a real table.
 *
 * Failure modes can be switched on to simulate partial writes, truncated existence responses and
 * responses with no results container.
 */
public class InMemoryDestinationStore implements DestinationStore {

    private final Map<DestinationKey, DestinationRecord> rows = new ConcurrentHashMap<>();
    private final List<List<DestinationKey>> getRequests = new CopyOnWriteArrayList<>();
    private final List<List<DestinationRecord>> putRequests = new CopyOnWriteArrayList<>();

    private volatile Predicate<DestinationRecord> rejectWrite = r -> false;
    private volatile Predicate<DestinationKey> omitFromResponse = k -> false;
    private volatile boolean malformedResponses;

    public InMemoryDestinationStore withExisting(DestinationRecord... records) {
        for (var record : records) {
            rows.put(record.primaryKey(), record);
        }
        return this;
    }

    /** Writes matching the predicate come back as unprocessed. */
    public InMemoryDestinationStore rejectingWrites(Predicate<DestinationRecord> predicate) {
        this.rejectWrite = predicate;
        return this;
    }

    /** Existing keys matching the predicate are left out of existence responses. */
    public InMemoryDestinationStore omittingFromResponses(Predicate<DestinationKey> predicate) {
        this.omitFromResponse = predicate;
        return this;
    }

    public InMemoryDestinationStore withMalformedResponses() {
        this.malformedResponses = true;
        return this;
    }

    @Override
    public Mono<ExistenceResponse> batchGet(List<DestinationKey> keys) {
        return Mono.fromCallable(() -> {
            rejectDuplicates(keys);
            getRequests.add(List.copyOf(keys));
            if (malformedResponses) {
                return ExistenceResponse.malformed();
            }
            var present = new ArrayList<DestinationKey>();
            for (var key : keys) {
                if (rows.containsKey(key) && !omitFromResponse.test(key)) {
                    present.add(key);
                }
            }
            return new ExistenceResponse(present);
        });
    }

    @Override
    public Mono<List<DestinationRecord>> batchPut(List<DestinationRecord> records) {
        return Mono.fromCallable(() -> {
            rejectDuplicates(records.stream().map(DestinationRecord::primaryKey).toList());
            putRequests.add(List.copyOf(records));
            var unprocessed = new ArrayList<DestinationRecord>();
            for (var record : records) {
                if (rejectWrite.test(record)) {
                    unprocessed.add(record);
                } else {
                    rows.put(record.primaryKey(), record);
                }
            }
            return unprocessed;
        });
    }

    private static void rejectDuplicates(List<DestinationKey> keys) {
        Set<DestinationKey> seen = new HashSet<>();
        for (var key : keys) {
            if (!seen.add(key)) {
                throw new IllegalArgumentException("Provided list of item keys contains duplicates: " + key);
            }
        }
    }

    public Set<DestinationKey> keys() {
        return Collections.unmodifiableSet(new HashSet<>(rows.keySet()));
    }

    public DestinationRecord get(DestinationKey key) {
        return rows.get(key);
    }

    public List<List<DestinationKey>> getGetRequests() {
        return Collections.unmodifiableList(getRequests);
    }

    public List<List<DestinationRecord>> getPutRequests() {
        return Collections.unmodifiableList(putRequests);
    }
}
