package org.blockindex.migrations.pipeline;

import java.util.List;

import org.blockindex.migrations.pipeline.ir.DestinationRecord;
import org.blockindex.migrations.pipeline.ir.WriteResult;
import org.blockindex.migrations.pipeline.sink.DestinationStore;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Puts a batch into the destination table. Items the table reports as unprocessed are returned as they
 * are; deciding what to do with them is up to the caller.
 */
@Slf4j
public class BatchWriter {
    private final DestinationStore store;
    private final int maxBatchSize;

    public BatchWriter(DestinationStore store, int maxBatchSize) {
        this.store = store;
        this.maxBatchSize = maxBatchSize;
    }

    public Mono<WriteResult> write(List<DestinationRecord> batch) {
        if (batch.isEmpty()) {
            return Mono.just(new WriteResult(0, List.of()));
        }
        if (batch.size() > maxBatchSize) {
            return Mono.error(new IllegalArgumentException(
                "Write batch of " + batch.size() + " exceeds the limit of " + maxBatchSize));
        }
        // a batched put also rejects duplicate keys
        var deduped = DestinationRecords.dedupeByKey(batch);
        return store.batchPut(deduped)
            .map(unprocessed -> new WriteResult(deduped.size(), List.copyOf(unprocessed)))
            .doOnNext(result -> log.debug("Wrote {} of {} records", result.committed(), result.submitted()));
    }
}
