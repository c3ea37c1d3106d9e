package org.blockindex.migrations.pipeline;

import java.util.HashSet;
import java.util.List;

import org.blockindex.migrations.pipeline.common.MalformedExistenceResponseException;
import org.blockindex.migrations.pipeline.ir.DestinationKey;
import org.blockindex.migrations.pipeline.ir.DestinationRecord;
import org.blockindex.migrations.pipeline.sink.DestinationStore;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * Drops the candidates that already exist in the destination table.
 *
 * Candidates are deduplicated by primary key first, because a batched existence query rejects duplicate
 * keys. Any key the store's response leaves out is treated as not found: an extra idempotent put is
 * preferable to silently skipping a record. A response with no results container fails the batch.
 */
@Slf4j
public class ExistenceFilter {
    private final DestinationStore store;
    private final int maxBatchSize;

    public ExistenceFilter(DestinationStore store, int maxBatchSize) {
        this.store = store;
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * Returns a cold Flux of the candidates not yet present, in first-occurrence order.
     */
    public Flux<DestinationRecord> filterMissing(List<DestinationRecord> candidates) {
        if (candidates.isEmpty()) {
            return Flux.empty();
        }
        if (candidates.size() > maxBatchSize) {
            return Flux.error(new IllegalArgumentException(
                "Existence check batch of " + candidates.size() + " exceeds the limit of " + maxBatchSize));
        }
        var deduped = DestinationRecords.dedupeByKey(candidates);
        var keys = deduped.stream().map(DestinationRecord::primaryKey).toList();

        return store.batchGet(keys)
            .flatMapMany(response -> {
                if (response.isMalformed()) {
                    return Flux.error(new MalformedExistenceResponseException(
                        "Existence check for " + keys.size() + " keys returned no results"));
                }
                var present = new HashSet<DestinationKey>(response.presentKeys());
                log.atDebug().setMessage("{} of {} candidates already exist")
                    .addArgument(present::size).addArgument(deduped::size).log();
                return Flux.fromIterable(deduped)
                    .filter(record -> !present.contains(record.primaryKey()));
            });
    }
}
