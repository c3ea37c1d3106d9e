package org.blockindex.migrations.pipeline.scan;

import org.blockindex.migrations.pipeline.checkpoint.CheckpointKeys;
import org.blockindex.migrations.pipeline.checkpoint.CheckpointStore;
import org.blockindex.migrations.pipeline.checkpoint.CursorCodec;
import org.blockindex.migrations.pipeline.common.PipelineSettings;
import org.blockindex.migrations.pipeline.common.TransientRetry;
import org.blockindex.migrations.pipeline.ir.ScanCursor;
import org.blockindex.migrations.pipeline.ir.ScanPartition;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Scan cursors and the stop signal on top of a CheckpointStore, with transient failures retried.
 */
@RequiredArgsConstructor
public class ScanCheckpoints {
    private final CheckpointStore store;
    private final CheckpointKeys keys;
    private final CursorCodec codec;
    private final PipelineSettings settings;

    /** The persisted cursor, or a fresh one when the partition has never been scanned. */
    public Mono<ScanCursor> load(ScanPartition partition) {
        return TransientRetry.withRetry(store.get(keys.cursorKey(partition)), settings, "checkpoint read")
            .map(value -> value
                .map(stored -> codec.decode(partition, stored))
                .orElseGet(() -> ScanCursor.fresh(partition)));
    }

    /**
     * Persists the cursor and emits what was written. A stop requested for the partition since the cursor
     * was loaded is kept: it is carried into the written value.
     */
    public Mono<ScanCursor> save(ScanCursor cursor) {
        return load(cursor.partition())
            .map(persisted -> persisted.stopRequested() && !cursor.stopRequested()
                ? cursor.withStopRequested()
                : cursor)
            .flatMap(merged -> Mono.fromCallable(() -> codec.encode(merged))
                .flatMap(value -> TransientRetry.withRetry(
                    store.put(keys.cursorKey(merged.partition()), value), settings, "checkpoint write"))
                .thenReturn(merged));
    }

    /** Only the presence of the stop key matters, not its value. */
    public Mono<Boolean> isStopSignalled() {
        return TransientRetry.withRetry(store.get(keys.stopKey()), settings, "stop signal read")
            .map(value -> value.isPresent());
    }

    public Mono<Void> signalStop(String reason) {
        return TransientRetry.withRetry(store.put(keys.stopKey(), reason), settings, "stop signal write");
    }
}
