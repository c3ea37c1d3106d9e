package org.blockindex.migrations.pipeline.scan;

import org.blockindex.migrations.pipeline.ir.ScanCursor;
import org.blockindex.migrations.pipeline.ir.ScanPartition;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Operator actions on a running migration: starting an N-way scan, stopping it, and checking progress.
 */
@Slf4j
@RequiredArgsConstructor
public class ScanControl {
    private final ScanCheckpoints checkpoints;
    private final ContinuationScheduler scheduler;

    /**
     * Schedules the first invocation of every partition of an N-way scan. Emits the number scheduled.
     */
    public Mono<Integer> launch(int totalPartitions) {
        if (totalPartitions < 1) {
            return Mono.error(new IllegalArgumentException("totalPartitions must be >= 1, was " + totalPartitions));
        }
        return Flux.range(0, totalPartitions)
            .map(partitionId -> new ScanPartition(totalPartitions, partitionId))
            .concatMap(partition -> scheduler.schedule(partition).thenReturn(partition))
            .count()
            .map(Long::intValue)
            .doOnNext(count -> log.info("Launched {} scan partitions", count));
    }

    /** Halts every partition at its next check. */
    public Mono<Void> requestStop() {
        return checkpoints.signalStop("stop")
            .doOnSuccess(unused -> log.info("Stop signal set"));
    }

    /** Halts one partition after the page it is scanning, or at its next invocation, keeping its progress. */
    public Mono<ScanCursor> requestPartitionStop(ScanPartition partition) {
        return checkpoints.load(partition)
            .map(ScanCursor::withStopRequested)
            .flatMap(checkpoints::save)
            .doOnNext(cursor -> log.info("Stop requested for partition {}", partition));
    }

    public Mono<ScanCursor> progress(ScanPartition partition) {
        return checkpoints.load(partition);
    }
}
