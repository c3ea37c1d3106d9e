package org.blockindex.migrations.pipeline.scan;

import org.blockindex.migrations.pipeline.ir.ScanPartition;

import reactor.core.publisher.Mono;

/**
 * Schedules a fresh scanner invocation for a partition. Fire-and-forget: completion means the work item
 * was accepted, not that it ran.
 */
public interface ContinuationScheduler {
    Mono<Void> schedule(ScanPartition partition);
}
