package org.blockindex.migrations.pipeline.source;

import org.blockindex.migrations.pipeline.ir.ScanPartition;
import org.blockindex.migrations.pipeline.ir.SourcePage;

import reactor.core.publisher.Mono;

/**
 * Port for paginated reads of one partition of the legacy table.
 *
 * @param <T> the raw item type the store returns, mapped to a SourceRecord by the scanner
 */
public interface SourceTable<T> {

    /**
     * Read one page of the partition, starting after {@code exclusiveStartKey} (null for the first page).
     * Returns a cold Mono: subscription triggers the read, so resubscribing retries it.
     */
    Mono<SourcePage<T>> readPage(ScanPartition partition, String exclusiveStartKey, int limit);
}
