package org.blockindex.migrations.pipeline.sink;

import java.util.List;

import org.blockindex.migrations.pipeline.ir.DestinationKey;
import org.blockindex.migrations.pipeline.ir.DestinationRecord;
import org.blockindex.migrations.pipeline.ir.ExistenceResponse;

import reactor.core.publisher.Mono;

/**
 * Port for the destination table's batch operations.
 *
 * Both calls reject a request carrying the same primary key twice, like DynamoDB does.
 */
public interface DestinationStore {

    /** Look up which of the keys already exist. Keys left out of the response count as not found. */
    Mono<ExistenceResponse> batchGet(List<DestinationKey> keys);

    /** Put every record. Emits the records the store did not commit. */
    Mono<List<DestinationRecord>> batchPut(List<DestinationRecord> records);
}
