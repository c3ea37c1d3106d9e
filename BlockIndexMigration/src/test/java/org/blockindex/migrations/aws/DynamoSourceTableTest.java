package org.blockindex.migrations.aws;

import java.util.ArrayList;
import java.util.List;

import org.blockindex.migrations.pipeline.common.TransientStoreException;
import org.blockindex.migrations.pipeline.ir.Position;
import org.blockindex.migrations.pipeline.ir.ScanPartition;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

import static org.blockindex.migrations.aws.FakeDynamoDb.blockItem;
import static org.junit.jupiter.api.Assertions.*;

class DynamoSourceTableTest {

    private static final String TABLE = "blocks";

    private FakeDynamoDb tableWith(int items) {
        var dynamo = new FakeDynamoDb(TABLE, "unused");
        for (int i = 0; i < items; i++) {
            dynamo.withSourceItem(blockItem("hash-" + i, new Position(0, 10, "car-" + i)));
        }
        return dynamo;
    }

    @Test
    void pagesThroughOnePartitionWithContinuationKeys() {
        var dynamo = tableWith(5);
        var source = new DynamoSourceTable(dynamo, TABLE);
        var partition = ScanPartition.unsharded();

        var first = source.readPage(partition, null, 2).block();
        assertEquals(2, first.items().size());
        assertEquals("{\"multihash\":{\"S\":\"hash-1\"}}", first.nextKey());

        var second = source.readPage(partition, first.nextKey(), 2).block();
        assertEquals("hash-2", second.items().get(0).get("multihash").s());

        var last = source.readPage(partition, second.nextKey(), 2).block();
        assertEquals(1, last.items().size());
        assertTrue(last.isLast());

        var request = dynamo.getScanRequests().get(1);
        assertEquals(TABLE, request.tableName());
        assertEquals(2, request.limit());
        assertEquals("hash-1", request.exclusiveStartKey().get("multihash").s());
        assertFalse(dynamo.getScanRequests().get(0).hasExclusiveStartKey());
    }

    @Test
    void scansOnlyItsSegment() {
        var dynamo = tableWith(6);
        var source = new DynamoSourceTable(dynamo, TABLE);

        var page = source.readPage(new ScanPartition(3, 1), null, 10).block();

        var hashes = new ArrayList<String>();
        page.items().forEach(item -> hashes.add(item.get("multihash").s()));
        assertEquals(List.of("hash-1", "hash-4"), hashes);
        assertEquals(3, dynamo.getScanRequests().get(0).totalSegments());
        assertEquals(1, dynamo.getScanRequests().get(0).segment());
    }

    @Test
    void mapsRetryableFailuresToTransientStoreException() {
        var dynamo = tableWith(1).failingWith(SdkClientException.create("connection reset"));

        StepVerifier.create(new DynamoSourceTable(dynamo, TABLE).readPage(ScanPartition.unsharded(), null, 10))
            .expectError(TransientStoreException.class)
            .verify();
    }

    @Test
    void passesThroughPermanentFailures() {
        var dynamo = tableWith(1).failingWith(ResourceNotFoundException.builder()
            .statusCode(400).message("Requested resource not found").build());

        StepVerifier.create(new DynamoSourceTable(dynamo, TABLE).readPage(ScanPartition.unsharded(), null, 10))
            .expectError(ResourceNotFoundException.class)
            .verify();
    }
}
