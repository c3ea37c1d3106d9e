package org.blockindex.migrations.aws;

import java.util.List;
import java.util.Map;

import org.blockindex.migrations.pipeline.ir.DestinationKey;
import org.blockindex.migrations.pipeline.ir.DestinationRecord;
import org.blockindex.migrations.pipeline.ir.ExistenceResponse;
import org.blockindex.migrations.pipeline.sink.DestinationStore;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.BatchGetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.KeysAndAttributes;
import software.amazon.awssdk.services.dynamodb.model.PutRequest;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * The blocks cars position table, through BatchGetItem and BatchWriteItem.
 */
@Slf4j
public class DynamoDestinationStore implements DestinationStore {
    private static final String KEY_PROJECTION =
        BlockIndexItems.BLOCK_MULTIHASH + ", " + BlockIndexItems.CAR_PATH;

    private final DynamoDbAsyncClient client;
    private final String tableName;

    public DynamoDestinationStore(DynamoDbAsyncClient client, String tableName) {
        this.client = client;
        this.tableName = tableName;
    }

    @Override
    public Mono<ExistenceResponse> batchGet(List<DestinationKey> keys) {
        var request = BatchGetItemRequest.builder()
            .requestItems(Map.of(tableName, KeysAndAttributes.builder()
                .keys(keys.stream().map(BlockIndexItems::toKey).toList())
                .projectionExpression(KEY_PROJECTION)
                .build()))
            .build();

        return Mono.fromFuture(() -> client.batchGetItem(request))
            .map(response -> {
                if (!response.hasResponses()) {
                    return ExistenceResponse.malformed();
                }
                if (response.hasUnprocessedKeys() && !response.unprocessedKeys().isEmpty()) {
                    log.debug("BatchGetItem left keys unprocessed on {}, treating them as missing", tableName);
                }
                // no entry for the table when every key was deferred to UnprocessedKeys
                return new ExistenceResponse(response.responses().getOrDefault(tableName, List.of()).stream()
                    .map(BlockIndexItems::toDestinationKey)
                    .toList());
            })
            .onErrorMap(AwsErrors::isTransient, e -> AwsErrors.asTransient("BatchGetItem on " + tableName, e));
    }

    @Override
    public Mono<List<DestinationRecord>> batchPut(List<DestinationRecord> records) {
        var request = BatchWriteItemRequest.builder()
            .requestItems(Map.of(tableName, records.stream()
                .map(record -> WriteRequest.builder()
                    .putRequest(PutRequest.builder().item(BlockIndexItems.toItem(record)).build())
                    .build())
                .toList()))
            .build();

        return Mono.fromFuture(() -> client.batchWriteItem(request))
            .map(response -> {
                if (!response.hasUnprocessedItems()) {
                    return List.<DestinationRecord>of();
                }
                return response.unprocessedItems().getOrDefault(tableName, List.of()).stream()
                    .filter(write -> write.putRequest() != null)
                    .map(write -> BlockIndexItems.toDestinationRecord(write.putRequest().item()))
                    .toList();
            })
            .onErrorMap(AwsErrors::isTransient, e -> AwsErrors.asTransient("BatchWriteItem on " + tableName, e));
    }
}
