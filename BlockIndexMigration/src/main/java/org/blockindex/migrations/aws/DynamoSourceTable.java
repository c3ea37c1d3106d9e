package org.blockindex.migrations.aws;

import java.util.List;
import java.util.Map;

import org.blockindex.migrations.pipeline.ir.ScanPartition;
import org.blockindex.migrations.pipeline.ir.SourcePage;
import org.blockindex.migrations.pipeline.source.SourceTable;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;

/**
 * Reads the legacy blocks table with DynamoDB parallel scan, one segment per partition.
 */
@Slf4j
public class DynamoSourceTable implements SourceTable<Map<String, AttributeValue>> {
    private final DynamoDbAsyncClient client;
    private final String tableName;

    public DynamoSourceTable(DynamoDbAsyncClient client, String tableName) {
        this.client = client;
        this.tableName = tableName;
    }

    @Override
    public Mono<SourcePage<Map<String, AttributeValue>>> readPage(ScanPartition partition,
                                                                  String exclusiveStartKey,
                                                                  int limit) {
        var request = ScanRequest.builder()
            .tableName(tableName)
            .totalSegments(partition.totalPartitions())
            .segment(partition.partitionId())
            .limit(limit);
        if (exclusiveStartKey != null) {
            request.exclusiveStartKey(AttributeValueJson.decodeKey(exclusiveStartKey));
        }

        return Mono.fromFuture(() -> client.scan(request.build()))
            .map(response -> {
                List<Map<String, AttributeValue>> items = response.hasItems() ? response.items() : List.of();
                if (!response.hasItems()) {
                    log.warn("Scan of {} partition {} returned no items container", tableName, partition);
                }
                var nextKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                    ? AttributeValueJson.encodeKey(response.lastEvaluatedKey())
                    : null;
                log.debug("Scanned {} items from {} partition {}", items.size(), tableName, partition);
                return new SourcePage<>(items, nextKey);
            })
            .onErrorMap(AwsErrors::isTransient, e -> AwsErrors.asTransient("Scan of " + tableName, e));
    }
}
