package org.blockindex.migrations;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.blockindex.migrations.aws.AwsClients;
import org.blockindex.migrations.aws.BlockIndexItems;
import org.blockindex.migrations.aws.DynamoSourceTable;
import org.blockindex.migrations.aws.LambdaContinuationScheduler;
import org.blockindex.migrations.aws.SqsMessageQueue;
import org.blockindex.migrations.aws.SsmCheckpointStore;
import org.blockindex.migrations.pipeline.checkpoint.CheckpointKeys;
import org.blockindex.migrations.pipeline.checkpoint.CursorCodec;
import org.blockindex.migrations.pipeline.queue.BatchDispatcher;
import org.blockindex.migrations.pipeline.queue.MessageCodec;
import org.blockindex.migrations.pipeline.scan.PartitionedScanner;
import org.blockindex.migrations.pipeline.scan.RemainingTime;
import org.blockindex.migrations.pipeline.scan.ScanCheckpoints;
import org.blockindex.migrations.pipeline.scan.ScanControl;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Entry point of one scanner invocation: scans the requested partition of the blocks table until it is
 * done, stopped, or out of time.
 */
@Slf4j
public class ScannerFunction {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final PartitionedScanner<Map<String, AttributeValue>> scanner;
    private final ScanControl control;

    ScannerFunction(PartitionedScanner<Map<String, AttributeValue>> scanner, ScanControl control) {
        this.scanner = scanner;
        this.control = control;
    }

    public static ScannerFunction create(MigrationConfig config, AwsClients clients) {
        var settings = config.getSettings();
        var checkpoints = new ScanCheckpoints(
            new SsmCheckpointStore(clients.ssm()),
            CheckpointKeys.forStage(config.getStage()),
            new CursorCodec(),
            settings);
        var continuations = new LambdaContinuationScheduler(clients.lambda(), config.requireScannerFunctionName());
        var scanner = new PartitionedScanner<>(
            new DynamoSourceTable(clients.dynamoDb(), config.getSourceTable()),
            BlockIndexItems::toSourceRecord,
            new BatchDispatcher(new SqsMessageQueue(clients.sqs(), config.getBatchQueueUrl()), new MessageCodec(),
                settings),
            checkpoints,
            continuations,
            settings);
        return new ScannerFunction(scanner, new ScanControl(checkpoints, continuations));
    }

    public ScanResponse handle(ScanRequest request, RemainingTime remainingTime) {
        var partition = request.toPartition();
        log.info("Scanner invoked for partition {}", partition);
        var outcome = scanner.scan(partition, remainingTime).block();
        return ScanResponse.of(outcome);
    }

    /** Raw JSON in, raw JSON out, for runtimes that hand over the payload as a string. */
    public String handle(String payload, RemainingTime remainingTime) throws JsonProcessingException {
        var response = handle(ScanRequest.fromJson(payload), remainingTime);
        return objectMapper.writeValueAsString(response);
    }

    public ScanControl control() {
        return control;
    }
}
