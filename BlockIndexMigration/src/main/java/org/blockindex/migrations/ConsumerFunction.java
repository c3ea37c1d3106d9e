package org.blockindex.migrations;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.blockindex.migrations.aws.AwsClients;
import org.blockindex.migrations.aws.DynamoDestinationStore;
import org.blockindex.migrations.aws.SqsMessageQueue;
import org.blockindex.migrations.pipeline.BatchWriter;
import org.blockindex.migrations.pipeline.ConsumerPipeline;
import org.blockindex.migrations.pipeline.ExistenceFilter;
import org.blockindex.migrations.pipeline.RecordTransformer;
import org.blockindex.migrations.pipeline.ir.MigrationTally;
import org.blockindex.migrations.pipeline.queue.MessageCodec;
import org.blockindex.migrations.pipeline.queue.UnprocessedSink;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Entry point for queue deliveries. Messages are migrated one after another; a message that fails is
 * logged and reported by id so the queue redelivers only that one.
 */
@Slf4j
public class ConsumerFunction {
    private final ConsumerPipeline pipeline;

    ConsumerFunction(ConsumerPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public static ConsumerFunction create(MigrationConfig config, AwsClients clients) {
        var settings = config.getSettings();
        var codec = new MessageCodec();
        var store = new DynamoDestinationStore(clients.dynamoDb(), config.getDestinationTable());
        var unprocessedSink = new UnprocessedSink(
            new SqsMessageQueue(clients.sqs(), config.getUnprocessedQueueUrl()),
            codec,
            settings,
            config.getDestinationTable());
        return new ConsumerFunction(new ConsumerPipeline(
            new RecordTransformer(),
            new ExistenceFilter(store, settings.getReadBatchSize()),
            new BatchWriter(store, settings.getWriteBatchSize()),
            unprocessedSink,
            codec,
            settings));
    }

    /** Batch queue messages. */
    public ConsumerResponse handle(List<QueueMessage> messages) {
        return run(messages, pipeline::process, "migrate");
    }

    /** Unprocessed-writes queue messages. */
    public ConsumerResponse redrive(List<QueueMessage> messages) {
        return run(messages, pipeline::redrive, "redrive");
    }

    private ConsumerResponse run(List<QueueMessage> messages,
                                 Function<String, Mono<MigrationTally>> action,
                                 String actionName) {
        var failed = new ArrayList<String>();
        var tally = Flux.fromIterable(messages)
            .concatMap(message -> action.apply(message.body())
                .onErrorResume(e -> {
                    log.atError()
                        .setMessage("Failed to {} message {}")
                        .addArgument(actionName)
                        .addArgument(message.messageId())
                        .setCause(e)
                        .log();
                    failed.add(message.messageId());
                    return Mono.empty();
                }))
            .reduce(MigrationTally.EMPTY, MigrationTally::plus)
            .block();
        log.info("Finished {} of {} messages, {} failed: {}", actionName, messages.size(), failed.size(), tally);
        return new ConsumerResponse(tally, List.copyOf(failed));
    }
}
