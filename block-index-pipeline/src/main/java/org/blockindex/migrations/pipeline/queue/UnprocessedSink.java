package org.blockindex.migrations.pipeline.queue;

import java.util.List;

import org.blockindex.migrations.pipeline.common.PipelineSettings;
import org.blockindex.migrations.pipeline.common.TransientRetry;
import org.blockindex.migrations.pipeline.ir.DestinationRecord;
import org.blockindex.migrations.pipeline.ir.UnprocessedWrite;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Forwards put requests the destination table did not commit to the unprocessed-writes queue. This
 * queue is separate from the batch queue's dead-letter queue.
 */
@Slf4j
public class UnprocessedSink {
    private final MessageQueue queue;
    private final MessageCodec codec;
    private final PipelineSettings settings;
    private final String tableName;

    public UnprocessedSink(MessageQueue queue, MessageCodec codec, PipelineSettings settings, String tableName) {
        this.queue = queue;
        this.codec = codec;
        this.settings = settings;
        this.tableName = tableName;
    }

    public Mono<Void> forward(List<DestinationRecord> unprocessed) {
        if (unprocessed.isEmpty()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> codec.encodeUnprocessed(unprocessed.stream()
                .map(record -> new UnprocessedWrite(tableName, record))
                .toList()))
            .doOnNext(body -> log.warn("Forwarding {} unprocessed writes for {}", unprocessed.size(), tableName))
            .flatMap(body -> TransientRetry.withRetry(queue.send(body), settings, "unprocessed send"));
    }
}
