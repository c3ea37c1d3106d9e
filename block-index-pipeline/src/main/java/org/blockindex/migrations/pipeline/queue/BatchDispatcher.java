package org.blockindex.migrations.pipeline.queue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.blockindex.migrations.pipeline.common.PipelineSettings;
import org.blockindex.migrations.pipeline.common.TransientRetry;
import org.blockindex.migrations.pipeline.ir.SourceRecord;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Sends a page of source records to the batch queue as one message, or as several when the serialized
 * batch would not fit in a single message.
 */
@Slf4j
@RequiredArgsConstructor
public class BatchDispatcher {
    private final MessageQueue queue;
    private final MessageCodec codec;
    private final PipelineSettings settings;

    /**
     * Emits the number of messages sent.
     */
    public Mono<Integer> dispatch(List<SourceRecord> records) {
        if (records.isEmpty()) {
            return Mono.just(0);
        }
        return Mono.fromCallable(() -> split(records))
            .flatMapMany(Flux::fromIterable)
            .concatMap(body -> TransientRetry.withRetry(queue.send(body), settings, "batch send").thenReturn(1))
            .reduce(0, Integer::sum);
    }

    private List<String> split(List<SourceRecord> records) {
        var body = codec.encodeBatch(records);
        int bytes = body.getBytes(StandardCharsets.UTF_8).length;
        if (bytes <= settings.getMaxMessageBytes()) {
            log.debug("Sending batch of {} with size {}", records.size(), bytes);
            return List.of(body);
        }
        if (records.size() == 1) {
            throw new IllegalArgumentException("Record " + records.get(0).key() + " serializes to " + bytes
                + " bytes, over the " + settings.getMaxMessageBytes() + " byte message limit");
        }
        log.debug("Batch of {} is {} bytes, splitting", records.size(), bytes);
        int half = records.size() / 2;
        var bodies = new ArrayList<>(split(records.subList(0, half)));
        bodies.addAll(split(records.subList(half, records.size())));
        return bodies;
    }
}
