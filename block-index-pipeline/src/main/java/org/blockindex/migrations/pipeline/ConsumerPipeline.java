package org.blockindex.migrations.pipeline;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.blockindex.migrations.pipeline.common.PipelineSettings;
import org.blockindex.migrations.pipeline.ir.DestinationRecord;
import org.blockindex.migrations.pipeline.ir.MigrationTally;
import org.blockindex.migrations.pipeline.ir.SourceRecord;
import org.blockindex.migrations.pipeline.ir.UnprocessedWrite;
import org.blockindex.migrations.pipeline.ir.WriteResult;
import org.blockindex.migrations.pipeline.queue.MessageCodec;
import org.blockindex.migrations.pipeline.queue.UnprocessedSink;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Migrates the records of one batch queue message: transform, drop what already exists, write the rest,
 * forward whatever the destination did not commit.
 *
 * Everything in a message is processed sequentially so each call to the destination table stays within
 * its batch limits. Many pipelines may run at once on different messages; they share nothing but the
 * destination table, where idempotent puts keyed by primary key make duplicate work harmless.
 */
@Slf4j
public class ConsumerPipeline {
    private final RecordTransformer transformer;
    private final ExistenceFilter existenceFilter;
    private final BatchWriter batchWriter;
    private final UnprocessedSink unprocessedSink;
    private final MessageCodec codec;
    private final PipelineSettings settings;

    public ConsumerPipeline(RecordTransformer transformer,
                            ExistenceFilter existenceFilter,
                            BatchWriter batchWriter,
                            UnprocessedSink unprocessedSink,
                            MessageCodec codec,
                            PipelineSettings settings) {
        this.transformer = transformer;
        this.existenceFilter = existenceFilter;
        this.batchWriter = batchWriter;
        this.unprocessedSink = unprocessedSink;
        this.codec = codec;
        this.settings = settings;
    }

    /**
     * Parse and migrate one batch queue message. A body that fails validation errors with
     * MalformedMessageException before anything is written.
     */
    public Mono<MigrationTally> process(String messageBody) {
        return Mono.fromCallable(() -> codec.decodeBatch(messageBody))
            .flatMap(this::migrate);
    }

    public Mono<MigrationTally> migrate(List<SourceRecord> records) {
        return Mono.defer(() -> {
            var counters = new Counters();
            return Flux.fromIterable(records)
                .concatMapIterable(transformer::transform)
                .buffer(settings.getReadBatchSize())
                .doOnNext(candidates -> counters.items.addAndGet(candidates.size()))
                .concatMap(existenceFilter::filterMissing)
                .buffer(settings.getWriteBatchSize())
                .concatMap(batch -> writeAndForward(batch, counters))
                .then(Mono.fromSupplier(counters::toTally))
                .doOnNext(tally -> log.info("Migrated {} records: {}", records.size(), tally));
        });
    }

    /**
     * Retry put requests from an unprocessed-writes message. Anything still not committed goes back to the
     * unprocessed-writes queue.
     */
    public Mono<MigrationTally> redrive(String unprocessedMessageBody) {
        return Mono.fromCallable(() -> codec.decodeUnprocessed(unprocessedMessageBody))
            .flatMap(writes -> {
                var counters = new Counters();
                return Flux.fromIterable(writes)
                    .map(UnprocessedWrite::putRequest)
                    .doOnNext(record -> counters.items.incrementAndGet())
                    .buffer(settings.getWriteBatchSize())
                    .concatMap(batch -> writeAndForward(batch, counters))
                    .then(Mono.fromSupplier(counters::toTally));
            })
            .doOnNext(tally -> log.info("Redrove unprocessed writes: {}", tally));
    }

    private Mono<WriteResult> writeAndForward(List<DestinationRecord> batch, Counters counters) {
        return batchWriter.write(batch)
            .flatMap(result -> {
                counters.written.addAndGet(result.committed());
                counters.unprocessed.addAndGet(result.unprocessed().size());
                return unprocessedSink.forward(result.unprocessed()).thenReturn(result);
            });
    }

    private static class Counters {
        final AtomicLong items = new AtomicLong();
        final AtomicLong written = new AtomicLong();
        final AtomicLong unprocessed = new AtomicLong();

        MigrationTally toTally() {
            return new MigrationTally(items.get(), written.get(), unprocessed.get());
        }
    }
}
