package org.blockindex.migrations.pipeline.scan;

import java.util.List;
import java.util.function.Function;

import org.blockindex.migrations.pipeline.common.PipelineSettings;
import org.blockindex.migrations.pipeline.common.TransientRetry;
import org.blockindex.migrations.pipeline.ir.ScanCursor;
import org.blockindex.migrations.pipeline.ir.ScanOutcome;
import org.blockindex.migrations.pipeline.ir.ScanPartition;
import org.blockindex.migrations.pipeline.ir.SourcePage;
import org.blockindex.migrations.pipeline.ir.SourceRecord;
import org.blockindex.migrations.pipeline.queue.BatchDispatcher;
import org.blockindex.migrations.pipeline.source.SourceTable;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Scans one partition of the source table page by page, sending each page to the batch queue and
 * checkpointing after it, for as long as the invocation's time budget allows.
 *
 * Each page is fetched, dispatched and checkpointed before the next one is fetched. The checkpoint is
 * written only after the page's batch was sent, so an interrupted invocation loses at most the page in
 * flight, which the next invocation sends again. When the budget runs low the scanner schedules a
 * continuation that resumes from the persisted cursor. Stopping is cooperative: the stop signal and the
 * partition's own stop request are checked before the first page and again after every page.
 *
 * @param <T> the raw item type of the source table
 */
@Slf4j
public class PartitionedScanner<T> {
    private final SourceTable<T> sourceTable;
    private final Function<T, SourceRecord> itemTransform;
    private final BatchDispatcher dispatcher;
    private final ScanCheckpoints checkpoints;
    private final ContinuationScheduler continuations;
    private final PipelineSettings settings;

    public PartitionedScanner(SourceTable<T> sourceTable,
                              Function<T, SourceRecord> itemTransform,
                              BatchDispatcher dispatcher,
                              ScanCheckpoints checkpoints,
                              ContinuationScheduler continuations,
                              PipelineSettings settings) {
        this.sourceTable = sourceTable;
        this.itemTransform = itemTransform;
        this.dispatcher = dispatcher;
        this.checkpoints = checkpoints;
        this.continuations = continuations;
        this.settings = settings;
    }

    /** Progress of the current invocation; status is null while pages remain to be read. */
    private record Step(ScanCursor cursor, int pages, long records, ScanOutcome.Status status) {
        boolean isFinal() {
            return status != null;
        }

        ScanOutcome toOutcome() {
            return new ScanOutcome(status, cursor, pages, records);
        }
    }

    public Mono<ScanOutcome> scan(ScanPartition partition, RemainingTime remainingTime) {
        return checkpoints.load(partition)
            .doOnNext(cursor -> log.info("Scanning partition {} from {} records scanned", partition,
                cursor.recordsScanned()))
            .flatMap(cursor -> {
                if (cursor.stopRequested()) {
                    log.info("Stop requested for partition {}, not scanning", partition);
                    return Mono.just(new ScanOutcome(ScanOutcome.Status.STOPPED, cursor, 0, 0));
                }
                return checkpoints.isStopSignalled().flatMap(stopped -> {
                    if (stopped) {
                        log.info("Stop signal present, not scanning partition {}", partition);
                        return Mono.just(new ScanOutcome(ScanOutcome.Status.STOPPED, cursor, 0, 0));
                    }
                    if (cursor.exhausted()) {
                        log.info("Partition {} already complete with {} records", partition,
                            cursor.recordsScanned());
                        return Mono.just(new ScanOutcome(ScanOutcome.Status.EXHAUSTED, cursor, 0, 0));
                    }
                    return scanPages(cursor, remainingTime);
                });
            });
    }

    private Mono<ScanOutcome> scanPages(ScanCursor start, RemainingTime remainingTime) {
        var partition = start.partition();
        return Mono.just(new Step(start, 0, 0, null))
            .expand(step -> step.isFinal() ? Mono.empty() : nextPage(step, remainingTime))
            .last()
            .flatMap(step -> {
                if (step.status() != ScanOutcome.Status.CONTINUED) {
                    return Mono.just(step);
                }
                return continuations.schedule(partition).thenReturn(step);
            })
            .map(Step::toOutcome)
            .doOnNext(outcome -> log.info("Partition {} {} after {} pages, {} records this invocation, {} in total",
                partition, outcome.status(), outcome.pagesFetched(), outcome.recordsDispatched(),
                outcome.cursor().recordsScanned()));
    }

    private Mono<Step> nextPage(Step step, RemainingTime remainingTime) {
        var cursor = step.cursor();
        return TransientRetry.withRetry(
                sourceTable.readPage(cursor.partition(), cursor.lastKey(), settings.getScanPageSize()),
                settings, "source scan")
            .flatMap(page -> dispatch(page).thenReturn(page))
            .flatMap(page -> checkpoints.save(cursor.advance(page.nextKey(), page.items().size()))
                .map(saved -> new Step(saved, step.pages() + 1, step.records() + page.items().size(), null)))
            .flatMap(next -> decide(next, remainingTime));
    }

    private Mono<Integer> dispatch(SourcePage<T> page) {
        if (page.items().isEmpty()) {
            log.debug("Empty page, nothing to dispatch");
            return Mono.just(0);
        }
        return Mono.fromCallable(() -> transform(page.items()))
            .flatMap(dispatcher::dispatch);
    }

    private List<SourceRecord> transform(List<T> items) {
        return items.stream().map(itemTransform).toList();
    }

    private Mono<Step> decide(Step next, RemainingTime remainingTime) {
        if (next.cursor().exhausted()) {
            return Mono.just(withStatus(next, ScanOutcome.Status.EXHAUSTED));
        }
        if (next.cursor().stopRequested()) {
            log.info("Stop requested for partition {} during scan", next.cursor().partition());
            return Mono.just(withStatus(next, ScanOutcome.Status.STOPPED));
        }
        return checkpoints.isStopSignalled().map(stopped -> {
            if (stopped) {
                log.info("Stop signal seen during scan of partition {}", next.cursor().partition());
                return withStatus(next, ScanOutcome.Status.STOPPED);
            }
            var remaining = remainingTime.remaining();
            if (remaining.compareTo(settings.getMinRemainingTime()) < 0) {
                log.info("Continuing partition {} in a new invocation, {}ms remain",
                    next.cursor().partition(), remaining.toMillis());
                return withStatus(next, ScanOutcome.Status.CONTINUED);
            }
            return next;
        });
    }

    private static Step withStatus(Step step, ScanOutcome.Status status) {
        return new Step(step.cursor(), step.pages(), step.records(), status);
    }
}
