package org.blockindex.migrations.pipeline.scan;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.blockindex.migrations.pipeline.TestSettings;
import org.blockindex.migrations.pipeline.checkpoint.CheckpointKeys;
import org.blockindex.migrations.pipeline.checkpoint.CursorCodec;
import org.blockindex.migrations.pipeline.checkpoint.InMemoryCheckpointStore;
import org.blockindex.migrations.pipeline.common.PipelineSettings;
import org.blockindex.migrations.pipeline.common.TransientStoreException;
import org.blockindex.migrations.pipeline.ir.ScanCursor;
import org.blockindex.migrations.pipeline.ir.ScanOutcome;
import org.blockindex.migrations.pipeline.ir.ScanPartition;
import org.blockindex.migrations.pipeline.ir.SourceRecord;
import org.blockindex.migrations.pipeline.queue.BatchDispatcher;
import org.blockindex.migrations.pipeline.queue.CollectingMessageQueue;
import org.blockindex.migrations.pipeline.queue.MessageCodec;
import org.blockindex.migrations.pipeline.source.SourceTable;
import org.blockindex.migrations.pipeline.source.SyntheticSourceTable;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class PartitionedScannerTest {

    private static final CheckpointKeys KEYS = CheckpointKeys.forStage("test");

    private final MessageCodec messageCodec = new MessageCodec();
    private final CursorCodec cursorCodec = new CursorCodec();
    private InMemoryCheckpointStore checkpointStore;
    private CollectingMessageQueue batchQueue;
    private RecordingContinuationScheduler scheduler;
    private PipelineSettings settings;

    @BeforeEach
    void setUp() {
        checkpointStore = new InMemoryCheckpointStore();
        batchQueue = new CollectingMessageQueue();
        scheduler = new RecordingContinuationScheduler();
        settings = TestSettings.fastRetries().toBuilder().scanPageSize(10).build();
    }

    private ScanCheckpoints checkpoints() {
        return new ScanCheckpoints(checkpointStore, KEYS, cursorCodec, settings);
    }

    private PartitionedScanner<String> scanner(SyntheticSourceTable source) {
        return new PartitionedScanner<>(
            source,
            SyntheticSourceTable::toSourceRecord,
            new BatchDispatcher(batchQueue, messageCodec, settings),
            checkpoints(),
            scheduler,
            settings);
    }

    private List<String> dispatchedKeys() {
        var keys = new ArrayList<String>();
        for (var message : batchQueue.getMessages()) {
            messageCodec.decodeBatch(message).stream().map(SourceRecord::key).forEach(keys::add);
        }
        return keys;
    }

    private ScanCursor persistedCursor(ScanPartition partition) {
        return cursorCodec.decode(partition, checkpointStore.peek(KEYS.cursorKey(partition)).orElseThrow());
    }

    @Test
    void scansAWholePartitionAndPersistsTheTerminalCursor() {
        var source = new SyntheticSourceTable(25);
        var partition = ScanPartition.unsharded();

        StepVerifier.create(scanner(source).scan(partition, RemainingTime.unbounded()))
            .assertNext(outcome -> {
                assertEquals(ScanOutcome.Status.EXHAUSTED, outcome.status());
                assertEquals(3, outcome.pagesFetched());
                assertEquals(25, outcome.recordsDispatched());
                assertTrue(outcome.cursor().exhausted());
            })
            .verifyComplete();

        assertEquals(3, batchQueue.getMessages().size());
        assertEquals(25, dispatchedKeys().size());
        assertEquals(3, checkpointStore.getWrites().size());
        var persisted = persistedCursor(partition);
        assertTrue(persisted.exhausted());
        assertNull(persisted.lastKey());
        assertEquals(25, persisted.recordsScanned());
    }

    @Test
    void reinvokingAnExhaustedPartitionFetchesNothing() {
        var source = new SyntheticSourceTable(5);
        var partition = ScanPartition.unsharded();
        scanner(source).scan(partition, RemainingTime.unbounded()).block();
        int fetchesBefore = source.getFetches().size();

        StepVerifier.create(scanner(source).scan(partition, RemainingTime.unbounded()))
            .assertNext(outcome -> {
                assertEquals(ScanOutcome.Status.EXHAUSTED, outcome.status());
                assertEquals(0, outcome.pagesFetched());
                assertEquals(5, outcome.cursor().recordsScanned());
            })
            .verifyComplete();

        assertEquals(fetchesBefore, source.getFetches().size());
    }

    @Test
    void partitionsOnlyReadTheirOwnSlice() {
        var source = new SyntheticSourceTable(30);
        var partitions = List.of(new ScanPartition(3, 0), new ScanPartition(3, 1), new ScanPartition(3, 2));

        for (var partition : partitions) {
            scanner(source).scan(partition, RemainingTime.unbounded()).block();
        }

        var keys = dispatchedKeys();
        assertEquals(30, keys.size());
        assertEquals(30, keys.stream().distinct().count());
        for (var partition : partitions) {
            assertEquals(10, persistedCursor(partition).recordsScanned());
        }
    }

    @Test
    void schedulesAContinuationWhenTheBudgetRunsLow() {
        var source = new SyntheticSourceTable(100);
        var partition = new ScanPartition(2, 1);
        var checks = new AtomicInteger();
        RemainingTime budget = () -> checks.incrementAndGet() < 2 ? Duration.ofMinutes(5) : Duration.ofSeconds(3);

        StepVerifier.create(scanner(source).scan(partition, budget))
            .assertNext(outcome -> {
                assertEquals(ScanOutcome.Status.CONTINUED, outcome.status());
                assertEquals(2, outcome.pagesFetched());
                assertEquals(20, outcome.recordsDispatched());
            })
            .verifyComplete();

        assertEquals(List.of(partition), scheduler.getScheduled());
        var persisted = persistedCursor(partition);
        assertFalse(persisted.exhausted());
        assertEquals(20, persisted.recordsScanned());
    }

    @Test
    void continuationResumesWhereThePreviousInvocationStopped() {
        var source = new SyntheticSourceTable(45);
        var partition = ScanPartition.unsharded();
        RemainingTime alwaysLow = () -> Duration.ofSeconds(1);

        int invocations = 0;
        ScanOutcome outcome;
        do {
            outcome = scanner(source).scan(partition, alwaysLow).block();
            invocations++;
            assertNotNull(outcome);
        } while (outcome.status() == ScanOutcome.Status.CONTINUED && invocations < 20);

        assertEquals(ScanOutcome.Status.EXHAUSTED, outcome.status());
        assertEquals(5, invocations);
        assertEquals(4, scheduler.getScheduled().size());
        var keys = dispatchedKeys();
        assertEquals(45, keys.size());
        assertEquals(45, keys.stream().distinct().count());
    }

    @Test
    void resumingAfterAFailureRevisitsNoPersistedPage() {
        var source = new SyntheticSourceTable(50)
            .failingAfter(2, new IllegalStateException("source unavailable"));
        var partition = ScanPartition.unsharded();

        StepVerifier.create(scanner(source).scan(partition, RemainingTime.unbounded()))
            .expectErrorMessage("source unavailable")
            .verify();

        var interrupted = persistedCursor(partition);
        assertEquals(20, interrupted.recordsScanned());
        assertEquals("20", interrupted.lastKey());

        StepVerifier.create(scanner(source).scan(partition, RemainingTime.unbounded()))
            .assertNext(outcome -> assertEquals(ScanOutcome.Status.EXHAUSTED, outcome.status()))
            .verifyComplete();

        var startKeys = source.getFetches().stream().map(SyntheticSourceTable.Fetch::startKey).toList();
        assertEquals(startKeys.size(), startKeys.stream().distinct().count());
        assertEquals(50, dispatchedKeys().stream().distinct().count());
        assertEquals(50, persistedCursor(partition).recordsScanned());
    }

    @Test
    void retriesTransientSourceFailures() {
        var source = new SyntheticSourceTable(15).failingAfter(1,
            new TransientStoreException("throttled", null),
            new TransientStoreException("throttled", null));

        StepVerifier.create(scanner(source).scan(ScanPartition.unsharded(), RemainingTime.unbounded()))
            .assertNext(outcome -> {
                assertEquals(ScanOutcome.Status.EXHAUSTED, outcome.status());
                assertEquals(15, outcome.recordsDispatched());
            })
            .verifyComplete();
    }

    @Test
    void exhaustedRetriesFailTheInvocationWithoutAdvancingTheCheckpoint() {
        var source = new SyntheticSourceTable(30).failingAfter(1,
            new TransientStoreException("throttled 1", null),
            new TransientStoreException("throttled 2", null),
            new TransientStoreException("throttled 3", null),
            new TransientStoreException("throttled 4", null));
        var partition = ScanPartition.unsharded();

        StepVerifier.create(scanner(source).scan(partition, RemainingTime.unbounded()))
            .expectErrorMatches(e -> e instanceof TransientStoreException && e.getMessage().equals("throttled 4"))
            .verify();

        assertEquals(10, persistedCursor(partition).recordsScanned());
    }

    @Test
    void stopSignalMeansNoFetchesAndUnchangedProgress() {
        var source = new SyntheticSourceTable(100);
        var partition = new ScanPartition(4, 2);
        var existing = ScanCursor.fresh(partition).advance("42", 10);
        checkpointStore.put(KEYS.cursorKey(partition), cursorCodec.encode(existing)).block();
        checkpointStore.put(KEYS.stopKey(), "any value").block();

        StepVerifier.create(scanner(source).scan(partition, RemainingTime.unbounded()))
            .assertNext(outcome -> {
                assertEquals(ScanOutcome.Status.STOPPED, outcome.status());
                assertEquals(0, outcome.pagesFetched());
                assertEquals(existing, outcome.cursor());
            })
            .verifyComplete();

        assertTrue(source.getFetches().isEmpty());
        assertEquals(existing, persistedCursor(partition));
        assertTrue(batchQueue.getMessages().isEmpty());
    }

    @Test
    void stopSignalIsObservedBetweenPages() {
        var partition = ScanPartition.unsharded();
        var source = new SyntheticSourceTable(100);
        var queueThatStops = new CollectingMessageQueue() {
            @Override
            public Mono<Void> send(String body) {
                return super.send(body).then(checkpointStore.put(KEYS.stopKey(), "stop"));
            }
        };
        var stoppingScanner = new PartitionedScanner<>(
            source,
            SyntheticSourceTable::toSourceRecord,
            new BatchDispatcher(queueThatStops, messageCodec, settings),
            checkpoints(),
            scheduler,
            settings);

        StepVerifier.create(stoppingScanner.scan(partition, RemainingTime.unbounded()))
            .assertNext(outcome -> {
                assertEquals(ScanOutcome.Status.STOPPED, outcome.status());
                assertEquals(1, outcome.pagesFetched());
            })
            .verifyComplete();

        assertEquals(10, persistedCursor(partition).recordsScanned());
        assertTrue(scheduler.getScheduled().isEmpty());
    }

    @Test
    void partitionStopRequestHaltsOnlyThatPartition() {
        var source = new SyntheticSourceTable(20);
        var stopped = new ScanPartition(2, 0);
        var running = new ScanPartition(2, 1);
        new ScanControl(checkpoints(), scheduler).requestPartitionStop(stopped).block();

        var stoppedOutcome = scanner(source).scan(stopped, RemainingTime.unbounded()).block();
        var runningOutcome = scanner(source).scan(running, RemainingTime.unbounded()).block();

        assertNotNull(stoppedOutcome);
        assertNotNull(runningOutcome);
        assertEquals(ScanOutcome.Status.STOPPED, stoppedOutcome.status());
        assertFalse(stoppedOutcome.cursor().exhausted());
        assertEquals(ScanOutcome.Status.EXHAUSTED, runningOutcome.status());
        assertTrue(source.getFetches().stream().noneMatch(f -> f.partition().equals(stopped)));
    }

    @Test
    void partitionStopRequestedMidScanSurvivesTheNextCheckpoint() {
        var partition = ScanPartition.unsharded();
        var source = new SyntheticSourceTable(100);
        var control = new ScanControl(checkpoints(), scheduler);
        var reads = new AtomicInteger();
        SourceTable<String> stoppedDuringSecondRead = (p, startKey, limit) -> source.readPage(p, startKey, limit)
            .doOnNext(page -> {
                if (reads.incrementAndGet() == 2) {
                    control.requestPartitionStop(p).block();
                }
            });
        var stoppingScanner = new PartitionedScanner<>(
            stoppedDuringSecondRead,
            SyntheticSourceTable::toSourceRecord,
            new BatchDispatcher(batchQueue, messageCodec, settings),
            checkpoints(),
            scheduler,
            settings);

        StepVerifier.create(stoppingScanner.scan(partition, RemainingTime.unbounded()))
            .assertNext(outcome -> {
                assertEquals(ScanOutcome.Status.STOPPED, outcome.status());
                assertEquals(2, outcome.pagesFetched());
                assertTrue(outcome.cursor().stopRequested());
            })
            .verifyComplete();

        var persisted = persistedCursor(partition);
        assertTrue(persisted.stopRequested());
        assertEquals(20, persisted.recordsScanned());
        assertEquals("20", persisted.lastKey());
        assertTrue(scheduler.getScheduled().isEmpty());

        int fetchesBefore = source.getFetches().size();
        StepVerifier.create(scanner(source).scan(partition, RemainingTime.unbounded()))
            .assertNext(outcome -> assertEquals(ScanOutcome.Status.STOPPED, outcome.status()))
            .verifyComplete();
        assertEquals(fetchesBefore, source.getFetches().size());
    }

    @Test
    void emptyPagesAreCheckpointedWithoutDispatching() {
        var source = new SyntheticSourceTable(0);
        var partition = ScanPartition.unsharded();

        StepVerifier.create(scanner(source).scan(partition, RemainingTime.unbounded()))
            .assertNext(outcome -> {
                assertEquals(ScanOutcome.Status.EXHAUSTED, outcome.status());
                assertEquals(1, outcome.pagesFetched());
                assertEquals(0, outcome.recordsDispatched());
            })
            .verifyComplete();

        assertTrue(batchQueue.getMessages().isEmpty());
        assertTrue(persistedCursor(partition).exhausted());
    }
}
