package org.blockindex.migrations.pipeline.source;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.blockindex.migrations.pipeline.ir.Position;
import org.blockindex.migrations.pipeline.ir.ScanPartition;
import org.blockindex.migrations.pipeline.ir.SourcePage;
import org.blockindex.migrations.pipeline.ir.SourceRecord;

import reactor.core.publisher.Mono;

/**
 * A source table of generated multihashes {@code hash-0 .. hash-(n-1)}. Item i belongs to partition
 * {@code i % totalPartitions}; the continuation token is the index of the next item to read.
 */
public class SyntheticSourceTable implements SourceTable<String> {

    public record Fetch(ScanPartition partition, String startKey) {}

    private final int totalItems;
    private final List<Fetch> fetches = new CopyOnWriteArrayList<>();
    private final Deque<RuntimeException> failures = new ArrayDeque<>();
    private int failAfterFetches = -1;

    public SyntheticSourceTable(int totalItems) {
        this.totalItems = totalItems;
    }

    /** The next reads after {@code successfulFetches} more successful ones fail with these errors, in order. */
    public synchronized SyntheticSourceTable failingAfter(int successfulFetches, RuntimeException... errors) {
        this.failAfterFetches = fetches.size() + successfulFetches;
        Collections.addAll(failures, errors);
        return this;
    }

    @Override
    public Mono<SourcePage<String>> readPage(ScanPartition partition, String exclusiveStartKey, int limit) {
        return Mono.fromCallable(() -> read(partition, exclusiveStartKey, limit));
    }

    private synchronized SourcePage<String> read(ScanPartition partition, String exclusiveStartKey, int limit) {
        if (failAfterFetches >= 0 && fetches.size() >= failAfterFetches && !failures.isEmpty()) {
            throw failures.poll();
        }
        fetches.add(new Fetch(partition, exclusiveStartKey));

        int index = exclusiveStartKey == null ? partition.partitionId() : Integer.parseInt(exclusiveStartKey);
        var items = new ArrayList<String>();
        while (index < totalItems && items.size() < limit) {
            items.add("hash-" + index);
            index += partition.totalPartitions();
        }
        return new SourcePage<>(items, index < totalItems ? Integer.toString(index) : null);
    }

    public List<Fetch> getFetches() {
        return Collections.unmodifiableList(fetches);
    }

    public static SourceRecord toSourceRecord(String multihash) {
        return SourceRecord.of(multihash, List.of(new Position(0, 10, "car-" + multihash)));
    }
}
