package org.blockindex.migrations.pipeline.ir;

/**
 * Counters reported by the consumer for one message, or summed over several.
 *
 * {@code writeCount + unprocessedCount} is the number of items submitted to the destination table.
 */
public record MigrationTally(
    long itemCount,
    long writeCount,
    long unprocessedCount
) {
    public static final MigrationTally EMPTY = new MigrationTally(0, 0, 0);

    public MigrationTally plus(MigrationTally other) {
        return new MigrationTally(
            itemCount + other.itemCount,
            writeCount + other.writeCount,
            unprocessedCount + other.unprocessedCount);
    }
}
