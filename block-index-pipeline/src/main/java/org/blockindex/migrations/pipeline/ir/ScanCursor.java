package org.blockindex.migrations.pipeline.ir;

/**
 * Resumable scan progress for one partition. Persisted after every page.
 *
 * <p>{@code lastKey} is the source store's opaque continuation token. A cursor that has been persisted
 * without a {@code lastKey} belongs to an exhausted partition; a cursor that has never been persisted is
 * fresh and starts from the beginning of the partition.
 */
public record ScanCursor(
    ScanPartition partition,
    String lastKey,
    long recordsScanned,
    boolean stopRequested,
    boolean exhausted
) {
    public static ScanCursor fresh(ScanPartition partition) {
        return new ScanCursor(partition, null, 0, false, false);
    }

    /**
     * Moves past one page. A null {@code nextKey} terminates the partition.
     */
    public ScanCursor advance(String nextKey, int pageSize) {
        if (exhausted) {
            throw new IllegalStateException("Cursor for partition " + partition + " is already exhausted");
        }
        return new ScanCursor(partition, nextKey, recordsScanned + pageSize, stopRequested, nextKey == null);
    }

    public ScanCursor withStopRequested() {
        return new ScanCursor(partition, lastKey, recordsScanned, true, exhausted);
    }
}
