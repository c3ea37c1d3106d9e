package org.blockindex.migrations.pipeline.ir;

/**
 * What one scanner invocation did and where it left the partition.
 */
public record ScanOutcome(
    Status status,
    ScanCursor cursor,
    int pagesFetched,
    long recordsDispatched
) {
    public enum Status {
        /** The partition has no more pages. */
        EXHAUSTED,
        /** A stop was requested globally or for this partition. */
        STOPPED,
        /** The time budget ran low and a continuation was scheduled. */
        CONTINUED
    }
}
