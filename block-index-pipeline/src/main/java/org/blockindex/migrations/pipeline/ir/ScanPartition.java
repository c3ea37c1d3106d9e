package org.blockindex.migrations.pipeline.ir;

/**
 * Identifies one disjoint slice of the source table's key range in an N-way parallel scan.
 */
public record ScanPartition(
    int totalPartitions,
    int partitionId
) {
    public ScanPartition {
        if (totalPartitions < 1) {
            throw new IllegalArgumentException("totalPartitions must be >= 1, was " + totalPartitions);
        }
        if (partitionId < 0 || partitionId >= totalPartitions) {
            throw new IllegalArgumentException(
                "partitionId must be in [0, " + totalPartitions + "), was " + partitionId);
        }
    }

    /** The whole table as a single partition. */
    public static ScanPartition unsharded() {
        return new ScanPartition(1, 0);
    }

    @Override
    public String toString() {
        return partitionId + "/" + totalPartitions;
    }
}
