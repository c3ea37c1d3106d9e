package org.blockindex.migrations.pipeline.checkpoint;

import org.blockindex.migrations.pipeline.ir.ScanPartition;

/**
 * Layout of the checkpoint keyspace for one deployment stage.
 *
 * <pre>
 *   /{prefix}/{stage}                                           stop signal, value ignored
 *   /{prefix}/{stage}/last-evaluated/{totalPartitions}/{partitionId}  scan cursor
 * </pre>
 */
public record CheckpointKeys(
    String prefix,
    String stage
) {
    public static final String DEFAULT_PREFIX = "migrate-block-index";

    public CheckpointKeys {
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage must not be blank");
        }
    }

    public static CheckpointKeys forStage(String stage) {
        return new CheckpointKeys(DEFAULT_PREFIX, stage);
    }

    public String stopKey() {
        return "/" + prefix + "/" + stage;
    }

    public String cursorKey(ScanPartition partition) {
        return stopKey() + "/last-evaluated/" + partition.totalPartitions() + "/" + partition.partitionId();
    }
}
