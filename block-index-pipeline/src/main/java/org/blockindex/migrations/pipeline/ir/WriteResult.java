package org.blockindex.migrations.pipeline.ir;

import java.util.List;

/**
 * Result of one batched put: how many distinct items were sent and which of them were not committed.
 */
public record WriteResult(
    int submitted,
    List<DestinationRecord> unprocessed
) {
    public int committed() {
        return submitted - unprocessed.size();
    }
}
