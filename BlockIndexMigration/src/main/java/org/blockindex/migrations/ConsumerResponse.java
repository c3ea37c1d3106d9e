package org.blockindex.migrations;

import java.util.List;

import org.blockindex.migrations.pipeline.ir.MigrationTally;

/**
 * Totals across the messages of one delivery, and the ids of the messages that must be redelivered.
 */
public record ConsumerResponse(MigrationTally tally, List<String> failedMessageIds) {

    public boolean hasFailures() {
        return !failedMessageIds.isEmpty();
    }
}
