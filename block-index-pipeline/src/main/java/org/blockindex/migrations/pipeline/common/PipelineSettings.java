package org.blockindex.migrations.pipeline.common;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning for the scanner and consumer engines. The defaults match the limits of DynamoDB and SQS.
 */
@Value
@Builder(toBuilder = true)
public class PipelineSettings {
    /** Items per scan page; 500 items of ~350 bytes stay well under one queue message. */
    @Builder.Default
    int scanPageSize = 500;

    /** Below this much remaining time the scanner hands over to a continuation. */
    @Builder.Default
    Duration minRemainingTime = Duration.ofSeconds(10);

    /** BatchGetItem limit. */
    @Builder.Default
    int readBatchSize = 100;

    /** BatchWriteItem limit. */
    @Builder.Default
    int writeBatchSize = 25;

    /** SQS allows 256 KiB per message. */
    @Builder.Default
    int maxMessageBytes = 240 * 1024;

    @Builder.Default
    int maxRetries = 8;

    @Builder.Default
    Duration initialBackoff = Duration.ofMillis(500);

    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(30);

    public static PipelineSettings defaults() {
        return PipelineSettings.builder().build();
    }
}
