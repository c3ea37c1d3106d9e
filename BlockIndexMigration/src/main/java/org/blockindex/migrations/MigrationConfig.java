package org.blockindex.migrations;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import org.blockindex.migrations.pipeline.common.PipelineSettings;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Deployment settings, read once per process from the environment.
 */
@Value
@Builder
public class MigrationConfig {
    @NonNull String stage;
    @NonNull String sourceTable;
    @NonNull String destinationTable;
    @NonNull String batchQueueUrl;
    @NonNull String unprocessedQueueUrl;
    /** Needed only by the scanner, which invokes itself to continue a partition. */
    String scannerFunctionName;
    String region;
    String endpoint;
    @NonNull
    @Builder.Default
    PipelineSettings settings = PipelineSettings.defaults();

    public static MigrationConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static MigrationConfig fromEnvironment(Map<String, String> env) {
        var settings = PipelineSettings.builder();
        optional(env, "SCAN_PAGE_SIZE").map(Integer::parseInt).ifPresent(settings::scanPageSize);
        optional(env, "MIN_REMAINING_TIME_MS").map(Long::parseLong).map(Duration::ofMillis)
            .ifPresent(settings::minRemainingTime);
        optional(env, "MAX_RETRIES").map(Integer::parseInt).ifPresent(settings::maxRetries);

        return MigrationConfig.builder()
            .stage(required(env, "STAGE"))
            .sourceTable(required(env, "SRC_TABLE"))
            .destinationTable(required(env, "DST_TABLE"))
            .batchQueueUrl(required(env, "BATCH_QUEUE_URL"))
            .unprocessedQueueUrl(required(env, "UNPROCESSED_QUEUE_URL"))
            .scannerFunctionName(optional(env, "SCANNER_FUNCTION_NAME").orElse(null))
            .region(optional(env, "AWS_REGION").orElse(null))
            .endpoint(optional(env, "AWS_ENDPOINT_URL").orElse(null))
            .settings(settings.build())
            .build();
    }

    public String requireScannerFunctionName() {
        if (scannerFunctionName == null) {
            throw new IllegalStateException("SCANNER_FUNCTION_NAME must be defined in env");
        }
        return scannerFunctionName;
    }

    private static String required(Map<String, String> env, String name) {
        return optional(env, name)
            .orElseThrow(() -> new IllegalStateException(name + " must be defined in env"));
    }

    private static Optional<String> optional(Map<String, String> env, String name) {
        var value = env.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
