package org.blockindex.migrations;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import org.blockindex.migrations.pipeline.ir.ScanOutcome;

@JsonPropertyOrder({"recordCount", "TotalSegments", "Segment", "status"})
public record ScanResponse(
    @JsonProperty("recordCount") long recordCount,
    @JsonProperty("TotalSegments") int totalSegments,
    @JsonProperty("Segment") int segment,
    @JsonProperty("status") ScanOutcome.Status status
) {
    public static ScanResponse of(ScanOutcome outcome) {
        var partition = outcome.cursor().partition();
        return new ScanResponse(outcome.cursor().recordsScanned(), partition.totalPartitions(),
            partition.partitionId(), outcome.status());
    }
}
