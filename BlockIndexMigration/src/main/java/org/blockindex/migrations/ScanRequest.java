package org.blockindex.migrations;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.blockindex.migrations.pipeline.ir.ScanPartition;

/**
 * Scanner invocation payload. Both fields are optional and default to a single unsharded scan.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanRequest(
    @JsonProperty("TotalSegments") Integer totalSegments,
    @JsonProperty("Segment") Integer segment
) {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static ScanRequest forPartition(ScanPartition partition) {
        return new ScanRequest(partition.totalPartitions(), partition.partitionId());
    }

    public static ScanRequest fromJson(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return new ScanRequest(null, null);
        }
        return objectMapper.readValue(json, ScanRequest.class);
    }

    /** Rejects a segment outside {@code [0, TotalSegments)} with IllegalArgumentException. */
    public ScanPartition toPartition() {
        return new ScanPartition(
            totalSegments == null ? 1 : totalSegments,
            segment == null ? 0 : segment);
    }

    public String toJson() throws JsonProcessingException {
        return objectMapper.writeValueAsString(this);
    }
}
