package org.blockindex.migrations.pipeline.queue;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import org.blockindex.migrations.pipeline.ir.SourceRecord;

/**
 * Body of a batch queue message.
 */
@JsonPropertyOrder({"version", "records"})
public record BatchMessage(
    @JsonProperty("version") int version,
    @JsonProperty("records") List<SourceRecord> records
) {
    public static final int CURRENT_VERSION = 1;

    public static BatchMessage of(List<SourceRecord> records) {
        return new BatchMessage(CURRENT_VERSION, records);
    }
}
