package org.blockindex.migrations.pipeline.queue;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.blockindex.migrations.pipeline.ir.UnprocessedWrite;

/**
 * Body of an unprocessed-writes queue message.
 */
public record UnprocessedWritesMessage(
    @JsonProperty("version") int version,
    @JsonProperty("writes") List<UnprocessedWrite> writes
) {
    public static final int CURRENT_VERSION = 1;

    public static UnprocessedWritesMessage of(List<UnprocessedWrite> writes) {
        return new UnprocessedWritesMessage(CURRENT_VERSION, writes);
    }
}
