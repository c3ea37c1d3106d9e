package org.blockindex.migrations.pipeline.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A put request the destination table did not commit. Forwarded for redrive, never dropped.
 */
public record UnprocessedWrite(
    @JsonProperty("table") String table,
    @JsonProperty("putRequest") DestinationRecord putRequest
) {}
