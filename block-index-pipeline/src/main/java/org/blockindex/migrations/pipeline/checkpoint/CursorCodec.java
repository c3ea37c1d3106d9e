package org.blockindex.migrations.pipeline.checkpoint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.blockindex.migrations.pipeline.ir.ScanCursor;
import org.blockindex.migrations.pipeline.ir.ScanPartition;

/**
 * Serializes a ScanCursor to the checkpoint value
 * {@code {"recordsScanned":n,"lastKey":"...","stopRequested":b,"complete":b}}.
 *
 * The partition is not part of the value; it is implied by the key the value is stored under.
 */
public class CursorCodec {

    private static final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CheckpointValue(
        @JsonProperty("recordsScanned") long recordsScanned,
        @JsonProperty("lastKey") String lastKey,
        @JsonProperty("stopRequested") boolean stopRequested,
        @JsonProperty("complete") Boolean complete
    ) {}

    public String encode(ScanCursor cursor) {
        try {
            return objectMapper.writeValueAsString(
                new CheckpointValue(cursor.recordsScanned(), cursor.lastKey(), cursor.stopRequested(), cursor.exhausted()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize cursor for partition " + cursor.partition(), e);
        }
    }

    /**
     * A persisted value without a lastKey is an exhausted partition, unless it says otherwise: a stop can be
     * requested for a partition before its first page.
     */
    public ScanCursor decode(ScanPartition partition, String value) {
        try {
            var stored = objectMapper.readValue(value, CheckpointValue.class);
            return new ScanCursor(
                partition,
                stored.lastKey(),
                stored.recordsScanned(),
                stored.stopRequested(),
                stored.complete() != null ? stored.complete() : stored.lastKey() == null);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt checkpoint for partition " + partition + ": " + value, e);
        }
    }
}
