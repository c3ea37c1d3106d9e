package org.blockindex.migrations.pipeline.ir;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A row of the legacy blocks index: one block multihash and every CAR position it was found at.
 *
 * Only {@code key} and {@code positions} take part in the migration; the remaining attributes are carried
 * through the batch queue untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"multihash", "cars", "createdAt", "data", "type"})
public record SourceRecord(
    @JsonProperty("multihash") String key,
    @JsonProperty("cars") List<Position> positions,
    @JsonProperty("createdAt") String createdAt,
    @JsonProperty("data") String payload,
    @JsonProperty("type") String kind
) {
    public static SourceRecord of(String key, List<Position> positions) {
        return new SourceRecord(key, positions, null, null, null);
    }
}
