package org.blockindex.migrations.pipeline.ir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A row of the destination table: one block inside one CAR file.
 */
@JsonPropertyOrder({"blockmultihash", "carpath", "offset", "length"})
public record DestinationRecord(
    @JsonProperty("blockmultihash") String key,
    @JsonProperty("carpath") String locator,
    @JsonProperty(value = "offset", required = true) long offset,
    @JsonProperty(value = "length", required = true) long length
) {
    @JsonIgnore
    public DestinationKey primaryKey() {
        return new DestinationKey(key, locator);
    }
}
