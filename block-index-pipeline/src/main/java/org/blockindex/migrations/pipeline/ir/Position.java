package org.blockindex.migrations.pipeline.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Where a block lives inside one CAR file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"offset", "length", "car"})
public record Position(
    @JsonProperty(value = "offset", required = true) long offset,
    @JsonProperty(value = "length", required = true) long length,
    @JsonProperty("car") String locator
) {}
