package org.blockindex.migrations.pipeline.ir;

/**
 * Primary key of the destination table.
 */
public record DestinationKey(
    String key,
    String locator
) {}
