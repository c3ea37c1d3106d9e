package org.blockindex.migrations.pipeline.ir;

import java.util.List;

/**
 * Keys a batched existence query found in the destination table.
 *
 * A null {@code presentKeys} means the store's response had no results container at all.
 */
public record ExistenceResponse(
    List<DestinationKey> presentKeys
) {
    public static ExistenceResponse malformed() {
        return new ExistenceResponse(null);
    }

    public boolean isMalformed() {
        return presentKeys == null;
    }
}
