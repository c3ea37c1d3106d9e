package org.blockindex.migrations.pipeline.ir;

import java.util.List;

/**
 * One page of a partition scan. A null {@code nextKey} means the partition has no further pages.
 *
 * @param <T> the source store's raw item type
 */
public record SourcePage<T>(
    List<T> items,
    String nextKey
) {
    public boolean isLast() {
        return nextKey == null;
    }
}
