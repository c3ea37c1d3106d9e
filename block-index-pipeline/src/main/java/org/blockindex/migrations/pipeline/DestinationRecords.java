package org.blockindex.migrations.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import org.blockindex.migrations.pipeline.ir.DestinationKey;
import org.blockindex.migrations.pipeline.ir.DestinationRecord;

final class DestinationRecords {

    private DestinationRecords() {}

    /**
     * One record per primary key: the last occurrence wins, placed where the key first occurred.
     */
    static List<DestinationRecord> dedupeByKey(List<DestinationRecord> records) {
        var byKey = new LinkedHashMap<DestinationKey, DestinationRecord>();
        for (var record : records) {
            byKey.put(record.primaryKey(), record);
        }
        return new ArrayList<>(byKey.values());
    }
}
