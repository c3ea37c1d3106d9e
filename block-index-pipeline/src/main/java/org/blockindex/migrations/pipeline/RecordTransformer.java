package org.blockindex.migrations.pipeline;

import java.util.List;

import org.blockindex.migrations.pipeline.ir.DestinationRecord;
import org.blockindex.migrations.pipeline.ir.SourceRecord;

/**
 * Maps a legacy blocks index row to one destination row per CAR position, in position order.
 */
public class RecordTransformer {

    public List<DestinationRecord> transform(SourceRecord record) {
        return record.positions().stream()
            .map(position -> new DestinationRecord(
                record.key(),
                position.locator(),
                position.offset(),
                position.length()))
            .toList();
    }
}
