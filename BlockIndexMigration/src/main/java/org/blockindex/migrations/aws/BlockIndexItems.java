package org.blockindex.migrations.aws;

import java.util.ArrayList;
import java.util.Map;

import org.blockindex.migrations.pipeline.ir.DestinationKey;
import org.blockindex.migrations.pipeline.ir.DestinationRecord;
import org.blockindex.migrations.pipeline.ir.Position;
import org.blockindex.migrations.pipeline.ir.SourceRecord;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Attribute mapping for the legacy blocks table and the blocks cars position table.
 */
@Slf4j
public final class BlockIndexItems {

    public static final String MULTIHASH = "multihash";
    public static final String CARS = "cars";
    public static final String CAR = "car";
    public static final String CREATED_AT = "createdAt";
    public static final String DATA = "data";
    public static final String TYPE = "type";

    public static final String BLOCK_MULTIHASH = "blockmultihash";
    public static final String CAR_PATH = "carpath";
    public static final String OFFSET = "offset";
    public static final String LENGTH = "length";

    private BlockIndexItems() {}

    /**
     * Unmarshalls a blocks table item. A row without cars maps to a record with no positions.
     */
    public static SourceRecord toSourceRecord(Map<String, AttributeValue> item) {
        var multihash = string(item, MULTIHASH);
        if (multihash == null) {
            throw new IllegalArgumentException("Blocks table item has no " + MULTIHASH + ": " + item.keySet());
        }
        var positions = new ArrayList<Position>();
        var cars = item.get(CARS);
        if (cars == null || !cars.hasL()) {
            log.warn("Block {} has no cars", multihash);
        } else {
            for (AttributeValue car : cars.l()) {
                var position = car.m();
                positions.add(new Position(number(position, OFFSET), number(position, LENGTH), string(position, CAR)));
            }
        }
        return new SourceRecord(multihash, positions,
            carried(item, multihash, CREATED_AT), carried(item, multihash, DATA), carried(item, multihash, TYPE));
    }

    public static Map<String, AttributeValue> toItem(DestinationRecord record) {
        return Map.of(
            BLOCK_MULTIHASH, AttributeValue.fromS(record.key()),
            CAR_PATH, AttributeValue.fromS(record.locator()),
            OFFSET, AttributeValue.fromN(Long.toString(record.offset())),
            LENGTH, AttributeValue.fromN(Long.toString(record.length())));
    }

    public static DestinationRecord toDestinationRecord(Map<String, AttributeValue> item) {
        return new DestinationRecord(
            string(item, BLOCK_MULTIHASH),
            string(item, CAR_PATH),
            number(item, OFFSET),
            number(item, LENGTH));
    }

    public static Map<String, AttributeValue> toKey(DestinationKey key) {
        return Map.of(
            BLOCK_MULTIHASH, AttributeValue.fromS(key.key()),
            CAR_PATH, AttributeValue.fromS(key.locator()));
    }

    public static DestinationKey toDestinationKey(Map<String, AttributeValue> item) {
        return new DestinationKey(string(item, BLOCK_MULTIHASH), string(item, CAR_PATH));
    }

    /**
     * An attribute that only travels through the batch queue. Numbers are carried as their decimal text;
     * any other non-string type is dropped with a warning.
     */
    private static String carried(Map<String, AttributeValue> item, String multihash, String name) {
        var value = item.get(name);
        if (value == null) {
            return null;
        }
        if (value.s() != null) {
            return value.s();
        }
        if (value.n() != null) {
            return value.n();
        }
        log.warn("Block {} has {} of unsupported type {}, dropping it", multihash, name, value.type());
        return null;
    }

    private static String string(Map<String, AttributeValue> item, String name) {
        var value = item.get(name);
        return value == null ? null : value.s();
    }

    private static long number(Map<String, AttributeValue> item, String name) {
        var value = item.get(name);
        if (value == null || value.n() == null) {
            throw new IllegalArgumentException("Item has no numeric " + name + ": " + item.keySet());
        }
        return Long.parseLong(value.n());
    }
}
