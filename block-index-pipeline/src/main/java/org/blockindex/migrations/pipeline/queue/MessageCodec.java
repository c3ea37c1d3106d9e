package org.blockindex.migrations.pipeline.queue;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.blockindex.migrations.pipeline.common.MalformedMessageException;
import org.blockindex.migrations.pipeline.ir.Position;
import org.blockindex.migrations.pipeline.ir.SourceRecord;
import org.blockindex.migrations.pipeline.ir.UnprocessedWrite;

/**
 * JSON encoding of the queue message bodies, with validation on the way in.
 *
 * A batch body is either the versioned envelope {@code {"version":1,"records":[...]}} or a bare array of
 * records, which is read as version 1.
 */
public class MessageCodec {

    private static final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    public String encodeBatch(List<SourceRecord> records) {
        return write(BatchMessage.of(records));
    }

    public String encodeUnprocessed(List<UnprocessedWrite> writes) {
        return write(UnprocessedWritesMessage.of(writes));
    }

    public List<SourceRecord> decodeBatch(String body) {
        JsonNode root = readTree(body);
        JsonNode recordsNode;
        if (root.isArray()) {
            recordsNode = root;
        } else if (root.isObject()) {
            checkVersion(root, BatchMessage.CURRENT_VERSION);
            recordsNode = root.get("records");
            if (recordsNode == null || !recordsNode.isArray()) {
                throw new MalformedMessageException("Batch message has no records array");
            }
        } else {
            throw new MalformedMessageException("Batch message must be a JSON object or array");
        }

        var records = new ArrayList<SourceRecord>(recordsNode.size());
        for (JsonNode node : recordsNode) {
            var record = convert(node, SourceRecord.class);
            validate(record, records.size());
            records.add(record);
        }
        return records;
    }

    public List<UnprocessedWrite> decodeUnprocessed(String body) {
        JsonNode root = readTree(body);
        if (!root.isObject()) {
            throw new MalformedMessageException("Unprocessed writes message must be a JSON object");
        }
        checkVersion(root, UnprocessedWritesMessage.CURRENT_VERSION);
        var message = convert(root, UnprocessedWritesMessage.class);
        if (message.writes() == null) {
            throw new MalformedMessageException("Unprocessed writes message has no writes array");
        }
        for (var write : message.writes()) {
            if (write == null || write.putRequest() == null || isBlank(write.putRequest().key())
                || isBlank(write.putRequest().locator())) {
                throw new MalformedMessageException("Unprocessed write is missing its put request key: " + write);
            }
            if (write.putRequest().offset() < 0 || write.putRequest().length() < 0) {
                throw new MalformedMessageException("Unprocessed write has a negative offset or length: " + write);
            }
        }
        return message.writes();
    }

    private static void validate(SourceRecord record, int index) {
        if (record == null || isBlank(record.key())) {
            throw new MalformedMessageException("Record " + index + " has no multihash");
        }
        if (record.positions() == null) {
            throw new MalformedMessageException("Record " + record.key() + " has no cars");
        }
        for (Position position : record.positions()) {
            if (position == null || isBlank(position.locator())) {
                throw new MalformedMessageException("Record " + record.key() + " has a car position without a car");
            }
            if (position.offset() < 0 || position.length() < 0) {
                throw new MalformedMessageException("Record " + record.key() + " has a negative offset or length in "
                    + position.locator());
            }
        }
    }

    private static void checkVersion(JsonNode root, int expected) {
        JsonNode version = root.get("version");
        if (version == null || !version.isInt() || version.intValue() != expected) {
            throw new MalformedMessageException("Unsupported message version: " + version);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static JsonNode readTree(String body) {
        if (body == null) {
            throw new MalformedMessageException("Message body is missing");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Message body is not valid JSON", e);
        }
    }

    private static <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException("Message does not match " + type.getSimpleName(), e);
        }
    }

    private static String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
