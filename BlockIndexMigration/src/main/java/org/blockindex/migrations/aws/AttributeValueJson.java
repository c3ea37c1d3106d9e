package org.blockindex.migrations.aws;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Turns a DynamoDB key ({@code LastEvaluatedKey} / {@code ExclusiveStartKey}) into the opaque string the
 * scan cursor stores and back, using DynamoDB's JSON notation: {@code {"multihash":{"S":"..."}}}.
 *
 * Key attributes can only be strings, numbers or binary, so those are the only types handled.
 */
public final class AttributeValueJson {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private AttributeValueJson() {}

    public static String encodeKey(Map<String, AttributeValue> key) {
        ObjectNode root = objectMapper.createObjectNode();
        key.forEach((name, value) -> {
            ObjectNode typed = root.putObject(name);
            if (value.s() != null) {
                typed.put("S", value.s());
            } else if (value.n() != null) {
                typed.put("N", value.n());
            } else if (value.b() != null) {
                typed.put("B", Base64.getEncoder().encodeToString(value.b().asByteArray()));
            } else {
                throw new IllegalArgumentException("Unsupported key attribute type for " + name + ": " + value);
            }
        });
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize key " + key, e);
        }
    }

    public static Map<String, AttributeValue> decodeKey(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored scan key is not valid JSON: " + json, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Stored scan key is not a JSON object: " + json);
        }
        var key = new LinkedHashMap<String, AttributeValue>();
        root.fields().forEachRemaining(entry -> key.put(entry.getKey(), decodeValue(entry.getKey(), entry.getValue())));
        return key;
    }

    private static AttributeValue decodeValue(String name, JsonNode typed) {
        if (typed.hasNonNull("S")) {
            return AttributeValue.fromS(typed.get("S").asText());
        }
        if (typed.hasNonNull("N")) {
            return AttributeValue.fromN(typed.get("N").asText());
        }
        if (typed.hasNonNull("B")) {
            return AttributeValue.fromB(SdkBytes.fromByteArray(Base64.getDecoder().decode(typed.get("B").asText())));
        }
        throw new IllegalArgumentException("Unsupported key attribute type for " + name + ": " + typed);
    }
}
