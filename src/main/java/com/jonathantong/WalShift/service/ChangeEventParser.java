package com.jonathantong.WalShift.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jonathantong.WalShift.model.ChangeEvent;
import com.jonathantong.WalShift.model.Operation;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes Debezium JSON change records.
 * <p>
 * Accepts both converter layouts:
 * <pre>
 * {"op": "c", "before": null, "after": {...}}
 * {"schema": {...}, "payload": {"op": "c", "before": null, "after": {...}}}
 * </pre>
 */
@Component
public class ChangeEventParser {

    private final ObjectMapper objectMapper;

    public ChangeEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ChangeEvent parse(String message) {
        JsonNode root;
        try {
            root = objectMapper.readTree(message);
        } catch (JsonProcessingException e) {
            throw new ChangeEventParseException("Not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ChangeEventParseException("Change record is not a JSON object");
        }

        JsonNode payload = root.get("payload");
        // Debezium JSON converter envelope, with or without schemas
        JsonNode record = payload != null && payload.isObject() ? payload : root;

        JsonNode op = record.get("op");
        if (op == null || !op.isTextual()) {
            throw new ChangeEventParseException("Change record has no op field");
        }
        Operation operation;
        try {
            operation = Operation.fromCode(op.textValue());
        } catch (IllegalArgumentException e) {
            throw new ChangeEventParseException(e.getMessage(), e);
        }

        return new ChangeEvent(
                operation,
                readImage(record, "before"),
                readImage(record, "after"));
    }

    private Map<String, Object> readImage(JsonNode record, String field) {
        JsonNode image = record.get(field);
        if (image == null || image.isNull()) {
            return null;
        }
        if (!image.isObject()) {
            throw new ChangeEventParseException("Field " + field + " is not an object");
        }
        return convertJsonToMap(image);
    }

    private Map<String, Object> convertJsonToMap(JsonNode jsonNode) {
        Map<String, Object> map = new LinkedHashMap<>();

        jsonNode.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode value = entry.getValue();

            if (value.isNull()) {
                map.put(key, null);
            } else if (value.isBoolean()) {
                map.put(key, value.booleanValue());
            } else if (value.isInt()) {
                map.put(key, value.intValue());
            } else if (value.isLong()) {
                map.put(key, value.longValue());
            } else if (value.isBigInteger()) {
                map.put(key, value.bigIntegerValue());
            } else if (value.isBigDecimal()) {
                map.put(key, value.decimalValue());
            } else if (value.isNumber()) {
                map.put(key, value.doubleValue());
            } else if (value.isTextual()) {
                map.put(key, value.textValue());
            } else {
                // Structs and arrays (e.g. geometry) are written as their JSON text
                map.put(key, value.toString());
            }
        });

        return map;
    }
}
