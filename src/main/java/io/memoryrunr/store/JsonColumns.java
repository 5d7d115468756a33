package io.memoryrunr.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoryrunr.error.DataIntegrityException;

import java.util.List;
import java.util.Map;

/**
 * JSON encoding of list, map and vector columns.
 */
final class JsonColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };

    private JsonColumns() {
    }

    static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode column value", e);
        }
    }

    static List<String> readList(String id, String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new DataIntegrityException(id, "Malformed list column: " + e.getOriginalMessage(), e);
        }
    }

    static Map<String, Object> readMap(String id, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, OBJECT_MAP);
        } catch (JsonProcessingException e) {
            throw new DataIntegrityException(id, "Malformed metadata: " + e.getOriginalMessage(), e);
        }
    }

    static float[] readVector(String id, String json) {
        try {
            return MAPPER.readValue(json, float[].class);
        } catch (JsonProcessingException e) {
            throw new DataIntegrityException(id, "Malformed vector column: " + e.getOriginalMessage(), e);
        }
    }
}
