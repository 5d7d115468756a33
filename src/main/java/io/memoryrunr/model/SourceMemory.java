package io.memoryrunr.model;

import java.time.Instant;
import java.util.Map;

/**
 * An immutable record from the upstream memory feed.
 *
 * @param id          stable identifier assigned upstream
 * @param contentRef  opaque reference to the content
 * @param createdAt   creation time, never changes after creation
 * @param metadata    free-form metadata (salience, importance, sentiment, content)
 * @param contentHash hash of the fields above, used to detect corrections
 */
public record SourceMemory(
        String id,
        String contentRef,
        Instant createdAt,
        Map<String, Object> metadata,
        String contentHash
) {
    public SourceMemory {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public double metadataDouble(String key, double defaultValue) {
        Object value = metadata.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }
}
