package io.memoryrunr.model;

/**
 * Pipeline stages. Each stage owns one watermark and one run lock.
 */
public enum MemoryStage {
    ATTENTION,
    EPISODE,
    CONSOLIDATION,
    SEMANTIC,
    HOMEOSTASIS;

    public static MemoryStage fromString(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Stage name must not be blank");
        }
        return valueOf(s.trim().toUpperCase());
    }
}
