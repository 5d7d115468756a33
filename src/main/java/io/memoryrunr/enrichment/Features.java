package io.memoryrunr.enrichment;

import java.util.List;

/**
 * Structured features extracted from one memory item.
 *
 * @param category       high-level goal category, used to group items into episodes
 * @param topics         topics mentioned by the content
 * @param entities       named entities mentioned by the content
 * @param sentiment      sentiment in [-1,1]
 * @param importance     importance in [0,1]
 * @param spatialContext coarse location of the experience (workplace, residential, unspecified)
 */
public record Features(
        String category,
        List<String> topics,
        List<String> entities,
        double sentiment,
        double importance,
        String spatialContext
) {
    public Features {
        topics = topics == null ? List.of() : List.copyOf(topics);
        entities = entities == null ? List.of() : List.copyOf(entities);
    }
}
