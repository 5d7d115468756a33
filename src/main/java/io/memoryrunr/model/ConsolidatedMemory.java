package io.memoryrunr.model;

import java.time.Instant;

/**
 * A durable record derived exactly once from a consolidated {@link Episode}.
 *
 * @param id                    stable id derived from the episode id
 * @param episodeId             source episode
 * @param category              episode category (goal)
 * @param semanticCategory      cortical category the memory is filed under
 * @param profile               replay profile text, used for embeddings
 * @param consolidatedStrength  strength at promotion time in [0,1]
 * @param createdAt             creation time of the newest item in the episode
 * @param consolidatedAt        promotion time
 */
public record ConsolidatedMemory(
        String id,
        String episodeId,
        String category,
        String semanticCategory,
        String profile,
        double consolidatedStrength,
        Instant createdAt,
        Instant consolidatedAt
) {
    public static String idFor(String episodeId) {
        return "cm-" + episodeId;
    }
}
