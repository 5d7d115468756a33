package io.memoryrunr.episode;

import io.memoryrunr.enrichment.Features;
import io.memoryrunr.model.MemoryItem;

/**
 * An admitted item together with the features extracted for it.
 */
public record EnrichedItem(MemoryItem item, Features features) {

    public String category() {
        return features.category();
    }
}
