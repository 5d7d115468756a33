package io.memoryrunr.episode;

import io.memoryrunr.model.Episode;
import io.memoryrunr.model.MemoryItem;

import java.util.List;

/**
 * Output of one grouping pass.
 *
 * @param episodes   new or extended episodes
 * @param coActivated other pending episodes whose co-activation set grew
 * @param items      items bound to their episode
 */
public record EpisodeBatch(List<Episode> episodes, List<Episode> coActivated, List<MemoryItem> items) {

    public EpisodeBatch {
        episodes = List.copyOf(episodes);
        coActivated = List.copyOf(coActivated);
        items = List.copyOf(items);
    }
}
