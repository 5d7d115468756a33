package io.memoryrunr.consolidation;

import io.memoryrunr.model.Episode;

import java.util.List;

/**
 * Picks episode pairs that replay would not relate on its own.
 */
public interface AssociationSamplingStrategy {

    List<EpisodePair> sample(List<Episode> episodes, int count, long cycle);
}
