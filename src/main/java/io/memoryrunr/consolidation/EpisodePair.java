package io.memoryrunr.consolidation;

import io.memoryrunr.model.Episode;

/**
 * Two episodes chosen for a creative association.
 */
public record EpisodePair(Episode left, Episode right) {
}
