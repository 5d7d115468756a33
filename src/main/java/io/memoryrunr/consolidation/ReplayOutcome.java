package io.memoryrunr.consolidation;

import io.memoryrunr.model.Association;
import io.memoryrunr.model.ConsolidatedMemory;
import io.memoryrunr.model.Episode;

import java.util.List;
import java.util.Optional;

/**
 * Result of replaying one episode.
 *
 * @param episode      the episode in its post-replay state
 * @param associations replay edges created or re-weighted
 * @param promoted     the long-term memory derived from the episode, when it crossed the consolidation threshold
 */
public record ReplayOutcome(Episode episode, List<Association> associations, Optional<ConsolidatedMemory> promoted) {

    public ReplayOutcome {
        associations = List.copyOf(associations);
    }
}
