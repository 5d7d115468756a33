package io.memoryrunr.model;

import io.memoryrunr.error.InvariantViolationException;

import java.time.Instant;
import java.util.List;

/**
 * A temporally and topically grouped cluster of items representing one experience.
 *
 * @param id                    stable identifier
 * @param category              shared category of the grouped items
 * @param topics                topics collected from enrichment, used for replay similarity
 * @param windowStart           creation time of the oldest item
 * @param windowEnd             creation time of the newest item
 * @param itemIds               ids of the grouped items, insertion ordered and deduplicated
 * @param recencyFactor         {@code exp(-age / decay_constant)}
 * @param emotionalSalience     blend of sentiment and importance
 * @param stmStrength           {@code recencyFactor * emotionalSalience}
 * @param hebbianPotential      deduplicated co-activation count with same-category episodes
 * @param coActivatedWith       ids of the co-activated episodes behind {@code hebbianPotential}
 * @param readyForConsolidation whether the episode may enter replay
 * @param strength              current consolidation strength in [0,1]
 * @param state                 consolidation state
 * @param claimedAt             time the current replay claim was taken, null when unclaimed
 */
public record Episode(
        String id,
        String category,
        List<String> topics,
        Instant windowStart,
        Instant windowEnd,
        List<String> itemIds,
        double recencyFactor,
        double emotionalSalience,
        double stmStrength,
        int hebbianPotential,
        List<String> coActivatedWith,
        boolean readyForConsolidation,
        double strength,
        EpisodeState state,
        Instant claimedAt
) {
    public Episode {
        topics = topics == null ? List.of() : List.copyOf(topics);
        itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
        coActivatedWith = coActivatedWith == null ? List.of() : List.copyOf(coActivatedWith);
    }

    /**
     * Moves the episode to {@code next}, enforcing the state machine.
     *
     * @throws InvariantViolationException when the transition is not allowed
     */
    public Episode transitionTo(EpisodeState next, Instant at) {
        if (!state.canTransitionTo(next)) {
            throw new InvariantViolationException(
                    "Episode %s cannot move from %s to %s".formatted(id, state, next));
        }
        Instant claim = next == EpisodeState.REPLAYING ? at : null;
        return new Episode(id, category, topics, windowStart, windowEnd, itemIds, recencyFactor,
                emotionalSalience, stmStrength, hebbianPotential, coActivatedWith, readyForConsolidation,
                strength, next, claim);
    }

    public Episode withStrength(double strength) {
        return new Episode(id, category, topics, windowStart, windowEnd, itemIds, recencyFactor,
                emotionalSalience, stmStrength, hebbianPotential, coActivatedWith, readyForConsolidation,
                strength, state, claimedAt);
    }

    /** Replay text used for similarity scoring. */
    public String profile() {
        return topics.isEmpty() ? category : category + ": " + String.join(", ", topics);
    }
}
