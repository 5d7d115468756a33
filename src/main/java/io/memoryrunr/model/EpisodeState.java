package io.memoryrunr.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Consolidation state machine for an {@link Episode}.
 *
 * <pre>
 * PENDING -> REPLAYING -> {STRENGTHENED, WEAKENED} -> {CONSOLIDATED_TO_LTM, DISCARDED}
 * </pre>
 *
 * STRENGTHENED and WEAKENED episodes are replayed again in later cycles.
 * CONSOLIDATED_TO_LTM and DISCARDED are terminal.
 */
public enum EpisodeState {
    PENDING,
    REPLAYING,
    STRENGTHENED,
    WEAKENED,
    CONSOLIDATED_TO_LTM,
    DISCARDED;

    public boolean isTerminal() {
        return this == CONSOLIDATED_TO_LTM || this == DISCARDED;
    }

    public Set<EpisodeState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(REPLAYING);
            case REPLAYING -> EnumSet.of(STRENGTHENED, WEAKENED);
            case STRENGTHENED, WEAKENED -> EnumSet.of(REPLAYING, CONSOLIDATED_TO_LTM, DISCARDED);
            case CONSOLIDATED_TO_LTM, DISCARDED -> EnumSet.noneOf(EpisodeState.class);
        };
    }

    public boolean canTransitionTo(EpisodeState next) {
        return successors().contains(next);
    }

    /** States an episode may be claimed from for a replay cycle. */
    public static Set<EpisodeState> replayable() {
        return EnumSet.of(PENDING, STRENGTHENED, WEAKENED);
    }
}
