package io.memoryrunr.model;

/**
 * Origin of an association edge.
 */
public enum AssociationKind {
    /** Found while replaying an episode against related episodes. */
    REPLAY,
    /** Sampled pairing of otherwise unrelated episodes. */
    CREATIVE
}
