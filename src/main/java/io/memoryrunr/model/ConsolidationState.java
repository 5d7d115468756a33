package io.memoryrunr.model;

/**
 * Episodic-to-semantic transition of a long-term record, driven by rolling 7-day access frequency.
 */
public enum ConsolidationState {
    EPISODIC,
    CONSOLIDATING,
    SCHEMATIZED;

    public static ConsolidationState of(int weeklyAccesses, int consolidatingAt, int schematizedAt) {
        if (weeklyAccesses >= schematizedAt) return SCHEMATIZED;
        if (weeklyAccesses >= consolidatingAt) return CONSOLIDATING;
        return EPISODIC;
    }
}
