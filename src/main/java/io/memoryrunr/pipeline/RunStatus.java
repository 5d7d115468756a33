package io.memoryrunr.pipeline;

/**
 * Outcome of one stage run.
 */
public enum RunStatus {
    SUCCEEDED,
    /** Completed, but some records were quarantined. */
    PARTIAL,
    FAILED,
    /** Another run of the same stage holds the run lock. */
    ALREADY_RUNNING,
    CANCELLED
}
