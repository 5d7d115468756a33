package io.memoryrunr.store;

import io.memoryrunr.model.MemoryStage;

import java.time.Instant;

/**
 * A record that failed validation or a store constraint.
 *
 * @param stage           stage that quarantined it
 * @param recordId        id of the record
 * @param reason          last failure reason
 * @param consecutiveRuns runs in a row that quarantined it
 * @param deadLettered    whether it was escalated to the dead-letter list
 * @param updatedAt       last quarantine time
 */
public record QuarantineEntry(
        MemoryStage stage,
        String recordId,
        String reason,
        int consecutiveRuns,
        boolean deadLettered,
        Instant updatedAt
) {
}
