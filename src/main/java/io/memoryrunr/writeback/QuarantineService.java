package io.memoryrunr.writeback;

import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.observability.PipelineObserver;
import io.memoryrunr.store.MemoryStore;
import io.memoryrunr.store.QuarantineEntry;

import java.time.Clock;
import java.util.Collection;

/**
 * Sets aside records that cannot be processed. A record quarantined in {@code deadLetterAfterRuns}
 * consecutive runs is dead-lettered and no longer offered to its stage.
 */
public class QuarantineService {

    private final MemoryStore store;
    private final PipelineObserver observer;
    private final int deadLetterAfterRuns;
    private final Clock clock;

    public QuarantineService(MemoryStore store, PipelineObserver observer, int deadLetterAfterRuns, Clock clock) {
        this.store = store;
        this.observer = observer;
        this.deadLetterAfterRuns = deadLetterAfterRuns;
        this.clock = clock;
    }

    public QuarantineEntry quarantine(MemoryStage stage, String recordId, String reason) {
        QuarantineEntry entry = store.recordQuarantine(stage, recordId, reason, clock.instant());
        boolean deadLettered = entry.deadLettered();
        if (!deadLettered && entry.consecutiveRuns() >= deadLetterAfterRuns) {
            store.markDeadLettered(stage, recordId);
            deadLettered = true;
            entry = new QuarantineEntry(stage, recordId, reason, entry.consecutiveRuns(), true, entry.updatedAt());
        }
        observer.onRecordQuarantined(stage, recordId, reason, deadLettered);
        return entry;
    }

    /** Resets the consecutive-run counter of records that were written successfully. */
    public void clear(MemoryStage stage, Collection<String> recordIds) {
        if (!recordIds.isEmpty()) {
            store.clearQuarantine(stage, recordIds);
        }
    }
}
