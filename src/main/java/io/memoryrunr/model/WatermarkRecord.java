package io.memoryrunr.model;

import java.time.Instant;

/**
 * Per-stage incremental processing cursor.
 *
 * @param stage                  owning stage
 * @param lastProcessedTimestamp newest record timestamp committed by the stage
 * @param contentHash            hash of the last committed batch
 */
public record WatermarkRecord(MemoryStage stage, Instant lastProcessedTimestamp, String contentHash) {

    public static WatermarkRecord initial(MemoryStage stage) {
        return new WatermarkRecord(stage, Instant.EPOCH, "");
    }
}
