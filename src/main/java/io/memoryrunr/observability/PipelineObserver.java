package io.memoryrunr.observability;

import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.pipeline.JobRunResult;

/**
 * Sink for pipeline telemetry. Implementations must be cheap; callers go through
 * {@link GuardedPipelineObserver} so a failing sink never stalls a stage.
 */
public interface PipelineObserver {

    default void onBatchCommitted(BatchMetrics metrics) {
    }

    default void onBatchSizeReduced(MemoryStage stage, int from, int to, String reason) {
    }

    default void onRecordQuarantined(MemoryStage stage, String recordId, String reason, boolean deadLettered) {
    }

    default void onFallback(String collaborator, String reason) {
    }

    default void onRunCompleted(JobRunResult result) {
    }
}
