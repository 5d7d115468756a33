package io.memoryrunr.observability;

import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.pipeline.JobRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes pipeline telemetry to the application log.
 */
public class LoggingPipelineObserver implements PipelineObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingPipelineObserver.class);

    @Override
    public void onBatchCommitted(BatchMetrics metrics) {
        log.debug("[{}] batch committed: size={}, processed={}, succeeded={}, failed={}, took {}ms",
                metrics.stage(), metrics.batchSize(), metrics.processed(), metrics.succeeded(), metrics.failed(),
                metrics.elapsed().toMillis());
    }

    @Override
    public void onBatchSizeReduced(MemoryStage stage, int from, int to, String reason) {
        log.warn("[{}] batch of {} failed ({}), retrying with {}", stage, from, reason, to);
    }

    @Override
    public void onRecordQuarantined(MemoryStage stage, String recordId, String reason, boolean deadLettered) {
        if (deadLettered) {
            log.error("[{}] record {} dead-lettered: {}", stage, recordId, reason);
        } else {
            log.warn("[{}] record {} quarantined: {}", stage, recordId, reason);
        }
    }

    @Override
    public void onFallback(String collaborator, String reason) {
        log.warn("{} unavailable, using fallback: {}", collaborator, reason);
    }

    @Override
    public void onRunCompleted(JobRunResult result) {
        if (result.isSuccess()) {
            log.info("[{}] run {} {}: processed={}, quarantined={}, took {}ms", result.stage(), result.runId(),
                    result.status(), result.recordsProcessed(), result.recordsQuarantined(), result.elapsed().toMillis());
        } else {
            log.warn("[{}] run {} {}: {}", result.stage(), result.runId(), result.status(), result.errors());
        }
    }
}
