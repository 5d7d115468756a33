package io.memoryrunr.observability;

import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.pipeline.JobRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shields the pipeline from observer failures. Every exception thrown by the delegate is logged
 * and dropped.
 */
public class GuardedPipelineObserver implements PipelineObserver {

    private static final Logger log = LoggerFactory.getLogger(GuardedPipelineObserver.class);

    private final PipelineObserver delegate;

    public GuardedPipelineObserver(PipelineObserver delegate) {
        this.delegate = delegate;
    }

    @Override
    public void onBatchCommitted(BatchMetrics metrics) {
        guard("onBatchCommitted", () -> delegate.onBatchCommitted(metrics));
    }

    @Override
    public void onBatchSizeReduced(MemoryStage stage, int from, int to, String reason) {
        guard("onBatchSizeReduced", () -> delegate.onBatchSizeReduced(stage, from, to, reason));
    }

    @Override
    public void onRecordQuarantined(MemoryStage stage, String recordId, String reason, boolean deadLettered) {
        guard("onRecordQuarantined", () -> delegate.onRecordQuarantined(stage, recordId, reason, deadLettered));
    }

    @Override
    public void onFallback(String collaborator, String reason) {
        guard("onFallback", () -> delegate.onFallback(collaborator, reason));
    }

    @Override
    public void onRunCompleted(JobRunResult result) {
        guard("onRunCompleted", () -> delegate.onRunCompleted(result));
    }

    private void guard(String event, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Observer {} failed in {}: {}", delegate.getClass().getSimpleName(), event, e.getMessage());
        }
    }
}
