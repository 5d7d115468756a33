package io.memoryrunr.pipeline;

import io.memoryrunr.model.MemoryStage;

import java.time.Duration;
import java.util.List;

/**
 * Result of a single stage run, returned to the scheduler and handed to the observer.
 */
public record JobRunResult(
        String runId,
        MemoryStage stage,
        RunStatus status,
        int recordsProcessed,
        int recordsQuarantined,
        List<String> errors,
        Duration elapsed
) {
    public JobRunResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static JobRunResult alreadyRunning(String runId, MemoryStage stage) {
        return new JobRunResult(runId, stage, RunStatus.ALREADY_RUNNING, 0, 0,
                List.of("Stage '%s' is already running".formatted(stage)), Duration.ZERO);
    }

    public static JobRunResult failed(String runId, MemoryStage stage, StageReport partial, String error, Duration elapsed) {
        return new JobRunResult(runId, stage, RunStatus.FAILED, partial.processed(), partial.quarantined(),
                List.of(error), elapsed);
    }

    public static JobRunResult completed(String runId, MemoryStage stage, StageReport report, Duration elapsed) {
        RunStatus status;
        if (report.cancelled()) {
            status = RunStatus.CANCELLED;
        } else if (report.quarantined() > 0) {
            status = RunStatus.PARTIAL;
        } else {
            status = RunStatus.SUCCEEDED;
        }
        return new JobRunResult(runId, stage, status, report.processed(), report.quarantined(), report.errors(), elapsed);
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCEEDED || status == RunStatus.PARTIAL;
    }
}
