package io.memoryrunr.pipeline;

import io.memoryrunr.model.MemoryStage;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-run state handed to a stage processor. Cancellation is cooperative: processors check
 * {@link #isCancelled()} at batch boundaries only, so a batch is never half applied.
 */
public class RunContext {

    private final String runId;
    private final MemoryStage stage;
    private final Instant startedAt;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public RunContext(String runId, MemoryStage stage, Instant startedAt) {
        this.runId = runId;
        this.stage = stage;
        this.startedAt = startedAt;
    }

    public static RunContext start(MemoryStage stage, Instant now) {
        return new RunContext(UUID.randomUUID().toString(), stage, now);
    }

    public String runId() {
        return runId;
    }

    public MemoryStage stage() {
        return stage;
    }

    /** Wall-clock start of the run; stages use it as "now" so one run sees one consistent time. */
    public Instant startedAt() {
        return startedAt;
    }

    /**
     * Monotonic cycle number derived from the start minute. Seeds the per-cycle capacity draw.
     */
    public long cycle() {
        return startedAt.getEpochSecond() / 60;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
