package io.memoryrunr.pipeline;

import io.memoryrunr.error.ConcurrencyConflictException;
import io.memoryrunr.error.PipelineException;
import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.observability.PipelineObserver;
import io.memoryrunr.store.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Runs one stage under its run lock and turns the outcome into a {@link JobRunResult}.
 * A held lock yields ALREADY_RUNNING; an exception escaping the stage yields FAILED.
 */
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final MemoryStore store;
    private final Map<MemoryStage, StageProcessor> processors = new EnumMap<>(MemoryStage.class);
    private final PipelineObserver observer;
    private final Clock clock;
    private final Duration lockTtl;
    private final Map<String, RunContext> running = new ConcurrentHashMap<>();

    public StageRunner(MemoryStore store, List<StageProcessor> processors, PipelineObserver observer,
                       Clock clock, Duration lockTtl) {
        this.store = store;
        for (StageProcessor processor : processors) {
            this.processors.put(processor.stage(), processor);
        }
        this.observer = observer;
        this.clock = clock;
        this.lockTtl = lockTtl;
    }

    public JobRunResult run(MemoryStage stage) {
        StageProcessor processor = processors.get(stage);
        if (processor == null) {
            throw new IllegalArgumentException("No processor registered for stage " + stage);
        }
        return run(stage, processor::process);
    }

    /**
     * Runs arbitrary work under the run lock of {@code stage}, e.g. a semantic re-cluster.
     */
    public JobRunResult run(MemoryStage stage, Function<RunContext, StageReport> work) {
        RunContext context = RunContext.start(stage, clock.instant());
        try {
            acquireLock(stage, context.runId());
        } catch (ConcurrencyConflictException e) {
            log.info("[{}] skipped: {}", stage, e.getMessage());
            JobRunResult result = JobRunResult.alreadyRunning(context.runId(), stage);
            observer.onRunCompleted(result);
            return result;
        }

        long started = System.nanoTime();
        running.put(context.runId(), context);
        JobRunResult result;
        try {
            log.info("[{}] run {} started", stage, context.runId());
            StageReport report = work.apply(context);
            result = JobRunResult.completed(context.runId(), stage, report, elapsedSince(started));
        } catch (PipelineException e) {
            log.error("[{}] run {} failed: {}", stage, context.runId(), e.getMessage(), e);
            result = JobRunResult.failed(context.runId(), stage, StageReport.empty(), e.getMessage(), elapsedSince(started));
        } catch (RuntimeException e) {
            log.error("[{}] run {} failed unexpectedly", stage, context.runId(), e);
            result = JobRunResult.failed(context.runId(), stage, StageReport.empty(),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), elapsedSince(started));
        } finally {
            running.remove(context.runId());
            releaseQuietly(stage, context.runId());
        }

        log.info("[{}] run {} finished: {} ({} processed, {} quarantined) in {} ms", stage, context.runId(),
                result.status(), result.recordsProcessed(), result.recordsQuarantined(), result.elapsed().toMillis());
        observer.onRunCompleted(result);
        return result;
    }

    /**
     * Requests cancellation of every in-flight run of {@code stage}. Runs stop at their next batch boundary.
     *
     * @return number of runs signalled
     */
    public int cancel(MemoryStage stage) {
        int signalled = 0;
        for (RunContext context : running.values()) {
            if (context.stage() == stage) {
                context.cancel();
                signalled++;
            }
        }
        return signalled;
    }

    public Collection<RunContext> runningContexts() {
        return List.copyOf(running.values());
    }

    public Set<MemoryStage> stages() {
        return Collections.unmodifiableSet(processors.keySet());
    }

    private void acquireLock(MemoryStage stage, String holder) {
        if (!store.acquireRunLock(stage, holder, lockTtl)) {
            throw new ConcurrencyConflictException(stage.name());
        }
    }

    private void releaseQuietly(MemoryStage stage, String holder) {
        try {
            store.releaseRunLock(stage, holder);
        } catch (PipelineException e) {
            // The lock expires on its own after the TTL.
            log.warn("[{}] could not release run lock: {}", stage, e.getMessage());
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
