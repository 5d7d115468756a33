package io.memoryrunr.pipeline;

import io.memoryrunr.error.DataIntegrityException;
import io.memoryrunr.error.TransientIoException;
import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.observability.PipelineObserver;
import io.memoryrunr.store.MemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StageRunnerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");
    private static final Duration LOCK_TTL = Duration.ofMinutes(30);

    private MemoryStore store;
    private PipelineObserver observer;
    private StageProcessor attention;
    private StageRunner runner;

    @BeforeEach
    void setUp() {
        store = mock(MemoryStore.class);
        observer = mock(PipelineObserver.class);
        attention = mock(StageProcessor.class);
        when(attention.stage()).thenReturn(MemoryStage.ATTENTION);
        when(store.acquireRunLock(eq(MemoryStage.ATTENTION), anyString(), eq(LOCK_TTL))).thenReturn(true);
        runner = new StageRunner(store, List.of(attention), observer, Clock.fixed(T0, ZoneOffset.UTC), LOCK_TTL);
    }

    @Test
    void shouldRunStageUnderLockAndReleaseIt() {
        AtomicReference<RunContext> seen = new AtomicReference<>();
        when(attention.process(any())).thenAnswer(invocation -> {
            seen.set(invocation.getArgument(0));
            return new StageReport(7, 0, List.of(), false);
        });

        JobRunResult result = runner.run(MemoryStage.ATTENTION);

        assertEquals(RunStatus.SUCCEEDED, result.status());
        assertEquals(7, result.recordsProcessed());
        assertEquals(T0, seen.get().startedAt());
        assertEquals(result.runId(), seen.get().runId());
        verify(store).releaseRunLock(MemoryStage.ATTENTION, result.runId());
        verify(observer).onRunCompleted(result);
        assertTrue(runner.runningContexts().isEmpty());
    }

    @Test
    void shouldReportPartialWhenRecordsWereQuarantined() {
        when(attention.process(any())).thenReturn(new StageReport(9, 1, List.of("m-3: salience 3.0 outside [0,1]"), false));

        JobRunResult result = runner.run(MemoryStage.ATTENTION);

        assertEquals(RunStatus.PARTIAL, result.status());
        assertTrue(result.isSuccess());
        assertEquals(List.of("m-3: salience 3.0 outside [0,1]"), result.errors());
    }

    @Test
    void shouldReturnAlreadyRunningWhenLockIsHeld() {
        when(store.acquireRunLock(eq(MemoryStage.ATTENTION), anyString(), eq(LOCK_TTL))).thenReturn(false);

        JobRunResult result = runner.run(MemoryStage.ATTENTION);

        assertEquals(RunStatus.ALREADY_RUNNING, result.status());
        assertFalse(result.isSuccess());
        verify(attention, never()).process(any());
        verify(store, never()).releaseRunLock(any(), anyString());
    }

    @Test
    void shouldReportFailureAndStillReleaseLock() {
        when(attention.process(any())).thenThrow(new TransientIoException("database is locked"));

        JobRunResult result = runner.run(MemoryStage.ATTENTION);

        assertEquals(RunStatus.FAILED, result.status());
        assertTrue(result.errors().get(0).contains("database is locked"));
        verify(store).releaseRunLock(MemoryStage.ATTENTION, result.runId());
    }

    @Test
    void shouldContainUnexpectedExceptions() {
        when(attention.process(any())).thenThrow(new IllegalStateException("boom"));

        JobRunResult result = runner.run(MemoryStage.ATTENTION);

        assertEquals(RunStatus.FAILED, result.status());
        assertEquals(List.of("IllegalStateException: boom"), result.errors());
    }

    @Test
    void shouldIgnoreLockReleaseFailure() {
        when(attention.process(any())).thenReturn(StageReport.empty());
        doThrow(new TransientIoException("disk I/O error")).when(store).releaseRunLock(eq(MemoryStage.ATTENTION), anyString());

        assertEquals(RunStatus.SUCCEEDED, runner.run(MemoryStage.ATTENTION).status());
    }

    @Test
    void shouldRejectStageWithoutProcessor() {
        assertThrows(IllegalArgumentException.class, () -> runner.run(MemoryStage.HOMEOSTASIS));
        assertEquals(java.util.Set.of(MemoryStage.ATTENTION), runner.stages());
    }

    @Test
    void shouldSignalCancellationToRunningContext() {
        when(attention.process(any())).thenAnswer(invocation -> {
            RunContext context = invocation.getArgument(0);
            assertEquals(1, runner.cancel(MemoryStage.ATTENTION));
            assertEquals(0, runner.cancel(MemoryStage.EPISODE));
            return context.isCancelled() ? StageReport.cancelledReport() : StageReport.empty();
        });

        JobRunResult result = runner.run(MemoryStage.ATTENTION);

        assertEquals(RunStatus.CANCELLED, result.status());
    }

    @Test
    void shouldRunCustomWorkUnderStageLock() {
        when(store.acquireRunLock(eq(MemoryStage.SEMANTIC), anyString(), eq(LOCK_TTL))).thenReturn(true);

        JobRunResult result = runner.run(MemoryStage.SEMANTIC, context -> new StageReport(3, 0, List.of(), false));

        assertEquals(RunStatus.SUCCEEDED, result.status());
        assertEquals(3, result.recordsProcessed());
        verify(store).releaseRunLock(MemoryStage.SEMANTIC, result.runId());
    }

    @Test
    void shouldCarryPipelineExceptionMessage() {
        when(attention.process(any())).thenThrow(new DataIntegrityException("m-1", "bad row"));

        JobRunResult result = runner.run(MemoryStage.ATTENTION);

        assertEquals(RunStatus.FAILED, result.status());
        assertFalse(result.errors().isEmpty());
    }
}
