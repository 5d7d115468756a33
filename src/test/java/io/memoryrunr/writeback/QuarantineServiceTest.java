package io.memoryrunr.writeback;

import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.observability.PipelineObserver;
import io.memoryrunr.store.MemoryStore;
import io.memoryrunr.store.QuarantineEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class QuarantineServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private MemoryStore store;
    private PipelineObserver observer;
    private QuarantineService quarantine;

    @BeforeEach
    void setUp() {
        store = mock(MemoryStore.class);
        observer = mock(PipelineObserver.class);
        quarantine = new QuarantineService(store, observer, 3, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    void shouldQuarantineWithoutDeadLetteringBelowThreshold() {
        when(store.recordQuarantine(MemoryStage.EPISODE, "m-1", "bad sentiment", T0))
                .thenReturn(new QuarantineEntry(MemoryStage.EPISODE, "m-1", "bad sentiment", 2, false, T0));

        QuarantineEntry entry = quarantine.quarantine(MemoryStage.EPISODE, "m-1", "bad sentiment");

        assertFalse(entry.deadLettered());
        verify(store, never()).markDeadLettered(any(), anyString());
        verify(observer).onRecordQuarantined(MemoryStage.EPISODE, "m-1", "bad sentiment", false);
    }

    @Test
    void shouldDeadLetterOnThirdConsecutiveRun() {
        when(store.recordQuarantine(MemoryStage.EPISODE, "m-1", "bad sentiment", T0))
                .thenReturn(new QuarantineEntry(MemoryStage.EPISODE, "m-1", "bad sentiment", 3, false, T0));

        QuarantineEntry entry = quarantine.quarantine(MemoryStage.EPISODE, "m-1", "bad sentiment");

        assertTrue(entry.deadLettered());
        assertEquals(3, entry.consecutiveRuns());
        verify(store).markDeadLettered(MemoryStage.EPISODE, "m-1");
        verify(observer).onRecordQuarantined(MemoryStage.EPISODE, "m-1", "bad sentiment", true);
    }

    @Test
    void shouldNotMarkTwiceWhenAlreadyDeadLettered() {
        when(store.recordQuarantine(MemoryStage.EPISODE, "m-1", "again", T0))
                .thenReturn(new QuarantineEntry(MemoryStage.EPISODE, "m-1", "again", 4, true, T0));

        quarantine.quarantine(MemoryStage.EPISODE, "m-1", "again");

        verify(store, never()).markDeadLettered(any(), anyString());
        verify(observer).onRecordQuarantined(MemoryStage.EPISODE, "m-1", "again", true);
    }

    @Test
    void shouldSkipStoreWhenNothingToClear() {
        quarantine.clear(MemoryStage.ATTENTION, List.of());
        verifyNoInteractions(store);

        quarantine.clear(MemoryStage.ATTENTION, List.of("m-2"));
        verify(store).clearQuarantine(MemoryStage.ATTENTION, List.of("m-2"));
    }
}
