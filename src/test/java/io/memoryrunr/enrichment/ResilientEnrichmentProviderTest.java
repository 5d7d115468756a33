package io.memoryrunr.enrichment;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.config.ResilienceConfig;
import io.memoryrunr.error.TransientIoException;
import io.memoryrunr.observability.PipelineObserver;
import io.memoryrunr.support.CollaboratorGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ResilientEnrichmentProviderTest {

    private static final EnrichmentRequest REQUEST = new EnrichmentRequest("Quarterly budget review", 0.0, 0.5);

    private ExecutorService executor;
    private EnrichmentProvider primary;
    private PipelineObserver observer;
    private CollaboratorGuard guard;
    private ResilientEnrichmentProvider provider;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        primary = mock(EnrichmentProvider.class);
        when(primary.name()).thenReturn("remote");
        observer = mock(PipelineObserver.class);
        guard = ResilienceConfig.guard(ResilienceConfig.ENRICHMENT,
                new PipelineProperties.Collaborators(1L, 1, 1L, null, null, null), executor);
        provider = new ResilientEnrichmentProvider(primary, new RuleBasedEnrichmentProvider(), guard, observer);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReturnPrimaryResultWhenHealthy() {
        Features remote = new Features("Client Relations and Service", List.of("budget"), List.of(), 0.2, 0.7, "workplace");
        when(primary.enrich(any())).thenReturn(EnrichmentResult.ok(remote));

        assertEquals(remote, provider.enrich(REQUEST).value().orElseThrow());
        verifyNoInteractions(observer);
    }

    @Test
    void shouldRetryThenFallBackOnTransportFailure() {
        when(primary.enrich(any())).thenThrow(new TransientIoException("connection reset"));

        EnrichmentResult<Features> result = provider.enrich(REQUEST);

        assertEquals("Financial Planning and Management", result.value().orElseThrow().category());
        verify(primary, times(2)).enrich(REQUEST);
        verify(observer).onFallback(eq("remote"), anyString());
    }

    @Test
    void shouldFallBackOnMalformedResponse() {
        when(primary.enrich(any())).thenReturn(EnrichmentResult.failed(EnrichmentError.malformed("not JSON")));

        EnrichmentResult<Features> result = provider.enrich(REQUEST);

        assertTrue(result.isOk());
        verify(primary, times(1)).enrich(REQUEST);
        verify(observer).onFallback(eq("remote"), contains("not JSON"));
    }

    @Test
    void shouldFallBackWhenPrimaryTimesOut() {
        when(primary.similarity(anyString(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(3_000);
            return EnrichmentResult.ok(0.9);
        });

        EnrichmentResult<Double> result = provider.similarity("budget review", "budget review");

        assertEquals(1.0, result.value().orElseThrow(), 1e-9);
        verify(observer).onFallback(eq("remote"), contains("timed out"));
    }

    @Test
    void shouldStopCallingPrimaryOnceCircuitOpens() {
        when(primary.enrich(any())).thenThrow(new TransientIoException("connection refused"));

        for (int i = 0; i < 5; i++) {
            assertTrue(provider.enrich(REQUEST).isOk());
        }
        assertEquals(CircuitBreaker.State.OPEN, guard.circuitState());

        clearInvocations(primary);
        assertTrue(provider.enrich(REQUEST).isOk());
        verify(primary, never()).enrich(any());
    }
}
