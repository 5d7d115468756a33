package io.memoryrunr.enrichment;

import io.memoryrunr.support.CaffeineResponseCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CachingEnrichmentProviderTest {

    private EnrichmentProvider delegate;
    private CaffeineResponseCache<EnrichmentRequest, Features> featureCache;
    private CaffeineResponseCache<String, Double> similarityCache;
    private CachingEnrichmentProvider provider;

    @BeforeEach
    void setUp() {
        delegate = mock(EnrichmentProvider.class);
        featureCache = new CaffeineResponseCache<>(100, Duration.ofMinutes(10));
        similarityCache = new CaffeineResponseCache<>(100, Duration.ofMinutes(10));
        provider = new CachingEnrichmentProvider(delegate, featureCache, similarityCache);
    }

    @Test
    void shouldServeRepeatedRequestsFromCache() {
        EnrichmentRequest request = new EnrichmentRequest("Budget review", 0.0, 0.5);
        Features features = new Features("Financial Planning and Management", List.of("budget"), List.of(), 0.0, 0.5, "unspecified");
        when(delegate.enrich(request)).thenReturn(EnrichmentResult.ok(features));

        assertEquals(features, provider.enrich(request).value().orElseThrow());
        assertEquals(features, provider.enrich(new EnrichmentRequest("Budget review", 0.0, 0.5)).value().orElseThrow());

        verify(delegate, times(1)).enrich(any());
    }

    @Test
    void shouldNotCacheFailures() {
        EnrichmentRequest request = new EnrichmentRequest("Budget review", 0.0, 0.5);
        when(delegate.enrich(request)).thenReturn(EnrichmentResult.failed(EnrichmentError.unavailable("down")));

        assertFalse(provider.enrich(request).isOk());
        assertFalse(provider.enrich(request).isOk());

        verify(delegate, times(2)).enrich(request);
        assertEquals(0, featureCache.size());
    }

    @Test
    void shouldShareSimilarityEntryForBothArgumentOrders() {
        when(delegate.similarity("alpha", "beta")).thenReturn(EnrichmentResult.ok(0.4));

        assertEquals(0.4, provider.similarity("alpha", "beta").value().orElseThrow());
        assertEquals(0.4, provider.similarity("beta", "alpha").value().orElseThrow());

        verify(delegate, never()).similarity("beta", "alpha");
        assertEquals(1, similarityCache.size());
    }

    @Test
    void shouldKeepDelegateName() {
        when(delegate.name()).thenReturn("remote");

        assertEquals("remote", provider.name());
    }
}
