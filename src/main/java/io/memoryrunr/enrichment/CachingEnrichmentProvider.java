package io.memoryrunr.enrichment;

import io.memoryrunr.support.ResponseCache;

import java.util.Optional;

/**
 * Serves repeated enrichment calls from an injected bounded cache. Only successful results are cached.
 */
public class CachingEnrichmentProvider implements EnrichmentProvider {

    private final EnrichmentProvider delegate;
    private final ResponseCache<EnrichmentRequest, Features> featureCache;
    private final ResponseCache<String, Double> similarityCache;

    public CachingEnrichmentProvider(EnrichmentProvider delegate,
                                     ResponseCache<EnrichmentRequest, Features> featureCache,
                                     ResponseCache<String, Double> similarityCache) {
        this.delegate = delegate;
        this.featureCache = featureCache;
        this.similarityCache = similarityCache;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public EnrichmentResult<Features> enrich(EnrichmentRequest request) {
        Optional<Features> cached = featureCache.get(request);
        if (cached.isPresent()) {
            return EnrichmentResult.ok(cached.get());
        }
        EnrichmentResult<Features> result = delegate.enrich(request);
        result.value().ifPresent(features -> featureCache.put(request, features));
        return result;
    }

    @Override
    public EnrichmentResult<Double> similarity(String left, String right) {
        // Similarity is symmetric, so both argument orders share one entry.
        String key = left.compareTo(right) <= 0 ? left + "\u0000" + right : right + "\u0000" + left;
        Optional<Double> cached = similarityCache.get(key);
        if (cached.isPresent()) {
            return EnrichmentResult.ok(cached.get());
        }
        EnrichmentResult<Double> result = delegate.similarity(left, right);
        result.value().ifPresent(score -> similarityCache.put(key, score));
        return result;
    }
}
