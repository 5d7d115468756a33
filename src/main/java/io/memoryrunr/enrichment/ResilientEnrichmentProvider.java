package io.memoryrunr.enrichment;

import io.memoryrunr.error.TransientIoException;
import io.memoryrunr.observability.PipelineObserver;
import io.memoryrunr.support.CollaboratorGuard;

/**
 * Calls the primary provider through a {@link CollaboratorGuard} and switches to the fallback when the
 * call times out, keeps failing after retries, the circuit is open, or the response is unusable.
 */
public class ResilientEnrichmentProvider implements EnrichmentProvider {

    private final EnrichmentProvider primary;
    private final EnrichmentProvider fallback;
    private final CollaboratorGuard guard;
    private final PipelineObserver observer;

    public ResilientEnrichmentProvider(EnrichmentProvider primary, EnrichmentProvider fallback,
                                       CollaboratorGuard guard, PipelineObserver observer) {
        this.primary = primary;
        this.fallback = fallback;
        this.guard = guard;
        this.observer = observer;
    }

    @Override
    public String name() {
        return primary.name() + "+" + fallback.name();
    }

    @Override
    public EnrichmentResult<Features> enrich(EnrichmentRequest request) {
        try {
            EnrichmentResult<Features> result = guard.call(() -> primary.enrich(request));
            if (result.isOk()) {
                return result;
            }
            observer.onFallback(primary.name(), String.valueOf(result.error().orElse(null)));
        } catch (TransientIoException e) {
            observer.onFallback(primary.name(), e.getMessage());
        }
        return fallback.enrich(request);
    }

    @Override
    public EnrichmentResult<Double> similarity(String left, String right) {
        try {
            EnrichmentResult<Double> result = guard.call(() -> primary.similarity(left, right));
            if (result.isOk()) {
                return result;
            }
            observer.onFallback(primary.name(), String.valueOf(result.error().orElse(null)));
        } catch (TransientIoException e) {
            observer.onFallback(primary.name(), e.getMessage());
        }
        return fallback.similarity(left, right);
    }
}
