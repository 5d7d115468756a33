package io.memoryrunr.enrichment;

import java.util.Optional;

/**
 * Either a value or an {@link EnrichmentError}. Enrichment failures are data, not exceptions, so
 * callers decide how to degrade.
 */
public final class EnrichmentResult<T> {

    private final T value;
    private final EnrichmentError error;

    private EnrichmentResult(T value, EnrichmentError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> EnrichmentResult<T> ok(T value) {
        return new EnrichmentResult<>(value, null);
    }

    public static <T> EnrichmentResult<T> failed(EnrichmentError error) {
        return new EnrichmentResult<>(null, error);
    }

    public boolean isOk() {
        return error == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<EnrichmentError> error() {
        return Optional.ofNullable(error);
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    @Override
    public String toString() {
        return isOk() ? "ok(" + value + ")" : "failed(" + error + ")";
    }
}
