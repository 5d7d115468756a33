package io.memoryrunr.enrichment;

/**
 * Why an enrichment call produced no value.
 */
public record EnrichmentError(Kind kind, String message) {

    public enum Kind {
        UNAVAILABLE,
        MALFORMED_RESPONSE,
        UNSUPPORTED
    }

    public static EnrichmentError unavailable(String message) {
        return new EnrichmentError(Kind.UNAVAILABLE, message);
    }

    public static EnrichmentError malformed(String message) {
        return new EnrichmentError(Kind.MALFORMED_RESPONSE, message);
    }
}
