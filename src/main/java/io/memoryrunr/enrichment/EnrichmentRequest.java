package io.memoryrunr.enrichment;

/**
 * Input of a feature extraction call. Sentiment and importance are the values supplied with the
 * source record; providers may refine them.
 */
public record EnrichmentRequest(String text, double sentiment, double importance) {
}
