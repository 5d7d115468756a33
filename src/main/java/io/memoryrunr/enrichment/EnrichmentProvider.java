package io.memoryrunr.enrichment;

/**
 * Cognitive enrichment collaborator: feature extraction for memory items and pairwise similarity
 * for replay. Core logic only sees this interface.
 */
public interface EnrichmentProvider {

    String name();

    EnrichmentResult<Features> enrich(EnrichmentRequest request);

    /**
     * Similarity of two replay profiles in [0,1].
     */
    EnrichmentResult<Double> similarity(String left, String right);
}
