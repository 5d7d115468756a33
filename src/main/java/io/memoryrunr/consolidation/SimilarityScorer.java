package io.memoryrunr.consolidation;

import io.memoryrunr.enrichment.EnrichmentProvider;
import io.memoryrunr.enrichment.EnrichmentResult;
import io.memoryrunr.model.Episode;
import io.memoryrunr.support.UnitInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Pairwise episode similarity through the enrichment collaborator. An unavailable collaborator yields
 * no score, never an exception, so replay degrades to an empty association list.
 */
public class SimilarityScorer {

    private static final Logger log = LoggerFactory.getLogger(SimilarityScorer.class);

    private final EnrichmentProvider enrichment;

    public SimilarityScorer(EnrichmentProvider enrichment) {
        this.enrichment = enrichment;
    }

    public Optional<Double> score(Episode left, Episode right) {
        EnrichmentResult<Double> result;
        try {
            result = enrichment.similarity(left.profile(), right.profile());
        } catch (RuntimeException e) {
            log.warn("Similarity of {} and {} unavailable: {}", left.id(), right.id(), e.getMessage());
            return Optional.empty();
        }
        if (!result.isOk()) {
            log.debug("Similarity of {} and {} failed: {}", left.id(), right.id(), result.error().orElse(null));
            return Optional.empty();
        }
        return result.value().map(UnitInterval::clamp);
    }
}
