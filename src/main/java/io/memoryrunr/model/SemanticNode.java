package io.memoryrunr.model;

import java.time.Instant;

/**
 * Final long-term entity in the semantic network.
 *
 * @param id                    equal to the consolidated memory id
 * @param semanticCategory      cortical category
 * @param clusterId             assigned cluster in {@code [0, K)}, sticky until a re-cluster runs
 * @param consolidatedStrength  strength carried over from consolidation
 * @param competitionRank       1-based rank inside the cluster
 * @param accessFrequency       accesses during the rolling 7-day window
 * @param homeostaticScale      multiplicative factor applied by homeostatic rescaling
 * @param retrievalStrength     derived from the fields above, see {@code RetrievalStrength}
 * @param ageCategory           age bucket at {@code evaluatedAt}
 * @param consolidationState    episodic/consolidating/schematized
 * @param createdAt             creation time of the underlying memory
 * @param evaluatedAt           time the derived fields were computed
 */
public record SemanticNode(
        String id,
        String semanticCategory,
        int clusterId,
        double consolidatedStrength,
        int competitionRank,
        int accessFrequency,
        double homeostaticScale,
        double retrievalStrength,
        AgeCategory ageCategory,
        ConsolidationState consolidationState,
        Instant createdAt,
        Instant evaluatedAt
) {

    public long ageSeconds() {
        return Math.max(0, evaluatedAt.getEpochSecond() - createdAt.getEpochSecond());
    }

    public SemanticNode withCluster(int clusterId) {
        return new SemanticNode(id, semanticCategory, clusterId, consolidatedStrength, competitionRank,
                accessFrequency, homeostaticScale, retrievalStrength, ageCategory, consolidationState,
                createdAt, evaluatedAt);
    }

    public SemanticNode withScale(double homeostaticScale) {
        return new SemanticNode(id, semanticCategory, clusterId, consolidatedStrength, competitionRank,
                accessFrequency, homeostaticScale, retrievalStrength, ageCategory, consolidationState,
                createdAt, evaluatedAt);
    }
}
