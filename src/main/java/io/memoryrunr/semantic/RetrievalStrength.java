package io.memoryrunr.semantic;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.model.SemanticNode;
import io.memoryrunr.support.UnitInterval;

/**
 * {@code scale * (w1*cs + w2/(rank+1) + w3*ln(af+1) + w4*exp(-age/ageDecay))}, clamped to [0,1].
 *
 * <p>Depends only on persisted node fields, so a stored value can always be recomputed exactly.</p>
 */
public final class RetrievalStrength {

    private RetrievalStrength() {
    }

    public static double compute(double consolidatedStrength, int competitionRank, int accessFrequency,
                                 long ageSeconds, double homeostaticScale, PipelineProperties.Semantic weights) {
        double raw = weights.strengthWeight() * consolidatedStrength
                + weights.rankWeight() * (1.0 / (competitionRank + 1))
                + weights.frequencyWeight() * Math.log(accessFrequency + 1.0)
                + weights.recencyWeight() * Math.exp(-ageSeconds / weights.ageDecaySeconds());
        return UnitInterval.clamp(homeostaticScale * raw);
    }

    public static double of(SemanticNode node, PipelineProperties.Semantic weights) {
        return compute(node.consolidatedStrength(), node.competitionRank(), node.accessFrequency(),
                node.ageSeconds(), node.homeostaticScale(), weights);
    }
}
