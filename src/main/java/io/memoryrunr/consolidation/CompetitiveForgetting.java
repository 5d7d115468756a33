package io.memoryrunr.consolidation;

import io.memoryrunr.support.UnitInterval;

/**
 * Weak traces decay, strong traces grow. Anything between the two thresholds is left alone.
 */
public class CompetitiveForgetting {

    static final double DECAY_FACTOR = 0.8;
    static final double STRENGTHEN_FACTOR = 1.2;

    private final double decayThreshold;
    private final double strengthenThreshold;

    public CompetitiveForgetting(double decayThreshold, double strengthenThreshold) {
        this.decayThreshold = decayThreshold;
        this.strengthenThreshold = strengthenThreshold;
    }

    public double apply(double strength) {
        if (strength < decayThreshold) {
            return UnitInterval.clamp(strength * DECAY_FACTOR);
        }
        if (strength > strengthenThreshold) {
            return UnitInterval.clamp(strength * STRENGTHEN_FACTOR);
        }
        return UnitInterval.clamp(strength);
    }
}
