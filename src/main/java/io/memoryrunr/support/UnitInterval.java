package io.memoryrunr.support;

import io.memoryrunr.error.InvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps strength and retrieval values inside [0,1].
 */
public final class UnitInterval {

    private static final Logger log = LoggerFactory.getLogger(UnitInterval.class);

    private UnitInterval() {
    }

    /** Silent clamp for values that are expected to overshoot, such as multiplicative boosts. */
    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            throw new InvariantViolationException("Strength computation produced NaN");
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Clamp for values that should already be in range. Out-of-range input is logged so the
     * offending record can be traced, then clamped.
     */
    public static double enforce(double value, String field, String recordId) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvariantViolationException("%s of %s is not finite: %s".formatted(field, recordId, value));
        }
        if (value < 0.0 || value > 1.0) {
            log.warn("Clamped {} of {} from {} into [0,1]", field, recordId, value);
        }
        return clamp(value);
    }
}
