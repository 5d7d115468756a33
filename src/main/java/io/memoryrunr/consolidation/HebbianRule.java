package io.memoryrunr.consolidation;

import io.memoryrunr.error.ConfigurationException;
import io.memoryrunr.support.UnitInterval;

import java.util.List;

/**
 * Hebbian strengthening: {@code new = old * (1 + lr * pre * post)}, clamped to [0,1].
 */
public class HebbianRule {

    public static final double MIN_LEARNING_RATE = 0.05;
    public static final double MAX_LEARNING_RATE = 0.2;

    private final double learningRate;

    public HebbianRule(double learningRate) {
        if (Double.isNaN(learningRate) || learningRate < MIN_LEARNING_RATE || learningRate > MAX_LEARNING_RATE) {
            throw new ConfigurationException(List.of("learning rate %s must be within [%s, %s]"
                    .formatted(learningRate, MIN_LEARNING_RATE, MAX_LEARNING_RATE)));
        }
        this.learningRate = learningRate;
    }

    public double learningRate() {
        return learningRate;
    }

    /**
     * @param old  current strength or edge weight
     * @param pre  presynaptic activity in [0,1]
     * @param post postsynaptic activity in [0,1]
     */
    public double apply(double old, double pre, double post) {
        return UnitInterval.clamp(old * (1 + learningRate * UnitInterval.clamp(pre) * UnitInterval.clamp(post)));
    }
}
