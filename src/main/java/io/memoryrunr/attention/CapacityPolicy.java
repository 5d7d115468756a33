package io.memoryrunr.attention;

import io.memoryrunr.error.ConfigurationException;

import java.util.List;
import java.util.Random;

/**
 * Working-memory capacity per attention cycle: {@code base +/- variance}, drawn from a generator seeded
 * with the configured seed and the cycle number, so a cycle always sees the same capacity.
 */
public class CapacityPolicy {

    public static final int MIN_CAPACITY = 5;
    public static final int MAX_CAPACITY = 9;

    private final int base;
    private final int variance;
    private final long seed;

    public CapacityPolicy(int base, int variance, long seed) {
        if (variance < 0 || base - variance < MIN_CAPACITY || base + variance > MAX_CAPACITY) {
            throw new ConfigurationException(List.of(
                    "capacity %d+/-%d must stay within [%d,%d]".formatted(base, variance, MIN_CAPACITY, MAX_CAPACITY)));
        }
        this.base = base;
        this.variance = variance;
        this.seed = seed;
    }

    public int capacityFor(long cycle) {
        Random random = new Random(seed * 31 + cycle);
        int drawn = base + random.nextInt(2 * variance + 1) - variance;
        return Math.max(MIN_CAPACITY, Math.min(MAX_CAPACITY, drawn));
    }
}
