package io.memoryrunr.consolidation;

import io.memoryrunr.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HebbianRuleTest {

    @Test
    void shouldStrengthenInProportionToCoActivity() {
        HebbianRule rule = new HebbianRule(0.1);

        assertEquals(0.624, rule.apply(0.6, 0.8, 0.5), 1e-12);
    }

    @Test
    void shouldLeaveStrengthUnchangedWithoutActivity() {
        HebbianRule rule = new HebbianRule(0.1);

        assertEquals(0.6, rule.apply(0.6, 0.0, 0.9), 1e-12);
        assertEquals(0.6, rule.apply(0.6, 0.9, 0.0), 1e-12);
    }

    @Test
    void shouldClampToUnitInterval() {
        HebbianRule rule = new HebbianRule(0.2);

        assertEquals(1.0, rule.apply(0.95, 1.0, 1.0), 1e-12);
        assertEquals(0.5 * 1.2, rule.apply(0.5, 3.0, 7.0), 1e-12);
    }

    @Test
    void shouldRejectLearningRateOutsideBounds() {
        assertThrows(ConfigurationException.class, () -> new HebbianRule(0.01));
        assertThrows(ConfigurationException.class, () -> new HebbianRule(0.25));
        assertEquals(0.05, new HebbianRule(0.05).learningRate());
        assertEquals(0.2, new HebbianRule(0.2).learningRate());
    }
}
