package io.memoryrunr.support;

import io.memoryrunr.error.InvariantViolationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContentHashesTest {

    @Test
    void shouldIgnoreMapIterationOrder() {
        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("salience", 0.8);
        forward.put("importance", 0.5);
        Map<String, Object> backward = new LinkedHashMap<>();
        backward.put("importance", 0.5);
        backward.put("salience", 0.8);

        assertEquals(ContentHashes.ofMap(forward), ContentHashes.ofMap(backward));
        assertNotEquals(ContentHashes.ofMap(forward), ContentHashes.ofMap(new HashMap<>(Map.of("salience", 0.9))));
    }

    @Test
    void shouldProduceSha256Hex() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", ContentHashes.of("abc"));
    }

    @Test
    void shouldDependOnBatchOrder() {
        assertNotEquals(ContentHashes.ofBatch(List.of("a", "b")), ContentHashes.ofBatch(List.of("b", "a")));
    }

    @Test
    void shouldClampIntoUnitInterval() {
        assertEquals(1.0, UnitInterval.clamp(1.3));
        assertEquals(0.0, UnitInterval.clamp(-0.2));
        assertEquals(0.4, UnitInterval.enforce(0.4, "strength", "ep-1"));
        assertEquals(1.0, UnitInterval.enforce(1.01, "strength", "ep-1"));
        assertThrows(InvariantViolationException.class, () -> UnitInterval.clamp(Double.NaN));
        assertThrows(InvariantViolationException.class,
                () -> UnitInterval.enforce(Double.POSITIVE_INFINITY, "strength", "ep-1"));
    }
}
