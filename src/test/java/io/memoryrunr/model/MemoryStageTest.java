package io.memoryrunr.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStageTest {

    @Test
    void shouldParseCaseInsensitively() {
        assertEquals(MemoryStage.SEMANTIC, MemoryStage.fromString(" semantic "));
        assertEquals(MemoryStage.HOMEOSTASIS, MemoryStage.fromString("HOMEOSTASIS"));
    }

    @Test
    void shouldRejectBlankOrUnknownNames() {
        assertThrows(IllegalArgumentException.class, () -> MemoryStage.fromString(" "));
        assertThrows(IllegalArgumentException.class, () -> MemoryStage.fromString(null));
        assertThrows(IllegalArgumentException.class, () -> MemoryStage.fromString("sleep"));
    }
}
