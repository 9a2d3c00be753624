package com.scrabble.core.movegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class GenerationConstraintsTest {

    @Test
    void unboundedHasNoLimits() {
        GenerationConstraints constraints = GenerationConstraints.unbounded();

        assertFalse(constraints.hasMoveLimit());
        assertTrue(constraints.timeLimit().isZero());
        assertEquals(GenerationConstraints.Mode.SEQ, constraints.mode());
        assertEquals(GenerationConstraints.Mode.PAR, GenerationConstraints.of(GenerationConstraints.Mode.PAR).mode());
    }

    @Test
    void rejectsNegativeLimits() {
        assertThrows(IllegalArgumentException.class,
                () -> new GenerationConstraints(-1, Duration.ZERO, GenerationConstraints.Mode.SEQ));
        assertThrows(IllegalArgumentException.class,
                () -> new GenerationConstraints(0, Duration.ofMillis(-5), GenerationConstraints.Mode.SEQ));
        assertThrows(NullPointerException.class, () -> new GenerationConstraints(0, Duration.ZERO, null));
    }
}
