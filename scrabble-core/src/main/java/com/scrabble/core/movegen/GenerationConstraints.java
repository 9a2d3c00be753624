package com.scrabble.core.movegen;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable limits for one {@link MoveGenerator#generate} call. A {@code moveLimit} of zero and a
 * zero {@code timeLimit} mean unlimited. Limits are checked between anchors.
 */
public record GenerationConstraints(int moveLimit, Duration timeLimit, Mode mode) {

    private static final GenerationConstraints UNBOUNDED = new GenerationConstraints(0, Duration.ZERO, Mode.SEQ);

    public GenerationConstraints {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(mode, "mode");
        if (moveLimit < 0) {
            throw new IllegalArgumentException("moveLimit must not be negative");
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
    }

    public static GenerationConstraints unbounded() {
        return UNBOUNDED;
    }

    public static GenerationConstraints of(Mode mode) {
        return new GenerationConstraints(0, Duration.ZERO, mode);
    }

    public boolean hasMoveLimit() {
        return moveLimit > 0;
    }

    /**
     * Execution strategy hint for {@link MoveGenerator} implementations.
     */
    public enum Mode {
        SEQ,
        PAR
    }
}
