package com.scrabble.core.movegen;

import com.scrabble.core.Board;
import com.scrabble.core.Rack;

/**
 * Enumerates the legal plays of a rack on a board.
 */
public interface MoveGenerator {

    /**
     * Generates every legal move of {@code rack} on {@code board} under the supplied
     * {@link GenerationConstraints}. The board must not change while the call runs.
     *
     * @param board       the position to play on
     * @param rack        the tiles of the player to move
     * @param constraints limits and execution strategy
     * @return the generated moves, in no particular order
     * @throws java.util.concurrent.CancellationException if generation was stopped, ran out of
     *                                                    time or exceeded the move limit
     */
    GenerationResult generate(Board board, Rack rack, GenerationConstraints constraints);

    /**
     * Requests cooperative cancellation of the generation currently running.
     */
    void requestStop();
}
