package com.scrabble.core.movegen;

import com.scrabble.core.Move;
import java.util.List;

/**
 * Result payload returned by {@link MoveGenerator} implementations.
 */
public record GenerationResult(List<Move> moves, int anchorsSearched, long visitedNodes, long elapsedNanos) {

    public GenerationResult {
        moves = List.copyOf(moves);
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
