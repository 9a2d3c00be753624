package com.scrabble.core.movegen.parallel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.scrabble.core.Board;
import com.scrabble.core.Rack;
import com.scrabble.core.Square;
import com.scrabble.core.Tile;
import com.scrabble.core.gaddag.Gaddag;
import com.scrabble.core.gaddag.GaddagBuilder;
import com.scrabble.core.movegen.GaddagMoveGenerator;
import com.scrabble.core.movegen.GenerationConstraints;
import com.scrabble.core.movegen.GenerationResult;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

class ForkJoinMoveGeneratorTest {

    private static final Gaddag GADDAG = GaddagBuilder.build(List.of("CAT", "CATS", "AT", "TA", "ACT", "ACTS",
            "SCAT", "CAST", "AS", "TAS", "SAT", "TACT", "TACTS", "STAT", "TASK", "ASK", "TSK"));

    private static Board board() {
        Board board = new Board();
        board.place(new Square(7, 7), Tile.of('C'));
        board.place(new Square(7, 8), Tile.of('A'));
        board.place(new Square(7, 9), Tile.of('T'));
        // TACT down from the T
        board.place(new Square(8, 9), Tile.of('A'));
        board.place(new Square(9, 9), Tile.of('C'));
        board.place(new Square(10, 9), Tile.of('T'));
        return board;
    }

    @Test
    void matchesSequentialGenerator() {
        ForkJoinMoveGenerator generator = new ForkJoinMoveGenerator(GADDAG, 2);
        try {
            Board board = board();
            Rack rack = Rack.of("SKAT?");
            GenerationResult parallel = generator.generate(board, rack, GenerationConstraints.unbounded());
            GenerationResult sequential = new GaddagMoveGenerator(GADDAG).generate(board, rack,
                    GenerationConstraints.unbounded());

            assertEquals(sequential.moves(), parallel.moves());
            assertEquals(sequential.anchorsSearched(), parallel.anchorsSearched());
            assertTrue(parallel.visitedNodes() > 0);
        } finally {
            generator.shutdown();
        }
    }

    @Test
    void repeatedRunsAgree() {
        ForkJoinMoveGenerator generator = new ForkJoinMoveGenerator(GADDAG, 4);
        try {
            GenerationResult first = generator.generate(board(), Rack.of("CAST"), GenerationConstraints.unbounded());
            GenerationResult second = generator.generate(board(), Rack.of("CAST"), GenerationConstraints.unbounded());

            assertEquals(first.moves(), second.moves());
        } finally {
            generator.shutdown();
        }
    }

    @Test
    void doesNotChangeBoard() {
        ForkJoinMoveGenerator generator = new ForkJoinMoveGenerator(GADDAG);
        Board board = board();
        Board before = board.copy();

        generator.generate(board, Rack.of("CAST"), GenerationConstraints.unbounded());

        assertEquals(before, board);
        assertFalse(board.isReadOnly());
    }

    @Test
    void honoursLimitsAndStopRequests() {
        ForkJoinMoveGenerator generator = new ForkJoinMoveGenerator(GADDAG, 2);
        try {
            assertThrows(CancellationException.class, () -> generator.generate(board(), Rack.of("CAST"),
                    new GenerationConstraints(1, Duration.ZERO, GenerationConstraints.Mode.PAR)));
            assertThrows(CancellationException.class, () -> generator.generate(board(), Rack.of("CAST"),
                    new GenerationConstraints(0, Duration.ofNanos(1), GenerationConstraints.Mode.PAR)));

            generator.requestStop();
            assertThrows(CancellationException.class,
                    () -> generator.generate(board(), Rack.of("CAST"), GenerationConstraints.unbounded()));
            assertTrue(generator.generate(board(), Rack.of("CAST"), GenerationConstraints.unbounded())
                    .moves().size() > 1);
        } finally {
            generator.shutdown();
        }
    }

    @Test
    void rejectsInvalidParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new ForkJoinMoveGenerator(GADDAG, 0));
    }
}
