package com.scrabble.core.movegen;

import com.scrabble.core.Axis;
import com.scrabble.core.Board;
import com.scrabble.core.Move;
import com.scrabble.core.Rack;
import com.scrabble.core.Square;
import com.scrabble.core.gaddag.Gaddag;
import com.scrabble.core.movegen.parallel.ForkJoinMoveGenerator;
import com.scrabble.core.movegen.state.TraversalState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Move generator walking the GADDAG from every anchor, horizontally and then vertically.
 * Sequential by default; {@link GenerationConstraints.Mode#PAR} hands the anchors to a
 * {@link ForkJoinMoveGenerator}.
 */
public final class GaddagMoveGenerator implements MoveGenerator {

    private static final Logger LOGGER = Logger.getLogger(GaddagMoveGenerator.class.getName());

    private final Gaddag gaddag;
    private final TraversalState traversalState = new TraversalState();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final ForkJoinMoveGenerator parallelGenerator;

    private long lastVisitedNodes;

    public GaddagMoveGenerator(Gaddag gaddag) {
        this(gaddag, new ForkJoinMoveGenerator(gaddag));
    }

    /**
     * Uses {@code parallelGenerator}, which must walk the same automaton, for
     * {@link GenerationConstraints.Mode#PAR} calls.
     */
    public GaddagMoveGenerator(Gaddag gaddag, ForkJoinMoveGenerator parallelGenerator) {
        this.gaddag = Objects.requireNonNull(gaddag, "gaddag");
        this.parallelGenerator = Objects.requireNonNull(parallelGenerator, "parallelGenerator");
    }

    /**
     * Generates all moves without limits on the calling thread.
     */
    public List<Move> generateMoves(Board board, Rack rack) {
        return generate(board, rack, GenerationConstraints.unbounded()).moves();
    }

    public long getLastVisitedNodeCount() {
        return lastVisitedNodes;
    }

    @Override
    public void requestStop() {
        stopRequested.set(true);
    }

    @Override
    public GenerationResult generate(Board board, Rack rack, GenerationConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(rack, "rack");
        Objects.requireNonNull(constraints, "constraints");

        long start = System.nanoTime();
        long deadline = toDeadline(start, constraints.timeLimit());
        try {
            if (constraints.mode() == GenerationConstraints.Mode.PAR) {
                GenerationResult result = parallelGenerator.generate(board, rack, constraints, stopRequested);
                lastVisitedNodes = result.visitedNodes();
                return result;
            }

            CrossChecks crossChecks = CrossChecks.compute(board, gaddag);
            boolean[] anchorMask = AnchorFinder.anchorMask(board);
            List<Square> anchors = AnchorFinder.find(board);
            AnchorTraversal traversal = new AnchorTraversal(gaddag, board, crossChecks, anchorMask, traversalState);

            List<Move> moves = new ArrayList<>();
            for (Square anchor : anchors) {
                checkLimits(deadline, moves.size(), constraints);
                for (Axis axis : Axis.values()) {
                    traversal.traverse(anchor, axis, rack, moves);
                }
            }
            checkLimits(deadline, moves.size(), constraints);

            long elapsed = System.nanoTime() - start;
            lastVisitedNodes = traversal.visitedNodes();
            final int moveCount = moves.size();
            final int anchorCount = anchors.size();
            final long visited = traversal.visitedNodes();
            LOGGER.info(() -> String.format("Generated %d moves from %d anchors (%d nodes, %.2f ms, rack=%s)",
                    moveCount, anchorCount, visited, elapsed / 1_000_000.0, rack));
            return new GenerationResult(moves, anchorCount, visited, elapsed);
        } finally {
            stopRequested.set(false);
        }
    }

    private void checkLimits(long deadline, int moveCount, GenerationConstraints constraints) {
        if (stopRequested.get()) {
            throw new CancellationException("Move generation stopped on request");
        }
        if (deadline != Long.MAX_VALUE && System.nanoTime() >= deadline) {
            throw new CancellationException("Move generation exceeded " + constraints.timeLimit());
        }
        if (constraints.hasMoveLimit() && moveCount > constraints.moveLimit()) {
            throw new CancellationException("Move generation exceeded " + constraints.moveLimit() + " moves");
        }
    }

    private static long toDeadline(long start, Duration timeLimit) {
        if (timeLimit.isZero()) {
            return Long.MAX_VALUE;
        }
        long result = start + timeLimit.toNanos();
        return result < start ? Long.MAX_VALUE : result;
    }
}
