package com.scrabble.core.movegen.parallel;

import com.scrabble.core.Axis;
import com.scrabble.core.Board;
import com.scrabble.core.Move;
import com.scrabble.core.Rack;
import com.scrabble.core.Square;
import com.scrabble.core.gaddag.Gaddag;
import com.scrabble.core.movegen.AnchorFinder;
import com.scrabble.core.movegen.AnchorTraversal;
import com.scrabble.core.movegen.CrossChecks;
import com.scrabble.core.movegen.GenerationConstraints;
import com.scrabble.core.movegen.GenerationResult;
import com.scrabble.core.movegen.MoveGenerator;
import com.scrabble.core.movegen.state.TraversalState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Parallel move generator. The anchor list is split recursively into fork-join tasks; every task
 * walks its anchors with a {@link TraversalState} borrowed from this generator over one read-only
 * board snapshot, and the partial move lists are concatenated in anchor order.
 */
public final class ForkJoinMoveGenerator implements MoveGenerator {

    private static final Logger LOGGER = Logger.getLogger(ForkJoinMoveGenerator.class.getName());
    private static final int SPLIT_THRESHOLD = 4;

    private final Gaddag gaddag;
    private final ForkJoinPool pool;
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final ConcurrentLinkedQueue<TraversalState> idleStates = new ConcurrentLinkedQueue<>();

    public ForkJoinMoveGenerator(Gaddag gaddag) {
        this(gaddag, ForkJoinPool.commonPool());
    }

    public ForkJoinMoveGenerator(Gaddag gaddag, int parallelism) {
        this(gaddag, newPool(parallelism));
    }

    public ForkJoinMoveGenerator(Gaddag gaddag, ForkJoinPool pool) {
        this.gaddag = Objects.requireNonNull(gaddag, "gaddag");
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /**
     * Requests cooperative cancellation of the currently running generation.
     */
    @Override
    public void requestStop() {
        stopRequested.set(true);
    }

    /**
     * Shuts down the pool unless it is the common pool.
     */
    public void shutdown() {
        if (pool != ForkJoinPool.commonPool()) {
            pool.shutdown();
        }
    }

    @Override
    public GenerationResult generate(Board board, Rack rack, GenerationConstraints constraints) {
        try {
            return generate(board, rack, constraints, stopRequested);
        } finally {
            stopRequested.set(false);
        }
    }

    /**
     * Same as {@link #generate(Board, Rack, GenerationConstraints)}, but polls {@code stopFlag}
     * instead of the flag set by {@link #requestStop()}. The caller owns {@code stopFlag} and
     * resets it.
     */
    public GenerationResult generate(Board board, Rack rack, GenerationConstraints constraints,
            AtomicBoolean stopFlag) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(rack, "rack");
        Objects.requireNonNull(constraints, "constraints");
        Objects.requireNonNull(stopFlag, "stopFlag");

        long start = System.nanoTime();
        long deadline = toDeadline(start, constraints.timeLimit());
        Board snapshot = board.snapshot();
        CrossChecks crossChecks = CrossChecks.compute(snapshot, gaddag);
        boolean[] anchorMask = AnchorFinder.anchorMask(snapshot);
        List<Square> anchors = AnchorFinder.find(snapshot);

        GenerationContext context = new GenerationContext(snapshot, rack, crossChecks, anchorMask, deadline,
                constraints.moveLimit(), stopFlag);
        List<Move> moves = anchors.isEmpty()
                ? List.of()
                : pool.invoke(new AnchorRangeTask(anchors, 0, anchors.size(), context));
        if (context.wasAborted()) {
            throw new CancellationException(context.abortReason());
        }

        long elapsed = System.nanoTime() - start;
        final int moveCount = moves.size();
        final int anchorCount = anchors.size();
        final long visited = context.visitedNodes();
        LOGGER.info(() -> String.format(
                "Generated %d moves from %d anchors in parallel (%d nodes, %.2f ms, rack=%s)",
                moveCount, anchorCount, visited, elapsed / 1_000_000.0, rack));
        return new GenerationResult(moves, anchorCount, visited, elapsed);
    }

    private static ForkJoinPool newPool(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        return new ForkJoinPool(parallelism);
    }

    private static long toDeadline(long start, Duration timeLimit) {
        if (timeLimit.isZero()) {
            return Long.MAX_VALUE;
        }
        long result = start + timeLimit.toNanos();
        return result < start ? Long.MAX_VALUE : result;
    }

    private List<Move> searchRange(List<Square> anchors, int from, int to, GenerationContext context) {
        TraversalState state = idleStates.poll();
        if (state == null) {
            state = new TraversalState();
        }
        try {
            AnchorTraversal traversal = new AnchorTraversal(gaddag, context.board, context.crossChecks,
                    context.anchorMask, state);
            List<Move> moves = new ArrayList<>();
            for (int i = from; i < to && !context.shouldAbort(); i++) {
                int before = moves.size();
                for (Axis axis : Axis.values()) {
                    traversal.traverse(anchors.get(i), axis, context.rack, moves);
                }
                context.moveCount.addAndGet(moves.size() - before);
            }
            context.visitedNodes.addAndGet(traversal.visitedNodes());
            return moves;
        } finally {
            idleStates.offer(state);
        }
    }

    private final class AnchorRangeTask extends RecursiveTask<List<Move>> {

        private final List<Square> anchors;
        private final int from;
        private final int to;
        private final GenerationContext context;

        private AnchorRangeTask(List<Square> anchors, int from, int to, GenerationContext context) {
            this.anchors = anchors;
            this.from = from;
            this.to = to;
            this.context = context;
        }

        @Override
        protected List<Move> compute() {
            if (to - from <= SPLIT_THRESHOLD) {
                return searchRange(anchors, from, to, context);
            }
            int middle = (from + to) >>> 1;
            AnchorRangeTask left = new AnchorRangeTask(anchors, from, middle, context);
            AnchorRangeTask right = new AnchorRangeTask(anchors, middle, to, context);
            left.fork();
            List<Move> rightMoves = right.compute();
            List<Move> leftMoves = left.join();
            List<Move> merged = new ArrayList<>(leftMoves.size() + rightMoves.size());
            merged.addAll(leftMoves);
            merged.addAll(rightMoves);
            return merged;
        }
    }

    /**
     * Read-only inputs of one call plus the counters its tasks share.
     */
    private static final class GenerationContext {
        private final Board board;
        private final Rack rack;
        private final CrossChecks crossChecks;
        private final boolean[] anchorMask;
        private final long deadline;
        private final int moveLimit;
        private final AtomicBoolean stopFlag;
        private final AtomicLong visitedNodes = new AtomicLong();
        private final AtomicInteger moveCount = new AtomicInteger();
        private volatile String abortReason;

        private GenerationContext(Board board, Rack rack, CrossChecks crossChecks, boolean[] anchorMask,
                long deadline, int moveLimit, AtomicBoolean stopFlag) {
            this.board = board;
            this.rack = rack;
            this.crossChecks = crossChecks;
            this.anchorMask = anchorMask;
            this.deadline = deadline;
            this.moveLimit = moveLimit;
            this.stopFlag = stopFlag;
        }

        private boolean shouldAbort() {
            if (abortReason != null) {
                return true;
            }
            if (stopFlag.get()) {
                abortReason = "Move generation stopped on request";
            } else if (deadline != Long.MAX_VALUE && System.nanoTime() >= deadline) {
                abortReason = "Move generation ran out of time";
            } else if (moveLimit > 0 && moveCount.get() > moveLimit) {
                abortReason = "Move generation exceeded " + moveLimit + " moves";
            }
            return abortReason != null;
        }

        private long visitedNodes() {
            return visitedNodes.get();
        }

        private boolean wasAborted() {
            // a limit crossed by the last anchors is only noticed here
            return shouldAbort();
        }

        private String abortReason() {
            return abortReason;
        }
    }
}
