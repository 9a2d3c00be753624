package com.scrabble.core.movegen;

import com.scrabble.core.Axis;
import com.scrabble.core.Board;
import com.scrabble.core.Line;
import com.scrabble.core.Move;
import com.scrabble.core.Placement;
import com.scrabble.core.Rack;
import com.scrabble.core.Scorer;
import com.scrabble.core.Square;
import com.scrabble.core.Tile;
import com.scrabble.core.gaddag.Gaddag;
import com.scrabble.core.movegen.state.TraversalState;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Walks the GADDAG and one board line together, outwards from an anchor.
 *
 * <p>The walk first covers the anchor, then moves backwards placing rack tiles or reading the
 * tiles already on the line. Wherever the automaton offers the separator it may turn and continue
 * forwards from the square after the anchor. Moving backwards stops at the line edge and in front
 * of another anchor, so each play is produced only from the leftmost anchor it covers. Letters are
 * tried only if the current node has an arc for them, the square's cross-check accepts them and
 * the rack still holds them (or a blank).
 *
 * <p>Not thread-safe: one instance per worker, reading a board that does not change during the
 * walk.
 */
public final class AnchorTraversal {

    private static final Comparator<Placement> BY_SQUARE = Comparator
            .comparingInt((Placement p) -> p.square().row())
            .thenComparingInt(p -> p.square().col());

    private final Gaddag gaddag;
    private final Board board;
    private final CrossChecks crossChecks;
    private final boolean[] anchors;
    private final TraversalState state;

    private Line line;
    private Axis axis;
    private int anchor;
    private List<Move> sink;
    private long visitedNodes;

    public AnchorTraversal(Gaddag gaddag, Board board, CrossChecks crossChecks, boolean[] anchors,
            TraversalState state) {
        this.gaddag = Objects.requireNonNull(gaddag, "gaddag");
        this.board = Objects.requireNonNull(board, "board");
        this.crossChecks = Objects.requireNonNull(crossChecks, "crossChecks");
        this.anchors = Objects.requireNonNull(anchors, "anchors");
        this.state = Objects.requireNonNull(state, "state");
    }

    /**
     * Adds to {@code moves} every play along {@code axis} whose leftmost anchor is
     * {@code anchorSquare}.
     *
     * @return the number of moves added
     */
    public int traverse(Square anchorSquare, Axis axis, Rack rack, List<Move> moves) {
        Objects.requireNonNull(anchorSquare, "anchorSquare");
        Objects.requireNonNull(axis, "axis");
        Objects.requireNonNull(rack, "rack");
        if (board.isOccupied(anchorSquare)) {
            throw new IllegalArgumentException("Anchor " + anchorSquare + " is occupied");
        }
        if (rack.isEmpty()) {
            return 0;
        }
        this.axis = axis;
        this.line = board.line(axis, axis.lineIndex(anchorSquare));
        this.anchor = axis.position(anchorSquare);
        this.sink = Objects.requireNonNull(moves, "moves");
        int before = moves.size();
        state.reset(rack);
        try {
            extend(anchor, gaddag.root(), anchor, false);
        } finally {
            this.sink = null;
            this.line = null;
        }
        return moves.size() - before;
    }

    public long visitedNodes() {
        return visitedNodes;
    }

    private void extend(int position, int node, int leftmost, boolean forward) {
        if (line.isOccupied(position)) {
            int next = gaddag.nextLetter(node, line.letterAt(position));
            goOn(position, next, leftmost, forward);
            return;
        }
        if (!state.hasTiles()) {
            return;
        }
        int candidates = gaddag.letterMask(node) & crossChecks.mask(axis, line.index(), position);
        int fromRack = candidates & state.rackLetterMask();
        for (int bits = fromRack; bits != 0; bits &= bits - 1) {
            int symbol = Integer.numberOfTrailingZeros(bits);
            state.push(position, (char) ('A' + symbol), false);
            goOn(position, gaddag.next(node, symbol), leftmost, forward);
            state.pop();
        }
        if (state.blankCount() > 0) {
            for (int bits = candidates; bits != 0; bits &= bits - 1) {
                int symbol = Integer.numberOfTrailingZeros(bits);
                state.push(position, (char) ('A' + symbol), true);
                goOn(position, gaddag.next(node, symbol), leftmost, forward);
                state.pop();
            }
        }
    }

    private void goOn(int position, int node, int leftmost, boolean forward) {
        if (node == Gaddag.NO_NODE) {
            return;
        }
        visitedNodes++;
        if (!forward) {
            if (gaddag.isTerminal(node) && line.isFree(position - 1) && line.isFree(anchor + 1)) {
                record(position, anchor);
            }
            if (canMoveBack(position)) {
                extend(position - 1, node, position - 1, false);
            }
            int pivot = gaddag.nextSeparator(node);
            if (pivot != Gaddag.NO_NODE && line.isFree(position - 1) && line.contains(anchor + 1)) {
                extend(anchor + 1, pivot, position, true);
            }
        } else {
            if (gaddag.isTerminal(node) && line.isFree(position + 1)) {
                record(leftmost, position);
            }
            if (line.contains(position + 1)) {
                extend(position + 1, node, leftmost, true);
            }
        }
    }

    private boolean canMoveBack(int position) {
        int previous = position - 1;
        if (previous < 0) {
            return false;
        }
        return line.isOccupied(previous) || !anchors[line.square(previous).index()];
    }

    private void record(int start, int end) {
        int placed = state.placedCount();
        if (placed == 0 || end - start + 1 < Scorer.MIN_WORD_LENGTH) {
            return;
        }
        if (placed == 1 && axis == Axis.VERTICAL
                && crossChecks.isConstrained(Axis.VERTICAL, line.square(state.positionAt(0)))) {
            // the horizontal pass already produced this single tile
            return;
        }
        List<Placement> placements = new ArrayList<>(placed);
        for (int i = 0; i < placed; i++) {
            char letter = state.letterAt(i);
            Tile tile = state.isBlankAt(i) ? Tile.blankAs(letter) : Tile.of(letter);
            placements.add(new Placement(line.square(state.positionAt(i)), tile));
        }
        placements.sort(BY_SQUARE);
        Scorer.Evaluation evaluation = Scorer.evaluate(board, axis, placements);
        sink.add(new Move(placements, axis, evaluation.score(), evaluation.words()));
    }
}
