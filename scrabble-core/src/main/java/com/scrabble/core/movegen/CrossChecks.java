package com.scrabble.core.movegen;

import com.scrabble.core.Axis;
import com.scrabble.core.Board;
import com.scrabble.core.Line;
import com.scrabble.core.Square;
import com.scrabble.core.Tile;
import com.scrabble.core.gaddag.Gaddag;
import java.util.Arrays;
import java.util.Objects;

/**
 * Cross-check sets of every square of a board, for plays along both axes. A snapshot derived from
 * one board state; recompute after the board changes. Occupied squares accept no letter.
 */
public final class CrossChecks {

    private final int[] masks = new int[2 * Board.CELL_COUNT];
    private final int[] scores = new int[2 * Board.CELL_COUNT];
    private final boolean[] constrained = new boolean[2 * Board.CELL_COUNT];

    private CrossChecks() {
    }

    public static CrossChecks compute(Board board, Gaddag gaddag) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(gaddag, "gaddag");
        CrossChecks checks = new CrossChecks();
        for (Axis axis : Axis.values()) {
            Axis cross = axis.other();
            for (int lineIndex = 0; lineIndex < Board.SIZE; lineIndex++) {
                Line crossLine = board.line(cross, lineIndex);
                for (int position = 0; position < Board.SIZE; position++) {
                    int slot = slot(axis, crossLine.square(position));
                    if (crossLine.isOccupied(position)) {
                        checks.constrained[slot] = true;
                        continue;
                    }
                    int start = crossLine.extentBefore(position);
                    int end = crossLine.extentAfter(position);
                    if (start == position && end == position) {
                        checks.masks[slot] = CrossCheckSet.ALL_LETTERS;
                        continue;
                    }
                    checks.constrained[slot] = true;
                    checks.masks[slot] = acceptedLetters(gaddag, crossLine, start, position, end);
                    checks.scores[slot] = faceValue(crossLine, start, position - 1)
                            + faceValue(crossLine, position + 1, end);
                }
            }
        }
        return checks;
    }

    /*
     * For each letter L the perpendicular word is before + L + after. It is read in GADDAG order:
     * L, the letters before it backwards, then the separator and the letters after it.
     */
    private static int acceptedLetters(Gaddag gaddag, Line line, int start, int position, int end) {
        int mask = 0;
        int candidates = gaddag.letterMask(gaddag.root());
        for (int letter = 0; letter < Gaddag.ALPHABET_SIZE; letter++) {
            if ((candidates & (1 << letter)) == 0) {
                continue;
            }
            int node = gaddag.next(gaddag.root(), letter);
            for (int i = position - 1; i >= start && node != Gaddag.NO_NODE; i--) {
                node = gaddag.nextLetter(node, line.letterAt(i));
            }
            if (end > position) {
                node = gaddag.nextSeparator(node);
                for (int i = position + 1; i <= end && node != Gaddag.NO_NODE; i++) {
                    node = gaddag.nextLetter(node, line.letterAt(i));
                }
            }
            if (gaddag.isTerminal(node)) {
                mask |= 1 << letter;
            }
        }
        return mask;
    }

    private static int faceValue(Line line, int from, int to) {
        int sum = 0;
        for (int i = from; i <= to; i++) {
            Tile tile = line.tileAt(i);
            sum += tile.points();
        }
        return sum;
    }

    public CrossCheckSet get(Axis axis, Square square) {
        int slot = slot(axis, square);
        if (!constrained[slot]) {
            return CrossCheckSet.UNCONSTRAINED;
        }
        return new CrossCheckSet(masks[slot], true, scores[slot]);
    }

    /**
     * Returns the accepted letters on {@code square} for plays along {@code axis}, bit 0 = A.
     */
    public int mask(Axis axis, Square square) {
        return masks[slot(axis, square)];
    }

    /**
     * Same as {@link #mask(Axis, Square)} for the square at {@code position} on line
     * {@code lineIndex} of {@code axis}.
     */
    public int mask(Axis axis, int lineIndex, int position) {
        int index = axis == Axis.HORIZONTAL ? lineIndex * Board.SIZE + position : position * Board.SIZE + lineIndex;
        return masks[axis.ordinal() * Board.CELL_COUNT + index];
    }

    public boolean isConstrained(Axis axis, Square square) {
        return constrained[slot(axis, square)];
    }

    public boolean allows(Axis axis, Square square, char letter) {
        return get(axis, square).allows(letter);
    }

    private static int slot(Axis axis, Square square) {
        return axis.ordinal() * Board.CELL_COUNT + square.index();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CrossChecks)) {
            return false;
        }
        CrossChecks that = (CrossChecks) other;
        return Arrays.equals(masks, that.masks) && Arrays.equals(scores, that.scores)
                && Arrays.equals(constrained, that.constrained);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(masks) + Arrays.hashCode(scores)) + Arrays.hashCode(constrained);
    }
}
