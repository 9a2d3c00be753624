package com.scrabble.core.movegen;

import com.scrabble.core.Axis;
import com.scrabble.core.Board;
import com.scrabble.core.IllegalMoveException;
import com.scrabble.core.Line;
import com.scrabble.core.Move;
import com.scrabble.core.Placement;
import com.scrabble.core.Rack;
import com.scrabble.core.Scorer;
import com.scrabble.core.Square;
import com.scrabble.core.Tile;
import com.scrabble.core.gaddag.Gaddag;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks an arbitrary set of placements against the rules and turns it into a scored
 * {@link Move}: tiles on empty squares in one line without gaps, the first play covering the
 * center and later plays touching a tile, and every word formed found in the dictionary.
 */
public final class MoveValidator {

    private static final int[][] NEIGHBOURS = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};

    private final Gaddag gaddag;

    public MoveValidator(Gaddag gaddag) {
        this.gaddag = Objects.requireNonNull(gaddag, "gaddag");
    }

    /**
     * Validates {@code placements} and additionally checks that {@code rack} holds their tiles.
     */
    public Move validate(Board board, Rack rack, List<Placement> placements) {
        Objects.requireNonNull(rack, "rack");
        Objects.requireNonNull(placements, "placements");
        List<Tile> tiles = new ArrayList<>(placements.size());
        for (Placement placement : placements) {
            tiles.add(placement.tile());
        }
        if (!rack.canSupply(tiles)) {
            throw new IllegalMoveException("Rack " + rack + " does not hold the placed tiles");
        }
        return validate(board, placements);
    }

    /**
     * Returns the move made by {@code placements} on {@code board}.
     *
     * @throws IllegalMoveException if the placements do not form a legal play
     */
    public Move validate(Board board, List<Placement> placements) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(placements, "placements");
        if (placements.isEmpty()) {
            throw new IllegalMoveException("No tiles placed");
        }
        if (placements.size() > Rack.MAX_TILES) {
            throw new IllegalMoveException("At most " + Rack.MAX_TILES + " tiles can be placed");
        }
        Set<Square> squares = new HashSet<>();
        for (Placement placement : placements) {
            if (!squares.add(placement.square())) {
                throw new IllegalMoveException("Square " + placement.square() + " is used twice");
            }
            if (board.isOccupied(placement.square())) {
                throw new IllegalMoveException("Square " + placement.square() + " is already occupied");
            }
        }

        Axis axis = directionOf(board, placements);
        Line line = board.line(axis, axis.lineIndex(placements.get(0).square()));
        int first = Board.SIZE;
        int last = -1;
        for (Placement placement : placements) {
            int position = axis.position(placement.square());
            first = Math.min(first, position);
            last = Math.max(last, position);
        }
        for (int position = first; position <= last; position++) {
            if (!line.isOccupied(position) && !squares.contains(line.square(position))) {
                throw new IllegalMoveException("Placements leave a gap at " + line.square(position));
            }
        }
        if (line.extentAfter(last) - line.extentBefore(first) + 1 < Scorer.MIN_WORD_LENGTH) {
            throw new IllegalMoveException("A play must form a word of at least " + Scorer.MIN_WORD_LENGTH
                    + " letters");
        }

        if (board.isEmpty()) {
            if (!squares.contains(Board.CENTER_SQUARE)) {
                throw new IllegalMoveException("The first play must cover the center square");
            }
        } else if (!touchesTile(board, squares)) {
            throw new IllegalMoveException("Placements are not connected to the tiles on the board");
        }

        Scorer.Evaluation evaluation = Scorer.evaluate(board, axis, placements);
        for (String word : evaluation.words()) {
            if (!gaddag.contains(word)) {
                throw new IllegalMoveException("Word " + word + " is not in the dictionary");
            }
        }
        List<Placement> sorted = new ArrayList<>(placements);
        sorted.sort(Comparator.comparingInt((Placement p) -> p.square().row()).thenComparingInt(p -> p.square().col()));
        return new Move(sorted, axis, evaluation.score(), evaluation.words());
    }

    private static Axis directionOf(Board board, List<Placement> placements) {
        Square first = placements.get(0).square();
        if (placements.size() == 1) {
            Line row = board.line(Axis.HORIZONTAL, first.row());
            if (row.extentBefore(first.col()) != row.extentAfter(first.col())) {
                return Axis.HORIZONTAL;
            }
            Line column = board.line(Axis.VERTICAL, first.col());
            return column.extentBefore(first.row()) != column.extentAfter(first.row()) ? Axis.VERTICAL
                    : Axis.HORIZONTAL;
        }
        boolean sameRow = true;
        boolean sameColumn = true;
        for (Placement placement : placements) {
            sameRow &= placement.square().row() == first.row();
            sameColumn &= placement.square().col() == first.col();
        }
        if (sameRow) {
            return Axis.HORIZONTAL;
        }
        if (sameColumn) {
            return Axis.VERTICAL;
        }
        throw new IllegalMoveException("Placements are not in a single row or column");
    }

    private static boolean touchesTile(Board board, Set<Square> squares) {
        for (Square square : squares) {
            for (int[] offset : NEIGHBOURS) {
                int row = square.row() + offset[0];
                int col = square.col() + offset[1];
                if (Square.isValid(row, col) && board.isOccupied(new Square(row, col))) {
                    return true;
                }
            }
        }
        return false;
    }
}
