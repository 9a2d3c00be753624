package com.scrabble.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Live view of one row or column of a {@link Board}. Positions run from 0 to
 * {@link Board#SIZE} - 1 along the line's axis, so code written against a line works for both
 * orientations.
 */
public final class Line {

    private final Board board;
    private final Axis axis;
    private final int index;

    Line(Board board, Axis axis, int index) {
        if (index < 0 || index >= Board.SIZE) {
            throw new IllegalArgumentException("Line index out of range: " + index);
        }
        this.board = board;
        this.axis = axis;
        this.index = index;
    }

    public Axis axis() {
        return axis;
    }

    public int index() {
        return index;
    }

    public int length() {
        return Board.SIZE;
    }

    public boolean contains(int position) {
        return position >= 0 && position < Board.SIZE;
    }

    public Square square(int position) {
        return axis.square(index, position);
    }

    /**
     * Returns the tile at {@code position}, or {@code null} if the square is empty.
     */
    public Tile tileAt(int position) {
        return board.tileAt(axis, index, position);
    }

    public boolean isOccupied(int position) {
        return board.tileAt(axis, index, position) != null;
    }

    /**
     * Returns {@code true} if {@code position} is off the line or an empty square.
     */
    public boolean isFree(int position) {
        return !contains(position) || !isOccupied(position);
    }

    public char letterAt(int position) {
        Tile tile = tileAt(position);
        if (tile == null) {
            throw new IllegalStateException("Square " + square(position) + " is empty");
        }
        return tile.letter();
    }

    public Premium premium(int position) {
        return Board.premiumAt(square(position));
    }

    /**
     * Returns the first position of the occupied run that ends directly before {@code position},
     * or {@code position} itself if the preceding square is free.
     */
    public int extentBefore(int position) {
        int start = position;
        while (start - 1 >= 0 && isOccupied(start - 1)) {
            start--;
        }
        return start;
    }

    /**
     * Returns the last position of the occupied run that starts directly after {@code position},
     * or {@code position} itself if the following square is free.
     */
    public int extentAfter(int position) {
        int end = position;
        while (end + 1 < Board.SIZE && isOccupied(end + 1)) {
            end++;
        }
        return end;
    }

    public List<Square> squares() {
        List<Square> squares = new ArrayList<>(Board.SIZE);
        for (int position = 0; position < Board.SIZE; position++) {
            squares.add(square(position));
        }
        return squares;
    }
}
