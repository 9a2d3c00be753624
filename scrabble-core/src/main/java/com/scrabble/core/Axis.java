package com.scrabble.core;

/**
 * Direction along which a word is read. A square is addressed on an axis by the index of its line
 * (row for {@link #HORIZONTAL}, column for {@link #VERTICAL}) and its position along that line.
 */
public enum Axis {
    HORIZONTAL,
    VERTICAL;

    public Axis other() {
        return this == HORIZONTAL ? VERTICAL : HORIZONTAL;
    }

    public Square square(int lineIndex, int position) {
        return this == HORIZONTAL ? new Square(lineIndex, position) : new Square(position, lineIndex);
    }

    public int lineIndex(Square square) {
        return this == HORIZONTAL ? square.row() : square.col();
    }

    public int position(Square square) {
        return this == HORIZONTAL ? square.col() : square.row();
    }
}
