package com.scrabble.core;

/**
 * Position of a square on the board.
 */
public record Square(int row, int col) {

    public Square {
        if (!isValid(row, col)) {
            throw new IllegalArgumentException("Square out of range: (" + row + ", " + col + ")");
        }
    }

    public static boolean isValid(int row, int col) {
        return row >= 0 && row < Board.SIZE && col >= 0 && col < Board.SIZE;
    }

    /**
     * Returns the row-major index of this square.
     */
    public int index() {
        return row * Board.SIZE + col;
    }

    public static Square fromIndex(int index) {
        return new Square(index / Board.SIZE, index % Board.SIZE);
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
