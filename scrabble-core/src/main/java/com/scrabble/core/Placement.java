package com.scrabble.core;

import java.util.Objects;

/**
 * A tile put down on a square as part of a move. Blanks must already be bound to a letter.
 */
public record Placement(Square square, Tile tile) {

    public Placement {
        Objects.requireNonNull(square, "square");
        Objects.requireNonNull(tile, "tile");
        if (!tile.isAssigned()) {
            throw new IllegalArgumentException("Placed blank at " + square + " has no letter");
        }
    }

    public static Placement of(int row, int col, char letter) {
        return new Placement(new Square(row, col), Tile.of(letter));
    }
}
