package com.scrabble.core;

/**
 * Thrown when a move does not fit the current board or the rack it claims to use.
 */
public class IllegalMoveException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public IllegalMoveException(String message) {
        super(message);
    }
}
