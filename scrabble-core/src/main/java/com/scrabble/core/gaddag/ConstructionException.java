package com.scrabble.core.gaddag;

/**
 * Thrown when a word list or a serialized automaton cannot be turned into a {@link Gaddag}.
 */
public class ConstructionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConstructionException(String message) {
        super(message);
    }

    public ConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
