package com.scrabble.core;

/**
 * Face values of the English tile set.
 */
public final class LetterValues {

    private static final int[] VALUES = {
        1, 3, 3, 2, 1, 4, 2, 4, 1, 8, 5, 1, 3, // A-M
        1, 1, 3, 10, 1, 1, 1, 1, 4, 4, 8, 4, 10 // N-Z
    };

    private LetterValues() {
    }

    /**
     * Returns the face value of an upper-case letter.
     */
    public static int valueOf(char letter) {
        if (letter < 'A' || letter > 'Z') {
            throw new IllegalArgumentException("Not a tile letter: " + letter);
        }
        return VALUES[letter - 'A'];
    }
}
