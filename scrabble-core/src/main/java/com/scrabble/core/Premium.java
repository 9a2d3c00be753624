package com.scrabble.core;

/**
 * Score multiplier printed on a board square.
 */
public enum Premium {
    NONE(1, 1),
    DOUBLE_LETTER(2, 1),
    TRIPLE_LETTER(3, 1),
    DOUBLE_WORD(1, 2),
    TRIPLE_WORD(1, 3);

    private final int letterMultiplier;
    private final int wordMultiplier;

    Premium(int letterMultiplier, int wordMultiplier) {
        this.letterMultiplier = letterMultiplier;
        this.wordMultiplier = wordMultiplier;
    }

    public int letterMultiplier() {
        return letterMultiplier;
    }

    public int wordMultiplier() {
        return wordMultiplier;
    }

    static Premium fromLayoutChar(char c) {
        switch (c) {
            case '.':
                return NONE;
            case 'd':
                return DOUBLE_LETTER;
            case 't':
                return TRIPLE_LETTER;
            case 'D':
                return DOUBLE_WORD;
            case 'T':
                return TRIPLE_WORD;
            default:
                throw new IllegalArgumentException("Unknown premium marker: " + c);
        }
    }
}
