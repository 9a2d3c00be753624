package com.scrabble.core;

/**
 * A single tile. Lettered tiles carry their face value; a blank is worth nothing and is bound to
 * a letter only while it is being played.
 *
 * @param letter the letter shown on the tile, or {@link #UNASSIGNED} for a blank still on a rack
 * @param blank  whether the tile is a blank
 */
public record Tile(char letter, boolean blank) {

    public static final char UNASSIGNED = '?';

    private static final Tile BLANK = new Tile(UNASSIGNED, true);
    private static final Tile[] LETTERS = new Tile[26];
    private static final Tile[] BOUND_BLANKS = new Tile[26];

    static {
        for (int i = 0; i < 26; i++) {
            LETTERS[i] = new Tile((char) ('A' + i), false);
            BOUND_BLANKS[i] = new Tile((char) ('A' + i), true);
        }
    }

    public Tile {
        boolean isLetter = letter >= 'A' && letter <= 'Z';
        if (!isLetter && !(blank && letter == UNASSIGNED)) {
            throw new IllegalArgumentException("Invalid tile letter: " + letter);
        }
    }

    public static Tile of(char letter) {
        checkLetter(letter);
        return LETTERS[letter - 'A'];
    }

    public static Tile unboundBlank() {
        return BLANK;
    }

    /**
     * Returns a blank bound to {@code letter} for the move being played.
     */
    public static Tile blankAs(char letter) {
        checkLetter(letter);
        return BOUND_BLANKS[letter - 'A'];
    }

    /**
     * Parses the board notation: upper case for a lettered tile, lower case for a played blank and
     * {@code ?} for an unbound blank.
     */
    public static Tile fromChar(char c) {
        if (c >= 'A' && c <= 'Z') {
            return of(c);
        }
        if (c >= 'a' && c <= 'z') {
            return blankAs(Character.toUpperCase(c));
        }
        if (c == UNASSIGNED) {
            return BLANK;
        }
        throw new IllegalArgumentException("Invalid tile character: " + c);
    }

    public boolean isAssigned() {
        return letter != UNASSIGNED;
    }

    public int points() {
        return blank ? 0 : LetterValues.valueOf(letter);
    }

    public char toChar() {
        if (!blank) {
            return letter;
        }
        return isAssigned() ? Character.toLowerCase(letter) : UNASSIGNED;
    }

    @Override
    public String toString() {
        return String.valueOf(toChar());
    }

    private static void checkLetter(char letter) {
        if (letter < 'A' || letter > 'Z') {
            throw new IllegalArgumentException("Letter must be in A-Z: " + letter);
        }
    }
}
