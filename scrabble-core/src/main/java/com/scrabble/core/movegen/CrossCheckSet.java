package com.scrabble.core.movegen;

/**
 * Letters that may be placed on one empty square for plays along one axis.
 *
 * @param letterMask         accepted letters, bit 0 = A
 * @param constrained        whether the square has perpendicular neighbours
 * @param perpendicularScore face value of the perpendicular neighbours joined by a tile placed here
 */
public record CrossCheckSet(int letterMask, boolean constrained, int perpendicularScore) {

    public static final int ALL_LETTERS = (1 << 26) - 1;
    public static final CrossCheckSet UNCONSTRAINED = new CrossCheckSet(ALL_LETTERS, false, 0);

    public boolean allows(char letter) {
        return letter >= 'A' && letter <= 'Z' && (letterMask & (1 << (letter - 'A'))) != 0;
    }

    public String letters() {
        StringBuilder builder = new StringBuilder(Integer.bitCount(letterMask));
        for (int i = 0; i < 26; i++) {
            if ((letterMask & (1 << i)) != 0) {
                builder.append((char) ('A' + i));
            }
        }
        return builder.toString();
    }
}
