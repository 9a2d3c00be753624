package com.scrabble.core.movegen.state;

import com.scrabble.core.Rack;

/**
 * Mutable buffers for one depth-first walk: the rack tiles still available and the stack of tiles
 * placed on the current path. Every {@link #push} is undone by a {@link #pop} before a sibling
 * branch is explored, so a branch only ever sees its own placements. One instance per thread.
 */
public final class TraversalState {

    private static final int LETTERS = 26;

    private final int[] counts = new int[Rack.BLANK_INDEX + 1];
    private final int[] positions = new int[Rack.MAX_TILES];
    private final char[] letters = new char[Rack.MAX_TILES];
    private final boolean[] blanks = new boolean[Rack.MAX_TILES];

    private int letterMask;
    private int remaining;
    private int placed;

    /**
     * Resets the buffers to the tiles of {@code rack} with nothing placed.
     */
    public void reset(Rack rack) {
        int[] rackCounts = rack.counts();
        System.arraycopy(rackCounts, 0, counts, 0, counts.length);
        letterMask = 0;
        for (int i = 0; i < LETTERS; i++) {
            if (counts[i] > 0) {
                letterMask |= 1 << i;
            }
        }
        remaining = rack.size();
        placed = 0;
    }

    public boolean hasTiles() {
        return remaining > 0;
    }

    /**
     * Returns the letters still on the rack, bit 0 = A. Blanks are not included.
     */
    public int rackLetterMask() {
        return letterMask;
    }

    public int blankCount() {
        return counts[Rack.BLANK_INDEX];
    }

    /**
     * Takes a tile from the rack and puts it on {@code position}. A blank is played as
     * {@code letter}.
     */
    public void push(int position, char letter, boolean blank) {
        int index = blank ? Rack.BLANK_INDEX : letter - 'A';
        if (counts[index] == 0) {
            throw new IllegalStateException("No " + (blank ? "blank" : String.valueOf(letter)) + " left on the rack");
        }
        if (--counts[index] == 0 && !blank) {
            letterMask &= ~(1 << index);
        }
        positions[placed] = position;
        letters[placed] = letter;
        blanks[placed] = blank;
        placed++;
        remaining--;
    }

    /**
     * Returns the most recently placed tile to the rack.
     */
    public void pop() {
        if (placed == 0) {
            throw new IllegalStateException("Nothing to pop");
        }
        placed--;
        remaining++;
        int index = blanks[placed] ? Rack.BLANK_INDEX : letters[placed] - 'A';
        if (counts[index]++ == 0 && !blanks[placed]) {
            letterMask |= 1 << index;
        }
    }

    public int placedCount() {
        return placed;
    }

    public int positionAt(int i) {
        return positions[i];
    }

    public char letterAt(int i) {
        return letters[i];
    }

    public boolean isBlankAt(int i) {
        return blanks[i];
    }
}
