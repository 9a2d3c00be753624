package com.scrabble.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable multiset of the tiles held by the player to move.
 */
public final class Rack {

    public static final int MAX_TILES = 7;
    public static final int BLANK_INDEX = 26;

    private final int[] counts;
    private final int size;

    private Rack(int[] counts) {
        int total = 0;
        for (int count : counts) {
            total += count;
        }
        if (total > MAX_TILES) {
            throw new IllegalArgumentException("A rack holds at most " + MAX_TILES + " tiles, got " + total);
        }
        this.counts = counts;
        this.size = total;
    }

    /**
     * Parses a rack such as {@code "AEINST?"}; {@code ?} stands for a blank.
     */
    public static Rack of(String tiles) {
        Objects.requireNonNull(tiles, "tiles");
        int[] counts = new int[BLANK_INDEX + 1];
        for (int i = 0; i < tiles.length(); i++) {
            char c = tiles.charAt(i);
            if (c == Tile.UNASSIGNED) {
                counts[BLANK_INDEX]++;
            } else if (c >= 'A' && c <= 'Z') {
                counts[c - 'A']++;
            } else {
                throw new IllegalArgumentException("Invalid rack tile: " + c);
            }
        }
        return new Rack(counts);
    }

    public static Rack of(Collection<Tile> tiles) {
        Objects.requireNonNull(tiles, "tiles");
        int[] counts = new int[BLANK_INDEX + 1];
        for (Tile tile : tiles) {
            counts[tile.blank() ? BLANK_INDEX : tile.letter() - 'A']++;
        }
        return new Rack(counts);
    }

    public static Rack empty() {
        return new Rack(new int[BLANK_INDEX + 1]);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int count(char letter) {
        if (letter < 'A' || letter > 'Z') {
            throw new IllegalArgumentException("Letter must be in A-Z: " + letter);
        }
        return counts[letter - 'A'];
    }

    public int blankCount() {
        return counts[BLANK_INDEX];
    }

    /**
     * Returns a copy of the per-letter counts, indexed A=0 .. Z=25 with blanks at
     * {@link #BLANK_INDEX}.
     */
    public int[] counts() {
        return counts.clone();
    }

    /**
     * Returns {@code true} if the given tiles can all be taken from this rack. Blanks in
     * {@code tiles} must be matched by blanks on the rack.
     */
    public boolean canSupply(Collection<Tile> tiles) {
        int[] remaining = counts.clone();
        for (Tile tile : tiles) {
            int index = tile.blank() ? BLANK_INDEX : tile.letter() - 'A';
            if (--remaining[index] < 0) {
                return false;
            }
        }
        return true;
    }

    public List<Tile> tiles() {
        List<Tile> tiles = new ArrayList<>(size);
        for (int i = 0; i < BLANK_INDEX; i++) {
            for (int n = 0; n < counts[i]; n++) {
                tiles.add(Tile.of((char) ('A' + i)));
            }
        }
        for (int n = 0; n < counts[BLANK_INDEX]; n++) {
            tiles.add(Tile.unboundBlank());
        }
        return Collections.unmodifiableList(tiles);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Rack)) {
            return false;
        }
        return Arrays.equals(counts, ((Rack) other).counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(size);
        for (Tile tile : tiles()) {
            builder.append(tile.toChar());
        }
        return builder.toString();
    }
}
