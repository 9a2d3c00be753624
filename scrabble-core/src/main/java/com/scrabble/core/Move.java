package com.scrabble.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A fully specified play: the tiles put down, the direction of the main word, its score and the
 * words it forms (main word first).
 */
public record Move(List<Placement> placements, Axis direction, int score, List<String> words) {

    public Move {
        Objects.requireNonNull(placements, "placements");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(words, "words");
        if (placements.isEmpty()) {
            throw new IllegalArgumentException("A move places at least one tile");
        }
        placements = List.copyOf(placements);
        words = List.copyOf(words);
    }

    public int tilesPlaced() {
        return placements.size();
    }

    public boolean isBingo() {
        return placements.size() == Rack.MAX_TILES;
    }

    public String mainWord() {
        return words.isEmpty() ? "" : words.get(0);
    }

    public List<Tile> tiles() {
        List<Tile> tiles = new ArrayList<>(placements.size());
        for (Placement placement : placements) {
            tiles.add(placement.tile());
        }
        return tiles;
    }

    public boolean covers(Square square) {
        for (Placement placement : placements) {
            if (placement.square().equals(square)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        Square start = placements.get(0).square();
        StringBuilder tiles = new StringBuilder(placements.size());
        for (Placement placement : placements) {
            tiles.append(placement.tile().toChar());
        }
        return String.format("%s %s %s %d %s", mainWord(), direction == Axis.HORIZONTAL ? "H" : "V", start,
                score, tiles);
    }
}
