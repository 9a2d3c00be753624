package com.scrabble.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes the value of a play against the board as it stood before the play. Premiums count only
 * for squares covered by newly placed tiles.
 */
public final class Scorer {

    public static final int BINGO_BONUS = 50;
    public static final int MIN_WORD_LENGTH = 2;

    private Scorer() {
    }

    /**
     * Returns the score of {@code move} on {@code board}, recomputed from the placements.
     */
    public static int score(Move move, Board board) {
        Objects.requireNonNull(move, "move");
        return evaluate(board, move.direction(), move.placements()).score();
    }

    /**
     * Scores the placements as a play along {@code axis} and collects the words they form. The
     * placements must lie on one line of {@code axis}, cover only empty squares and, together with
     * the tiles already on that line, form one contiguous word.
     */
    public static Evaluation evaluate(Board board, Axis axis, List<Placement> placements) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(axis, "axis");
        Objects.requireNonNull(placements, "placements");
        if (placements.isEmpty()) {
            throw new IllegalArgumentException("No tiles placed");
        }

        int lineIndex = axis.lineIndex(placements.get(0).square());
        Tile[] placed = new Tile[Board.SIZE];
        int first = Board.SIZE;
        int last = -1;
        for (Placement placement : placements) {
            Square square = placement.square();
            if (axis.lineIndex(square) != lineIndex) {
                throw new IllegalArgumentException("Placements are not on a single line");
            }
            if (board.isOccupied(square)) {
                throw new IllegalArgumentException("Square " + square + " is already occupied");
            }
            int position = axis.position(square);
            if (placed[position] != null) {
                throw new IllegalArgumentException("Square " + square + " is used twice");
            }
            placed[position] = placement.tile();
            first = Math.min(first, position);
            last = Math.max(last, position);
        }

        List<String> words = new ArrayList<>();
        int total = 0;

        Line line = board.line(axis, lineIndex);
        int start = line.extentBefore(first);
        int end = line.extentAfter(last);
        StringBuilder word = new StringBuilder(end - start + 1);
        int mainScore = scoreSpan(line, start, end, placed, word);
        if (word.length() >= MIN_WORD_LENGTH) {
            words.add(word.toString());
            total += mainScore;
        }

        Axis cross = axis.other();
        Tile[] single = new Tile[Board.SIZE];
        for (int position = first; position <= last; position++) {
            Tile tile = placed[position];
            if (tile == null) {
                continue;
            }
            Square square = line.square(position);
            Line crossLine = board.line(cross, cross.lineIndex(square));
            int crossPosition = cross.position(square);
            int crossStart = crossLine.extentBefore(crossPosition);
            int crossEnd = crossLine.extentAfter(crossPosition);
            if (crossStart == crossEnd) {
                continue;
            }
            single[crossPosition] = tile;
            StringBuilder crossWord = new StringBuilder(crossEnd - crossStart + 1);
            total += scoreSpan(crossLine, crossStart, crossEnd, single, crossWord);
            single[crossPosition] = null;
            words.add(crossWord.toString());
        }

        if (placements.size() == Rack.MAX_TILES) {
            total += BINGO_BONUS;
        }
        return new Evaluation(total, words);
    }

    private static int scoreSpan(Line line, int start, int end, Tile[] placed, StringBuilder word) {
        int sum = 0;
        int wordMultiplier = 1;
        for (int position = start; position <= end; position++) {
            Tile tile = placed[position];
            if (tile != null) {
                Premium premium = line.premium(position);
                sum += tile.points() * premium.letterMultiplier();
                wordMultiplier *= premium.wordMultiplier();
            } else {
                tile = line.tileAt(position);
                if (tile == null) {
                    throw new IllegalArgumentException("Placements leave a gap at " + line.square(position));
                }
                sum += tile.points();
            }
            word.append(tile.letter());
        }
        return sum * wordMultiplier;
    }

    /**
     * Score of a play together with the words it forms, main word first.
     */
    public record Evaluation(int score, List<String> words) {

        public Evaluation {
            words = List.copyOf(words);
        }
    }
}
