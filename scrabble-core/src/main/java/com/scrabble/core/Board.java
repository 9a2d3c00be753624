package com.scrabble.core;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable 15x15 Scrabble board. Tiles are stored twice, row-major and column-major, so that every
 * {@link Line} reads a contiguous slice whatever its axis. Both copies are written by the same
 * {@link #place} call.
 */
public final class Board {

    public static final int SIZE = 15;
    public static final int CELL_COUNT = SIZE * SIZE;
    public static final int CENTER = SIZE / 2;
    public static final Square CENTER_SQUARE = new Square(CENTER, CENTER);

    private static final String[] LAYOUT = {
        "T..d...T...d..T",
        ".D...t...t...D.",
        "..D...d.d...D..",
        "d..D...d...D..d",
        "....D.....D....",
        ".t...t...t...t.",
        "..d...d.d...d..",
        "T..d...D...d..T",
        "..d...d.d...d..",
        ".t...t...t...t.",
        "....D.....D....",
        "d..D...d...D..d",
        "..D...d.d...D..",
        ".D...t...t...D.",
        "T..d...T...d..T"
    };

    private static final Premium[] PREMIUMS = new Premium[CELL_COUNT];

    static {
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                PREMIUMS[row * SIZE + col] = Premium.fromLayoutChar(LAYOUT[row].charAt(col));
            }
        }
    }

    private final Tile[] rowMajor;
    private final Tile[] columnMajor;
    private final boolean readOnly;
    private int tileCount;

    /**
     * Creates an empty board.
     */
    public Board() {
        this(new Tile[CELL_COUNT], new Tile[CELL_COUNT], 0, false);
    }

    private Board(Tile[] rowMajor, Tile[] columnMajor, int tileCount, boolean readOnly) {
        this.rowMajor = rowMajor;
        this.columnMajor = columnMajor;
        this.tileCount = tileCount;
        this.readOnly = readOnly;
    }

    /**
     * Parses a board from 15 rows of 15 characters: {@code .} for an empty square, an upper-case
     * letter for a tile and a lower-case letter for a played blank.
     */
    public static Board parse(List<String> rows) {
        Objects.requireNonNull(rows, "rows");
        if (rows.size() != SIZE) {
            throw new IllegalArgumentException("Expected " + SIZE + " rows but got " + rows.size());
        }
        Board board = new Board();
        for (int row = 0; row < SIZE; row++) {
            String line = rows.get(row);
            if (line == null || line.length() != SIZE) {
                throw new IllegalArgumentException("Row " + row + " must have " + SIZE + " characters");
            }
            for (int col = 0; col < SIZE; col++) {
                char c = line.charAt(col);
                if (c != '.') {
                    board.place(new Square(row, col), Tile.fromChar(c));
                }
            }
        }
        return board;
    }

    public static Board parse(String... rows) {
        return parse(Arrays.asList(rows));
    }

    public static Premium premiumAt(Square square) {
        return PREMIUMS[square.index()];
    }

    /**
     * Returns {@code true} if no tile has been placed yet.
     */
    public boolean isEmpty() {
        return tileCount == 0;
    }

    public boolean isEmpty(Square square) {
        return rowMajor[square.index()] == null;
    }

    public boolean isOccupied(Square square) {
        return !isEmpty(square);
    }

    /**
     * Returns the tile on {@code square}, or {@code null} if it is empty.
     */
    public Tile tileAt(Square square) {
        return rowMajor[square.index()];
    }

    public int tileCount() {
        return tileCount;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Places a tile on an empty square.
     */
    public void place(Square square, Tile tile) {
        Objects.requireNonNull(square, "square");
        Objects.requireNonNull(tile, "tile");
        if (readOnly) {
            throw new IllegalStateException("Board snapshot is read-only");
        }
        if (!tile.isAssigned()) {
            throw new IllegalArgumentException("Blank must be bound to a letter before it is placed");
        }
        if (isOccupied(square)) {
            throw new IllegalArgumentException("Square " + square + " is already occupied");
        }
        rowMajor[square.index()] = tile;
        columnMajor[square.col() * SIZE + square.row()] = tile;
        tileCount++;
    }

    /**
     * Places every tile of {@code move} after checking that its squares are still empty and that
     * {@code rack} holds the tiles it uses.
     *
     * @throws IllegalMoveException if the move does not fit the board or the rack
     */
    public void apply(Move move, Rack rack) {
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(rack, "rack");
        if (readOnly) {
            throw new IllegalStateException("Board snapshot is read-only");
        }
        Set<Square> targets = new HashSet<>();
        for (Placement placement : move.placements()) {
            Square square = placement.square();
            if (!targets.add(square)) {
                throw new IllegalMoveException("Square " + square + " is used twice");
            }
            if (isOccupied(square)) {
                throw new IllegalMoveException("Square " + square + " is already occupied");
            }
        }
        if (!rack.canSupply(move.tiles())) {
            throw new IllegalMoveException("Rack " + rack + " does not hold the tiles of " + move);
        }
        for (Placement placement : move.placements()) {
            place(placement.square(), placement.tile());
        }
    }

    public List<Square> squaresInRow(int row) {
        return line(Axis.HORIZONTAL, row).squares();
    }

    public List<Square> squaresInCol(int col) {
        return line(Axis.VERTICAL, col).squares();
    }

    /**
     * Returns the row ({@link Axis#HORIZONTAL}) or column ({@link Axis#VERTICAL}) with the given
     * index.
     */
    public Line line(Axis axis, int index) {
        Objects.requireNonNull(axis, "axis");
        return new Line(this, axis, index);
    }

    Tile tileAt(Axis axis, int lineIndex, int position) {
        Tile[] cells = axis == Axis.HORIZONTAL ? rowMajor : columnMajor;
        return cells[lineIndex * SIZE + position];
    }

    /**
     * Returns an independent, mutable copy of this board.
     */
    public Board copy() {
        return new Board(rowMajor.clone(), columnMajor.clone(), tileCount, false);
    }

    /**
     * Returns a read-only copy that can be shared between threads.
     */
    public Board snapshot() {
        if (readOnly) {
            return this;
        }
        return new Board(rowMajor.clone(), columnMajor.clone(), tileCount, true);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Board)) {
            return false;
        }
        return Arrays.equals(rowMajor, ((Board) other).rowMajor);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(rowMajor);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(CELL_COUNT + SIZE);
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                Tile tile = rowMajor[row * SIZE + col];
                builder.append(tile == null ? '.' : tile.toChar());
            }
            builder.append('\n');
        }
        return builder.toString();
    }
}
