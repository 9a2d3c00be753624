package com.scrabble.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class BoardTest {

    @Test
    void newBoardIsEmpty() {
        Board board = new Board();
        assertTrue(board.isEmpty());
        assertEquals(0, board.tileCount());
        for (int index = 0; index < Board.CELL_COUNT; index++) {
            assertTrue(board.isEmpty(Square.fromIndex(index)));
        }
    }

    @Test
    void placeUpdatesRowAndColumnViews() {
        Board board = new Board();
        Square square = new Square(3, 5);
        board.place(square, Tile.of('Q'));

        assertSame(Tile.of('Q'), board.tileAt(square));
        assertSame(Tile.of('Q'), board.line(Axis.HORIZONTAL, 3).tileAt(5));
        assertSame(Tile.of('Q'), board.line(Axis.VERTICAL, 5).tileAt(3));
        assertNull(board.line(Axis.VERTICAL, 3).tileAt(5));
        assertEquals(1, board.tileCount());
        assertFalse(board.isEmpty());
    }

    @Test
    void rejectsPlacementOnOccupiedSquare() {
        Board board = new Board();
        board.place(Board.CENTER_SQUARE, Tile.of('A'));

        assertThrows(IllegalArgumentException.class, () -> board.place(Board.CENTER_SQUARE, Tile.of('B')));
        assertSame(Tile.of('A'), board.tileAt(Board.CENTER_SQUARE));
    }

    @Test
    void rejectsUnboundBlank() {
        Board board = new Board();
        assertThrows(IllegalArgumentException.class, () -> board.place(Board.CENTER_SQUARE, Tile.unboundBlank()));
    }

    @Test
    void snapshotIsReadOnlyAndDetached() {
        Board board = new Board();
        board.place(Board.CENTER_SQUARE, Tile.of('A'));
        Board snapshot = board.snapshot();

        board.place(new Square(7, 8), Tile.of('T'));

        assertTrue(snapshot.isReadOnly());
        assertTrue(snapshot.isEmpty(new Square(7, 8)));
        assertThrows(IllegalStateException.class, () -> snapshot.place(new Square(0, 0), Tile.of('Z')));
        assertSame(snapshot, snapshot.snapshot());
    }

    @Test
    void parsesAndPrintsBoard() {
        String[] rows = new String[Board.SIZE];
        for (int row = 0; row < Board.SIZE; row++) {
            rows[row] = "...............";
        }
        rows[7] = ".......CAt.....";
        Board board = Board.parse(rows);

        assertEquals(3, board.tileCount());
        assertEquals(Tile.blankAs('T'), board.tileAt(new Square(7, 9)));
        assertEquals(0, board.tileAt(new Square(7, 9)).points());
        assertEquals(String.join("\n", rows) + "\n", board.toString());
        assertEquals(board, Board.parse(board.toString().split("\n")));
    }

    @Test
    void rejectsMalformedBoardText() {
        assertThrows(IllegalArgumentException.class, () -> Board.parse("..."));
        String[] rows = new String[Board.SIZE];
        for (int row = 0; row < Board.SIZE; row++) {
            rows[row] = "...............";
        }
        rows[2] = "......1........";
        assertThrows(IllegalArgumentException.class, () -> Board.parse(rows));
    }

    @Test
    void premiumLayoutIsSymmetric() {
        assertEquals(Premium.DOUBLE_WORD, Board.premiumAt(Board.CENTER_SQUARE));
        assertEquals(Premium.TRIPLE_WORD, Board.premiumAt(new Square(0, 0)));
        assertEquals(Premium.DOUBLE_LETTER, Board.premiumAt(new Square(0, 3)));
        assertEquals(Premium.TRIPLE_LETTER, Board.premiumAt(new Square(1, 5)));
        assertEquals(Premium.DOUBLE_WORD, Board.premiumAt(new Square(1, 1)));
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                Premium premium = Board.premiumAt(new Square(row, col));
                assertEquals(premium, Board.premiumAt(new Square(col, row)));
                assertEquals(premium, Board.premiumAt(new Square(Board.SIZE - 1 - row, col)));
            }
        }
    }

    @Test
    void applyPlacesMoveTiles() {
        Board board = new Board();
        Move move = new Move(List.of(Placement.of(7, 7, 'A'), Placement.of(7, 8, 'T')), Axis.HORIZONTAL, 4,
                List.of("AT"));

        board.apply(move, Rack.of("AT"));

        assertEquals(2, board.tileCount());
        assertSame(Tile.of('T'), board.tileAt(new Square(7, 8)));
    }

    @Test
    void applyRejectsTilesMissingFromRack() {
        Board board = new Board();
        Move move = new Move(List.of(Placement.of(7, 7, 'A'), Placement.of(7, 8, 'T')), Axis.HORIZONTAL, 4,
                List.of("AT"));

        assertThrows(IllegalMoveException.class, () -> board.apply(move, Rack.of("A?")));
        assertTrue(board.isEmpty());
    }

    @Test
    void applyRejectsOccupiedSquare() {
        Board board = new Board();
        board.place(new Square(7, 8), Tile.of('T'));
        Move move = new Move(List.of(Placement.of(7, 7, 'A'), Placement.of(7, 8, 'T')), Axis.HORIZONTAL, 4,
                List.of("AT"));

        assertThrows(IllegalMoveException.class, () -> board.apply(move, Rack.of("AT")));
        assertEquals(1, board.tileCount());
    }

    @Test
    void copyIsIndependent() {
        Board board = new Board();
        Board copy = board.copy();
        copy.place(Board.CENTER_SQUARE, Tile.of('A'));

        assertTrue(board.isEmpty());
        assertFalse(copy.isReadOnly());
        assertEquals(15, board.squaresInRow(4).size());
        assertEquals(new Square(14, 2), board.squaresInCol(2).get(14));
    }
}
