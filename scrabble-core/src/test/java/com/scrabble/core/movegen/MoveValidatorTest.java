package com.scrabble.core.movegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.scrabble.core.Axis;
import com.scrabble.core.Board;
import com.scrabble.core.IllegalMoveException;
import com.scrabble.core.Move;
import com.scrabble.core.Placement;
import com.scrabble.core.Rack;
import com.scrabble.core.Square;
import com.scrabble.core.Tile;
import com.scrabble.core.gaddag.GaddagBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class MoveValidatorTest {

    private final MoveValidator validator = new MoveValidator(GaddagBuilder.build(List.of("CAT", "CATS", "AT")));

    private static Board boardWithCat() {
        Board board = new Board();
        board.place(new Square(7, 7), Tile.of('C'));
        board.place(new Square(7, 8), Tile.of('A'));
        board.place(new Square(7, 9), Tile.of('T'));
        return board;
    }

    @Test
    void acceptsFirstMoveThroughCenter() {
        Move move = validator.validate(new Board(), List.of(Placement.of(7, 8, 'T'), Placement.of(7, 7, 'A')));

        assertEquals(Axis.HORIZONTAL, move.direction());
        assertEquals(List.of(Placement.of(7, 7, 'A'), Placement.of(7, 8, 'T')), move.placements());
        assertEquals(4, move.score());
        assertEquals("AT", move.mainWord());
    }

    @Test
    void singleTileTakesDirectionOfItsWord() {
        Move vertical = validator.validate(boardWithCat(), List.of(Placement.of(8, 8, 'T')));
        Move horizontal = validator.validate(boardWithCat(), List.of(Placement.of(7, 10, 'S')));

        assertEquals(Axis.VERTICAL, vertical.direction());
        assertEquals(3, vertical.score());
        assertEquals(Axis.HORIZONTAL, horizontal.direction());
        assertEquals(6, horizontal.score());
    }

    @Test
    void rejectsFirstMoveAwayFromCenter() {
        assertThrows(IllegalMoveException.class,
                () -> validator.validate(new Board(), List.of(Placement.of(0, 0, 'A'), Placement.of(0, 1, 'T'))));
    }

    @Test
    void rejectsDisconnectedMove() {
        assertThrows(IllegalMoveException.class, () -> validator.validate(boardWithCat(),
                List.of(Placement.of(0, 0, 'A'), Placement.of(0, 1, 'T'))));
    }

    @Test
    void rejectsUnknownWords() {
        assertThrows(IllegalMoveException.class,
                () -> validator.validate(boardWithCat(), List.of(Placement.of(7, 6, 'S'))));
        assertThrows(IllegalMoveException.class, () -> validator.validate(boardWithCat(),
                List.of(Placement.of(6, 8, 'A'), Placement.of(6, 9, 'T'))));
    }

    @Test
    void rejectsMalformedPlacements() {
        Board board = boardWithCat();

        assertThrows(IllegalMoveException.class, () -> validator.validate(board, List.of()));
        assertThrows(IllegalMoveException.class,
                () -> validator.validate(board, List.of(Placement.of(7, 8, 'A'))));
        assertThrows(IllegalMoveException.class, () -> validator.validate(board,
                List.of(Placement.of(7, 10, 'S'), Placement.of(7, 10, 'S'))));
        assertThrows(IllegalMoveException.class, () -> validator.validate(board,
                List.of(Placement.of(6, 9, 'A'), Placement.of(8, 10, 'T'))));
        assertThrows(IllegalMoveException.class, () -> validator.validate(board,
                List.of(Placement.of(6, 9, 'A'), Placement.of(6, 11, 'T'))));
        assertThrows(IllegalMoveException.class,
                () -> validator.validate(new Board(), List.of(Placement.of(7, 7, 'A'))));
    }

    @Test
    void rejectsTilesMissingFromRack() {
        assertThrows(IllegalMoveException.class,
                () -> validator.validate(boardWithCat(), Rack.of("T"), List.of(Placement.of(7, 10, 'S'))));
        Move move = validator.validate(boardWithCat(), Rack.of("?"),
                List.of(new Placement(new Square(7, 10), Tile.blankAs('S'))));
        assertEquals(5, move.score());
    }
}
