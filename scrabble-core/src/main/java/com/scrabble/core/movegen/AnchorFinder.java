package com.scrabble.core.movegen;

import com.scrabble.core.Board;
import com.scrabble.core.Square;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds the squares a play may be built through: empty squares next to a tile, or the center
 * square while the board is empty.
 */
public final class AnchorFinder {

    private static final int[][] NEIGHBOURS = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};

    private AnchorFinder() {
    }

    /**
     * Returns the anchors of {@code board} in row-major order.
     */
    public static List<Square> find(Board board) {
        boolean[] mask = anchorMask(board);
        List<Square> anchors = new ArrayList<>();
        for (int index = 0; index < Board.CELL_COUNT; index++) {
            if (mask[index]) {
                anchors.add(Square.fromIndex(index));
            }
        }
        return anchors;
    }

    /**
     * Returns a row-major array flagging every anchor square.
     */
    public static boolean[] anchorMask(Board board) {
        Objects.requireNonNull(board, "board");
        boolean[] mask = new boolean[Board.CELL_COUNT];
        if (board.isEmpty()) {
            mask[Board.CENTER_SQUARE.index()] = true;
            return mask;
        }
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                Square square = new Square(row, col);
                mask[square.index()] = board.isEmpty(square) && hasOccupiedNeighbour(board, row, col);
            }
        }
        return mask;
    }

    public static boolean isAnchor(Board board, Square square) {
        return anchorMask(board)[square.index()];
    }

    private static boolean hasOccupiedNeighbour(Board board, int row, int col) {
        for (int[] offset : NEIGHBOURS) {
            int r = row + offset[0];
            int c = col + offset[1];
            if (Square.isValid(r, c) && board.isOccupied(new Square(r, c))) {
                return true;
            }
        }
        return false;
    }
}
