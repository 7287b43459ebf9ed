package max.reversi.engine.movegen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.reversi.engine.common.Direction;
import max.reversi.engine.common.Piece;
import max.reversi.engine.common.TilePos;
import max.reversi.engine.game.board.Grid;

/**
 * Capture rules. Every list handed out here holds flat tile indices (see {@link TilePos#flatIndex()}).
 */
public final class MoveGenerator {
    // No position can offer more moves than there are tiles
    public static final int MAX_MOVES = Grid.SIZE * Grid.SIZE;

    private MoveGenerator() {}

    // Valid moves for player, row-major
    public static IntArrayList generateMoves(Grid grid, Piece player) {
        IntArrayList moves = new IntArrayList(16);
        for(int flatIndex = 0; flatIndex < MAX_MOVES; flatIndex++) {
            if(grid.pieceAt(flatIndex) == null && capturesAny(grid, player, TilePos.ofFlatIndex(flatIndex))) {
                moves.add(flatIndex);
            }
        }
        return moves;
    }

    public static boolean hasAnyMove(Grid grid, Piece player) {
        for(int flatIndex = 0; flatIndex < MAX_MOVES; flatIndex++) {
            if(grid.pieceAt(flatIndex) == null && capturesAny(grid, player, TilePos.ofFlatIndex(flatIndex))) {
                return true;
            }
        }
        return false;
    }

    public static boolean isValidMove(Grid grid, Piece player, TilePos pos) {
        return grid.isEmpty(pos) && capturesAny(grid, player, pos);
    }

    /**
     * Opponent tiles flipped if player drops a piece on pos, direction by direction.
     * Empty when the move captures nothing. pos itself is never part of the result.
     */
    public static IntArrayList computeFlips(Grid grid, Piece player, TilePos pos) {
        IntArrayList flips = new IntArrayList();
        for(Direction direction : Direction.values()) {
            int runLength = captureRunLength(grid, player, pos, direction);
            int row = pos.row();
            int col = pos.col();
            for(int i = 0; i < runLength; i++) {
                row += direction.rowDelta;
                col += direction.colDelta;
                flips.add(row * Grid.SIZE + col);
            }
        }
        return flips;
    }

    private static boolean capturesAny(Grid grid, Piece player, TilePos pos) {
        for(Direction direction : Direction.values()) {
            if(captureRunLength(grid, player, pos, direction) > 0) {
                return true;
            }
        }
        return false;
    }

    // Length of the opponent run starting next to pos and closed by one of player's pieces, 0 if none.
    // "OOOX" captures 3 for X, "OO", "OO X" and "X" capture nothing.
    static int captureRunLength(Grid grid, Piece player, TilePos pos, Direction direction) {
        Piece opponent = player.opposite();
        int row = pos.row() + direction.rowDelta;
        int col = pos.col() + direction.colDelta;
        int runLength = 0;
        while(TilePos.isInBounds(row, col)) {
            Piece tile = grid.pieceAt(row * Grid.SIZE + col);
            if(tile == null) {
                return 0;
            }
            if(tile == opponent) {
                runLength++;
            } else {
                return runLength;
            }
            row += direction.rowDelta;
            col += direction.colDelta;
        }
        // Hit the edge of the board without finding an anchor
        return 0;
    }
}
