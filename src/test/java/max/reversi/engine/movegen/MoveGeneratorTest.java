package max.reversi.engine.movegen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.reversi.engine.common.Direction;
import max.reversi.engine.common.Piece;
import max.reversi.engine.common.TilePos;
import max.reversi.engine.game.board.Grid;
import max.reversi.engine.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MoveGeneratorTest {

    @ParameterizedTest
    @CsvSource({
            // rank 0 after the empty tile A1, Black to play A1 looking right
            "1WWWB3, 3",  // run closed by a black piece
            "1WW5, 0",    // run reaches empty tiles
            "1WW1B3, 0",  // gap before the anchor
            "1B6, 0",     // no opponent in between
            "1WWWWWWW, 0" // run hits the border
    })
    public void captureRunLength(String rank, int expectedRun) {
        Grid grid = BoardGenerator.from(rank + "/8/8/8/8/8/8/8 b").grid();

        int run = MoveGenerator.captureRunLength(grid, Piece.BLACK, TilePos.at(0, 0), Direction.RIGHT);

        assertEquals(expectedRun, run);
    }

    @Test
    public void flipsShouldCoverEveryCapturingDirection() {
        // Given
        // Black on F4, D6, F6 ; White on E4, D5, E5 ; Black plays D4
        Grid grid = BoardGenerator.from("8/8/8/4WB2/3WW3/3B1B2/8/8 b").grid();

        // When
        IntArrayList flips = MoveGenerator.computeFlips(grid, Piece.BLACK, TilePos.at(3, 3));

        // Then
        // RIGHT, DOWN then DOWN_RIGHT
        assertEquals(IntArrayList.of(28, 35, 36), flips);
        // Flips are computed, not applied
        assertEquals(3, grid.count(Piece.WHITE));
    }

    @Test
    public void standardOpeningMoves() {
        Grid grid = BoardGenerator.newStandardGameBoard().grid();

        IntArrayList blackMoves = MoveGenerator.generateMoves(grid, Piece.BLACK);
        IntArrayList whiteMoves = MoveGenerator.generateMoves(grid, Piece.WHITE);

        // E3, F4, C5, D6
        assertEquals(IntArrayList.of(20, 29, 34, 43), blackMoves);
        // D3, C4, F5, E6
        assertEquals(IntArrayList.of(19, 26, 37, 44), whiteMoves);
        assertEquals(4, blackMoves.size());
    }

    @Test
    public void occupiedTileIsNeverValid() {
        Grid grid = BoardGenerator.newStandardGameBoard().grid();

        assertFalse(MoveGenerator.isValidMove(grid, Piece.BLACK, TilePos.at(3, 4)));
        assertTrue(MoveGenerator.isValidMove(grid, Piece.BLACK, TilePos.at(2, 4)));
    }

    @Test
    public void noMoveWithoutOpponentPieces() {
        Grid grid = BoardGenerator.from("8/8/8/3BB3/3BB3/8/8/8 w").grid();

        assertFalse(MoveGenerator.hasAnyMove(grid, Piece.BLACK));
        assertFalse(MoveGenerator.hasAnyMove(grid, Piece.WHITE));
    }
}
