package max.reversi.engine.utils.notations;

import max.reversi.engine.common.Piece;
import max.reversi.engine.common.TilePos;
import max.reversi.engine.game.Game;
import max.reversi.engine.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BoardNotationTest {

    @Test
    public void standardNotationShouldMatchNewGame() {
        Game fromNotation = BoardGenerator.from(BoardGenerator.STANDARD_GAME);

        assertEquals(new Game(), fromNotation);
        assertEquals(BoardGenerator.STANDARD_GAME, BoardNotation.getNotationFromGame(new Game()));
    }

    @Test
    public void notationShouldFollowTheGame() {
        // Given
        Game game = new Game();

        // When
        game.applyMove(TilePos.at(2, 4));

        // Then
        assertEquals("8/8/4B3/3BB3/3WB3/8/8/8 w", BoardNotation.getNotationFromGame(game));
    }

    @Test
    public void parsedPiecesShouldLandOnTheirTiles() {
        Game game = BoardNotation.getGameFrom("W7/8/8/8/8/8/8/6BW w");

        assertEquals(Optional.of(Piece.WHITE), game.get(TilePos.at(0, 0)));
        assertEquals(Optional.of(Piece.BLACK), game.get(TilePos.at(7, 6)));
        assertEquals(Optional.of(Piece.WHITE), game.get(TilePos.at(7, 7)));
        assertEquals(Piece.WHITE, game.currentPlayer());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "8/8/8/3BW3/3WB3/8/8/8",       // no side to move
            "8/8/8/3BW3/3WB3/8/8 b",       // 7 ranks
            "8/8/8/3BW3/3WB4/8/8/8 b",     // rank too long
            "8/8/8/3BW2/3WB3/8/8/8 b",     // rank too short
            "8/8/8/3BX3/3WB3/8/8/8 b",     // unknown piece
            "8/8/8/3BW3/3WB3/8/8/8 x",     // unknown side
            "BBBBBBBBB/8/8/8/8/8/8/8 b"    // overflowing rank
    })
    public void malformedNotationShouldBeRejected(String notation) {
        assertThrows(IllegalArgumentException.class, () -> BoardNotation.getGameFrom(notation));
    }
}
