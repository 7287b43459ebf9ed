package max.reversi.engine.search.evaluator;

import max.reversi.engine.common.Piece;
import max.reversi.engine.game.Game;
import max.reversi.engine.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class EdgeBonusEvaluatorTest {

    @Test
    public void cornerShouldCollectCornerAndBothSideBonuses() {
        assertEquals(8, EdgeBonusEvaluator.tileBonus(0));
        assertEquals(8, EdgeBonusEvaluator.tileBonus(63));
        assertEquals(2, EdgeBonusEvaluator.tileBonus(3));
        assertEquals(2, EdgeBonusEvaluator.tileBonus(8 * 4 + 7));
        assertEquals(0, EdgeBonusEvaluator.tileBonus(8 * 3 + 3));
    }

    @Test
    public void evaluationShouldRewardOwnEdgesAndPunishOpponentEdges() {
        // Given
        // Black: A1 corner and C3 ; White: D1 side and D4
        Game game = BoardGenerator.from("B2W4/8/2B5/3W4/8/8/8/8 b");

        // When
        int forBlack = EdgeBonusEvaluator.INSTANCE.evaluate(game, Piece.BLACK);
        int forWhite = EdgeBonusEvaluator.INSTANCE.evaluate(game, Piece.WHITE);

        // Then
        // differential 0, corner +8, side -2
        assertEquals(6, forBlack);
        assertEquals(-forBlack, forWhite);
    }

    @Test
    public void pieceCountShouldBeTheDifferential() {
        Game game = BoardGenerator.from("BBB5/8/8/3W4/8/8/8/8 w");

        assertEquals(2, PieceCountEvaluator.INSTANCE.evaluate(game, Piece.BLACK));
        assertEquals(-2, PieceCountEvaluator.INSTANCE.evaluate(game, Piece.WHITE));
    }
}
