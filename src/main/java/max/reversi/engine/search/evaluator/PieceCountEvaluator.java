package max.reversi.engine.search.evaluator;

import max.reversi.engine.common.Piece;
import max.reversi.engine.game.Game;

public final class PieceCountEvaluator implements PositionEvaluator {
    public static final PieceCountEvaluator INSTANCE = new PieceCountEvaluator();

    private PieceCountEvaluator() {}

    @Override
    public int evaluate(Game game, Piece perspective) {
        return game.score(perspective) - game.score(perspective.opposite());
    }
}
