package max.reversi.engine.search.evaluator;

import max.reversi.engine.common.Piece;
import max.reversi.engine.game.Game;

/**
 * Static evaluation of a position. Higher is better for {@code perspective}.
 * Implementations must be antisymmetric: evaluate(g, p) == -evaluate(g, p.opposite()).
 */
public interface PositionEvaluator {
    int evaluate(Game game, Piece perspective);
}
