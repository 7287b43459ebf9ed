package max.reversi.engine.search.evaluator;

import max.reversi.engine.common.Piece;
import max.reversi.engine.game.Game;
import max.reversi.engine.game.board.Grid;

/**
 * Piece differential plus positional bonuses: corners can never be flipped back and edges
 * are hard to flip, so owning them is worth more than a central tile.
 * A corner sits on two edges and collects the corner bonus plus both edge bonuses.
 */
public final class EdgeBonusEvaluator implements PositionEvaluator {
    public static final int CORNER_BONUS = 4;
    public static final int SIDE_BONUS = 2;

    public static final EdgeBonusEvaluator INSTANCE = new EdgeBonusEvaluator();

    private static final int LAST = Grid.SIZE - 1;
    // Bonus per flat index, precomputed once
    private static final int[] TILE_BONUS = new int[Grid.SIZE * Grid.SIZE];
    static {
        for(int row = 0; row < Grid.SIZE; row++) {
            for(int col = 0; col < Grid.SIZE; col++) {
                int bonus = 0;
                if((row == 0 || row == LAST) && (col == 0 || col == LAST)) {
                    bonus += CORNER_BONUS;
                }
                if(col == 0 || col == LAST) {
                    bonus += SIDE_BONUS;
                }
                if(row == 0 || row == LAST) {
                    bonus += SIDE_BONUS;
                }
                TILE_BONUS[row * Grid.SIZE + col] = bonus;
            }
        }
    }

    private EdgeBonusEvaluator() {}

    @Override
    public int evaluate(Game game, Piece perspective) {
        int score = PieceCountEvaluator.INSTANCE.evaluate(game, perspective);
        for(int flatIndex = 0; flatIndex < TILE_BONUS.length; flatIndex++) {
            int bonus = TILE_BONUS[flatIndex];
            if(bonus == 0) {
                continue;
            }
            Piece piece = game.pieceAt(flatIndex);
            if(piece == perspective) {
                score += bonus;
            } else if(piece != null) {
                score -= bonus;
            }
        }
        return score;
    }

    static int tileBonus(int flatIndex) {
        return TILE_BONUS[flatIndex];
    }
}
