package max.reversi.engine.search;

import max.reversi.engine.common.TilePos;
import max.reversi.engine.game.Game;
import max.reversi.engine.game.GameOverException;

import java.util.List;
import java.util.Random;

public class RandomSearch {

    public static TilePos pickNextMove(Game game, Random random) {
        if(game.isTerminal()) {
            throw new GameOverException("No move to pick on a finished game");
        }
        List<TilePos> moves = game.getValidMoves();
        if(moves.isEmpty()) {
            throw new IllegalStateException(game.currentPlayer() + " has no valid move and must pass");
        }
        return moves.get(random.nextInt(moves.size()));
    }
}
