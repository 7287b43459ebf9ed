package max.reversi.engine.search;

import max.reversi.engine.common.Piece;
import max.reversi.engine.common.TilePos;
import max.reversi.engine.game.Game;

import java.util.List;

import static max.reversi.engine.search.SearchConstants.INF;

/**
 * Plain negamax over copies of the game: a child never shares a grid with its parent or its
 * siblings. Scores are relative to the player to move in the node being searched.
 */
public final class Negamax {
    private Negamax() {}

    public static int negamaxScore(Game game, int depth, Piece perspective) {
        SearchContext ctx = new SearchContext(SearchConfig.defaults());
        return negamaxScore(game, depth, perspective, ctx);
    }

    /**
     * Score of game searched depth plies deep, seen from perspective. At depth 0, or on a
     * terminal game, this is the static evaluation and nothing is searched. The context is
     * reset first, so the same context and game always give the same score.
     */
    public static int negamaxScore(Game game, int depth, Piece perspective, SearchContext ctx) {
        if(depth < 0) {
            throw new IllegalArgumentException("Depth cannot be negative: " + depth);
        }
        ctx.newSearch();
        int score = search(game, ctx, depth, -INF, INF);
        return game.currentPlayer() == perspective ? score : -score;
    }

    static int search(Game game, SearchContext ctx, int depth, int alpha, int beta) {
        ctx.nodes++;
        final Piece mover = game.currentPlayer();

        if(depth <= 0 || game.isTerminal()) {
            ctx.leaves++;
            return ctx.cfg.evaluator.evaluate(game, mover) + ctx.nextNoise();
        }

        List<TilePos> moves = game.getValidMoves(mover);
        if(moves.isEmpty()) {
            // Stuck but not over: opponent plays on, the score is flipped back to our side
            Game passed = game.copy();
            passed.passTurn();
            return -search(passed, ctx, depth - 1, -beta, -alpha);
        }

        int bestScore = -INF;
        for(TilePos move : moves) {
            Game child = game.copy();
            child.applyMove(move);

            int score;
            if(child.currentPlayer() == mover) {
                // Opponent had to pass, child is still scored for us
                score = search(child, ctx, depth - 1, alpha, beta);
            } else {
                score = -search(child, ctx, depth - 1, -beta, -alpha);
            }

            if(score > bestScore) {
                bestScore = score;
            }
            if(ctx.cfg.useAlphaBeta) {
                if(bestScore > alpha) {
                    alpha = bestScore;
                }
                if(alpha >= beta) {
                    ctx.cutoffs++;
                    break;
                }
            }
        }
        return bestScore;
    }
}
