package max.reversi.engine.search;

import max.reversi.engine.common.Piece;
import max.reversi.engine.common.TilePos;
import max.reversi.engine.game.Game;
import max.reversi.engine.game.GameOverException;

import java.util.List;

import static max.reversi.engine.search.SearchConstants.INF;

public final class RootSearch {
    private RootSearch() {}

    public static SearchResult bestMove(Game game, int depth) {
        SearchConfig cfg = new SearchConfig.Builder().depth(depth).build();
        return bestMove(game, new SearchContext(cfg), depth);
    }

    /**
     * Best move for the player to move, each candidate searched depth - 1 plies further.
     * Among equal scores the first move in {@link Game#getValidMoves()} order wins.
     *
     * @throws GameOverException on a terminal game
     * @throws IllegalStateException if the player to move has to pass
     */
    public static SearchResult bestMove(Game game, SearchContext ctx, int depth) {
        if(depth < 1) {
            throw new IllegalArgumentException("Root search needs a depth of at least 1, got " + depth);
        }
        if(game.isTerminal()) {
            throw new GameOverException("No best move on a finished game");
        }
        final long start = System.nanoTime();
        ctx.newSearch();
        ctx.nodes++;

        final Piece mover = game.currentPlayer();
        final List<TilePos> moves = game.getValidMoves(mover);
        if(moves.isEmpty()) {
            throw new IllegalStateException(mover + " has no valid move and must pass");
        }

        TilePos bestMove = null;
        int bestScore = Integer.MIN_VALUE;
        int alpha = -INF;
        for(TilePos move : moves) {
            Game child = game.copy();
            child.applyMove(move);

            int score;
            if(child.currentPlayer() == mover) {
                score = Negamax.search(child, ctx, depth - 1, alpha, INF);
            } else {
                score = -Negamax.search(child, ctx, depth - 1, -INF, -alpha);
            }

            // Strictly greater keeps the first of equal moves. A child failing low returns
            // at most alpha, which can never beat the current best.
            if(score > bestScore) {
                bestScore = score;
                bestMove = move;
            }
            if(ctx.cfg.useAlphaBeta && bestScore > alpha) {
                alpha = bestScore;
            }
        }

        long timeMs = (System.nanoTime() - start) / 1_000_000L;
        return new SearchResult(bestMove, bestScore, depth, ctx.nodes, timeMs);
    }
}
