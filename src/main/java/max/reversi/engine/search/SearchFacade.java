package max.reversi.engine.search;

import max.reversi.engine.game.Game;

import java.util.function.Consumer;

public final class SearchFacade {

    private final SearchContext ctx;

    public SearchFacade(SearchConfig cfg) {
        this.ctx = new SearchContext(cfg);
    }

    public SearchConfig config() {
        return ctx.cfg;
    }

    public SearchResult findBestMove(Game game, Consumer<String> out) {
        SearchResult sr = RootSearch.bestMove(game, ctx, ctx.cfg.depth);
        out.accept(sr.toInfo());

        if (ctx.cfg.debug) {
            out.accept(ctx.toInfo(ctx.cfg.depth));
            // Verify bestMove legality in the current position
            if (!game.isValidMove(sr.move(), game.currentPlayer())) {
                throw new IllegalStateException("Illegal bestMove: " + sr.move());
            }
        }

        return sr;
    }
}
