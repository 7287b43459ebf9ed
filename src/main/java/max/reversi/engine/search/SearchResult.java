package max.reversi.engine.search;

import max.reversi.engine.common.TilePos;
import max.reversi.engine.utils.notations.TileNotation;

/**
 * Outcome of a root search. The score is seen from the player to move at the root.
 */
public record SearchResult(TilePos move, int score, int depth, long nodes, long timeMs) {
    @Override
    public String toString() {
        return "SearchResult\n" +
                "best move: " + TileNotation.write(move) + "\n" +
                "score: " + score + "\n" +
                "depth: " + depth + "\n" +
                "nodes: " + nodes + "\n" +
                "search time (ms): " + timeMs;
    }

    public String toInfo() {
        return "info" +
                " depth " + depth +
                " score " + score +
                " nodes " + nodes +
                " time " + timeMs +
                " pv " + TileNotation.write(move);
    }
}
