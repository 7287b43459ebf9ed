package max.reversi.engine.game;

import max.reversi.engine.common.Piece;
import max.reversi.engine.common.TilePos;

/**
 * Thrown when a move breaks the placement rules. The game is left untouched.
 */
public class InvalidMoveException extends RuntimeException {
    private final TilePos pos;
    private final Piece player;

    public InvalidMoveException(TilePos pos, Piece player, String reason) {
        super("Invalid move " + pos + " for " + player + ": " + reason);
        this.pos = pos;
        this.player = player;
    }

    public TilePos getPos() {
        return pos;
    }

    public Piece getPlayer() {
        return player;
    }
}
