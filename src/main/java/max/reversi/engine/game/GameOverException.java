package max.reversi.engine.game;

/**
 * Thrown when an action is requested on a game where neither player can move anymore.
 * This is a driver bug, not a bad move.
 */
public class GameOverException extends IllegalStateException {
    public GameOverException(String message) {
        super(message);
    }
}
