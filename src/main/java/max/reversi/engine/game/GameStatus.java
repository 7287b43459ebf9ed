package max.reversi.engine.game;

public enum GameStatus {
    IN_PROGRESS, TERMINAL
}
