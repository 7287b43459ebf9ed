package max.reversi.engine.game.board.utils;

import max.reversi.engine.game.Game;
import max.reversi.engine.utils.notations.BoardNotation;

public class BoardGenerator {
    public static final String STANDARD_GAME = "8/8/8/3BW3/3WB3/8/8/8 b";

    public static Game newStandardGameBoard() {
        return new Game();
    }

    public static Game from(String notation) {
        return BoardNotation.getGameFrom(notation);
    }
}
