package max.reversi.console;

import max.reversi.engine.common.Piece;
import max.reversi.engine.game.Game;
import max.reversi.engine.search.SearchConfig;
import max.reversi.engine.search.SearchFacade;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConsoleServerTest {

    private static ConsoleServer server(String input, StringWriter output, ConsolePlayer black, ConsolePlayer white) {
        SearchFacade search = new SearchFacade(new SearchConfig.Builder().depth(2).build());
        return new ConsoleServer(new BufferedReader(new StringReader(input)), new PrintWriter(output),
                black, white, search, new Random(17L));
    }

    @Test
    public void automatedPlayersShouldFinishTheGame() throws IOException {
        // Given
        StringWriter output = new StringWriter();

        // When
        Game game = server("", output, ConsolePlayer.ENGINE, ConsolePlayer.RANDOM).run(new Game());

        // Then
        assertTrue(game.isTerminal());
        String text = output.toString();
        assertTrue(text.contains("The winner is: ") || text.contains("The game ended with a tie"));
        assertTrue(text.contains("BLACK plays "));
        assertTrue(text.contains("WHITE plays "));
    }

    @Test
    public void humanInputShouldBeCheckedBeforeBeingPlayed() throws IOException {
        // Given
        // garbage, an empty tile that flips nothing, then a real move, then end of input
        StringWriter output = new StringWriter();

        // When
        Game game = server("zz\nA1\ne3\n", output, ConsolePlayer.HUMAN, ConsolePlayer.HUMAN).run(new Game());

        // Then
        String text = output.toString();
        assertTrue(text.contains("Invalid input: `zz`"));
        assertTrue(text.contains("Invalid move: `A1`"));
        assertTrue(text.contains("BLACK plays E3"));
        assertFalse(game.isTerminal());
        assertEquals(4, game.score(Piece.BLACK));
    }

    @Test
    public void boardShouldMarkValidMoves() {
        Game game = new Game();

        String board = BoardPrinter.render(game, game.getValidMoves());

        // row 3 of the grid is printed with the label 4: empty, empty, empty, B, W, valid move, empty, empty
        assertTrue(board.contains(" 4 |   |   |   | B | W | * |   |   |"));
    }

    @Test
    public void unknownPlayerTypeShouldBeRejected() {
        assertEquals(ConsolePlayer.ENGINE, ConsolePlayer.fromOption("AI"));
        assertThrows(IllegalArgumentException.class, () -> ConsolePlayer.fromOption("robot"));
    }
}
