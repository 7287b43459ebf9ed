package max.reversi.console;

import max.reversi.engine.common.Piece;
import max.reversi.engine.common.TilePos;
import max.reversi.engine.game.Game;
import max.reversi.engine.search.RandomSearch;
import max.reversi.engine.search.SearchFacade;
import max.reversi.engine.search.SearchResult;
import max.reversi.engine.utils.notations.TileNotation;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Text game loop. Humans type tiles like "D3", engine and random sides play on their own.
 * All the rules live in {@link Game}, this class only reads, prints and forwards.
 */
public final class ConsoleServer {
    private final BufferedReader in;
    private final PrintWriter out;
    private final Map<Piece, ConsolePlayer> players = new EnumMap<>(Piece.class);
    private final SearchFacade search;
    private final Random random;

    public ConsoleServer(BufferedReader in, PrintWriter out, ConsolePlayer black, ConsolePlayer white,
                         SearchFacade search, Random random) {
        this.in = Objects.requireNonNull(in);
        this.out = Objects.requireNonNull(out);
        this.players.put(Piece.BLACK, Objects.requireNonNull(black));
        this.players.put(Piece.WHITE, Objects.requireNonNull(white));
        this.search = Objects.requireNonNull(search);
        this.random = Objects.requireNonNull(random);
    }

    /**
     * Plays game to the end, or until human input runs out.
     *
     * @return the finished game, or the game as it stood when input ended
     */
    public Game run(Game game) throws IOException {
        while(!game.isTerminal()) {
            Piece player = game.currentPlayer();
            List<TilePos> validMoves = game.getValidMoves(player);
            printGame(game, validMoves);
            send("The current piece is: " + player);

            if(validMoves.isEmpty()) {
                // Only possible on positions loaded mid-game, applyMove passes by itself
                send("No moves available for " + player + ". Skipping turn.");
                game.passTurn();
                continue;
            }

            TilePos move = switch (players.get(player)) {
                case ENGINE -> engineMove(game);
                case RANDOM -> RandomSearch.pickNextMove(game, random);
                case HUMAN -> promptMove(game);
            };
            if(move == null) {
                send("");
                return game;
            }
            send(player + " plays " + TileNotation.write(move));
            game.applyMove(move);
            if(!game.isTerminal() && game.currentPlayer() == player) {
                send(player.opposite() + " has no valid move and passes.");
            }
        }

        printGame(game, List.of());
        printResult(game);
        return game;
    }

    private TilePos engineMove(Game game) {
        SearchResult result = search.findBestMove(game, this::sendInfo);
        return result.move();
    }

    // null when input is exhausted
    private TilePos promptMove(Game game) throws IOException {
        while(true) {
            out.print("Enter your move (e.g. A1): ");
            out.flush();
            String line = in.readLine();
            if(line == null) {
                return null;
            }
            Optional<TilePos> parsed = TileNotation.parse(line);
            if(parsed.isEmpty()) {
                send("Invalid input: `" + line.trim() + "`. Enter something like 'A1'.");
                continue;
            }
            TilePos move = parsed.get();
            if(!game.isValidMove(move, game.currentPlayer())) {
                send("Invalid move: `" + TileNotation.write(move) + "`. Your move must flip at least one tile.");
                continue;
            }
            return move;
        }
    }

    private void printGame(Game game, List<TilePos> validMoves) {
        send("");
        out.print(BoardPrinter.render(game, validMoves));
        send("");
        Map<Piece, Integer> scores = game.scores();
        send("Score: " + Piece.BLACK + " " + scores.get(Piece.BLACK) + " | " + Piece.WHITE + " " + scores.get(Piece.WHITE));
    }

    private void printResult(Game game) {
        Piece leader = game.leader();
        if(leader == null) {
            send("The game ended with a tie");
        } else {
            send("The winner is: " + leader);
        }
    }

    private void send(String line) {
        out.println(line);
        out.flush();
    }

    private void sendInfo(String infoLine) {
        if (infoLine == null || infoLine.isEmpty()) return;
        System.err.println(infoLine);
    }
}
