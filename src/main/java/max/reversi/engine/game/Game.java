package max.reversi.engine.game;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.reversi.engine.common.Piece;
import max.reversi.engine.common.TilePos;
import max.reversi.engine.game.board.Grid;
import max.reversi.engine.game.board.GridRow;
import max.reversi.engine.movegen.MoveGenerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class Game {

    private final Grid grid;
    private Piece currentPlayer;

    /**
     * Standard opening: 2x2 alternating square in the center, BLACK moves first.
     */
    public Game() {
        this(new Grid(), Piece.BLACK);
        grid.set(TilePos.at(3, 3), Piece.BLACK);
        grid.set(TilePos.at(3, 4), Piece.WHITE);
        grid.set(TilePos.at(4, 3), Piece.WHITE);
        grid.set(TilePos.at(4, 4), Piece.BLACK);
    }

    // The grid is copied, later changes to it do not reach the game
    public Game(Grid grid, Piece currentPlayer) {
        if(grid == null || currentPlayer == null) {
            throw new IllegalArgumentException("Grid and current player are required");
        }
        this.grid = grid.copy();
        this.currentPlayer = currentPlayer;
    }

    private Game(Game other) {
        this.grid = other.grid.copy();
        this.currentPlayer = other.currentPlayer;
    }

    public Game copy() {
        return new Game(this);
    }

    // Snapshot of the tiles, the game only changes through applyMove and passTurn
    public Grid grid() {
        return grid.copy();
    }

    public Optional<Piece> get(TilePos pos) {
        return grid.get(pos);
    }

    // Hot path accessor for evaluators, null when empty
    public Piece pieceAt(int flatIndex) {
        return grid.pieceAt(flatIndex);
    }

    public Iterable<GridRow> rows() {
        return grid.rows();
    }

    public boolean isFull() {
        return grid.isFull();
    }

    public Piece currentPlayer() {
        return currentPlayer;
    }

    public List<TilePos> getValidMoves(Piece player) {
        IntArrayList moves = MoveGenerator.generateMoves(grid, player);
        List<TilePos> validMoves = new ArrayList<>(moves.size());
        for(int i = 0; i < moves.size(); i++) {
            validMoves.add(TilePos.ofFlatIndex(moves.getInt(i)));
        }
        return Collections.unmodifiableList(validMoves);
    }

    public List<TilePos> getValidMoves() {
        return getValidMoves(currentPlayer);
    }

    public boolean isValidMove(TilePos pos, Piece player) {
        return MoveGenerator.isValidMove(grid, player, pos);
    }

    public void applyMove(TilePos pos) {
        applyMove(pos, currentPlayer);
    }

    /**
     * Drops player's piece on pos and flips every captured run. The turn then goes to the
     * opponent, unless the opponent has no move, in which case player moves again.
     *
     * @throws GameOverException if neither player can move
     * @throws InvalidMoveException if it is not player's turn or pos is not a valid move
     */
    public void applyMove(TilePos pos, Piece player) {
        if(isTerminal()) {
            throw new GameOverException("Game is over, no move accepted anymore");
        }
        if(player != currentPlayer) {
            throw new InvalidMoveException(pos, player, "it is " + currentPlayer + "'s turn");
        }
        if(!grid.isEmpty(pos)) {
            throw new InvalidMoveException(pos, player, "tile is not empty");
        }
        // Computing everything before touching the grid keeps a rejected move side-effect free
        IntArrayList flips = MoveGenerator.computeFlips(grid, player, pos);
        if(flips.isEmpty()) {
            throw new InvalidMoveException(pos, player, "move must flip at least one tile");
        }

        grid.set(pos, player);
        for(int i = 0; i < flips.size(); i++) {
            grid.set(TilePos.ofFlatIndex(flips.getInt(i)), player);
        }

        nextTurn();
    }

    /**
     * Hands the turn over when the current player is stuck. Only reachable from positions
     * that were not produced by {@link #applyMove}, which passes automatically.
     */
    public void passTurn() {
        if(isTerminal()) {
            throw new GameOverException("Game is over, nothing to pass");
        }
        if(MoveGenerator.hasAnyMove(grid, currentPlayer)) {
            throw new IllegalStateException(currentPlayer + " has a valid move and cannot pass");
        }
        currentPlayer = currentPlayer.opposite();
    }

    private void nextTurn() {
        Piece opponent = currentPlayer.opposite();
        if(MoveGenerator.hasAnyMove(grid, opponent)) {
            currentPlayer = opponent;
        }
        // else: opponent passes, same player again (or the game is over)
    }

    public Map<Piece, Integer> scores() {
        Map<Piece, Integer> scores = new EnumMap<>(Piece.class);
        for(Piece piece : Piece.values()) {
            scores.put(piece, grid.count(piece));
        }
        return scores;
    }

    public int score(Piece piece) {
        return grid.count(piece);
    }

    public boolean isTerminal() {
        return !MoveGenerator.hasAnyMove(grid, Piece.BLACK) && !MoveGenerator.hasAnyMove(grid, Piece.WHITE);
    }

    public GameStatus status() {
        return isTerminal() ? GameStatus.TERMINAL : GameStatus.IN_PROGRESS;
    }

    /**
     * The player with more pieces, null on a tie. Meaningful once the game is terminal.
     */
    public Piece leader() {
        int black = grid.count(Piece.BLACK);
        int white = grid.count(Piece.WHITE);
        if(black == white) {
            return null;
        }
        return black > white ? Piece.BLACK : Piece.WHITE;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj == this) {
            return true;
        }
        if(!(obj instanceof Game other)) {
            return false;
        }
        return currentPlayer == other.currentPlayer && grid.equals(other.grid);
    }

    @Override
    public int hashCode() {
        return 31 * grid.hashCode() + currentPlayer.hashCode();
    }
}
