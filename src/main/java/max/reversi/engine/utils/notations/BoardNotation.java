package max.reversi.engine.utils.notations;

import max.reversi.engine.common.Piece;
import max.reversi.engine.common.TilePos;
import max.reversi.engine.game.Game;
import max.reversi.engine.game.board.Grid;

/**
 * FEN-like one-liner: ranks from row 0 to row 7 joined by '/', a space, then the side to move.
 * Inside a rank 'B' and 'W' are pieces and a digit is a run of empty tiles.
 * The standard opening reads {@code 8/8/8/3BW3/3WB3/8/8/8 b}.
 */
public class BoardNotation {

    public static Game getGameFrom(String notation) {
        if(notation == null) {
            throw new IllegalArgumentException("Invalid board notation: null");
        }
        String[] fields = notation.trim().split("\\s+");
        if(fields.length != 2) {
            throw new IllegalArgumentException("Invalid board notation, expected placement and side to move: " + notation);
        }

        Grid grid = new Grid();
        injectPiecePlacement(grid, fields[0]);
        return new Game(grid, parseCurrentTurn(fields[1]));
    }

    public static String getNotationFromGame(Game game) {
        StringBuilder notation = new StringBuilder();
        injectPiecePlacement(game, notation);
        notation.append(' ').append(Character.toLowerCase(game.currentPlayer().symbol()));
        return notation.toString();
    }

    private static void injectPiecePlacement(Grid grid, String placement) {
        String[] ranks = placement.split("/");
        if(ranks.length != Grid.SIZE) {
            throw new IllegalArgumentException("Expected " + Grid.SIZE + " ranks but got " + ranks.length + ": " + placement);
        }
        for(int row = 0; row < Grid.SIZE; row++) {
            int col = 0;
            for(char c : ranks[row].toCharArray()) {
                if(Character.isDigit(c)) {
                    col += c - '0';
                } else {
                    if(col >= Grid.SIZE) {
                        throw new IllegalArgumentException("Rank " + (row + 1) + " is too long: " + ranks[row]);
                    }
                    grid.set(TilePos.at(row, col), Piece.fromSymbol(c));
                    col++;
                }
            }
            if(col != Grid.SIZE) {
                throw new IllegalArgumentException("Rank " + (row + 1) + " does not cover " + Grid.SIZE + " tiles: " + ranks[row]);
            }
        }
    }

    private static void injectPiecePlacement(Game game, StringBuilder notation) {
        for(int row = 0; row < Grid.SIZE; row++) {
            if(row > 0) {
                notation.append('/');
            }
            int emptyRun = 0;
            for(int col = 0; col < Grid.SIZE; col++) {
                Piece piece = game.pieceAt(row * Grid.SIZE + col);
                if(piece == null) {
                    emptyRun++;
                    continue;
                }
                if(emptyRun > 0) {
                    notation.append(emptyRun);
                    emptyRun = 0;
                }
                notation.append(piece.symbol());
            }
            if(emptyRun > 0) {
                notation.append(emptyRun);
            }
        }
    }

    private static Piece parseCurrentTurn(String currentTurn) {
        if(currentTurn.length() != 1) {
            throw new IllegalArgumentException("Invalid side to move: " + currentTurn);
        }
        return Piece.fromSymbol(currentTurn.charAt(0));
    }
}
