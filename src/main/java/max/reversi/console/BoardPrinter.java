package max.reversi.console;

import max.reversi.engine.common.Piece;
import max.reversi.engine.common.TilePos;
import max.reversi.engine.game.Game;
import max.reversi.engine.game.board.Grid;
import max.reversi.engine.game.board.GridRow;
import max.reversi.engine.utils.notations.TileNotation;

import java.util.List;
import java.util.Optional;

final class BoardPrinter {
    private static final char VALID_MOVE_MARK = '*';
    private static final int CELL_SIZE = 4;

    private BoardPrinter() {}

    static String render(Game game, List<TilePos> validMoves) {
        StringBuilder sb = new StringBuilder();
        appendCell(sb, " ");
        for(int col = 0; col < Grid.SIZE; col++) {
            appendCell(sb, TileNotation.getLetterFromCol(col));
        }
        sb.append('\n');
        appendRowSeparator(sb);

        for(GridRow row : game.rows()) {
            appendCell(sb, TileNotation.getNumberFromRow(row.index()));
            List<Optional<Piece>> tiles = row.tiles();
            for(int col = 0; col < tiles.size(); col++) {
                Optional<Piece> tile = tiles.get(col);
                if(tile.isPresent()) {
                    appendCell(sb, String.valueOf(tile.get().symbol()));
                } else if(validMoves.contains(TilePos.at(row.index(), col))) {
                    appendCell(sb, String.valueOf(VALID_MOVE_MARK));
                } else {
                    appendCell(sb, " ");
                }
            }
            sb.append('\n');
            appendRowSeparator(sb);
        }
        return sb.toString();
    }

    private static void appendCell(StringBuilder sb, String value) {
        sb.append(' ').append(value).append(" |");
    }

    private static void appendRowSeparator(StringBuilder sb) {
        sb.append("-".repeat((Grid.SIZE + 1) * CELL_SIZE)).append('\n');
    }
}
