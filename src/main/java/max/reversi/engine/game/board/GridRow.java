package max.reversi.engine.game.board;

import max.reversi.engine.common.Piece;

import java.util.List;
import java.util.Optional;

public record GridRow(int index, List<Optional<Piece>> tiles) {
    public GridRow {
        tiles = List.copyOf(tiles);
    }
}
