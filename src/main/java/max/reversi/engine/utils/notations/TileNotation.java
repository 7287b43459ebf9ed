package max.reversi.engine.utils.notations;

import max.reversi.engine.common.TilePos;

import java.util.Optional;

// Column letter then row number, "A1" is the top-left tile
public class TileNotation {

    public static String write(TilePos pos) {
        return getLetterFromCol(pos.col()) + getNumberFromRow(pos.row());
    }

    public static String getLetterFromCol(int col) {
        return String.valueOf((char) ('A' + col));
    }

    public static String getNumberFromRow(int row) {
        return String.valueOf(row + 1);
    }

    /**
     * Accepts "D3", "d3" and "3D". Anything else (including surrounding garbage) gives an empty result.
     */
    public static Optional<TilePos> parse(String input) {
        if(input == null) {
            return Optional.empty();
        }
        String tile = input.trim().toUpperCase();
        if(tile.length() != 2) {
            return Optional.empty();
        }
        char first = tile.charAt(0);
        char second = tile.charAt(1);
        if(Character.isLetter(first) && Character.isDigit(second)) {
            return TilePos.of(second - '1', first - 'A');
        } else if(Character.isDigit(first) && Character.isLetter(second)) {
            return TilePos.of(first - '1', second - 'A');
        }
        return Optional.empty();
    }
}
