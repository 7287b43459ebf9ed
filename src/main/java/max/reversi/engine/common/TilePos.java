package max.reversi.engine.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class TilePos implements Comparable<TilePos> {

    public static final int SIZE = 8;

    // Every in-bounds position is built once, of() only hands out cached instances
    private static final TilePos[] POSITION_CACHE = new TilePos[SIZE * SIZE];
    static {
        for(int row = 0; row < SIZE; row++) {
            for(int col = 0; col < SIZE; col++) {
                POSITION_CACHE[row * SIZE + col] = new TilePos(row, col);
            }
        }
    }

    public static boolean isInBounds(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    public static Optional<TilePos> of(int row, int col) {
        if(!isInBounds(row, col)) {
            return Optional.empty();
        }
        return Optional.of(POSITION_CACHE[row * SIZE + col]);
    }

    /**
     * Same as {@link #of(int, int)} for callers that already know the coordinates are valid.
     *
     * @throws IllegalArgumentException if the coordinates are outside the grid
     */
    public static TilePos at(int row, int col) {
        if(!isInBounds(row, col)) {
            throw new IllegalArgumentException("Tile out of the grid: row=" + row + ", col=" + col);
        }
        return POSITION_CACHE[row * SIZE + col];
    }

    public static TilePos ofFlatIndex(int flatIndex) {
        if(flatIndex < 0 || flatIndex >= SIZE * SIZE) {
            throw new IllegalArgumentException("Flat index out of the grid: " + flatIndex);
        }
        return POSITION_CACHE[flatIndex];
    }

    private final int row;
    private final int col;

    private TilePos(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public int row() {
        return row;
    }

    public int col() {
        return col;
    }

    public int flatIndex() {
        return row * SIZE + col;
    }

    public Optional<TilePos> translate(Direction direction) {
        return of(row + direction.rowDelta, col + direction.colDelta);
    }

    /**
     * The in-bounds adjacent tiles, in {@link Direction} declaration order.
     */
    public List<TilePos> neighbors() {
        List<TilePos> neighbors = new ArrayList<>(Direction.values().length);
        for(Direction direction : Direction.values()) {
            translate(direction).ifPresent(neighbors::add);
        }
        return Collections.unmodifiableList(neighbors);
    }

    @Override
    public int compareTo(TilePos other) {
        if(row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object obj) {
        if(obj == this) {
            return true;
        }
        if(!(obj instanceof TilePos other)) {
            return false;
        }
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return flatIndex();
    }

    @Override
    public String toString() {
        return "TilePos{" +
                "row=" + row +
                ", col=" + col +
                '}';
    }
}
