package max.reversi.engine.game.board;

import max.reversi.engine.common.Piece;
import max.reversi.engine.common.TilePos;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

public class Grid {
    public static final int SIZE = TilePos.SIZE;

    // Row-major, null means empty
    private final Piece[] tiles;

    public Grid() {
        this.tiles = new Piece[SIZE * SIZE];
    }

    private Grid(Grid other) {
        this.tiles = other.tiles.clone();
    }

    public Grid copy() {
        return new Grid(this);
    }

    public Optional<Piece> get(TilePos pos) {
        return Optional.ofNullable(tiles[pos.flatIndex()]);
    }

    public boolean isEmpty(TilePos pos) {
        return tiles[pos.flatIndex()] == null;
    }

    // Hot path accessor for move generation, null when empty
    public Piece pieceAt(int flatIndex) {
        return tiles[flatIndex];
    }

    public void set(TilePos pos, Piece piece) {
        if(piece == null) {
            throw new IllegalArgumentException("Use clear() to empty a tile");
        }
        tiles[pos.flatIndex()] = piece;
    }

    public void clear(TilePos pos) {
        tiles[pos.flatIndex()] = null;
    }

    public boolean isFull() {
        for(int row = 0; row < SIZE; row++) {
            for(int col = 0; col < SIZE; col++) {
                if(isEmpty(TilePos.at(row, col))) {
                    return false;
                }
            }
        }
        return true;
    }

    public int count(Piece piece) {
        int count = 0;
        for(Piece tile : tiles) {
            if(tile == piece) {
                count++;
            }
        }
        return count;
    }

    /**
     * Row-major view of the grid. Each call returns a new traversal and rows are only
     * materialized while iterating.
     */
    public Iterable<GridRow> rows() {
        return () -> new Iterator<>() {
            private int nextRow = 0;

            @Override
            public boolean hasNext() {
                return nextRow < SIZE;
            }

            @Override
            public GridRow next() {
                if(!hasNext()) {
                    throw new NoSuchElementException();
                }
                List<Optional<Piece>> rowTiles = new ArrayList<>(SIZE);
                for(int col = 0; col < SIZE; col++) {
                    rowTiles.add(Optional.ofNullable(tiles[nextRow * SIZE + col]));
                }
                return new GridRow(nextRow++, rowTiles);
            }
        };
    }

    @Override
    public boolean equals(Object obj) {
        if(obj == this) {
            return true;
        }
        if(!(obj instanceof Grid other)) {
            return false;
        }
        return Arrays.equals(tiles, other.tiles);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(tiles);
    }
}
