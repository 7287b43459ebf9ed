package max.reversi.engine.common;

public enum Piece {
    BLACK('B'), WHITE('W');

    private final char symbol;

    Piece(char symbol) {
        this.symbol = symbol;
    }

    public Piece opposite() {
        if(this == BLACK) {
            return WHITE;
        } else {
            return BLACK;
        }
    }

    public char symbol() {
        return symbol;
    }

    public static Piece fromSymbol(char symbol) {
        return switch (symbol) {
            case 'b', 'B' -> BLACK;
            case 'w', 'W' -> WHITE;
            default -> throw new IllegalArgumentException("Unknown piece symbol " + symbol);
        };
    }
}
