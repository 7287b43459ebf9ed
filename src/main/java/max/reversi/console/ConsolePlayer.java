package max.reversi.console;

/** Who plays a side in the console game. */
public enum ConsolePlayer {
    HUMAN, ENGINE, RANDOM;

    public static ConsolePlayer fromOption(String value) {
        return switch (value.trim().toLowerCase()) {
            case "human" -> HUMAN;
            case "engine", "ai" -> ENGINE;
            case "random" -> RANDOM;
            default -> throw new IllegalArgumentException("Unknown player type " + value);
        };
    }
}
