package max.reversi.console;

import max.reversi.engine.search.SearchConfig;

/**
 * Parsed command line: {@code --black=human|engine|random --white=... --depth=N
 * --evaluator=pieces|edges --noise=N --seed=N --debug}.
 */
public record ConsoleOptions(ConsolePlayer black, ConsolePlayer white, SearchConfig searchConfig, long seed) {

    /**
     * @throws IllegalArgumentException on an unknown option or a value that does not parse
     */
    public static ConsoleOptions parse(String[] args, long defaultSeed) {
        ConsolePlayer black = ConsolePlayer.HUMAN;
        ConsolePlayer white = ConsolePlayer.ENGINE;
        SearchConfig.Builder builder = new SearchConfig.Builder();
        long seed = defaultSeed;

        for(String arg : args) {
            String[] kv = arg.split("=", 2);
            String value = kv.length > 1 ? kv[1] : "";
            switch (kv[0]) {
                case "--black" -> black = ConsolePlayer.fromOption(value);
                case "--white" -> white = ConsolePlayer.fromOption(value);
                case "--depth" -> builder.depth((int) parseNumber(kv[0], value));
                case "--evaluator" -> builder.evaluator(EvaluatorOption.fromOption(value).evaluator());
                case "--noise" -> builder.evaluationNoise((int) parseNumber(kv[0], value));
                case "--seed" -> seed = parseNumber(kv[0], value);
                case "--debug" -> builder.debug(true);
                default -> throw new IllegalArgumentException("Unknown option " + arg);
            }
        }
        builder.seed(seed);
        return new ConsoleOptions(black, white, builder.build(), seed);
    }

    private static long parseNumber(String option, String value) {
        try {
            long number = Long.parseLong(value.trim());
            if(!option.equals("--seed") && (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE)) {
                throw new IllegalArgumentException("Value out of range for " + option + ": " + value);
            }
            return number;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number for " + option + " but got `" + value + "`", e);
        }
    }
}
