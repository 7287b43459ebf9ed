package max.reversi.console;

import max.reversi.engine.search.evaluator.EdgeBonusEvaluator;
import max.reversi.engine.search.evaluator.PieceCountEvaluator;
import max.reversi.engine.search.evaluator.PositionEvaluator;

/** Evaluators selectable from the command line. */
public enum EvaluatorOption {
    PIECES(PieceCountEvaluator.INSTANCE),
    EDGES(EdgeBonusEvaluator.INSTANCE);

    private final PositionEvaluator evaluator;

    EvaluatorOption(PositionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public PositionEvaluator evaluator() {
        return evaluator;
    }

    public static EvaluatorOption fromOption(String value) {
        return switch (value.trim().toLowerCase()) {
            case "pieces" -> PIECES;
            case "edges" -> EDGES;
            default -> throw new IllegalArgumentException("Unknown evaluator " + value);
        };
    }
}
