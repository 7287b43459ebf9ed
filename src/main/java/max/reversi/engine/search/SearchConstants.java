package max.reversi.engine.search;

public class SearchConstants {
    // Far above any reachable evaluation (64 tiles plus edge bonuses plus noise)
    public static final int INF = 30000;

    public static final int DEFAULT_DEPTH = 4;

    // Noise is clamped so INF stays out of reach
    public static final int MAX_EVALUATION_NOISE = 10000;
}
