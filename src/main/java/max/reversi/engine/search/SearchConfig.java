package max.reversi.engine.search;

import max.reversi.engine.search.evaluator.PieceCountEvaluator;
import max.reversi.engine.search.evaluator.PositionEvaluator;

public final class SearchConfig {

    public final boolean debug;

    public final int depth;
    public final boolean useAlphaBeta;  // pruning only, never changes the move picked
    public final PositionEvaluator evaluator;

    // Leaf noise in [-evaluationNoise, evaluationNoise), 0 keeps the search deterministic
    public final int evaluationNoise;
    public final long seed;

    private SearchConfig(Builder b) {
        debug = b.debug;
        depth = b.depth;
        useAlphaBeta = b.useAlphaBeta;
        evaluator = b.evaluator;
        evaluationNoise = b.evaluationNoise;
        seed = b.seed;
    }

    public static SearchConfig defaults() {
        return new Builder().build();
    }

    @Override
    public String toString() {
        return "SearchConfig{" +
                "depth=" + depth +
                ", useAlphaBeta=" + useAlphaBeta +
                ", evaluator=" + evaluator.getClass().getSimpleName() +
                ", evaluationNoise=" + evaluationNoise +
                ", seed=" + seed +
                ", debug=" + debug +
                '}';
    }

    public static final class Builder {
        private boolean debug = false;
        private int depth = SearchConstants.DEFAULT_DEPTH;
        private boolean useAlphaBeta = true;
        private PositionEvaluator evaluator = PieceCountEvaluator.INSTANCE;
        private int evaluationNoise = 0;
        private long seed = 0L;

        public Builder debug(boolean v){debug=v;return this;}
        public Builder depth(int v){depth=v;return this;}
        public Builder useAlphaBeta(boolean v){useAlphaBeta=v;return this;}
        public Builder evaluator(PositionEvaluator v){evaluator=v;return this;}
        public Builder evaluationNoise(int v){evaluationNoise=v;return this;}
        public Builder seed(long v){seed=v;return this;}

        public SearchConfig build(){
            if(depth < 1) {
                throw new IllegalArgumentException("Search depth must be at least 1, got " + depth);
            }
            if(evaluator == null) {
                throw new IllegalArgumentException("An evaluator is required");
            }
            if(evaluationNoise < 0 || evaluationNoise > SearchConstants.MAX_EVALUATION_NOISE) {
                throw new IllegalArgumentException("Evaluation noise must be in [0, "
                        + SearchConstants.MAX_EVALUATION_NOISE + "], got " + evaluationNoise);
            }
            return new SearchConfig(this);
        }
    }
}
