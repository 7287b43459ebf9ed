package max.reversi.engine.search;

import java.util.Random;

public final class SearchContext {
    public final SearchConfig cfg;

    // Counters
    public long nodes;
    public long leaves;
    public long cutoffs;

    private Random noise;

    public SearchContext(SearchConfig cfg) {
        this.cfg = cfg;
        this.noise = new Random(cfg.seed);
    }

    // Same seed every search, so two searches on one position agree
    public void newSearch() {
        nodes = leaves = cutoffs = 0;
        noise = new Random(cfg.seed);
    }

    int nextNoise() {
        if(cfg.evaluationNoise == 0) {
            return 0;
        }
        return noise.nextInt(2 * cfg.evaluationNoise) - cfg.evaluationNoise;
    }

    public String toInfo(int depth) {
        return String.format("info string diag depth %d nodes %d leaves %d cutoffs %d",
                depth, nodes, leaves, cutoffs);
    }
}
