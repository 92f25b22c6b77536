package marouter.placement.engine;

import marouter.placement.model.ScoredCandidate;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the winning candidate. Ties on score go to higher reliability, then
 * lower price, then lower node id, so identical inputs always give the same
 * winner.
 */
public class Selector {

    /** Best candidate first */
    static final Comparator<ScoredCandidate> BEST_FIRST = Comparator
            .comparingDouble((ScoredCandidate c) -> c.score().total()).reversed()
            .thenComparing(Comparator.comparingDouble((ScoredCandidate c) -> c.node().reliability()).reversed())
            .thenComparingDouble(c -> c.node().pricePerHour())
            .thenComparingLong(c -> c.node().id());

    /**
     * @return the winner, or empty when there is no eligible candidate
     */
    public Optional<ScoredCandidate> select(List<ScoredCandidate> scored) {
        return scored.stream().min(BEST_FIRST);
    }

    /**
     * All candidates ordered best first.
     */
    public List<ScoredCandidate> rank(List<ScoredCandidate> scored) {
        return scored.stream().sorted(BEST_FIRST).toList();
    }
}
