package marouter.placement.engine;

import marouter.placement.model.Decision;
import marouter.placement.model.DirectorySnapshot;
import marouter.placement.model.ResourceRequest;
import marouter.placement.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs one placement evaluation: validate, filter, score, select, assemble.
 *
 * The engine holds no mutable state and never touches node capacity, so one
 * instance can serve any number of threads. Two concurrent requests may be
 * steered to the same node; reserving capacity is not its job.
 */
public class PlacementEngine {

    private static final Logger log = LoggerFactory.getLogger(PlacementEngine.class);

    private final CandidateFilter filter;
    private final ScoringPolicy policy;
    private final Selector selector;
    private final DecisionAssembler assembler;

    public PlacementEngine(ScoringPolicy policy) {
        this(new CandidateFilter(), policy, new Selector(), new DecisionAssembler());
    }

    public PlacementEngine(CandidateFilter filter, ScoringPolicy policy, Selector selector,
            DecisionAssembler assembler) {
        this.filter = filter;
        this.policy = policy;
        this.selector = selector;
        this.assembler = assembler;
    }

    public ScoringPolicy policy() {
        return policy;
    }

    /**
     * Evaluate a request against a snapshot.
     *
     * @param requestId id of the originating request, null in quote mode
     * @param request   the request
     * @param snapshot  the node snapshot to choose from
     * @param decidedAt timestamp recorded on the decision
     * @return a decision, with no chosen node when nothing is eligible
     * @throws InvalidRequestException if the request is malformed
     */
    public Decision evaluate(String requestId, ResourceRequest request, DirectorySnapshot snapshot,
            Instant decidedAt) {
        RequestValidator.validate(request);

        FilterResult filtered = filter.filter(request, snapshot.nodes());
        if (filtered.isEmpty()) {
            Decision decision = assembler.noCandidate(requestId, request, filtered, policy.name(), decidedAt);
            log.debug("No eligible candidate for {}: {}", request, decision.justification());
            return decision;
        }

        List<ScoredCandidate> scored = policy.score(request, filtered.eligible());
        Optional<ScoredCandidate> winner = selector.select(scored);
        if (winner.isEmpty()) {
            // scoring returns one entry per eligible node, so this means a broken policy
            throw new IllegalStateException("Policy " + policy.name() + " returned no scores for "
                    + filtered.eligible().size() + " eligible nodes");
        }

        Decision decision = assembler.chosen(requestId, request, winner.get(), policy.name(), decidedAt);
        log.debug("Selected node {} for {} with score {}", decision.chosenNodeId(), request, decision.fitScore());
        return decision;
    }
}
