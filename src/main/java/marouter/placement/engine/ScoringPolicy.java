package marouter.placement.engine;

import marouter.placement.model.NodeSnapshot;
import marouter.placement.model.ResourceRequest;
import marouter.placement.model.ScoredCandidate;

import java.util.List;

/**
 * Strategy for scoring the eligible candidates of one request.
 *
 * Implementations must be pure: the result depends only on the request and
 * the eligible set passed in. The whole set is given at once because some
 * policies normalize against it.
 */
public interface ScoringPolicy {

    /**
     * Short policy name recorded on every decision.
     */
    String name();

    /**
     * Score every eligible candidate.
     *
     * @param request  the validated request
     * @param eligible nodes that passed the candidate filter
     * @return one scored candidate per eligible node, in input order
     */
    List<ScoredCandidate> score(ResourceRequest request, List<NodeSnapshot> eligible);
}
