package marouter.placement.repository;

import marouter.placement.model.Decision;
import marouter.placement.model.ResourceRequest;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of placement requests and their decisions.
 */
public interface DecisionStore {

    /**
     * Generate a new unique request ID.
     *
     * @return unique ID
     */
    String generateId();

    /**
     * Persist a request together with its decision in one transaction.
     *
     * @param requestId the request ID (also carried by the decision)
     * @param request   the request as evaluated
     * @param decision  the decision
     */
    void record(String requestId, ResourceRequest request, Decision decision);

    /**
     * Find the decision for a request.
     *
     * @param requestId the request ID
     * @return the decision if found
     */
    Optional<Decision> findByRequestId(String requestId);

    /**
     * Most recent decisions first.
     *
     * @param limit maximum number of decisions
     * @return decisions
     */
    List<Decision> findRecent(int limit);

    /**
     * Get total count of recorded decisions.
     *
     * @return count
     */
    int count();
}
