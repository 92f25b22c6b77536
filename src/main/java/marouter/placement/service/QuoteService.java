package marouter.placement.service;

import marouter.placement.engine.PlacementEngine;
import marouter.placement.model.Decision;
import marouter.placement.model.DirectorySnapshot;
import marouter.placement.model.ResourceRequest;
import marouter.placement.repository.NodeDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless placement quotes for external callers. Runs the same evaluation
 * as {@link PlacementService} but never records anything.
 *
 * The decision is stamped with the snapshot's acquisition time, so the same
 * request against the same snapshot always yields an equal decision.
 */
public class QuoteService {

    private static final Logger log = LoggerFactory.getLogger(QuoteService.class);

    private final NodeDirectory nodeDirectory;
    private final PlacementEngine engine;

    public QuoteService(NodeDirectory nodeDirectory, PlacementEngine engine) {
        this.nodeDirectory = nodeDirectory;
        this.engine = engine;
    }

    /**
     * Quote against a fresh directory snapshot.
     *
     * @throws marouter.placement.engine.InvalidRequestException      if the request is malformed
     * @throws marouter.placement.engine.SnapshotUnavailableException if the directory cannot be read
     */
    public Decision quote(ResourceRequest request) {
        return quote(request, nodeDirectory.snapshot());
    }

    /**
     * Quote against a given snapshot.
     */
    public Decision quote(ResourceRequest request, DirectorySnapshot snapshot) {
        Decision decision = engine.evaluate(null, request, snapshot, snapshot.takenAt());
        log.debug("Quote for {}: node={} score={}", request, decision.chosenNodeId(), decision.fitScore());
        return decision;
    }
}
