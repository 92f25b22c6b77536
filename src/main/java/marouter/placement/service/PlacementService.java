package marouter.placement.service;

import marouter.placement.engine.InvalidRequestException;
import marouter.placement.engine.PlacementEngine;
import marouter.placement.engine.RequestValidator;
import marouter.placement.model.Decision;
import marouter.placement.model.DirectorySnapshot;
import marouter.placement.model.ModelProfile;
import marouter.placement.model.ResourceRequest;
import marouter.placement.repository.DecisionStore;
import marouter.placement.repository.ModelProfileRepository;
import marouter.placement.repository.NodeDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Stateful placement: every evaluated request and its decision are recorded
 * in the decision store.
 */
public class PlacementService {

    private static final Logger log = LoggerFactory.getLogger(PlacementService.class);

    private final NodeDirectory nodeDirectory;
    private final DecisionStore decisionStore;
    private final ModelProfileRepository modelProfiles;
    private final PlacementEngine engine;
    private final Clock clock;

    public PlacementService(NodeDirectory nodeDirectory, DecisionStore decisionStore,
            ModelProfileRepository modelProfiles, PlacementEngine engine, Clock clock) {
        this.nodeDirectory = nodeDirectory;
        this.decisionStore = decisionStore;
        this.modelProfiles = modelProfiles;
        this.engine = engine;
        this.clock = clock;
    }

    public PlacementService(NodeDirectory nodeDirectory, DecisionStore decisionStore,
            ModelProfileRepository modelProfiles, PlacementEngine engine) {
        this(nodeDirectory, decisionStore, modelProfiles, engine, Clock.systemUTC());
    }

    /**
     * Evaluate a request and record it with its decision.
     *
     * If the request names a model but no VRAM amount, the model profile's
     * suggested minimum is used.
     *
     * @return the recorded decision, with no chosen node when nothing is eligible
     * @throws InvalidRequestException if the request is malformed or names an unknown model
     * @throws marouter.placement.engine.SnapshotUnavailableException if the directory cannot be read;
     *         nothing is recorded in that case
     */
    public Decision place(ResourceRequest request) {
        ResourceRequest resolved = resolveRequirement(request);
        RequestValidator.validate(resolved);

        DirectorySnapshot snapshot = nodeDirectory.snapshot();

        String requestId = decisionStore.generateId();
        Instant decidedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Decision decision = engine.evaluate(requestId, resolved, snapshot, decidedAt);

        decisionStore.record(requestId, resolved, decision);

        if (decision.hasChosenNode()) {
            log.info("Placement {}: node {} ({}) score {}", requestId, decision.chosenNodeId(),
                    decision.chosenNodeName(), String.format("%.1f", decision.fitScore()));
        } else {
            log.info("Placement {}: no eligible node - {}", requestId, decision.justification());
        }
        return decision;
    }

    public Optional<Decision> findDecision(String requestId) {
        return decisionStore.findByRequestId(requestId);
    }

    public List<Decision> listRecent(int limit) {
        return decisionStore.findRecent(limit);
    }

    private ResourceRequest resolveRequirement(ResourceRequest request) {
        if (request == null || request.requiredVramGb() != null) {
            return request;
        }
        String modelName = request.modelName();
        if (modelName == null || modelName.isBlank()) {
            throw new InvalidRequestException("requiredVramGb is required when no modelName is given");
        }

        ModelProfile profile = modelProfiles.findByName(modelName)
                .orElseThrow(() -> new InvalidRequestException(
                        "Model profile '" + modelName + "' not found and requiredVramGb not specified"));

        log.debug("Using model profile {} -> {} GB VRAM", modelName, profile.suggestedMinVramGb());
        return request.toBuilder().requiredVramGb(profile.suggestedMinVramGb()).build();
    }
}
