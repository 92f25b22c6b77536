package marouter.placement.engine;

import marouter.placement.model.NodeSnapshot;
import marouter.placement.model.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a directory snapshot to the nodes eligible for a request.
 * Optional criteria apply only when the request sets them. An inactive node
 * is rejected by the active criterion alone; active nodes are checked
 * against every other criterion.
 */
public class CandidateFilter {

    private static final Logger log = LoggerFactory.getLogger(CandidateFilter.class);

    public FilterResult filter(ResourceRequest request, List<NodeSnapshot> nodes) {
        List<NodeSnapshot> eligible = new ArrayList<>();
        Map<FilterCriterion, Integer> rejections = new EnumMap<>(FilterCriterion.class);

        for (NodeSnapshot node : nodes) {
            if (!accepts(FilterCriterion.ACTIVE, request, node)) {
                // inactive nodes count against the active criterion only
                rejections.merge(FilterCriterion.ACTIVE, 1, Integer::sum);
                log.trace("Rejected inactive node {} for {}", node.id(), request);
                continue;
            }
            boolean passed = true;
            for (FilterCriterion criterion : FilterCriterion.values()) {
                if (criterion != FilterCriterion.ACTIVE && !accepts(criterion, request, node)) {
                    rejections.merge(criterion, 1, Integer::sum);
                    passed = false;
                }
            }
            if (passed) {
                eligible.add(node);
            } else {
                log.trace("Rejected node {} for {}", node.id(), request);
            }
        }

        log.debug("{} of {} nodes eligible for {}", eligible.size(), nodes.size(), request);
        return new FilterResult(eligible, rejections, nodes.size());
    }

    /**
     * Whether the node satisfies one criterion. Criteria the request leaves
     * unset always accept.
     */
    static boolean accepts(FilterCriterion criterion, ResourceRequest request, NodeSnapshot node) {
        switch (criterion) {
            case ACTIVE:
                return node.active();
            case VRAM:
                return node.vramFreeGb() >= request.vramGb();
            case RAM:
                return request.requiredRamGb() == null || node.ramFreeGb() >= request.requiredRamGb();
            case REGION:
                return !request.hasRegion() || request.preferredRegion().equals(node.region());
            case DISTANCE:
                if (!request.hasLocation() || request.maxDistanceKm() == null) {
                    return true;
                }
                // a node without a location cannot be shown to be in range
                return node.hasLocation()
                        && request.location().distanceKm(node.location()) <= request.maxDistanceKm();
            case PRICE:
                return request.maxPricePerHour() == null || node.pricePerHour() <= request.maxPricePerHour();
            case RELIABILITY:
                return request.minReliability() == null || node.reliability() >= request.minReliability();
            default:
                throw new IllegalStateException("Unhandled criterion: " + criterion);
        }
    }
}
