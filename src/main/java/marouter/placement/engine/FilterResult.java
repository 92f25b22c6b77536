package marouter.placement.engine;

import marouter.placement.model.NodeSnapshot;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Eligible nodes for one request plus, for every criterion, how many nodes of
 * the snapshot failed it. Inactive nodes are counted under ACTIVE only; an
 * active node failing several other criteria counts once for each.
 */
public record FilterResult(List<NodeSnapshot> eligible, Map<FilterCriterion, Integer> rejections, int totalNodes) {

    public FilterResult {
        eligible = List.copyOf(eligible);
        rejections = Collections.unmodifiableMap(new EnumMap<>(rejections));
    }

    public boolean isEmpty() {
        return eligible.isEmpty();
    }

    public int rejectedBy(FilterCriterion criterion) {
        return rejections.getOrDefault(criterion, 0);
    }

    /**
     * Nodes of the snapshot that passed the active criterion.
     */
    public int activeNodes() {
        return totalNodes - rejectedBy(FilterCriterion.ACTIVE);
    }

    /**
     * ACTIVE when the snapshot has nodes but none of them is active.
     * Otherwise the criterion that rejected the most active nodes; ties go
     * to the criterion evaluated first. Empty when nothing was rejected.
     */
    public Optional<FilterCriterion> mostRestrictive() {
        if (totalNodes > 0 && activeNodes() == 0) {
            return Optional.of(FilterCriterion.ACTIVE);
        }
        FilterCriterion best = null;
        int bestCount = 0;
        for (FilterCriterion criterion : FilterCriterion.values()) {
            if (criterion == FilterCriterion.ACTIVE) {
                continue;
            }
            int count = rejectedBy(criterion);
            if (count > bestCount) {
                best = criterion;
                bestCount = count;
            }
        }
        return Optional.ofNullable(best);
    }
}
