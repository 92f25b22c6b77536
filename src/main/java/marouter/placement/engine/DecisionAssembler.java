package marouter.placement.engine;

import marouter.placement.model.Decision;
import marouter.placement.model.NodeSnapshot;
import marouter.placement.model.ResourceRequest;
import marouter.placement.model.ScoredCandidate;
import marouter.placement.model.SubScore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a selection outcome into a {@link Decision} with a readable
 * justification.
 */
public class DecisionAssembler {

    /** A component counts as dominant when it reaches this share of the largest one */
    private static final double DOMINANCE_SHARE = 0.5;
    private static final int MAX_DOMINANT = 2;

    public Decision chosen(String requestId, ResourceRequest request, ScoredCandidate winner, String policy,
            Instant decidedAt) {
        NodeSnapshot node = winner.node();
        double headroom = node.vramFreeGb() - request.vramGb();

        StringBuilder text = new StringBuilder()
                .append("Node '").append(node.name()).append("' selected with ")
                .append(fmt(headroom)).append(" GB VRAM headroom over the ")
                .append(fmt(request.vramGb())).append(" GB requirement");
        if (request.requiredRamGb() != null) {
            text.append(" and ").append(fmt(node.ramFreeGb() - request.requiredRamGb()))
                    .append(" GB RAM headroom");
        }
        text.append(". ");

        List<SubScore> dominant = dominant(winner.score().subScores());
        if (!dominant.isEmpty()) {
            text.append("Dominant factors: ")
                    .append(dominant.stream()
                            .map(s -> s.name() + " (+" + fmt(s.value()) + ")")
                            .collect(Collectors.joining(", ")))
                    .append(". ");
        }
        text.append("Fit score ").append(fmt(winner.score().total())).append(" (").append(policy).append(" policy).");

        return Decision.builder()
                .requestId(requestId)
                .chosenNodeId(node.id())
                .chosenNodeName(node.name())
                .policy(policy)
                .fitScore(winner.score().total())
                .rawScore(winner.score().raw())
                .subScores(winner.score().subScores())
                .headroomGb(headroom)
                .justification(text.toString())
                .createdAt(decidedAt)
                .build();
    }

    public Decision noCandidate(String requestId, ResourceRequest request, FilterResult filterResult, String policy,
            Instant decidedAt) {
        return Decision.builder()
                .requestId(requestId)
                .policy(policy)
                .fitScore(0.0)
                .rawScore(0.0)
                .subScores(List.of())
                .justification(explainRejection(request, filterResult))
                .createdAt(decidedAt)
                .build();
    }

    /**
     * Positive components, largest first, that reach half of the largest one.
     */
    static List<SubScore> dominant(List<SubScore> subScores) {
        List<SubScore> positive = subScores.stream()
                .filter(s -> s.value() > 0)
                .sorted(Comparator.comparingDouble(SubScore::value).reversed())
                .toList();
        if (positive.isEmpty()) {
            return List.of();
        }
        double threshold = positive.get(0).value() * DOMINANCE_SHARE;
        return positive.stream()
                .filter(s -> s.value() >= threshold)
                .limit(MAX_DOMINANT)
                .toList();
    }

    static String explainRejection(ResourceRequest request, FilterResult result) {
        if (result.totalNodes() == 0) {
            return "No eligible node: the node directory is empty.";
        }
        FilterCriterion criterion = result.mostRestrictive().orElse(FilterCriterion.ACTIVE);
        String where = request.hasRegion() ? " in region '" + request.preferredRegion() + "'" : "";

        String reason = switch (criterion) {
            case ACTIVE -> "no node is active";
            case VRAM -> "no active node" + where + " has >= " + fmt(request.vramGb()) + " GB VRAM free";
            case RAM -> "no active node" + where + " has >= " + fmt(request.ramGb()) + " GB RAM free";
            case REGION -> "no active node in region '" + request.preferredRegion() + "' has >= "
                    + fmt(request.vramGb()) + " GB VRAM free";
            case DISTANCE -> "no active node lies within " + fmt(request.maxDistanceKm())
                    + " km of the requested location";
            case PRICE -> "no active node" + where + " is priced at or below " + fmt(request.maxPricePerHour())
                    + " per hour";
            case RELIABILITY -> "no active node" + where + " has reliability >= " + fmt(request.minReliability());
        };

        String pool = criterion == FilterCriterion.ACTIVE
                ? result.totalNodes() + " nodes"
                : result.activeNodes() + " active nodes";
        return "No eligible node: " + reason + " (" + result.rejectedBy(criterion) + " of " + pool
                + " rejected by the " + criterion.name().toLowerCase(Locale.ROOT) + " criterion).";
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
