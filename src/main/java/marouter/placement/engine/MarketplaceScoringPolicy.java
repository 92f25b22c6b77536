package marouter.placement.engine;

import marouter.placement.model.FitScore;
import marouter.placement.model.NodeSnapshot;
import marouter.placement.model.ResourceRequest;
import marouter.placement.model.ScoredCandidate;
import marouter.placement.model.SubScore;

import java.util.ArrayList;
import java.util.List;

/**
 * Capacity-matching scoring used for quoting: the unweighted sum of
 * proximity, price, reliability, capacity and node-type components.
 *
 * <ul>
 * <li>proximity: 0 to proximityCap, falling linearly to 0 at the falloff
 * distance, multiplied when the request prefers local nodes, 0 when either
 * location is unknown</li>
 * <li>price: 0 to priceCap, min-max normalized over the eligible prices</li>
 * <li>reliability: linear in the node's 0-100 reliability</li>
 * <li>capacity: linear in free capacity surplus, saturating</li>
 * <li>node type: flat bonus for volunteer nodes</li>
 * </ul>
 */
public class MarketplaceScoringPolicy implements ScoringPolicy {

    public static final String NAME = "marketplace";

    private final MarketplaceWeights weights;

    public MarketplaceScoringPolicy(MarketplaceWeights weights) {
        this.weights = weights;
    }

    public MarketplaceScoringPolicy() {
        this(MarketplaceWeights.defaults());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ScoredCandidate> score(ResourceRequest request, List<NodeSnapshot> eligible) {
        double minPrice = Double.POSITIVE_INFINITY;
        double maxPrice = Double.NEGATIVE_INFINITY;
        for (NodeSnapshot node : eligible) {
            minPrice = Math.min(minPrice, node.pricePerHour());
            maxPrice = Math.max(maxPrice, node.pricePerHour());
        }

        List<ScoredCandidate> scored = new ArrayList<>(eligible.size());
        for (NodeSnapshot node : eligible) {
            List<SubScore> subScores = List.of(
                    new SubScore("proximity", proximity(request, node)),
                    new SubScore("price", price(node, minPrice, maxPrice)),
                    new SubScore("reliability", reliability(node)),
                    new SubScore("capacity", capacity(request, node)),
                    new SubScore("nodeType", node.category().isVolunteer() ? weights.nodeTypeBonus() : 0.0));

            double total = 0.0;
            for (SubScore s : subScores) {
                total += s.value();
            }
            scored.add(new ScoredCandidate(node, new FitScore(total, total, subScores)));
        }
        return scored;
    }

    double proximity(ResourceRequest request, NodeSnapshot node) {
        if (!request.hasLocation() || !node.hasLocation()) {
            return 0.0;
        }
        double distance = request.location().distanceKm(node.location());
        double score = Math.max(0.0, weights.proximityCap() * (1.0 - distance / weights.proximityFalloffKm()));
        return request.preferLocal() ? score * weights.localMultiplier() : score;
    }

    double price(NodeSnapshot node, double minPrice, double maxPrice) {
        double range = maxPrice - minPrice;
        if (range <= 0) {
            return weights.priceCap();
        }
        return weights.priceCap() * (maxPrice - node.pricePerHour()) / range;
    }

    double reliability(NodeSnapshot node) {
        double clamped = Math.max(0.0, Math.min(100.0, node.reliability()));
        return weights.reliabilityCap() * clamped / 100.0;
    }

    double capacity(ResourceRequest request, NodeSnapshot node) {
        double needed = request.vramGb() + request.ramGb();
        double available = node.vramFreeGb() + (request.requiredRamGb() != null ? node.ramFreeGb() : 0.0);
        double surplusRatio = Math.max(0.0, (available - needed) / needed);
        return weights.capacityCap() * Math.min(1.0, surplusRatio / weights.capacitySaturation());
    }
}
