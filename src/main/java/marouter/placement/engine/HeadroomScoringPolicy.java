package marouter.placement.engine;

import marouter.placement.model.FitScore;
import marouter.placement.model.NodeSnapshot;
import marouter.placement.model.ResourceRequest;
import marouter.placement.model.ScoredCandidate;
import marouter.placement.model.SubScore;

import java.util.ArrayList;
import java.util.List;

/**
 * Direct node placement scoring: VRAM headroom plus bandwidth minus latency,
 * rescaled to 0-100 across the eligible set of the current request.
 *
 * The rescale uses only the set passed in, so the same node can get a
 * different score when the other eligible nodes differ.
 */
public class HeadroomScoringPolicy implements ScoringPolicy {

    public static final String NAME = "headroom";

    private static final double SCALE = 100.0;

    private final HeadroomWeights weights;

    public HeadroomScoringPolicy(HeadroomWeights weights) {
        this.weights = weights;
    }

    public HeadroomScoringPolicy() {
        this(HeadroomWeights.defaults());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ScoredCandidate> score(ResourceRequest request, List<NodeSnapshot> eligible) {
        List<List<SubScore>> components = new ArrayList<>(eligible.size());
        double[] raw = new double[eligible.size()];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;

        for (int i = 0; i < eligible.size(); i++) {
            NodeSnapshot node = eligible.get(i);
            double headroom = weights.headroom() * (node.vramFreeGb() - request.vramGb());
            double bandwidth = weights.bandwidth() * node.bandwidthGbps();
            double latency = -weights.latency() * node.latencyMs();

            components.add(List.of(
                    new SubScore("headroom", headroom),
                    new SubScore("bandwidth", bandwidth),
                    new SubScore("latency", latency)));
            raw[i] = headroom + bandwidth + latency;
            min = Math.min(min, raw[i]);
            max = Math.max(max, raw[i]);
        }

        List<ScoredCandidate> scored = new ArrayList<>(eligible.size());
        double range = max - min;
        for (int i = 0; i < eligible.size(); i++) {
            // one candidate, or all equal: everyone is the best fit
            double total = range > 0 ? SCALE * (raw[i] - min) / range : SCALE;
            scored.add(new ScoredCandidate(eligible.get(i), new FitScore(total, raw[i], components.get(i))));
        }
        return scored;
    }
}
