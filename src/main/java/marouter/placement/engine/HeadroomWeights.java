package marouter.placement.engine;

/**
 * Weights of the headroom policy.
 */
public record HeadroomWeights(double headroom, double bandwidth, double latency) {

    public static HeadroomWeights defaults() {
        return new HeadroomWeights(0.5, 0.3, 0.2);
    }
}
