package marouter.placement.engine;

/**
 * Builds the scoring policy named by configuration.
 */
public final class ScoringPolicies {

    private ScoringPolicies() {
    }

    /**
     * @param name "headroom" or "marketplace" (case-insensitive)
     * @throws IllegalArgumentException for any other name
     */
    public static ScoringPolicy create(String name, HeadroomWeights headroom, MarketplaceWeights marketplace) {
        if (name == null || name.isBlank() || HeadroomScoringPolicy.NAME.equalsIgnoreCase(name)) {
            return new HeadroomScoringPolicy(headroom);
        }
        if (MarketplaceScoringPolicy.NAME.equalsIgnoreCase(name)) {
            return new MarketplaceScoringPolicy(marketplace);
        }
        throw new IllegalArgumentException("Unknown scoring policy: " + name);
    }
}
