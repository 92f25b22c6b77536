package marouter.placement.engine;

/**
 * Caps and bonuses of the marketplace policy.
 *
 * @param proximityCap       proximity score of a node at zero distance
 * @param priceCap           price score of the cheapest eligible node
 * @param reliabilityCap     reliability score of a node with reliability 100
 * @param capacityCap        capacity score at or above saturation
 * @param nodeTypeBonus      flat bonus for volunteer nodes
 * @param localMultiplier    proximity multiplier when the request prefers local nodes
 * @param proximityFalloffKm distance at which the proximity score reaches zero
 * @param capacitySaturation surplus ratio (surplus / requirement) that earns the full capacity score
 */
public record MarketplaceWeights(
        double proximityCap,
        double priceCap,
        double reliabilityCap,
        double capacityCap,
        double nodeTypeBonus,
        double localMultiplier,
        double proximityFalloffKm,
        double capacitySaturation) {

    public static MarketplaceWeights defaults() {
        return new MarketplaceWeights(100.0, 50.0, 50.0, 30.0, 20.0, 3.0, 1000.0, 2.0);
    }
}
