package marouter.placement.engine;

/**
 * Eligibility criteria applied by {@link CandidateFilter}, in evaluation order.
 */
public enum FilterCriterion {
    ACTIVE,
    VRAM,
    RAM,
    REGION,
    DISTANCE,
    PRICE,
    RELIABILITY
}
