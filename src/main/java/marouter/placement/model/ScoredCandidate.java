package marouter.placement.model;

/**
 * An eligible node paired with its score for one request.
 */
public record ScoredCandidate(NodeSnapshot node, FitScore score) {
}
