package marouter.placement.model;

/**
 * One named component of a fit score.
 */
public record SubScore(String name, double value) {
}
