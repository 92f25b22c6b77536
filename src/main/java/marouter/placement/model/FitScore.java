package marouter.placement.model;

import java.util.List;

/**
 * Final score of a candidate together with the components it was built from.
 *
 * @param total     the score used for selection, higher is better
 * @param raw       the value before any rescaling (equal to total when the
 *                  policy does not rescale)
 * @param subScores named components, in the order the policy computed them
 */
public record FitScore(double total, double raw, List<SubScore> subScores) {

    public FitScore {
        subScores = List.copyOf(subScores);
    }
}
