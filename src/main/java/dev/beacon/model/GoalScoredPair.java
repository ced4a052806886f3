package dev.beacon.model;

/**
 * Pair score recomputed with goal alignment as an extra factor.
 * {@code goalAlignment} is null when the pair was ineligible and the estimator was never consulted.
 */
public record GoalScoredPair(PairScore pairScore, GoalAlignment goalAlignment) {

    public boolean eligible() {
        return pairScore.eligible();
    }
}
