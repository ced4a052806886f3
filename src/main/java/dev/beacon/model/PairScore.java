package dev.beacon.model;

/**
 * Outcome of scoring one provider/seeker pair. Scores are on a 0-100 scale and all zero when ineligible.
 */
public record PairScore(
        double providerScore,
        double seekerScore,
        double bilateralScore,
        boolean eligible,
        String ineligibleReason,
        FactorScoreSet factors) {

    public static PairScore ineligible(String reason) {
        return new PairScore(0.0, 0.0, 0.0, false, reason, FactorScoreSet.empty());
    }

    public static PairScore eligible(double providerScore, double seekerScore, double bilateralScore,
            FactorScoreSet factors) {
        return new PairScore(providerScore, seekerScore, bilateralScore, true, null, factors);
    }
}
