package dev.beacon.service;

import dev.beacon.config.MatchingConfig;
import dev.beacon.model.Factor;
import dev.beacon.model.FactorScoreSet;
import dev.beacon.model.PairScore;
import dev.beacon.util.Rounding;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Weighted averages from each side's perspective and their blend into one bilateral score.
 */
@Service
public class BilateralScoringService {

    private final double providerShare;

    public BilateralScoringService(MatchingConfig matchingConfig) {
        double share = matchingConfig.getProviderShare();
        if (share < 0.0 || share > 1.0) {
            throw new IllegalStateException("matching.provider-share must be within [0, 1], got " + share);
        }
        this.providerShare = share;
    }

    /**
     * Weighted mean over factors with positive weight, on a 0-100 scale, 1 decimal.
     * Zero total weight is a valid input and scores 0.
     *
     * @throws IllegalStateException if a computed factor has no weight entry
     */
    public double weightedScore(FactorScoreSet factors, Map<Factor, Double> weights) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;

        for (Map.Entry<Factor, Double> entry : factors.asMap().entrySet()) {
            Double weight = weights.get(entry.getKey());
            if (weight == null) {
                throw new IllegalStateException("No weight defined for factor " + entry.getKey().id());
            }
            if (weight > 0) {
                weightedSum += entry.getValue() * weight;
                totalWeight += weight;
            }
        }

        if (totalWeight == 0.0) {
            return 0.0;
        }
        return Rounding.round(weightedSum / totalWeight * 100.0, 1);
    }

    public double blend(double providerScore, double seekerScore) {
        return Rounding.round(providerShare * providerScore + (1.0 - providerShare) * seekerScore, 1);
    }

    public PairScore combine(FactorScoreSet factors, Map<Factor, Double> providerWeights,
            Map<Factor, Double> seekerWeights) {
        double providerScore = weightedScore(factors, providerWeights);
        double seekerScore = weightedScore(factors, seekerWeights);
        return PairScore.eligible(providerScore, seekerScore, blend(providerScore, seekerScore), factors);
    }
}
