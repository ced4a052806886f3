package dev.beacon.service;

import dev.beacon.config.MatchingConfig;
import dev.beacon.model.Factor;
import dev.beacon.model.PreferenceRank;
import dev.beacon.model.Provider;
import dev.beacon.model.ProviderPreferences;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Converts provider preference ranks and the seeker default table into per-factor weights.
 */
@Slf4j
@Service
public class WeightingService {

    private final Map<Factor, Double> seekerDefaults;

    public WeightingService(MatchingConfig matchingConfig) {
        this.seekerDefaults = Collections.unmodifiableMap(parseSeekerWeights(matchingConfig.getSeekerWeights()));
        log.debug("Seeker default weights: {}", seekerDefaults);
    }

    /**
     * Rank 1 is weight 5, rank 5 is weight 1, no preference is weight 0.
     */
    public double toWeight(PreferenceRank rank) {
        if (rank == null || !rank.isExpressed()) {
            return 0.0;
        }
        return 6.0 - rank.rank();
    }

    public Map<Factor, Double> providerWeights(Provider provider) {
        ProviderPreferences preferences = provider.getPreferences() != null
                ? provider.getPreferences()
                : ProviderPreferences.noPreferences();

        EnumMap<Factor, Double> weights = new EnumMap<>(Factor.class);
        for (Factor factor : Factor.values()) {
            if (factor.isBase()) {
                weights.put(factor, toWeight(preferences.rankFor(factor.category())));
            }
        }
        return weights;
    }

    public Map<Factor, Double> providerWeights(Provider provider, double goalWeight) {
        Map<Factor, Double> weights = providerWeights(provider);
        weights.put(Factor.GOAL_ALIGNMENT, requireNonNegative(goalWeight));
        return weights;
    }

    public Map<Factor, Double> seekerWeights() {
        return new EnumMap<>(seekerDefaults);
    }

    public Map<Factor, Double> seekerWeights(double goalWeight) {
        Map<Factor, Double> weights = seekerWeights();
        weights.put(Factor.GOAL_ALIGNMENT, requireNonNegative(goalWeight));
        return weights;
    }

    private static EnumMap<Factor, Double> parseSeekerWeights(Map<String, Double> configured) {
        EnumMap<Factor, Double> weights = new EnumMap<>(Factor.class);
        if (configured != null) {
            for (Map.Entry<String, Double> entry : configured.entrySet()) {
                Factor factor;
                try {
                    factor = Factor.fromId(entry.getKey());
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException("matching.seeker-weights: " + e.getMessage(), e);
                }
                if (!factor.isBase()) {
                    throw new IllegalStateException(
                            "matching.seeker-weights must not set " + factor.id() + "; use matching.goal-weight");
                }
                Double weight = entry.getValue();
                if (weight == null || weight < 0 || weight.isNaN()) {
                    throw new IllegalStateException(
                            "matching.seeker-weights." + factor.id() + " must be a non-negative number");
                }
                weights.put(factor, weight);
            }
        }

        for (Factor factor : Factor.values()) {
            if (factor.isBase() && !weights.containsKey(factor)) {
                throw new IllegalStateException("matching.seeker-weights is missing " + factor.id());
            }
        }
        return weights;
    }

    private static double requireNonNegative(double goalWeight) {
        if (goalWeight < 0 || Double.isNaN(goalWeight)) {
            throw new IllegalArgumentException("Goal weight must be non-negative, got " + goalWeight);
        }
        return goalWeight;
    }
}
