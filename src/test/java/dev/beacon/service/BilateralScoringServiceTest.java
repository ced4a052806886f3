package dev.beacon.service;

import dev.beacon.config.MatchingConfig;
import dev.beacon.model.Factor;
import dev.beacon.model.FactorScoreSet;
import dev.beacon.model.PairScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BilateralScoringServiceTest {

    private BilateralScoringService bilateralScoringService;
    private WeightingService weightingService;

    @BeforeEach
    void setUp() {
        MatchingConfig config = new MatchingConfig();
        bilateralScoringService = new BilateralScoringService(config);
        weightingService = new WeightingService(config);
    }

    private static FactorScoreSet industryAndHalfHelp() {
        return FactorScoreSet.builder()
                .put(Factor.SHARED_INSTITUTION, 0.0)
                .put(Factor.INSTITUTION_TIER, 1.0)
                .put(Factor.INDUSTRY_ALIGNMENT, 1.0)
                .put(Factor.HELP_TYPE_MATCH, 0.5)
                .put(Factor.LOCATION_PROXIMITY, 0.0)
                .put(Factor.EXPERIENCE_GAP, 1.0)
                .build();
    }

    private static Map<Factor, Double> industryAndHelpOnly() {
        Map<Factor, Double> weights = new EnumMap<>(Factor.class);
        for (Factor factor : Factor.values()) {
            weights.put(factor, 0.0);
        }
        weights.put(Factor.INDUSTRY_ALIGNMENT, 5.0);
        weights.put(Factor.HELP_TYPE_MATCH, 5.0);
        return weights;
    }

    @Test
    @DisplayName("Provider weighting only industry and help type scores 75.0")
    void shouldWeightProviderPerspective() {
        assertThat(bilateralScoringService.weightedScore(industryAndHalfHelp(), industryAndHelpOnly()))
                .isEqualTo(75.0);
    }

    @Test
    void shouldCombineBothPerspectives() {
        PairScore score = bilateralScoringService.combine(industryAndHalfHelp(), industryAndHelpOnly(),
                weightingService.seekerWeights());

        assertThat(score.eligible()).isTrue();
        assertThat(score.providerScore()).isEqualTo(75.0);
        assertThat(score.seekerScore()).isEqualTo(65.8);
        assertThat(score.bilateralScore()).isEqualTo(71.3);
        assertThat(score.factors()).isEqualTo(industryAndHalfHelp());
    }

    @Test
    @DisplayName("A provider who cares about nothing scores 0, not an error")
    void shouldScoreZeroWithoutPositiveWeights() {
        Map<Factor, Double> nothing = new EnumMap<>(Factor.class);
        for (Factor factor : Factor.values()) {
            nothing.put(factor, 0.0);
        }

        assertThat(bilateralScoringService.weightedScore(industryAndHalfHelp(), nothing)).isZero();
    }

    @Test
    void shouldRejectFactorWithoutWeight() {
        FactorScoreSet withGoal = industryAndHalfHelp().with(Factor.GOAL_ALIGNMENT, 0.8);

        assertThatThrownBy(() -> bilateralScoringService.weightedScore(withGoal, weightingService.seekerWeights()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("goal_alignment");
    }

    @ParameterizedTest
    @CsvSource({
            "80.0, 50.0, 68.0",
            "74.2, 67.4, 71.5",
            "100.0, 0.0, 60.0",
            "0.0, 100.0, 40.0",
            "95.0, 87.5, 92.0"
    })
    void shouldBlendSixtyForty(double providerScore, double seekerScore, double expected) {
        assertThat(bilateralScoringService.blend(providerScore, seekerScore)).isEqualTo(expected);
    }

    @Test
    void shouldRejectProviderShareOutsideUnitInterval() {
        MatchingConfig config = new MatchingConfig();
        config.setProviderShare(1.5);

        assertThatThrownBy(() -> new BilateralScoringService(config)).isInstanceOf(IllegalStateException.class);
    }
}
