package dev.beacon.service;

import dev.beacon.TestProfiles;
import dev.beacon.config.MatchingConfig;
import dev.beacon.exception.ProfileNotFoundException;
import dev.beacon.metrics.MatchingMetrics;
import dev.beacon.model.Factor;
import dev.beacon.model.GoalAlignment;
import dev.beacon.model.PairScore;
import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;
import dev.beacon.repository.InMemoryProfileRepository;
import dev.beacon.repository.ProfileRepository;
import dev.beacon.util.Rounding;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static dev.beacon.TestProfiles.tags;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MatchingServiceTest {

    private SimpleMeterRegistry registry;
    private MatchingService matchingService;
    private ProfileRepository dataset;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        MatchingMetrics metrics = new MatchingMetrics(registry);
        MatchingConfig config = new MatchingConfig();
        matchingService = ServiceFixtures.matchingService(config, ServiceFixtures.heuristicGoals(metrics), metrics);

        dataset = new InMemoryProfileRepository(
                List.of(TestProfiles.provider("P1").build()),
                List.of(TestProfiles.strongSeeker("S1").build(),
                        TestProfiles.midSeeker("S2").build(),
                        TestProfiles.strongSeeker("S3").helpNeeds(tags("Networking")).build()),
                Map.of());
    }

    @Nested
    @DisplayName("Base pair scoring")
    class BaseScoringTests {

        @Test
        void shouldScoreEligiblePair() {
            PairScore score = matchingService.scorePair("P1", "S1", dataset);

            assertThat(score.eligible()).isTrue();
            assertThat(score.providerScore()).isEqualTo(100.0);
            assertThat(score.seekerScore()).isEqualTo(89.5);
            assertThat(score.bilateralScore()).isEqualTo(95.8);
            assertThat(score.factors().contains(Factor.GOAL_ALIGNMENT)).isFalse();
        }

        @Test
        @DisplayName("Ineligible pairs score zero on every axis")
        void shouldZeroIneligiblePair() {
            PairScore score = matchingService.scorePair("P1", "S3", dataset);

            assertThat(score.eligible()).isFalse();
            assertThat(score.ineligibleReason()).isEqualTo("no help type overlap");
            assertThat(score.providerScore()).isZero();
            assertThat(score.seekerScore()).isZero();
            assertThat(score.bilateralScore()).isZero();
            assertThat(score.factors().isEmpty()).isTrue();
            assertThat(registry.counter("beacon_pairs_ineligible_total", "reason", "no help type overlap").count())
                    .isEqualTo(1.0);
        }

        @Test
        void shouldKeepScoresInRangeAndBlendConsistent() {
            for (String seekerId : List.of("S1", "S2")) {
                PairScore score = matchingService.scorePair("P1", seekerId, dataset);

                assertThat(score.factors().asMap().values()).allSatisfy(v -> assertThat(v).isBetween(0.0, 1.0));
                assertThat(score.providerScore()).isBetween(0.0, 100.0);
                assertThat(score.seekerScore()).isBetween(0.0, 100.0);
                assertThat(score.bilateralScore())
                        .isEqualTo(Rounding.round(0.6 * score.providerScore() + 0.4 * score.seekerScore(), 1));
            }
        }

        @Test
        void shouldReportUnknownIds() {
            assertThatThrownBy(() -> matchingService.scorePair("P404", "S1", dataset))
                    .isInstanceOf(ProfileNotFoundException.class)
                    .hasMessage("Provider profile P404 not found");
            assertThatThrownBy(() -> matchingService.scorePair("P1", "S404", dataset))
                    .isInstanceOf(ProfileNotFoundException.class)
                    .hasMessage("Seeker profile S404 not found");
        }
    }

    @Nested
    @DisplayName("Scoring with goal alignment")
    class GoalScoringTests {

        @Test
        @DisplayName("Goal alignment joins both weighted averages")
        void shouldRescoreWithGoalAlignment() {
            StepVerifier.create(matchingService.scorePairWithGoals("P1", "S1", dataset))
                    .assertNext(scored -> {
                        assertThat(scored.eligible()).isTrue();
                        assertThat(scored.goalAlignment().score()).isCloseTo(0.8, within(1e-9));
                        assertThat(scored.goalAlignment().source()).isEqualTo(GoalAlignment.Source.HEURISTIC);
                        assertThat(scored.pairScore().factors().get(Factor.GOAL_ALIGNMENT)).isPresent();
                        assertThat(scored.pairScore().providerScore()).isEqualTo(95.0);
                        assertThat(scored.pairScore().seekerScore()).isEqualTo(87.5);
                        assertThat(scored.pairScore().bilateralScore()).isEqualTo(92.0);
                    })
                    .verifyComplete();
        }

        @Test
        void shouldHonourCustomGoalWeight() {
            StepVerifier.create(matchingService.scorePairWithGoals("P1", "S1", dataset, 0.0))
                    .assertNext(scored -> assertThat(scored.pairScore().bilateralScore()).isEqualTo(95.8))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Ineligible pairs never consult the goal estimator")
        void shouldSkipGoalsForIneligiblePair() {
            StepVerifier.create(matchingService.scorePairWithGoals("P1", "S3", dataset))
                    .assertNext(scored -> {
                        assertThat(scored.eligible()).isFalse();
                        assertThat(scored.goalAlignment()).isNull();
                        assertThat(scored.pairScore().bilateralScore()).isZero();
                    })
                    .verifyComplete();

            assertThat(registry.find("beacon_goal_estimates_total").counter()).isNull();
        }

        @Test
        void shouldSignalUnknownSeeker() {
            StepVerifier.create(matchingService.scorePairWithGoals("P1", "S404", dataset))
                    .expectError(ProfileNotFoundException.class)
                    .verify();
        }

        @Test
        void shouldScoreProfilesDirectly() {
            Provider provider = TestProfiles.provider("P9").build();
            Seeker seeker = TestProfiles.midSeeker("S9").build();

            assertThat(matchingService.scorePair(provider, seeker).bilateralScore()).isEqualTo(68.9);
        }
    }
}
