package dev.beacon.service;

import dev.beacon.config.MatchingConfig;
import dev.beacon.exception.ProfileNotFoundException;
import dev.beacon.metrics.MatchingMetrics;
import dev.beacon.model.Factor;
import dev.beacon.model.FactorScoreSet;
import dev.beacon.model.GoalAlignment;
import dev.beacon.model.GoalScoredPair;
import dev.beacon.model.NormalizedProfile;
import dev.beacon.model.PairScore;
import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;
import dev.beacon.repository.ProfileRepository;
import dev.beacon.service.EligibilityService.EligibilityResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Scores single provider/seeker pairs: eligibility, base factors, and optionally goal alignment.
 */
@Slf4j
@Service
public class MatchingService {

    private final ProfileNormalizer normalizer;
    private final EligibilityService eligibilityService;
    private final FactorScoringService factorScoringService;
    private final WeightingService weightingService;
    private final BilateralScoringService bilateralScoringService;
    private final GoalAlignmentService goalAlignmentService;
    private final MatchingMetrics metrics;
    private final double defaultGoalWeight;

    public MatchingService(ProfileNormalizer normalizer, EligibilityService eligibilityService,
            FactorScoringService factorScoringService, WeightingService weightingService,
            BilateralScoringService bilateralScoringService, GoalAlignmentService goalAlignmentService,
            MatchingMetrics metrics, MatchingConfig matchingConfig) {
        this.normalizer = normalizer;
        this.eligibilityService = eligibilityService;
        this.factorScoringService = factorScoringService;
        this.weightingService = weightingService;
        this.bilateralScoringService = bilateralScoringService;
        this.goalAlignmentService = goalAlignmentService;
        this.metrics = metrics;
        this.defaultGoalWeight = matchingConfig.getGoalWeight();
    }

    /**
     * Base bilateral score without goal alignment.
     *
     * @throws ProfileNotFoundException if either id is unknown to the dataset
     */
    public PairScore scorePair(String providerId, String seekerId, ProfileRepository dataset) {
        Provider provider = requireProvider(providerId, dataset);
        Seeker seeker = requireSeeker(seekerId, dataset);
        return scorePair(provider, seeker);
    }

    public PairScore scorePair(Provider provider, Seeker seeker) {
        return scorePair(provider, normalizer.normalize(provider), seeker);
    }

    /**
     * Same as {@link #scorePair(Provider, Seeker)} with the provider already normalized,
     * so batch callers do it once per request.
     */
    public PairScore scorePair(Provider provider, NormalizedProfile providerNormalized, Seeker seeker) {
        NormalizedProfile seekerNormalized = normalizer.normalize(seeker);
        EligibilityResult eligibility = eligibilityService.check(provider, seeker, providerNormalized,
                seekerNormalized);
        metrics.recordPairScored();

        if (!eligibility.eligible()) {
            metrics.recordIneligible(eligibility.reason());
            return PairScore.ineligible(eligibility.reason());
        }

        FactorScoreSet factors = factorScoringService.score(provider, seeker, providerNormalized, seekerNormalized);
        PairScore score = bilateralScoringService.combine(factors,
                weightingService.providerWeights(provider), weightingService.seekerWeights());
        log.debug("Pair {}/{} scored {} (provider {}, seeker {})", provider.getId(), seeker.getId(),
                score.bilateralScore(), score.providerScore(), score.seekerScore());
        return score;
    }

    public Mono<GoalScoredPair> scorePairWithGoals(String providerId, String seekerId, ProfileRepository dataset) {
        return scorePairWithGoals(providerId, seekerId, dataset, defaultGoalWeight);
    }

    /**
     * Bilateral score with goal alignment added as an extra factor on both sides.
     * Lookup failures are signalled as {@link ProfileNotFoundException}.
     */
    public Mono<GoalScoredPair> scorePairWithGoals(String providerId, String seekerId, ProfileRepository dataset,
            double goalWeight) {
        return Mono.defer(() -> {
            Provider provider = requireProvider(providerId, dataset);
            Seeker seeker = requireSeeker(seekerId, dataset);
            return scorePairWithGoals(provider, normalizer.normalize(provider), seeker, goalWeight);
        });
    }

    public Mono<GoalScoredPair> scorePairWithGoals(Provider provider, NormalizedProfile providerNormalized,
            Seeker seeker, double goalWeight) {
        if (goalWeight < 0 || Double.isNaN(goalWeight)) {
            return Mono.error(new IllegalArgumentException("Goal weight must be non-negative, got " + goalWeight));
        }

        return Mono.fromCallable(() -> scorePair(provider, providerNormalized, seeker))
                .flatMap(base -> {
                    if (!base.eligible()) {
                        return Mono.just(new GoalScoredPair(base, null));
                    }
                    return goalAlignmentService.align(provider, seeker)
                            .map(goal -> new GoalScoredPair(withGoal(provider, base, goal, goalWeight), goal));
                });
    }

    private PairScore withGoal(Provider provider, PairScore base, GoalAlignment goal, double goalWeight) {
        FactorScoreSet factors = base.factors().with(Factor.GOAL_ALIGNMENT, goal.score());
        return bilateralScoringService.combine(factors,
                weightingService.providerWeights(provider, goalWeight),
                weightingService.seekerWeights(goalWeight));
    }

    public double getDefaultGoalWeight() {
        return defaultGoalWeight;
    }

    public Provider requireProvider(String providerId, ProfileRepository dataset) {
        requireId(providerId, "Provider");
        return dataset.findProvider(providerId).orElseThrow(() -> ProfileNotFoundException.provider(providerId));
    }

    public Seeker requireSeeker(String seekerId, ProfileRepository dataset) {
        requireId(seekerId, "Seeker");
        return dataset.findSeeker(seekerId).orElseThrow(() -> ProfileNotFoundException.seeker(seekerId));
    }

    private static void requireId(String id, String role) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(role + " id must not be blank");
        }
    }
}
