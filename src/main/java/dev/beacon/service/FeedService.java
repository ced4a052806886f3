package dev.beacon.service;

import dev.beacon.config.FeedConfig;
import dev.beacon.metrics.MatchingMetrics;
import dev.beacon.model.FeedItem;
import dev.beacon.model.GoalScoredPair;
import dev.beacon.model.NormalizedProfile;
import dev.beacon.model.PairScore;
import dev.beacon.model.PastPosition;
import dev.beacon.model.Provider;
import dev.beacon.model.ScreenedCandidate;
import dev.beacon.model.Seeker;
import dev.beacon.repository.ProfileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ranked candidate feeds for a provider, plus the threshold-based batch screening flow.
 */
@Slf4j
@Service
public class FeedService {

    private static final String UNKNOWN = "Unknown";
    private static final int RECENT_POSITIONS = 2;

    private static final Comparator<FeedItem> FEED_ORDER = Comparator
            .comparingDouble((FeedItem item) -> item.getScore().bilateralScore()).reversed()
            .thenComparing(FeedItem::getSeekerId);

    private static final Comparator<ScreenedCandidate> SCREENING_ORDER = Comparator
            .comparingDouble((ScreenedCandidate c) -> c.score().bilateralScore()).reversed()
            .thenComparing(ScreenedCandidate::seekerId);

    private final MatchingService matchingService;
    private final ProfileNormalizer normalizer;
    private final AcceptanceEstimator acceptanceEstimator;
    private final FeedConfig feedConfig;
    private final MatchingMetrics metrics;

    public FeedService(MatchingService matchingService, ProfileNormalizer normalizer,
            AcceptanceEstimator acceptanceEstimator, FeedConfig feedConfig, MatchingMetrics metrics) {
        this.matchingService = matchingService;
        this.normalizer = normalizer;
        this.acceptanceEstimator = acceptanceEstimator;
        this.feedConfig = feedConfig;
        this.metrics = metrics;
    }

    /**
     * Standalone feed with the configured defaults and no exclusions.
     */
    public Mono<List<FeedItem>> generateFeed(String providerId, ProfileRepository dataset) {
        return generateFeed(providerId, dataset, feedConfig.getSize(), feedConfig.getMinBilateralScore(), Set.of());
    }

    /**
     * Caller-driven feed: endpoint size, and every seeker the provider already contacted is excluded.
     */
    public Mono<List<FeedItem>> generateFeedForProvider(String providerId, ProfileRepository dataset) {
        return Mono.fromCallable(() -> {
                    matchingService.requireProvider(providerId, dataset);
                    return dataset.findContactedSeekerIds(providerId);
                })
                .flatMap(contacted -> generateFeed(providerId, dataset, feedConfig.getEndpointSize(),
                        feedConfig.getMinBilateralScore(), contacted));
    }

    /**
     * Score every non-excluded seeker with goal alignment, keep eligible pairs at or above the floor,
     * and return the best {@code feedSize} by bilateral score. Ties go to the lower seeker id.
     *
     * @param providerId        provider to build the feed for
     * @param dataset           profile store
     * @param feedSize          maximum number of items, 0 allowed
     * @param minBilateralScore inclusive floor
     * @param excludedIds       seeker ids never to include
     * @return Mono with the ordered feed; errors with ProfileNotFoundException for an unknown provider
     */
    public Mono<List<FeedItem>> generateFeed(String providerId, ProfileRepository dataset, int feedSize,
            double minBilateralScore, Collection<String> excludedIds) {
        if (feedSize < 0) {
            return Mono.error(new IllegalArgumentException("Feed size must be non-negative, got " + feedSize));
        }
        Set<String> excluded = excludedIds == null ? Set.of() : new LinkedHashSet<>(excludedIds);

        return Mono.defer(() -> {
            long start = System.nanoTime();
            Provider provider = matchingService.requireProvider(providerId, dataset);
            NormalizedProfile providerNormalized = normalizer.normalize(provider);

            List<Seeker> candidates = dataset.findAllSeekers().stream()
                    .filter(seeker -> !excluded.contains(seeker.getId()))
                    .toList();
            log.info("Generating feed for provider {}: {} candidates ({} excluded)", providerId,
                    candidates.size(), excluded.size());

            return Flux.fromIterable(candidates)
                    .flatMap(seeker -> matchingService
                                    .scorePairWithGoals(provider, providerNormalized, seeker, goalWeight())
                                    .subscribeOn(Schedulers.parallel())
                                    .filter(scored -> scored.eligible()
                                            && scored.pairScore().bilateralScore() >= minBilateralScore)
                                    .map(scored -> toFeedItem(seeker, scored)),
                            Math.max(1, feedConfig.getConcurrency()))
                    .collectList()
                    .map(items -> rank(items, feedSize))
                    .doOnSuccess(feed -> {
                        metrics.getFeedTimer().record(Duration.ofNanos(System.nanoTime() - start));
                        metrics.recordFeedGenerated(candidates.size(), feed.size());
                        log.info("Feed for provider {} ready: {} items", providerId, feed.size());
                    });
        });
    }

    /**
     * Base scores (no goal alignment) for the given seekers, eligible ones only, best first.
     * A null id list means every seeker in the dataset.
     */
    public List<ScreenedCandidate> scoreCandidates(String providerId, Collection<String> seekerIds,
            ProfileRepository dataset) {
        Provider provider = matchingService.requireProvider(providerId, dataset);
        NormalizedProfile providerNormalized = normalizer.normalize(provider);

        List<Seeker> seekers = seekerIds == null
                ? dataset.findAllSeekers()
                : seekerIds.stream().map(id -> matchingService.requireSeeker(id, dataset)).toList();

        List<ScreenedCandidate> screened = new ArrayList<>();
        for (Seeker seeker : seekers) {
            PairScore score = matchingService.scorePair(provider, providerNormalized, seeker);
            if (score.eligible()) {
                screened.add(new ScreenedCandidate(seeker.getId(), score,
                        acceptanceEstimator.estimate(score.seekerScore())));
            }
        }
        screened.sort(SCREENING_ORDER);
        return screened;
    }

    public List<ScreenedCandidate> filterByThresholds(String providerId, Collection<String> seekerIds,
            ProfileRepository dataset) {
        FeedConfig.Screening screening = feedConfig.getScreening();
        return filterByThresholds(providerId, seekerIds, dataset, screening.getMinProviderScore(),
                screening.getMinSeekerScore(), screening.getMinBilateralScore());
    }

    /**
     * Three independent inclusive floors; all must pass. No truncation, no best pick.
     */
    public List<ScreenedCandidate> filterByThresholds(String providerId, Collection<String> seekerIds,
            ProfileRepository dataset, double minProviderScore, double minSeekerScore, double minBilateralScore) {
        List<ScreenedCandidate> qualified = scoreCandidates(providerId, seekerIds, dataset).stream()
                .filter(c -> c.score().providerScore() >= minProviderScore)
                .filter(c -> c.score().seekerScore() >= minSeekerScore)
                .filter(c -> c.score().bilateralScore() >= minBilateralScore)
                .toList();
        log.info("Screening for provider {}: {} candidates passed floors {}/{}/{}", providerId, qualified.size(),
                minProviderScore, minSeekerScore, minBilateralScore);
        return qualified;
    }

    private List<FeedItem> rank(List<FeedItem> items, int feedSize) {
        List<FeedItem> ranked = new ArrayList<>(items);
        ranked.sort(FEED_ORDER);
        List<FeedItem> feed = new ArrayList<>(ranked.subList(0, Math.min(feedSize, ranked.size())));
        for (int i = 0; i < feed.size(); i++) {
            feed.get(i).setBestPick(i == 0);
        }
        return feed;
    }

    private FeedItem toFeedItem(Seeker seeker, GoalScoredPair scored) {
        PairScore score = scored.pairScore();
        List<PastPosition> history = normalizer.orderedPositions(seeker);

        return FeedItem.builder()
                .seekerId(seeker.getId())
                .name(seeker.getName())
                .almaMater(normalizer.extractAlmaMater(seeker).orElse(UNKNOWN))
                .location(orUnknown(seeker.getLocation()))
                .gpa(seeker.getGpa())
                .currentRole(orUnknown(seeker.getCurrentRole()))
                .currentEmployer(orUnknown(seeker.getCurrentEmployer()))
                .currentIndustry(orUnknown(seeker.getCurrentIndustry()))
                .totalExperienceYears(normalizer.totalExperience(seeker))
                .recentPositions(List.copyOf(history.subList(0, Math.min(RECENT_POSITIONS, history.size()))))
                .helpNeeds(seeker.getHelpNeeds() == null ? Set.of() : new LinkedHashSet<>(seeker.getHelpNeeds()))
                .goals(seeker.getGoals() == null ? "" : seeker.getGoals())
                .context(seeker.getContext() == null ? "" : seeker.getContext())
                .score(score)
                .goalAlignmentScore(scored.goalAlignment().score())
                .goalReasoning(scored.goalAlignment().reasoning())
                .acceptanceProbability(acceptanceEstimator.estimate(score.seekerScore()))
                .bestPick(false)
                .build();
    }

    private double goalWeight() {
        return matchingService.getDefaultGoalWeight();
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
