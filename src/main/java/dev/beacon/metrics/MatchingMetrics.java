package dev.beacon.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for pair scoring and feed generation.
 */
@Component
public class MatchingMetrics {

    private static final String TAG_REASON = "reason";
    private static final String TAG_SOURCE = "source";

    private final MeterRegistry registry;

    // Counters
    private final Counter pairsScoredCounter;
    private final Counter feedsGeneratedCounter;
    private final Counter feedItemsCounter;

    // Timers
    private final Timer feedTimer;

    // Gauges
    private final AtomicInteger lastFeedCandidates = new AtomicInteger(0);
    private final AtomicInteger lastFeedItems = new AtomicInteger(0);

    public MatchingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.pairsScoredCounter = Counter.builder("beacon_pairs_scored_total")
                .description("Total provider/seeker pairs scored")
                .register(registry);

        this.feedsGeneratedCounter = Counter.builder("beacon_feeds_generated_total")
                .description("Total feeds generated")
                .register(registry);

        this.feedItemsCounter = Counter.builder("beacon_feed_items_total")
                .description("Total items emitted across all feeds")
                .register(registry);

        this.feedTimer = Timer.builder("beacon_feed_generation_duration")
                .description("Time to score candidates and assemble a feed")
                .register(registry);

        Gauge.builder("beacon_last_feed_candidates", lastFeedCandidates, AtomicInteger::get)
                .description("Candidates considered in the last feed")
                .register(registry);

        Gauge.builder("beacon_last_feed_items", lastFeedItems, AtomicInteger::get)
                .description("Items returned in the last feed")
                .register(registry);
    }

    public Timer getFeedTimer() {
        return feedTimer;
    }

    public void recordPairScored() {
        pairsScoredCounter.increment();
    }

    /**
     * Record a pair stopped by an eligibility gate.
     */
    public void recordIneligible(String reason) {
        Counter.builder("beacon_pairs_ineligible_total")
                .tag(TAG_REASON, reason)
                .register(registry)
                .increment();
    }

    /**
     * Record which estimator produced a goal alignment.
     */
    public void recordGoalEstimate(String source) {
        Counter.builder("beacon_goal_estimates_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    /**
     * Record why the remote estimator was bypassed.
     */
    public void recordGoalFallback(String reason) {
        Counter.builder("beacon_goal_fallbacks_total")
                .tag(TAG_REASON, reason)
                .register(registry)
                .increment();
    }

    public void recordFeedGenerated(int candidates, int items) {
        feedsGeneratedCounter.increment();
        feedItemsCounter.increment(items);
        lastFeedCandidates.set(candidates);
        lastFeedItems.set(items);
    }
}
