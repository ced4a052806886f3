package dev.beacon.ai;

import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;
import reactor.core.publisher.Mono;

/**
 * Judges how well a provider can help a seeker reach their stated goal.
 */
public interface GoalEstimator {

    /**
     * Estimate goal alignment for one pair.
     *
     * @param provider the mentor
     * @param seeker   the candidate
     * @return Mono with either an alignment or a typed failure; implementations do not signal errors
     */
    Mono<GoalEstimate> estimate(Provider provider, Seeker seeker);

    /**
     * Short name used in logs and metric tags.
     */
    String getName();

    /**
     * Check if the estimator is configured to run.
     *
     * @return true if estimates can be attempted
     */
    boolean isEnabled();
}
