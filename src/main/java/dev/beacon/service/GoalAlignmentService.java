package dev.beacon.service;

import dev.beacon.ai.GoalEstimate;
import dev.beacon.ai.HeuristicGoalEstimator;
import dev.beacon.ai.RemoteGoalEstimator;
import dev.beacon.metrics.MatchingMetrics;
import dev.beacon.model.GoalAlignment;
import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Optional;

/**
 * Goal alignment with a guaranteed result: the remote estimator when one is configured and answers,
 * the heuristic otherwise.
 */
@Slf4j
@Service
public class GoalAlignmentService {

    private final RemoteGoalEstimator remoteEstimator;
    private final HeuristicGoalEstimator heuristicEstimator;
    private final MatchingMetrics metrics;

    public GoalAlignmentService(Optional<RemoteGoalEstimator> remoteEstimator,
            HeuristicGoalEstimator heuristicEstimator, MatchingMetrics metrics) {
        this.remoteEstimator = remoteEstimator.orElse(null);
        this.heuristicEstimator = heuristicEstimator;
        this.metrics = metrics;

        if (this.remoteEstimator == null) {
            log.info("No remote goal estimator configured - using heuristic goal alignment");
        } else {
            log.info("Goal alignment via {} (enabled: {})", this.remoteEstimator.getName(),
                    this.remoteEstimator.isEnabled());
        }
    }

    /**
     * Never signals an error.
     */
    public Mono<GoalAlignment> align(Provider provider, Seeker seeker) {
        if (remoteEstimator == null) {
            return Mono.fromSupplier(() -> heuristic(provider, seeker, "not_configured"));
        }

        return remoteEstimator.estimate(provider, seeker)
                .map(estimate -> resolve(provider, seeker, estimate))
                .onErrorResume(e -> {
                    log.warn("Goal estimator {} raised unexpectedly for {}/{}: {}", remoteEstimator.getName(),
                            provider.getId(), seeker.getId(), e.getMessage());
                    return Mono.fromSupplier(() -> heuristic(provider, seeker, "unexpected_error"));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> heuristic(provider, seeker, "empty_response")));
    }

    private GoalAlignment resolve(Provider provider, Seeker seeker, GoalEstimate estimate) {
        if (estimate.succeeded()) {
            metrics.recordGoalEstimate(remoteEstimator.getName());
            return estimate.alignment();
        }
        log.debug("Falling back to heuristic for {}/{}: {} ({})", provider.getId(), seeker.getId(),
                estimate.failure(), estimate.detail());
        return heuristic(provider, seeker, estimate.failure().name().toLowerCase(Locale.ROOT));
    }

    private GoalAlignment heuristic(Provider provider, Seeker seeker, String reason) {
        metrics.recordGoalFallback(reason);
        metrics.recordGoalEstimate(heuristicEstimator.getName());
        return heuristicEstimator.compute(provider, seeker);
    }
}
