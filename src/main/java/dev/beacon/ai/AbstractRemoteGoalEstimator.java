package dev.beacon.ai;

import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Shared request pipeline for remote estimators: credential check, per-attempt timeout,
 * bounded backoff on transient failures, and conversion of every error into a typed failure.
 */
@Slf4j
public abstract class AbstractRemoteGoalEstimator implements RemoteGoalEstimator {

    private final String apiKey;
    private final GoalPromptBuilder promptBuilder;
    private final GoalResponseParser responseParser;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryBackoff;

    protected AbstractRemoteGoalEstimator(String apiKey, GoalPromptBuilder promptBuilder,
            GoalResponseParser responseParser, Duration timeout, int maxRetries, Duration retryBackoff) {
        this.apiKey = apiKey;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.timeout = timeout;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryBackoff = retryBackoff;
    }

    /**
     * Send the prompt and emit the model's raw reply text.
     */
    protected abstract Mono<String> requestCompletion(String prompt);

    protected String getApiKey() {
        return apiKey;
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<GoalEstimate> estimate(Provider provider, Seeker seeker) {
        if (!isEnabled()) {
            return Mono.just(GoalEstimate.failure(FailureKind.MISSING_CREDENTIAL,
                    getName() + " API key is not configured"));
        }

        String prompt = promptBuilder.build(provider, seeker);

        return Mono.defer(() -> requestCompletion(prompt))
                .timeout(timeout)
                .retryWhen(Retry.backoff(maxRetries, retryBackoff)
                        .filter(FailureKind::isRetryable)
                        .doBeforeRetry(signal -> log.info("Retrying {} goal estimate for {}/{} (Attempt {}): {}",
                                getName(), provider.getId(), seeker.getId(), signal.totalRetries() + 1,
                                signal.failure().toString()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .map(reply -> GoalEstimate.success(responseParser.parse(reply)))
                .onErrorResume(e -> {
                    FailureKind kind = FailureKind.classify(e);
                    log.warn("{} goal estimate failed for {}/{} [{}]: {}", getName(), provider.getId(),
                            seeker.getId(), kind, e.getMessage());
                    return Mono.just(GoalEstimate.failure(kind, e.getMessage()));
                });
    }
}
