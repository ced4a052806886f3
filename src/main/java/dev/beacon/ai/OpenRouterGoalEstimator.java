package dev.beacon.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Goal estimator backed by OpenRouter's OpenAI-compatible chat completions API.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "openrouter")
public class OpenRouterGoalEstimator extends AbstractRemoteGoalEstimator {

    private final WebClient webClient;
    private final String model;

    public OpenRouterGoalEstimator(
            @Value("${app.ai.openrouter.api-key:}") String apiKey,
            @Value("${app.ai.openrouter.model:google/gemini-2.0-flash-001}") String model,
            @Value("${app.ai.openrouter.base-url:https://openrouter.ai/api/v1}") String baseUrl,
            @Value("${app.ai.timeout-seconds:20}") long timeoutSeconds,
            @Value("${app.ai.max-retries:2}") int maxRetries,
            @Value("${app.ai.retry-backoff-millis:500}") long retryBackoffMillis,
            GoalPromptBuilder promptBuilder,
            GoalResponseParser responseParser) {
        super(apiKey, promptBuilder, responseParser, Duration.ofSeconds(timeoutSeconds), maxRetries,
                Duration.ofMillis(retryBackoffMillis));
        this.model = model;
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .defaultHeader("X-Title", "Beacon Matcher")
                .build();

        if (isEnabled()) {
            log.info("OpenRouter goal estimation enabled with model: {}", model);
        } else {
            log.warn("OpenRouter API Key is missing! Goal alignment will use the heuristic.");
        }
    }

    @Override
    public String getName() {
        return "openrouter";
    }

    @Override
    protected Mono<String> requestCompletion(String prompt) {
        OpenRouterRequest request = new OpenRouterRequest(model, List.of(new Message("user", prompt)), 0.2);

        return webClient.post()
                .uri("/chat/completions")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(OpenRouterResponse.class)
                .map(this::extractContent);
    }

    private String extractContent(OpenRouterResponse response) {
        if (response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null) {
            throw new GoalResponseException(FailureKind.MALFORMED_RESPONSE, "OpenRouter returned no choices");
        }
        return response.choices().get(0).message().content();
    }

    record OpenRouterRequest(String model, List<Message> messages, double temperature) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OpenRouterResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
        }
    }
}
