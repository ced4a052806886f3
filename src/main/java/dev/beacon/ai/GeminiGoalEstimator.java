package dev.beacon.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Goal estimator backed by the Google AI Studio (Gemini) generateContent REST API.
 * Uses simple API key authentication.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "gemini")
public class GeminiGoalEstimator extends AbstractRemoteGoalEstimator {

    private final WebClient webClient;
    private final String model;
    private final String geminiPath;

    public GeminiGoalEstimator(
            @Value("${app.ai.gemini.api-key:}") String apiKey,
            @Value("${app.ai.gemini.model:gemini-flash-latest}") String model,
            @Value("${app.ai.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${app.ai.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath,
            @Value("${app.ai.timeout-seconds:20}") long timeoutSeconds,
            @Value("${app.ai.max-retries:2}") int maxRetries,
            @Value("${app.ai.retry-backoff-millis:500}") long retryBackoffMillis,
            GoalPromptBuilder promptBuilder,
            GoalResponseParser responseParser) {
        super(apiKey, promptBuilder, responseParser, Duration.ofSeconds(timeoutSeconds), maxRetries,
                Duration.ofMillis(retryBackoffMillis));
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (isEnabled()) {
            log.info("Gemini goal estimation enabled with model: {} (Key present)", model);
        } else {
            log.warn("Gemini API Key is missing! Goal alignment will use the heuristic.");
        }
    }

    @Override
    public String getName() {
        return "gemini";
    }

    @Override
    protected Mono<String> requestCompletion(String prompt) {
        String uri = String.format(geminiPath, model) + "?key=" + getApiKey();

        return webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildRequest(prompt))
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .map(this::extractContent);
    }

    private GeminiRequest buildRequest(String prompt) {
        return new GeminiRequest(
                List.of(new GeminiRequest.Content(List.of(new GeminiRequest.Part(prompt)))),
                new GeminiRequest.GenerationConfig(0.2, 512, "application/json"));
    }

    private String extractContent(GeminiResponse response) {
        if (response.candidates() == null || response.candidates().isEmpty()) {
            throw new GoalResponseException(FailureKind.MALFORMED_RESPONSE, "Gemini returned no candidates");
        }

        var candidate = response.candidates().get(0);
        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }

        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            throw new GoalResponseException(FailureKind.MALFORMED_RESPONSE,
                    "Gemini candidate has no content parts (finish reason " + candidate.finishReason() + ")");
        }
        return candidate.content().parts().get(0).text();
    }

    // Request DTOs
    record GeminiRequest(
            List<Content> contents,
            @JsonProperty("generationConfig") GenerationConfig generationConfig) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        record GenerationConfig(double temperature, int maxOutputTokens, String responseMimeType) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(Content content, String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}
