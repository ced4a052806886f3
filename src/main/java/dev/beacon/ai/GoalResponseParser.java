package dev.beacon.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.beacon.model.GoalAlignment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads {"score": number, "reasoning": string} out of a model reply.
 * Anything else is a protocol violation.
 */
@Component
@RequiredArgsConstructor
public class GoalResponseParser {

    private static final String FENCE = "```";
    private static final String JSON_FENCE = "```json";

    private final ObjectMapper objectMapper;

    public GoalAlignment parse(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new GoalResponseException(FailureKind.MALFORMED_RESPONSE, "Empty reply");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripFences(reply.trim()));
        } catch (JsonProcessingException e) {
            throw new GoalResponseException(FailureKind.MALFORMED_RESPONSE,
                    "Reply is not JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new GoalResponseException(FailureKind.MALFORMED_RESPONSE, "Reply is not a JSON object");
        }

        JsonNode score = root.get("score");
        if (score == null || !score.isNumber()) {
            throw new GoalResponseException(FailureKind.INVALID_SCORE, "Missing or non-numeric score");
        }
        double value = score.asDouble();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new GoalResponseException(FailureKind.INVALID_SCORE, "Score out of range: " + value);
        }

        JsonNode reasoning = root.get("reasoning");
        if (reasoning == null || !reasoning.isTextual()) {
            throw new GoalResponseException(FailureKind.MALFORMED_RESPONSE, "Missing reasoning text");
        }

        return new GoalAlignment(Math.max(0.0, Math.min(1.0, value)), reasoning.asText().trim(),
                GoalAlignment.Source.REMOTE);
    }

    /**
     * Unwrap a Markdown code block if the model added one.
     */
    static String stripFences(String text) {
        int start;
        int bodyStart;
        if ((start = text.indexOf(JSON_FENCE)) >= 0) {
            bodyStart = start + JSON_FENCE.length();
        } else if ((start = text.indexOf(FENCE)) >= 0) {
            bodyStart = start + FENCE.length();
        } else {
            return text;
        }
        int end = text.indexOf(FENCE, bodyStart);
        return (end >= 0 ? text.substring(bodyStart, end) : text.substring(bodyStart)).trim();
    }
}
