package dev.beacon.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Why a remote goal estimate failed. Only transient kinds are retried.
 */
public enum FailureKind {
    MISSING_CREDENTIAL(false),
    TIMEOUT(true),
    TRANSPORT(true),
    RATE_LIMITED(true),
    SERVER_ERROR(true),
    CLIENT_ERROR(false),
    MALFORMED_RESPONSE(false),
    INVALID_SCORE(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static FailureKind classify(Throwable error) {
        if (error instanceof GoalResponseException response) {
            return response.getKind();
        }
        if (error instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (error instanceof WebClientResponseException response) {
            if (response.getStatusCode().value() == 429) {
                return RATE_LIMITED;
            }
            return response.getStatusCode().is5xxServerError() ? SERVER_ERROR : CLIENT_ERROR;
        }
        if (error instanceof WebClientRequestException) {
            return TRANSPORT;
        }
        if (error instanceof CodecException || error instanceof JsonProcessingException) {
            return MALFORMED_RESPONSE;
        }
        return TRANSPORT;
    }

    public static boolean isRetryable(Throwable error) {
        return classify(error).isRetryable();
    }
}
