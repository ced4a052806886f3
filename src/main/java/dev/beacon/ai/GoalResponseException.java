package dev.beacon.ai;

import lombok.Getter;

/**
 * The reasoning service answered, but not with a usable score.
 */
@Getter
public class GoalResponseException extends RuntimeException {

    private final FailureKind kind;

    public GoalResponseException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GoalResponseException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
