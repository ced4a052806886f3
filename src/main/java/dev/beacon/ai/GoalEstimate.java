package dev.beacon.ai;

import dev.beacon.model.GoalAlignment;

/**
 * Either an alignment or the reason none could be produced.
 */
public record GoalEstimate(GoalAlignment alignment, FailureKind failure, String detail) {

    public static GoalEstimate success(GoalAlignment alignment) {
        return new GoalEstimate(alignment, null, null);
    }

    public static GoalEstimate failure(FailureKind failure, String detail) {
        return new GoalEstimate(null, failure, detail);
    }

    public boolean succeeded() {
        return alignment != null;
    }
}
