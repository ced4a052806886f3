package dev.beacon.ai;

/**
 * A goal estimator backed by an external reasoning service. At most one is active, chosen by app.ai.provider.
 */
public interface RemoteGoalEstimator extends GoalEstimator {
}
