package dev.beacon.model;

/**
 * A seeker that passed eligibility in a batch screening run.
 */
public record ScreenedCandidate(String seekerId, PairScore score, double acceptanceProbability) {
}
