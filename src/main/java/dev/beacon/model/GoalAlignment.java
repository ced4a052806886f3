package dev.beacon.model;

/**
 * Goal-alignment judgment for a pair.
 *
 * @param score     in [0, 1]
 * @param reasoning short justification
 * @param source    whether the remote reasoning service or the local heuristic produced it
 */
public record GoalAlignment(double score, String reasoning, Source source) {

    public enum Source {
        REMOTE,
        HEURISTIC
    }

    public boolean isHeuristic() {
        return source == Source.HEURISTIC;
    }
}
