package dev.beacon.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Immutable per-pair factor values, each in [0, 1]. Only factors that were actually computed are present.
 */
public final class FactorScoreSet {

    private static final FactorScoreSet EMPTY = new FactorScoreSet(new EnumMap<>(Factor.class));

    private final Map<Factor, Double> scores;

    private FactorScoreSet(EnumMap<Factor, Double> scores) {
        this.scores = Collections.unmodifiableMap(scores);
    }

    public static FactorScoreSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this set with one factor added or replaced.
     */
    public FactorScoreSet with(Factor factor, double value) {
        EnumMap<Factor, Double> copy = scores.isEmpty() ? new EnumMap<>(Factor.class) : new EnumMap<>(scores);
        copy.put(factor, requireUnitInterval(factor, value));
        return new FactorScoreSet(copy);
    }

    public OptionalDouble get(Factor factor) {
        Double value = scores.get(factor);
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    public boolean contains(Factor factor) {
        return scores.containsKey(factor);
    }

    public Set<Factor> factors() {
        return scores.keySet();
    }

    public Map<Factor, Double> asMap() {
        return scores;
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    /**
     * Factor values keyed by their wire identifiers, in declaration order.
     */
    @JsonValue
    public Map<String, Double> toIdentifierMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        scores.forEach((factor, value) -> out.put(factor.id(), value));
        return out;
    }

    private static double requireUnitInterval(Factor factor, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(
                    "Factor " + factor.id() + " must be within [0, 1], got " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FactorScoreSet other)) return false;
        return scores.equals(other.scores);
    }

    @Override
    public int hashCode() {
        return scores.hashCode();
    }

    @Override
    public String toString() {
        return "FactorScoreSet" + toIdentifierMap();
    }

    public static final class Builder {
        private final EnumMap<Factor, Double> scores = new EnumMap<>(Factor.class);

        private Builder() {
        }

        public Builder put(Factor factor, double value) {
            scores.put(factor, requireUnitInterval(factor, value));
            return this;
        }

        public FactorScoreSet build() {
            return new FactorScoreSet(new EnumMap<>(scores));
        }
    }
}
