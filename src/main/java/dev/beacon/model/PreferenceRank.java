package dev.beacon.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A provider's rank for one preference category: 1 (most important) to 5, or no preference.
 *
 * @param rank 1-5, or 0 for no preference
 */
public record PreferenceRank(int rank) {

    public static final String NO_PREFERENCE_LABEL = "Don't care";
    public static final PreferenceRank NO_PREFERENCE = new PreferenceRank(0);

    public PreferenceRank {
        if (rank < 0 || rank > 5) {
            throw new IllegalArgumentException("Preference rank must be between 0 and 5, got " + rank);
        }
    }

    /**
     * Build a rank from a stored value. Zero means no preference; anything else is clamped into 1-5.
     */
    public static PreferenceRank of(int value) {
        if (value == 0) {
            return NO_PREFERENCE;
        }
        return new PreferenceRank(Math.max(1, Math.min(5, value)));
    }

    /**
     * Accepts an integer rank, a numeric string, or the "Don't care" label.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PreferenceRank fromJson(Object raw) {
        if (raw == null) {
            return NO_PREFERENCE;
        }
        if (raw instanceof Number number) {
            return of(number.intValue());
        }
        String text = raw.toString().trim();
        if (text.isEmpty() || NO_PREFERENCE_LABEL.equalsIgnoreCase(text)) {
            return NO_PREFERENCE;
        }
        try {
            return of(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unrecognised preference value: " + text, e);
        }
    }

    public boolean isExpressed() {
        return rank > 0;
    }

    @JsonValue
    public Object toJson() {
        return isExpressed() ? rank : NO_PREFERENCE_LABEL;
    }
}
