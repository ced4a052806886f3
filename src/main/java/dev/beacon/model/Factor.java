package dev.beacon.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of matching factors. Each base factor maps to exactly one preference category;
 * goal alignment is weighted by a configured constant instead.
 */
public enum Factor {
    SHARED_INSTITUTION("shared_institution", PreferenceCategory.ALMA_MATER),
    INSTITUTION_TIER("institution_tier", PreferenceCategory.ALMA_MATER),
    INDUSTRY_ALIGNMENT("industry_alignment", PreferenceCategory.INDUSTRY_ALIGNMENT),
    HELP_TYPE_MATCH("help_type_match", PreferenceCategory.HELP_TYPE),
    LOCATION_PROXIMITY("location_proximity", PreferenceCategory.LOCATION),
    EXPERIENCE_GAP("experience_gap", PreferenceCategory.PATH_ALIGNMENT),
    GPA("gpa", PreferenceCategory.GPA),
    GOAL_ALIGNMENT("goal_alignment", null);

    private final String id;
    private final PreferenceCategory category;

    Factor(String id, PreferenceCategory category) {
        this.id = id;
        this.category = category;
    }

    public String id() {
        return id;
    }

    /**
     * Preference category that drives this factor's provider-side weight, or null for goal alignment.
     */
    public PreferenceCategory category() {
        return category;
    }

    public boolean isBase() {
        return category != null;
    }

    public static Factor fromId(String id) {
        String normalized = id == null ? "" : id.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(f -> f.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown factor identifier: " + id));
    }
}
