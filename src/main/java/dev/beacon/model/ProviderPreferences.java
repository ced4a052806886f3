package dev.beacon.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A provider's preference vector. Every category defaults to no preference.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderPreferences {

    @Builder.Default
    private PreferenceRank location = PreferenceRank.NO_PREFERENCE;

    @Builder.Default
    @JsonAlias("uni")
    private PreferenceRank almaMater = PreferenceRank.NO_PREFERENCE;

    @Builder.Default
    private PreferenceRank gpa = PreferenceRank.NO_PREFERENCE;

    @Builder.Default
    private PreferenceRank industryAlignment = PreferenceRank.NO_PREFERENCE;

    @Builder.Default
    private PreferenceRank helpType = PreferenceRank.NO_PREFERENCE;

    @Builder.Default
    private PreferenceRank pathAlignment = PreferenceRank.NO_PREFERENCE;

    public static ProviderPreferences noPreferences() {
        return ProviderPreferences.builder().build();
    }

    public PreferenceRank rankFor(PreferenceCategory category) {
        PreferenceRank rank = switch (category) {
            case LOCATION -> location;
            case ALMA_MATER -> almaMater;
            case GPA -> gpa;
            case INDUSTRY_ALIGNMENT -> industryAlignment;
            case HELP_TYPE -> helpType;
            case PATH_ALIGNMENT -> pathAlignment;
        };
        return rank != null ? rank : PreferenceRank.NO_PREFERENCE;
    }
}
