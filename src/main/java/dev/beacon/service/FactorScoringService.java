package dev.beacon.service;

import dev.beacon.config.MatchingConfig;
import dev.beacon.model.Factor;
import dev.beacon.model.FactorScoreSet;
import dev.beacon.model.Location;
import dev.beacon.model.NormalizedProfile;
import dev.beacon.model.PreferenceCategory;
import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;
import dev.beacon.util.TagOverlap;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Computes the base factor values for an eligible pair.
 */
@Service
public class FactorScoringService {

    private static final double MAX_GPA = 4.0;

    private final ProfileNormalizer normalizer;
    private final Map<String, Integer> tierByInstitution;
    private final int defaultTier;
    private final double idealGapMin;
    private final double idealGapMax;
    private final double gapDecayRate;

    public FactorScoringService(MatchingConfig matchingConfig, ProfileNormalizer normalizer) {
        this.normalizer = normalizer;
        this.defaultTier = matchingConfig.getDefaultTier();
        this.idealGapMin = matchingConfig.getIdealGapMin();
        this.idealGapMax = matchingConfig.getIdealGapMax();
        this.gapDecayRate = matchingConfig.getGapDecayRate();

        Map<String, Integer> tiers = new HashMap<>();
        for (MatchingConfig.TierGroup group : matchingConfig.getInstitutionTiers()) {
            for (String institution : group.getInstitutions()) {
                // First listing wins if an institution appears in two tiers
                tiers.putIfAbsent(institution, group.getTier());
            }
        }
        this.tierByInstitution = Map.copyOf(tiers);
    }

    /**
     * All base factors, plus GPA when the provider expressed a GPA preference.
     */
    public FactorScoreSet score(Provider provider, Seeker seeker,
            NormalizedProfile providerNormalized, NormalizedProfile seekerNormalized) {
        FactorScoreSet.Builder builder = FactorScoreSet.builder()
                .put(Factor.SHARED_INSTITUTION,
                        sharedInstitution(providerNormalized.almaMater(), seekerNormalized.almaMater()))
                .put(Factor.INSTITUTION_TIER,
                        institutionTier(providerNormalized.almaMater(), seekerNormalized.almaMater()))
                .put(Factor.INDUSTRY_ALIGNMENT,
                        industryAlignment(provider.getCurrentIndustry(), seeker.getCurrentIndustry()))
                .put(Factor.HELP_TYPE_MATCH,
                        helpTypeMatch(provider.getHelpCapabilities(), seeker.getHelpNeeds()))
                .put(Factor.LOCATION_PROXIMITY,
                        locationProximity(providerNormalized.location(), seekerNormalized.location()))
                .put(Factor.EXPERIENCE_GAP,
                        experienceGap(providerNormalized.experienceYears(), seekerNormalized.experienceYears()));

        if (provider.getPreferences() != null
                && provider.getPreferences().rankFor(PreferenceCategory.GPA).isExpressed()) {
            builder.put(Factor.GPA, gpa(seeker.getGpa()));
        }
        return builder.build();
    }

    public double sharedInstitution(String providerAlmaMater, String seekerAlmaMater) {
        if (providerAlmaMater == null || seekerAlmaMater == null) {
            return 0.0;
        }
        return providerAlmaMater.equals(seekerAlmaMater) ? 1.0 : 0.0;
    }

    public int tierOf(String institution) {
        if (institution == null) {
            return defaultTier;
        }
        return tierByInstitution.getOrDefault(institution, defaultTier);
    }

    public double institutionTier(String providerAlmaMater, String seekerAlmaMater) {
        int difference = Math.abs(tierOf(providerAlmaMater) - tierOf(seekerAlmaMater));
        return Math.max(0.0, 1.0 - difference / 3.0);
    }

    public double industryAlignment(String providerIndustry, String seekerIndustry) {
        if (providerIndustry == null || seekerIndustry == null || providerIndustry.isEmpty()) {
            return 0.0;
        }
        return providerIndustry.equals(seekerIndustry) ? 1.0 : 0.0;
    }

    public double helpTypeMatch(Set<String> capabilities, Set<String> needs) {
        if (needs == null || needs.isEmpty()) {
            return 0.0;
        }
        return Math.min(1.0, (double) TagOverlap.count(capabilities, needs) / needs.size());
    }

    public double locationProximity(Location providerLocation, Location seekerLocation) {
        return normalizer.compareLocations(providerLocation, seekerLocation);
    }

    /**
     * 1.0 inside the ideal band, linear ramp below it, smooth decay above it.
     */
    public double experienceGap(double providerYears, double seekerYears) {
        double gap = providerYears - seekerYears;
        if (gap <= 0) {
            return 0.0;
        }
        if (gap < idealGapMin) {
            return gap / idealGapMin;
        }
        if (gap <= idealGapMax) {
            return 1.0;
        }
        return 1.0 / (1.0 + gapDecayRate * (gap - idealGapMax));
    }

    public double gpa(Double seekerGpa) {
        double value = seekerGpa == null ? 0.0 : seekerGpa / MAX_GPA;
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
