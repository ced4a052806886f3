package dev.beacon.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup tables and constants for pair scoring.
 * Loaded from application.yml under 'matching' prefix; components copy what they need at construction.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig {

    private double providerShare = 0.6;
    private double goalWeight = 5.0;

    private List<String> degreePrefixes = new ArrayList<>(
            List.of("BS", "BA", "MBA", "PhD", "MD", "DO", "MFA", "MS", "MA"));

    private int defaultTier = 4;
    private List<TierGroup> institutionTiers = defaultTiers();

    // Keyed by factor id in kebab case; relaxed binding strips underscores from map keys
    private Map<String, Double> seekerWeights = defaultSeekerWeights();

    private double idealGapMin = 3.0;
    private double idealGapMax = 7.0;
    private double gapDecayRate = 0.1;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierGroup {
        private int tier;
        private List<String> institutions = new ArrayList<>();
    }

    private static Map<String, Double> defaultSeekerWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("shared-institution", 2.0);
        weights.put("institution-tier", 1.0);
        weights.put("industry-alignment", 5.0);
        weights.put("help-type-match", 5.0);
        weights.put("location-proximity", 2.0);
        weights.put("experience-gap", 4.0);
        weights.put("gpa", 0.0);
        return weights;
    }

    private static List<TierGroup> defaultTiers() {
        List<TierGroup> tiers = new ArrayList<>();
        tiers.add(new TierGroup(1, new ArrayList<>(List.of(
                "Harvard University", "Yale University", "Princeton University", "Columbia University",
                "University of Pennsylvania", "Cornell University", "Brown University", "Dartmouth College",
                "Stanford University", "MIT", "Caltech"))));
        tiers.add(new TierGroup(2, new ArrayList<>(List.of(
                "Duke University", "Northwestern University", "Johns Hopkins University", "University of Chicago",
                "Rice University", "Vanderbilt University", "Washington University in St. Louis", "Notre Dame",
                "UC Berkeley", "UCLA", "Georgetown University"))));
        tiers.add(new TierGroup(3, new ArrayList<>(List.of(
                "University of Michigan", "University of Virginia", "University of North Carolina", "Georgia Tech",
                "University of Texas at Austin", "University of Wisconsin", "University of Illinois",
                "Ohio State University", "Penn State University", "University of Washington",
                "University of Florida", "Purdue University", "UC San Diego", "University of Maryland"))));
        return tiers;
    }
}
