package dev.beacon.service;

import dev.beacon.config.MatchingConfig;
import dev.beacon.model.Location;
import dev.beacon.model.NormalizedProfile;
import dev.beacon.model.PastPosition;
import dev.beacon.model.Profile;
import dev.beacon.model.Provider;
import dev.beacon.util.Rounding;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives alma mater, total experience and location components from loosely structured profile history.
 */
@Service
public class ProfileNormalizer {

    private static final Pattern FIRST_INTEGER = Pattern.compile("(\\d+)");
    private static final String CAREER_PATH_SEPARATOR = " → ";

    private final List<String> degreePrefixes;

    public ProfileNormalizer(MatchingConfig matchingConfig) {
        this.degreePrefixes = List.copyOf(matchingConfig.getDegreePrefixes());
    }

    /**
     * Compute all derived attributes of a profile in one pass.
     */
    public NormalizedProfile normalize(Profile profile) {
        return new NormalizedProfile(
                extractAlmaMater(profile).orElse(null),
                totalExperience(profile),
                parseLocation(profile.getLocation()));
    }

    /**
     * Check whether an entry is a degree rather than a job.
     */
    public boolean isEducation(PastPosition position) {
        if (position == null) {
            return false;
        }
        if (position.isEducation()) {
            return true;
        }
        String title = position.getTitle();
        if (title == null || title.isEmpty()) {
            return false;
        }
        return degreePrefixes.stream().anyMatch(title::startsWith);
    }

    /**
     * History entries sorted by their order key; entries without a key keep their stored position at the end.
     */
    public List<PastPosition> orderedPositions(Profile profile) {
        List<PastPosition> positions = profile.getPastPositions();
        if (positions == null || positions.isEmpty()) {
            return List.of();
        }
        return positions.stream()
                .filter(p -> p != null)
                .sorted(Comparator.comparing(PastPosition::getOrderKey,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * First degree institution in history order, falling back to a provider's explicit alma mater.
     */
    public Optional<String> extractAlmaMater(Profile profile) {
        for (PastPosition position : orderedPositions(profile)) {
            if (isEducation(position) && !isBlank(position.getOrganization())) {
                return Optional.of(position.getOrganization().trim());
            }
        }

        if (profile instanceof Provider provider && !isBlank(provider.getAlmaMater())) {
            return Optional.of(provider.getAlmaMater().trim());
        }
        return Optional.empty();
    }

    /**
     * Parse a free-text duration into years. "3 years" is 3.0, "6 months" is 0.5, anything else is 0.
     */
    public double parseDuration(String duration) {
        if (isBlank(duration)) {
            return 0.0;
        }

        String text = duration.toLowerCase(Locale.ROOT).trim();
        Matcher matcher = FIRST_INTEGER.matcher(text);
        if (!matcher.find()) {
            return 0.0;
        }

        double number = Double.parseDouble(matcher.group(1));

        if (text.contains("year")) {
            return number;
        }
        if (text.contains("month")) {
            return number / 12.0;
        }
        return 0.0;
    }

    /**
     * Sum of non-education durations, rounded to 2 decimals.
     */
    public double totalExperience(Profile profile) {
        double total = orderedPositions(profile).stream()
                .filter(position -> !isEducation(position))
                .mapToDouble(position -> parseDuration(position.getDuration()))
                .sum();
        return Rounding.round(total, 2);
    }

    /**
     * Split "City, Region" on its single comma. Any other shape is unknown.
     */
    public Location parseLocation(String location) {
        if (isBlank(location)) {
            return Location.UNKNOWN;
        }

        String[] parts = location.split(",", -1);
        if (parts.length != 2) {
            return Location.UNKNOWN;
        }

        // Empty components are kept; "Miami, " still matches "Miami, "
        return new Location(parts[0].trim(), parts[1].trim());
    }

    /**
     * 1.0 for same city and region, 0.5 for same region only, 0.0 otherwise or when either side is unknown.
     */
    public double compareLocations(Location first, Location second) {
        if (first == null || second == null || !first.isKnown() || !second.isKnown()) {
            return 0.0;
        }
        if (!first.region().equals(second.region())) {
            return 0.0;
        }
        return first.city().equals(second.city()) ? 1.0 : 0.5;
    }

    public double compareLocations(String first, String second) {
        return compareLocations(parseLocation(first), parseLocation(second));
    }

    /**
     * Non-education history rendered as "Title at Organization → ...".
     */
    public String careerPath(Profile profile) {
        return orderedPositions(profile).stream()
                .filter(position -> !isEducation(position))
                .map(position -> position.getTitle() + " at " + position.getOrganization())
                .collect(Collectors.joining(CAREER_PATH_SEPARATOR));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
