package dev.beacon.model;

/**
 * Attributes derived from a profile's raw history, computed once per profile per request.
 *
 * @param almaMater       first degree institution, or the explicit fallback; null when none found
 * @param experienceYears total non-education experience, rounded to 2 decimals
 * @param location        parsed location, {@link Location#UNKNOWN} when unparseable
 */
public record NormalizedProfile(String almaMater, double experienceYears, Location location) {
}
