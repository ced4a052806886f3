package dev.beacon.model;

/**
 * A "City, Region" location split into its two components.
 */
public record Location(String city, String region) {

    public static final String UNKNOWN_COMPONENT = "unknown";
    public static final Location UNKNOWN = new Location(UNKNOWN_COMPONENT, UNKNOWN_COMPONENT);

    public boolean isKnown() {
        return !UNKNOWN.equals(this);
    }
}
