package dev.beacon.model;

/**
 * The dimensions a provider ranks when stating preferences.
 */
public enum PreferenceCategory {
    LOCATION,
    ALMA_MATER,
    GPA,
    INDUSTRY_ALIGNMENT,
    HELP_TYPE,
    PATH_ALIGNMENT
}
