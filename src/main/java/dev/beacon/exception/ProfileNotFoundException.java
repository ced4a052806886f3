package dev.beacon.exception;

import lombok.Getter;

/**
 * Raised when the profile store has no record for a requested provider or seeker id.
 */
@Getter
public class ProfileNotFoundException extends RuntimeException {

    private static final String ERROR_CODE = "PROFILE_NOT_FOUND";

    private final String errorCode;
    private final String role;
    private final String profileId;

    public ProfileNotFoundException(String role, String profileId) {
        super(String.format("%s profile %s not found", role, profileId));
        this.errorCode = ERROR_CODE;
        this.role = role;
        this.profileId = profileId;
    }

    public static ProfileNotFoundException provider(String id) {
        return new ProfileNotFoundException("Provider", id);
    }

    public static ProfileNotFoundException seeker(String id) {
        return new ProfileNotFoundException("Seeker", id);
    }
}
