package dev.beacon.repository;

import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to the profile store and its connection state.
 * Implementations must return snapshots the engine can read without further synchronization.
 */
public interface ProfileRepository {

    Optional<Provider> findProvider(String providerId);

    Optional<Seeker> findSeeker(String seekerId);

    /**
     * All seekers, in store order.
     */
    List<Seeker> findAllSeekers();

    /**
     * Seekers the provider has already contacted or matched with.
     */
    Set<String> findContactedSeekerIds(String providerId);
}
