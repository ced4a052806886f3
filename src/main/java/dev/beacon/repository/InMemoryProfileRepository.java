package dev.beacon.repository;

import dev.beacon.model.Profile;
import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Profile store backed by immutable in-memory snapshots.
 */
public class InMemoryProfileRepository implements ProfileRepository {

    private final Map<String, Provider> providers;
    private final Map<String, Seeker> seekers;
    private final Map<String, Set<String>> contacts;

    public InMemoryProfileRepository(Collection<Provider> providers, Collection<Seeker> seekers,
            Map<String, ? extends Collection<String>> contacts) {
        this.providers = indexById(providers, "provider");
        this.seekers = indexById(seekers, "seeker");
        this.contacts = indexContacts(contacts);
    }

    public static InMemoryProfileRepository empty() {
        return new InMemoryProfileRepository(List.of(), List.of(), Map.of());
    }

    @Override
    public Optional<Provider> findProvider(String providerId) {
        return Optional.ofNullable(providerId).map(providers::get);
    }

    @Override
    public Optional<Seeker> findSeeker(String seekerId) {
        return Optional.ofNullable(seekerId).map(seekers::get);
    }

    @Override
    public List<Seeker> findAllSeekers() {
        return List.copyOf(seekers.values());
    }

    @Override
    public Set<String> findContactedSeekerIds(String providerId) {
        return contacts.getOrDefault(providerId, Set.of());
    }

    public int providerCount() {
        return providers.size();
    }

    public int seekerCount() {
        return seekers.size();
    }

    private static Map<String, Set<String>> indexContacts(Map<String, ? extends Collection<String>> contacts) {
        if (contacts == null) {
            return Map.of();
        }
        Map<String, Set<String>> index = new LinkedHashMap<>();
        contacts.forEach((providerId, seekerIds) -> {
            if (providerId == null || providerId.isBlank()) {
                throw new IllegalArgumentException("Contact history needs a provider id");
            }
            if (seekerIds == null || seekerIds.stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("Contact history for provider " + providerId
                        + " must be a list of seeker ids");
            }
            index.put(providerId, Set.copyOf(seekerIds));
        });
        return Collections.unmodifiableMap(index);
    }

    private static <T extends Profile> Map<String, T> indexById(Collection<T> profiles, String role) {
        if (profiles == null) {
            return Map.of();
        }
        Map<String, T> index = new LinkedHashMap<>();
        for (T profile : profiles) {
            if (profile.getId() == null || profile.getId().isBlank()) {
                throw new IllegalArgumentException("Every " + role + " needs an id: " + profile.getName());
            }
            if (index.putIfAbsent(profile.getId(), profile) != null) {
                throw new IllegalArgumentException("Duplicate " + role + " id: " + profile.getId());
            }
        }
        return Collections.unmodifiableMap(index);
    }
}
