package dev.beacon.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;
import dev.beacon.repository.InMemoryProfileRepository;
import dev.beacon.repository.ProfileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds the in-memory profile store from snake_case JSON files.
 */
@Slf4j
@Configuration
public class DatasetConfig {

    @Bean
    public ProfileRepository profileRepository(
            ObjectMapper objectMapper,
            @Value("${dataset.providers-file:data/providers.json}") String providersFile,
            @Value("${dataset.seekers-file:data/seekers.json}") String seekersFile,
            @Value("${dataset.contacts-file:data/contacts.json}") String contactsFile) {

        ObjectMapper datasetMapper = datasetMapper(objectMapper);

        List<Provider> providers = read(datasetMapper, providersFile, new TypeReference<List<Provider>>() {}, List::of);
        List<Seeker> seekers = read(datasetMapper, seekersFile, new TypeReference<List<Seeker>>() {}, List::of);
        Map<String, List<String>> contacts = read(datasetMapper, contactsFile,
                new TypeReference<Map<String, List<String>>>() {}, Map::of);

        InMemoryProfileRepository repository;
        try {
            repository = new InMemoryProfileRepository(providers, seekers, contacts);
        } catch (IllegalArgumentException e) {
            log.error("Dataset is inconsistent: {}", e.getMessage());
            throw new IllegalStateException("Invalid dataset: " + e.getMessage(), e);
        }
        log.info("Loaded dataset: {} providers, {} seekers, {} providers with contact history",
                repository.providerCount(), repository.seekerCount(), contacts.size());
        return repository;
    }

    static ObjectMapper datasetMapper(ObjectMapper objectMapper) {
        return objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    static <T> T read(ObjectMapper mapper, String path, TypeReference<T> type, Supplier<T> whenMissing) {
        File file = new File(path);
        if (!file.exists()) {
            log.warn("{} not found. Using an empty collection.", path);
            return whenMissing.get();
        }

        try {
            T value = mapper.readValue(file, type);
            return value != null ? value : whenMissing.get();
        } catch (IOException e) {
            log.error("Failed to load {}. Ensure it matches the required structure.", path, e);
            throw new IllegalStateException("Could not load dataset file " + path, e);
        }
    }
}
