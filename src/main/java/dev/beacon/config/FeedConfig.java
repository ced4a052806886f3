package dev.beacon.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Feed sizes, score floors and scoring concurrency.
 * Loaded from application.yml under 'feed' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "feed")
public class FeedConfig {

    private int size = 5;
    private int endpointSize = 20;
    private double minBilateralScore = 50.0;
    private int concurrency = 8;
    private Screening screening = new Screening();

    /**
     * Floors for the three-stage screening flow. All must pass.
     */
    @Data
    public static class Screening {
        private double minProviderScore = 60.0;
        private double minSeekerScore = 50.0;
        private double minBilateralScore = 55.0;
    }
}
