package dev.beacon;

import dev.beacon.model.FeedItem;
import dev.beacon.repository.ProfileRepository;
import dev.beacon.service.FeedService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Builds and logs the feed for the configured provider at startup.
 */
@Slf4j
@Component
public class FeedRunner {

    private static final String SEPARATOR = "========================================";
    private static final int CONTEXT_PREVIEW = 100;

    private final FeedService feedService;
    private final ProfileRepository profileRepository;
    private final String providerId;

    public FeedRunner(FeedService feedService, ProfileRepository profileRepository,
            @Value("${beacon.runner.provider-id:}") String providerId) {
        this.feedService = feedService;
        this.profileRepository = profileRepository;
        this.providerId = providerId;
    }

    /**
     * Executes feed generation for the configured provider.
     *
     * @return Number of feed items produced, 0 when no provider is configured
     */
    public int execute() {
        if (providerId == null || providerId.isBlank()) {
            log.info("No beacon.runner.provider-id configured - nothing to do");
            return 0;
        }

        log.info(SEPARATOR);
        log.info("Beacon feed for provider {}", providerId);
        log.info(SEPARATOR);

        try {
            List<FeedItem> feed = feedService.generateFeedForProvider(providerId, profileRepository).block();
            int count = feed != null ? feed.size() : 0;
            display(feed);
            return count;
        } catch (Exception e) {
            log.error("Feed generation failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Feed generation failed for provider " + providerId, e);
        }
    }

    private void display(List<FeedItem> feed) {
        if (feed == null || feed.isEmpty()) {
            log.info("No matches found");
            return;
        }

        log.info("YOUR MATCHES ({} prospects)", feed.size());
        for (int i = 0; i < feed.size(); i++) {
            FeedItem item = feed.get(i);
            if (item.isBestPick()) {
                log.info("-- Best pick --");
            }
            log.info("#{}. {} | {} | {}", i + 1, item.getName(), item.getAlmaMater(), item.getLocation());
            log.info("    Current: {} at {} ({}), {} years", item.getCurrentRole(), item.getCurrentEmployer(),
                    item.getCurrentIndustry(), item.getTotalExperienceYears());
            log.info("    Goal: {}", item.getGoals());
            log.info("    Context: {}", preview(item.getContext()));
            log.info("    Scores: bilateral {} | provider {} | seeker {} | goal {}",
                    item.getScore().bilateralScore(), item.getScore().providerScore(),
                    item.getScore().seekerScore(), String.format(Locale.ROOT, "%.2f", item.getGoalAlignmentScore()));
            log.info("    Acceptance: {}% | {}", Math.round(item.getAcceptanceProbability() * 100),
                    item.getGoalReasoning());
        }
        log.info(SEPARATOR);
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > CONTEXT_PREVIEW ? text.substring(0, CONTEXT_PREVIEW) + "..." : text;
    }
}
