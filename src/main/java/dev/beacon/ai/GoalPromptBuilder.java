package dev.beacon.ai;

import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;
import dev.beacon.service.ProfileNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Builds the goal-alignment request text sent to the reasoning service.
 */
@Component
@RequiredArgsConstructor
public class GoalPromptBuilder {

    private final ProfileNormalizer normalizer;

    public String build(Provider provider, Seeker seeker) {
        return String.format("""
                You are a career matching expert. Rate how well this MENTOR can help this MENTEE achieve their goal.

                MENTEE PROFILE:
                Name: %s
                Goal: %s
                Context: %s
                Current Role: %s at %s
                Industry: %s
                Needs Help With: %s

                MENTOR PROFILE:
                Name: %s
                Current Role: %s at %s
                Industry: %s
                Can Help With: %s
                Additional Context: %s
                Career Path: %s

                TASK:
                Rate from 0.0 to 1.0 how well this mentor can help the mentee achieve their specific goal.

                Consider:
                1. Does the mentor have direct experience in the mentee's target role/industry?
                2. Has the mentor made a similar career transition?
                3. Can the mentor provide the specific help the mentee needs?
                4. Does the mentor's background align with the mentee's aspirations?

                Return ONLY a JSON object with this exact format (no markdown, no explanation):
                {"score": 0.75, "reasoning": "Brief explanation in 1-2 sentences"}""",
                text(seeker.getName()),
                text(seeker.getGoals()),
                text(seeker.getContext()),
                text(seeker.getCurrentRole()), text(seeker.getCurrentEmployer()),
                text(seeker.getCurrentIndustry()),
                join(seeker.getHelpNeeds()),
                text(provider.getName()),
                text(provider.getCurrentRole()), text(provider.getCurrentEmployer()),
                text(provider.getCurrentIndustry()),
                join(provider.getHelpCapabilities()),
                text(provider.getHelpDetails()),
                normalizer.careerPath(provider));
    }

    private static String text(String value) {
        return value != null ? value : "";
    }

    private static String join(Collection<String> tags) {
        return tags == null ? "" : String.join(", ", tags);
    }
}
