package dev.beacon.ai;

import dev.beacon.model.GoalAlignment;
import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;
import dev.beacon.util.TagOverlap;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic goal alignment from industry match and help-tag overlap. Never fails.
 */
@Component
public class HeuristicGoalEstimator implements GoalEstimator {

    private static final double INDUSTRY_BONUS = 0.5;
    private static final double PER_TAG_BONUS = 0.3;
    private static final double MAX_TAG_BONUS = 0.4;
    private static final String SUFFIX = " (heuristic fallback)";

    @Override
    public Mono<GoalEstimate> estimate(Provider provider, Seeker seeker) {
        return Mono.fromSupplier(() -> GoalEstimate.success(compute(provider, seeker)));
    }

    public GoalAlignment compute(Provider provider, Seeker seeker) {
        double score = 0.0;
        List<String> reasons = new ArrayList<>();

        String industry = provider.getCurrentIndustry();
        if (industry != null && !industry.isEmpty() && industry.equals(seeker.getCurrentIndustry())) {
            score += INDUSTRY_BONUS;
            reasons.add("Same industry");
        }

        int overlap = TagOverlap.count(provider.getHelpCapabilities(), seeker.getHelpNeeds());
        if (overlap > 0) {
            score += Math.min(PER_TAG_BONUS * overlap, MAX_TAG_BONUS);
            reasons.add("Can help with " + overlap + " needed areas");
        }

        String reasoning = reasons.isEmpty() ? "Limited alignment" : String.join("; ", reasons);
        return new GoalAlignment(Math.min(1.0, score), reasoning + SUFFIX, GoalAlignment.Source.HEURISTIC);
    }

    @Override
    public String getName() {
        return "heuristic";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
