package dev.beacon.service;

import dev.beacon.model.NormalizedProfile;
import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;
import dev.beacon.util.TagOverlap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hard gates a pair must pass before any factor is scored.
 */
@Slf4j
@Service
public class EligibilityService {

    public static final String NO_HELP_OVERLAP = "no help type overlap";
    public static final String INSUFFICIENT_EXPERIENCE_GAP = "insufficient experience gap";

    /**
     * Result of eligibility check.
     */
    public record EligibilityResult(boolean eligible, String reason) {
        public static EligibilityResult passed() {
            return new EligibilityResult(true, null);
        }

        public static EligibilityResult blocked(String reason) {
            return new EligibilityResult(false, reason);
        }
    }

    /**
     * Help overlap is checked first, then experience ordering.
     *
     * @param provider           the mentor
     * @param seeker             the candidate
     * @param providerNormalized derived provider attributes
     * @param seekerNormalized   derived seeker attributes
     * @return EligibilityResult with the first failing gate as reason
     */
    public EligibilityResult check(Provider provider, Seeker seeker,
            NormalizedProfile providerNormalized, NormalizedProfile seekerNormalized) {
        if (TagOverlap.count(provider.getHelpCapabilities(), seeker.getHelpNeeds()) == 0) {
            log.debug("Pair {}/{} blocked: {}", provider.getId(), seeker.getId(), NO_HELP_OVERLAP);
            return EligibilityResult.blocked(NO_HELP_OVERLAP);
        }

        if (providerNormalized.experienceYears() <= seekerNormalized.experienceYears()) {
            log.debug("Pair {}/{} blocked: {} ({} <= {})", provider.getId(), seeker.getId(),
                    INSUFFICIENT_EXPERIENCE_GAP, providerNormalized.experienceYears(),
                    seekerNormalized.experienceYears());
            return EligibilityResult.blocked(INSUFFICIENT_EXPERIENCE_GAP);
        }

        return EligibilityResult.passed();
    }
}
