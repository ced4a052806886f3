package dev.beacon.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Set;

/**
 * Denormalized seeker card shown in a provider's feed.
 */
@Data
@Builder
public class FeedItem {
    private String seekerId;
    private String name;
    private String almaMater;
    private String location;
    private Double gpa;
    private String currentRole;
    private String currentEmployer;
    private String currentIndustry;
    private double totalExperienceYears;
    private List<PastPosition> recentPositions;
    private Set<String> helpNeeds;
    private String goals;
    private String context;

    // Scoring
    private PairScore score;
    private double goalAlignmentScore;
    private String goalReasoning;
    private double acceptanceProbability;

    // Placeholder for a real stable-matching pass: marks the top-ranked item only.
    // It does not imply the pairing is mutually optimal.
    private boolean bestPick;
}
