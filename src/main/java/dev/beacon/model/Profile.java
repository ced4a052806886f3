package dev.beacon.model;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Fields shared by providers and seekers, as served by the profile store.
 */
@Data
@SuperBuilder
@NoArgsConstructor
public abstract class Profile {

    private String id;
    private String name;
    private String currentRole;
    private String currentEmployer;
    private String currentIndustry;
    private String location; // "City, Region"

    @Builder.Default
    private List<PastPosition> pastPositions = new ArrayList<>();
}
