package dev.beacon.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A mentee looking for help.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Seeker extends Profile {

    @Builder.Default
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> helpNeeds = new LinkedHashSet<>();

    private Double gpa; // 0-4 scale, optional

    private String goals;

    private String context;
}
