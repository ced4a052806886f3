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
 * A mentor: what they can help with and how much they care about each matching factor.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Provider extends Profile {

    @Builder.Default
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> helpCapabilities = new LinkedHashSet<>();

    private String helpDetails;

    // Only consulted when no degree entry is found in the history
    private String almaMater;

    @Builder.Default
    private ProviderPreferences preferences = ProviderPreferences.noPreferences();
}
