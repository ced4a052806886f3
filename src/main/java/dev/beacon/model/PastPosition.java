package dev.beacon.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a profile's history: a job or a degree.
 * The order key defines display order; education entries never count towards experience.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PastPosition {

    private String title;

    @JsonAlias("company")
    private String organization; // employer, or institution for degrees

    private String duration; // free text, e.g. "3 years", "6 months"

    @JsonAlias("is_education")
    private boolean education;

    @JsonAlias("sort_order")
    private Integer orderKey;
}
