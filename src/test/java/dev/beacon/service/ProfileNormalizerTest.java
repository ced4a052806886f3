package dev.beacon.service;

import dev.beacon.config.MatchingConfig;
import dev.beacon.model.Location;
import dev.beacon.model.NormalizedProfile;
import dev.beacon.model.PastPosition;
import dev.beacon.model.Provider;
import dev.beacon.model.Seeker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import java.util.List;

import static dev.beacon.TestProfiles.degree;
import static dev.beacon.TestProfiles.job;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProfileNormalizerTest {

    private ProfileNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ProfileNormalizer(new MatchingConfig());
    }

    @Nested
    @DisplayName("Education detection")
    class EducationTests {

        @ParameterizedTest
        @CsvSource({
                "BS Computer Science, true",
                "MBA, true",
                "PhD Chemistry, true",
                "MSc Data Science, true",
                "Marketing Manager, false",
                "bs biology, false",
                "Software Engineer, false"
        })
        @DisplayName("Should detect degrees by case-sensitive title prefix")
        void shouldDetectDegreesByPrefix(String title, boolean expected) {
            assertThat(normalizer.isEducation(job(title, "Somewhere", "1 year"))).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should honour the explicit education flag")
        void shouldHonourEducationFlag() {
            PastPosition bootcamp = PastPosition.builder().title("Coding bootcamp").education(true).build();

            assertThat(normalizer.isEducation(bootcamp)).isTrue();
        }
    }

    @Nested
    @DisplayName("Duration parsing")
    class DurationTests {

        @ParameterizedTest
        @CsvSource({
                "3 years, 3.0",
                "1 Year, 1.0",
                "6 months, 0.5",
                "18 months, 1.5",
                "2 weeks, 0.0",
                "about a year, 0.0",
                "5 yrs, 0.0"
        })
        void shouldParseDurations(String duration, double expected) {
            assertThat(normalizer.parseDuration(duration)).isCloseTo(expected, within(1e-9));
        }

        @ParameterizedTest
        @NullAndEmptySource
        void shouldTreatMissingDurationAsZero(String duration) {
            assertThat(normalizer.parseDuration(duration)).isZero();
        }

        @Test
        @DisplayName("Should sum non-education durations and round to 2 decimals")
        void shouldSumExperience() {
            Seeker seeker = Seeker.builder()
                    .id("S1")
                    .pastPositions(List.of(
                            degree("BA Economics", "University of Florida"),
                            job("Analyst", "Globex", "2 years"),
                            job("Intern", "Globex", "7 months")))
                    .build();

            assertThat(normalizer.totalExperience(seeker)).isEqualTo(2.58);
        }
    }

    @Nested
    @DisplayName("Locations")
    class LocationTests {

        @Test
        void shouldSplitCityAndRegion() {
            assertThat(normalizer.parseLocation(" Miami ,  FL ")).isEqualTo(new Location("Miami", "FL"));
        }

        @Test
        @DisplayName("A single comma with an empty side keeps the empty component")
        void shouldKeepEmptyComponent() {
            assertThat(normalizer.parseLocation("Miami, ")).isEqualTo(new Location("Miami", ""));
            assertThat(normalizer.parseLocation(", FL")).isEqualTo(new Location("", "FL"));
            assertThat(normalizer.compareLocations("Miami, ", "Miami, ")).isEqualTo(1.0);
            assertThat(normalizer.compareLocations(", FL", "Tampa, FL")).isEqualTo(0.5);
        }

        @ParameterizedTest
        @CsvSource(value = {"Seattle", "'Paris, Ile-de-France, France'", "''"})
        void shouldTreatOtherShapesAsUnknown(String location) {
            assertThat(normalizer.parseLocation(location)).isEqualTo(Location.UNKNOWN);
        }

        @ParameterizedTest
        @CsvSource(value = {
                "Miami, FL | Miami, FL | 1.0",
                "Miami, FL | Orlando, FL | 0.5",
                "Austin, TX | Miami, FL | 0.0",
                "Seattle | Seattle | 0.0",
                "Miami, FL | '' | 0.0"
        }, delimiter = '|')
        void shouldCompareLocations(String first, String second, double expected) {
            assertThat(normalizer.compareLocations(first, second)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Alma mater")
    class AlmaMaterTests {

        @Test
        @DisplayName("Should take the first degree in history order")
        void shouldTakeFirstDegreeByOrderKey() {
            Seeker seeker = Seeker.builder()
                    .id("S1")
                    .pastPositions(List.of(
                            PastPosition.builder().title("MS Statistics").organization("Duke University")
                                    .orderKey(2).build(),
                            PastPosition.builder().title("Analyst").organization("Globex").orderKey(1).build(),
                            PastPosition.builder().title("BS Math").organization("Rice University")
                                    .orderKey(0).build()))
                    .build();

            assertThat(normalizer.extractAlmaMater(seeker)).contains("Rice University");
        }

        @Test
        @DisplayName("Should fall back to a provider's explicit alma mater")
        void shouldFallBackForProviders() {
            Provider provider = Provider.builder()
                    .id("P1")
                    .almaMater("Georgia Tech")
                    .pastPositions(List.of(job("Engineer", "Initech", "6 years")))
                    .build();

            assertThat(normalizer.extractAlmaMater(provider)).contains("Georgia Tech");
        }

        @Test
        void shouldBeEmptyWithoutDegrees() {
            Seeker seeker = Seeker.builder().id("S1").pastPositions(List.of(job("Analyst", "Globex", "1 year")))
                    .build();

            assertThat(normalizer.extractAlmaMater(seeker)).isEmpty();
        }
    }

    @Test
    @DisplayName("Should normalize a profile in one pass")
    void shouldNormalizeProfile() {
        Provider provider = Provider.builder()
                .id("P1")
                .location("Miami, FL")
                .pastPositions(List.of(
                        degree("BS Biology", "University of Florida"),
                        job("Consultant", "Deloitte", "3 years"),
                        job("Associate PM", "Lumen Health", "18 months"),
                        job("Product Manager", "Lumen Health", "5 years")))
                .build();

        NormalizedProfile normalized = normalizer.normalize(provider);

        assertThat(normalized.almaMater()).isEqualTo("University of Florida");
        assertThat(normalized.experienceYears()).isEqualTo(9.5);
        assertThat(normalized.location()).isEqualTo(new Location("Miami", "FL"));
        assertThat(normalizer.careerPath(provider))
                .isEqualTo("Consultant at Deloitte → Associate PM at Lumen Health → Product Manager at Lumen Health");
    }
}
