package dev.beacon.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FactorScoreSetTest {

    @ParameterizedTest
    @ValueSource(doubles = {-0.01, 1.01, Double.NaN})
    void shouldRejectValuesOutsideUnitInterval(double value) {
        assertThatThrownBy(() -> FactorScoreSet.builder().put(Factor.GPA, value))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("gpa");
        assertThatThrownBy(() -> FactorScoreSet.empty().with(Factor.GPA, value))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCopyOnWith() {
        FactorScoreSet base = FactorScoreSet.builder().put(Factor.INDUSTRY_ALIGNMENT, 1.0).build();
        FactorScoreSet extended = base.with(Factor.GOAL_ALIGNMENT, 0.4);

        assertThat(base.contains(Factor.GOAL_ALIGNMENT)).isFalse();
        assertThat(extended.get(Factor.GOAL_ALIGNMENT)).hasValue(0.4);
        assertThat(extended.get(Factor.INDUSTRY_ALIGNMENT)).hasValue(1.0);
        assertThat(extended.get(Factor.GPA)).isEmpty();
    }

    @Test
    void shouldSerializeUnderFactorIdentifiers() throws Exception {
        FactorScoreSet factors = FactorScoreSet.builder()
                .put(Factor.HELP_TYPE_MATCH, 0.5)
                .put(Factor.SHARED_INSTITUTION, 1.0)
                .build();

        assertThat(new ObjectMapper().writeValueAsString(factors))
                .isEqualTo("{\"shared_institution\":1.0,\"help_type_match\":0.5}");
    }

    @Test
    void shouldResolveFactorIdentifiers() {
        assertThat(Factor.fromId("Help-Type-Match")).isEqualTo(Factor.HELP_TYPE_MATCH);
        assertThat(Factor.GOAL_ALIGNMENT.isBase()).isFalse();
        assertThat(Factor.INSTITUTION_TIER.category()).isEqualTo(PreferenceCategory.ALMA_MATER);
        assertThatThrownBy(() -> Factor.fromId("charm")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldResolveIdentifiersIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(Factor.fromId("SHARED_INSTITUTION")).isEqualTo(Factor.SHARED_INSTITUTION);
            assertThat(Factor.fromId("Industry-Alignment")).isEqualTo(Factor.INDUSTRY_ALIGNMENT);
        } finally {
            Locale.setDefault(previous);
        }
    }
}
