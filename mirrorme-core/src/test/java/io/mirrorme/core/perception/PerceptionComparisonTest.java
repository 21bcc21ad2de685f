package io.mirrorme.core.perception;

import static io.mirrorme.core.perception.PerceptionAdvisorTest.result;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PerceptionComparisonTest {

    @Test
    void shouldAverageAndPickExtremesInDisplayOrder() {
        PerceptionComparison comparison = PerceptionComparison.of(List.of(
            result(PerceiverType.RECRUITER, 70, Map.of()),
            result(PerceiverType.ROMANTIC_PARTNER, 45, Map.of()),
            result(PerceiverType.COLLEAGUE, 70, Map.of()),
            result(PerceiverType.FAMILY_MEMBER, 45, Map.of())
        ), 12);

        assertThat(comparison.perceptions()).containsOnlyKeys("recruiter", "romantic_partner", "colleague", "family_member");
        assertThat(comparison.averageScore()).isEqualTo(57.5);
        assertThat(comparison.strongestPerception()).isEqualTo("recruiter");
        assertThat(comparison.mostConcerningPerception()).isEqualTo("romantic_partner");
        assertThat(comparison.totalRecords()).isEqualTo(12);
        assertThat(comparison.message()).isNull();
    }

    @Test
    void shouldRoundAverageToOneDecimal() {
        PerceptionComparison comparison = PerceptionComparison.of(List.of(
            result(PerceiverType.RECRUITER, 50, Map.of()),
            result(PerceiverType.COLLEAGUE, 51, Map.of()),
            result(PerceiverType.FAMILY_MEMBER, 51, Map.of())
        ), 3);

        assertThat(comparison.averageScore()).isEqualTo(50.7);
    }

    @Test
    void emptyComparisonShouldExplainMissingData() {
        PerceptionComparison empty = PerceptionComparison.empty();

        assertThat(empty.averageScore()).isEqualTo(50.0);
        assertThat(empty.strongestPerception()).isNull();
        assertThat(empty.message()).isEqualTo(PerceptionComparison.NO_DATA_MESSAGE);
    }
}
