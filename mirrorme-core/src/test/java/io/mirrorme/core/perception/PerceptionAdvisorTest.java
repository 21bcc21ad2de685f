package io.mirrorme.core.perception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PerceptionAdvisorTest {

    private final PerceptionAdvisor advisor = new PerceptionAdvisor();

    @Test
    void shouldMergeRecommendationsAndRankConcerns() {
        PerceptionResult recruiter = result(PerceiverType.RECRUITER, 35, Map.of(
            "concerns", List.of("Frequently negative or critical online - may impact team morale", "Heavy internet usage"),
            "recommendations", List.of("Consider sharing more professional achievements and industry insights", "Be kind")
        ));
        PerceptionResult partner = result(PerceiverType.ROMANTIC_PARTNER, 45, Map.of(
            "potential_concerns", List.of("Heavy internet usage"),
            "red_flags", List.of("Late night activity"),
            "recommendations", List.of("Be kind")
        ));
        PerceptionResult colleague = result(PerceiverType.COLLEAGUE, 60, Map.of(
            "concerns", List.of("Heavy internet usage", "Late night activity", "Rarely online")
        ));

        PerceptionRecommendations advice = advisor.advise(List.of(recruiter, partner, colleague));

        assertThat(advice.recommendations()).containsExactly(
            "Consider sharing more professional achievements and industry insights", "Be kind");
        assertThat(advice.uniqueRecommendations()).isEqualTo(2);
        assertThat(advice.topConcerns()).containsExactly(
            "Heavy internet usage",
            "Late night activity",
            "Frequently negative or critical online - may impact team morale"
        );
        assertThat(advice.mostCommonConcern()).isEqualTo("Heavy internet usage");
        assertThat(advice.perceiverTypesAnalyzed()).isEqualTo(3);
        assertThat(advice.priority()).isNull();
        assertThat(advice.actionPlan()).extracting(ActionPlanItem::category)
            .containsExactly("professional", "communication", "social_presence");
    }

    @Test
    void shouldAlwaysSuggestSocialPresenceEvenWithoutConcerns() {
        PerceptionRecommendations advice =
            advisor.advise(List.of(result(PerceiverType.FAMILY_MEMBER, 70, Map.of("positive_traits", List.of("Kind")))));

        assertThat(advice.topConcerns()).isEmpty();
        assertThat(advice.mostCommonConcern()).isEqualTo(PerceptionRecommendations.NO_MAJOR_CONCERNS);
        assertThat(advice.actionPlan()).extracting(ActionPlanItem::category).containsExactly("social_presence");
        assertThat(advice.actionPlan().get(0).priority()).isEqualTo("medium");
    }

    @Test
    void dataCollectionAdviceShouldCarryPriority() {
        PerceptionRecommendations advice = PerceptionRecommendations.dataCollection();

        assertThat(advice.priority()).isEqualTo("data_collection");
        assertThat(advice.recommendations()).hasSize(3);
        assertThat(advice.perceiverTypesAnalyzed()).isZero();
    }

    static PerceptionResult result(PerceiverType type, int score, Map<String, List<String>> findings) {
        return new PerceptionResult(type, type.scoreName(), score, "neutral", new LinkedHashMap<>(findings), Map.of(), null);
    }
}
