package io.mirrorme.core.perception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PerceptionRecommendations(
    List<String> recommendations,
    List<String> topConcerns,
    List<ActionPlanItem> actionPlan,
    int perceiverTypesAnalyzed,
    String mostCommonConcern,
    String priority
) {
    public static final String NO_MAJOR_CONCERNS = "No major concerns detected";

    public PerceptionRecommendations {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        topConcerns = topConcerns == null ? List.of() : List.copyOf(topConcerns);
        actionPlan = actionPlan == null ? List.of() : List.copyOf(actionPlan);
    }

    public int uniqueRecommendations() {
        return recommendations.size();
    }

    public static PerceptionRecommendations dataCollection() {
        return new PerceptionRecommendations(
            List.of(
                "Start using the browser extension to track your online behavior",
                "Engage with professional content to build a stronger digital presence",
                "Diversify your online interests to appeal to different audiences"
            ),
            List.of(),
            List.of(),
            0,
            NO_MAJOR_CONCERNS,
            "data_collection"
        );
    }
}
