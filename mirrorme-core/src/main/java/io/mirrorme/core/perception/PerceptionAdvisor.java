package io.mirrorme.core.perception;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rolls several perception results up into one prioritized set of recommendations and an action plan.
 */
public final class PerceptionAdvisor {
    static final int TOP_CONCERN_LIMIT = 3;

    private static final List<String> CONCERN_BUCKETS = List.of("concerns", "potential_concerns", "red_flags");

    public PerceptionRecommendations advise(List<PerceptionResult> results) {
        Set<String> recommendations = new LinkedHashSet<>();
        Map<String, Integer> concernCounts = new LinkedHashMap<>();
        for (PerceptionResult result : results) {
            recommendations.addAll(result.findings("recommendations"));
            for (String bucket : CONCERN_BUCKETS) {
                for (String concern : result.findings(bucket)) {
                    concernCounts.merge(concern, 1, Integer::sum);
                }
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(concernCounts.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        List<String> topConcerns = ranked.stream()
            .limit(TOP_CONCERN_LIMIT)
            .map(Map.Entry::getKey)
            .toList();

        return new PerceptionRecommendations(
            List.copyOf(recommendations),
            topConcerns,
            actionPlan(recommendations, topConcerns),
            results.size(),
            topConcerns.isEmpty() ? PerceptionRecommendations.NO_MAJOR_CONCERNS : topConcerns.get(0),
            null
        );
    }

    private List<ActionPlanItem> actionPlan(Set<String> recommendations, List<String> topConcerns) {
        List<ActionPlanItem> plan = new ArrayList<>();
        if (recommendations.stream().anyMatch(rec -> rec.toLowerCase(Locale.ROOT).contains("professional"))) {
            plan.add(new ActionPlanItem("professional", "high", List.of(
                "Share industry insights and professional achievements",
                "Engage with thought leaders in your field",
                "Reduce personal content during work hours"
            )));
        }
        if (topConcerns.stream().anyMatch(concern -> concern.contains("negative"))) {
            plan.add(new ActionPlanItem("communication", "high", List.of(
                "Balance critical posts with positive, solution-oriented content",
                "Focus on constructive rather than negative commentary",
                "Share uplifting content to improve overall sentiment"
            )));
        }
        plan.add(new ActionPlanItem("social_presence", "medium", List.of(
            "Diversify your content interests to appeal to different audiences",
            "Be mindful of political content frequency",
            "Maintain authentic voice while considering your audience"
        )));
        return plan;
    }
}
