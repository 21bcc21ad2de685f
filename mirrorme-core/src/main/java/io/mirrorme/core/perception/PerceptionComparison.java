package io.mirrorme.core.perception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Side-by-side results for the personal perceivers.
 *
 * @param averageScore mean score rounded to one decimal
 * @param message set only when there was nothing to compare
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PerceptionComparison(
    Map<String, PerceptionResult> perceptions,
    double averageScore,
    String strongestPerception,
    String mostConcerningPerception,
    int totalRecords,
    String message
) {
    public static final String NO_DATA_MESSAGE = "Not enough data for comparison analysis";

    public PerceptionComparison {
        perceptions = perceptions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(perceptions));
    }

    /**
     * Builds the summary over results given in display order. Ties go to the earlier perceiver.
     */
    public static PerceptionComparison of(List<PerceptionResult> results, int totalRecords) {
        Map<String, PerceptionResult> byType = new LinkedHashMap<>();
        PerceptionResult strongest = null;
        PerceptionResult weakest = null;
        int sum = 0;
        for (PerceptionResult result : results) {
            byType.put(result.perceiverType().id(), result);
            sum += result.score();
            if (strongest == null || result.score() > strongest.score()) {
                strongest = result;
            }
            if (weakest == null || result.score() < weakest.score()) {
                weakest = result;
            }
        }
        double average = results.isEmpty() ? 50.0 : Math.round(sum * 10.0 / results.size()) / 10.0;
        return new PerceptionComparison(
            byType,
            average,
            strongest == null ? null : strongest.perceiverType().id(),
            weakest == null ? null : weakest.perceiverType().id(),
            totalRecords,
            null
        );
    }

    public static PerceptionComparison empty() {
        return new PerceptionComparison(Map.of(), 50.0, null, null, 0, NO_DATA_MESSAGE);
    }
}
