package io.mirrorme.core.timeline;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One calendar day of activity. Label shares are percentages of the day's interactions.
 */
public record TimelinePoint(
    LocalDate date,
    double politicalLeft,
    double politicalRight,
    double politicalNeutral,
    double sentimentPositive,
    double sentimentNegative,
    double sentimentNeutral,
    int totalInteractions,
    Map<String, Integer> platformDistribution,
    Map<String, Integer> topicDistribution
) {
    public TimelinePoint {
        platformDistribution = readOnly(platformDistribution);
        topicDistribution = readOnly(topicDistribution);
    }

    /**
     * Positive means left lean, negative means right lean.
     */
    public double politicalTrend() {
        return politicalLeft - politicalRight;
    }

    public double sentimentTrend() {
        return sentimentPositive - sentimentNegative;
    }

    private static Map<String, Integer> readOnly(Map<String, Integer> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
