package io.mirrorme.core.timeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Day-by-day exposure over a trailing window plus the influence patterns detected in it.
 *
 * @param message set only when there was nothing to analyze
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InfluenceTimeline(
    List<TimelinePoint> timelineData,
    List<Double> politicalTrend,
    List<Double> sentimentTrend,
    AlgorithmInfluence algorithmInfluence,
    int analysisPeriodDays,
    int totalDataPoints,
    String message
) {
    public static final String NO_DATA_MESSAGE = "No behavior data available for algorithm influence analysis";

    public InfluenceTimeline {
        timelineData = timelineData == null ? List.of() : List.copyOf(timelineData);
        politicalTrend = politicalTrend == null ? List.of() : List.copyOf(politicalTrend);
        sentimentTrend = sentimentTrend == null ? List.of() : List.copyOf(sentimentTrend);
    }

    public static InfluenceTimeline empty(int windowDays) {
        return new InfluenceTimeline(List.of(), List.of(), List.of(), AlgorithmInfluence.noData(), windowDays, 0, NO_DATA_MESSAGE);
    }
}
