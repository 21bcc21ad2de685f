package io.mirrorme.core.bias;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param totalInteractionsAnalyzed records inside the window, matched or not
 * @param message set only when there was nothing to analyze
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TopicBiasReport(
    Map<String, TopicExposure> topicExposure,
    List<PushedTopic> algorithmicPushDetected,
    List<CoordinatedTopic> coordinatedTopics,
    Map<String, Map<String, Integer>> platformTopicBias,
    int totalInteractionsAnalyzed,
    int analysisPeriodDays,
    String message
) {
    public static final String NO_DATA_MESSAGE = "No behavior data available for topic bias analysis";

    public TopicBiasReport {
        topicExposure = topicExposure == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(topicExposure));
        algorithmicPushDetected = algorithmicPushDetected == null ? List.of() : List.copyOf(algorithmicPushDetected);
        coordinatedTopics = coordinatedTopics == null ? List.of() : List.copyOf(coordinatedTopics);
        platformTopicBias = platformTopicBias == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(platformTopicBias));
    }

    public static TopicBiasReport empty(int windowDays) {
        return new TopicBiasReport(Map.of(), List.of(), List.of(), Map.of(), 0, windowDays, NO_DATA_MESSAGE);
    }
}
