package io.mirrorme.core.bias;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keyword-level exposure to one topic, broken down by platform and by the records' labels.
 */
public record TopicExposure(
    int totalCount,
    Map<String, Integer> platformBreakdown,
    Map<String, Integer> sentimentBreakdown,
    Map<String, Integer> politicalBreakdown
) {
    public TopicExposure {
        platformBreakdown = readOnly(platformBreakdown);
        sentimentBreakdown = readOnly(sentimentBreakdown);
        politicalBreakdown = readOnly(politicalBreakdown);
    }

    private static Map<String, Integer> readOnly(Map<String, Integer> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
