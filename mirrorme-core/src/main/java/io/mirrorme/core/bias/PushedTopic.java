package io.mirrorme.core.bias;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record PushedTopic(
    String topic,
    double exposurePercentage,
    LabelBias sentimentBias,
    LabelBias politicalBias,
    Map<String, Integer> platformBreakdown,
    String warning
) {
    public PushedTopic {
        platformBreakdown = platformBreakdown == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(platformBreakdown));
    }
}
