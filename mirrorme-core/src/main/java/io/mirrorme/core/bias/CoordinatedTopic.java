package io.mirrorme.core.bias;

import java.util.List;

/**
 * A topic spread suspiciously evenly across platforms.
 *
 * @param coordinationStrength mean over population variance of per-platform counts, capped at
 *     {@link TopicBiasDetector#MAX_COORDINATION_STRENGTH}
 * @param perfectlyEven true when every platform saw the same count (zero variance)
 */
public record CoordinatedTopic(
    String topic,
    List<String> platforms,
    int totalExposure,
    double coordinationStrength,
    boolean perfectlyEven,
    String warning
) {
    public CoordinatedTopic {
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }
}
