package io.mirrorme.core.perception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one simulated perception.
 *
 * @param findings ordered finding buckets; bucket names depend on the perceiver
 * @param feedback narrative feedback, {@code null} until attached
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PerceptionResult(
    PerceiverType perceiverType,
    String scoreName,
    int score,
    String overallImpression,
    Map<String, List<String>> findings,
    Map<String, Object> detailedAnalysis,
    String feedback
) {
    public static final String INSUFFICIENT_DATA = "insufficient_data";

    public PerceptionResult {
        Objects.requireNonNull(perceiverType, "perceiverType must not be null");
        findings = copyFindings(findings);
        detailedAnalysis = detailedAnalysis == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(detailedAnalysis));
    }

    public static PerceptionResult insufficientData(PerceiverType type) {
        Map<String, List<String>> findings = new LinkedHashMap<>();
        findings.put("recommendations", List.of(
            "Use the browser extension to track more online behavior",
            "Engage with diverse content to build a richer profile"
        ));
        return new PerceptionResult(
            type,
            type.scoreName(),
            50,
            INSUFFICIENT_DATA,
            findings,
            Map.of("message", "Not enough data for perception analysis. Continue using the web to build your digital profile."),
            null
        );
    }

    public List<String> findings(String bucket) {
        return findings.getOrDefault(bucket, List.of());
    }

    public PerceptionResult withFeedback(String text) {
        return new PerceptionResult(perceiverType, scoreName, score, overallImpression, findings, detailedAnalysis, text);
    }

    private static Map<String, List<String>> copyFindings(Map<String, List<String>> findings) {
        if (findings == null) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        findings.forEach((bucket, items) -> copy.put(bucket, List.copyOf(items == null ? new ArrayList<>() : items)));
        return Collections.unmodifiableMap(copy);
    }
}
