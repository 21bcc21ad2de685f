package io.mirrorme.core.perception;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Accumulates rule outcomes for one perceiver: a score delta around the neutral baseline of 50,
 * findings per bucket and the detailed-analysis map.
 */
final class ScoreCard {
    static final int BASELINE = 50;

    private final PerceiverType type;
    private final Map<String, List<String>> findings = new LinkedHashMap<>();
    private final Map<String, Object> details = new LinkedHashMap<>();
    private int delta;

    ScoreCard(PerceiverType type, String... buckets) {
        this.type = type;
        for (String bucket : buckets) {
            findings.put(bucket, new ArrayList<>());
        }
    }

    void adjust(int points) {
        delta += points;
    }

    void note(String bucket, String finding) {
        List<String> items = findings.get(bucket);
        if (items == null) {
            throw new IllegalArgumentException("Unknown finding bucket for " + type.id() + ": " + bucket);
        }
        items.add(finding);
    }

    void note(String bucket, String finding, int points) {
        note(bucket, finding);
        adjust(points);
    }

    void detail(String key, Object value) {
        details.put(key, value);
    }

    /**
     * Score delta before it is added to the baseline and clamped.
     */
    int delta() {
        return delta;
    }

    int score() {
        return Math.max(0, Math.min(100, delta + BASELINE));
    }

    boolean isEmpty(String bucket) {
        List<String> items = findings.get(bucket);
        return items == null || items.isEmpty();
    }

    PerceptionResult finish(ImpressionScale scale) {
        int score = score();
        return new PerceptionResult(type, type.scoreName(), score, scale.label(score), findings, details, null);
    }

    static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
