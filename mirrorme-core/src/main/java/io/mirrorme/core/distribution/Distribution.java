package io.mirrorme.core.distribution;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Label proportions in [0,1] that sum to 1.0, or the canonical {@code {neutral: 1.0}}.
 */
public final class Distribution {
    public static final String NEUTRAL = "neutral";

    private static final Distribution NEUTRAL_DEFAULT = new Distribution(Map.of(NEUTRAL, 1.0));

    private final Map<String, Double> proportions;

    private Distribution(Map<String, Double> proportions) {
        this.proportions = Collections.unmodifiableMap(new LinkedHashMap<>(proportions));
    }

    public static Distribution neutralDefault() {
        return NEUTRAL_DEFAULT;
    }

    /**
     * Normalizes label counts by their total. A zero total yields {@link #neutralDefault()}.
     */
    public static Distribution fromCounts(Map<String, Integer> counts) {
        Objects.requireNonNull(counts, "counts must not be null");
        int total = 0;
        for (int count : counts.values()) {
            total += count;
        }
        if (total == 0) {
            return NEUTRAL_DEFAULT;
        }
        Map<String, Double> proportions = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            proportions.put(entry.getKey(), entry.getValue() / (double) total);
        }
        return new Distribution(proportions);
    }

    public double get(String label) {
        return proportions.getOrDefault(label, 0.0);
    }

    public boolean isNeutralDefault() {
        return proportions.size() == 1 && proportions.getOrDefault(NEUTRAL, 0.0) == 1.0;
    }

    /**
     * Label with the largest share; the earliest label wins ties.
     */
    public String dominant() {
        String best = NEUTRAL;
        double bestValue = -1.0;
        for (Map.Entry<String, Double> entry : proportions.entrySet()) {
            if (entry.getValue() > bestValue) {
                best = entry.getKey();
                bestValue = entry.getValue();
            }
        }
        return best;
    }

    public double max() {
        return proportions.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    public double min() {
        return proportions.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
    }

    public double sum() {
        return proportions.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    @JsonValue
    public Map<String, Double> asMap() {
        return proportions;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Distribution that && proportions.equals(that.proportions);
    }

    @Override
    public int hashCode() {
        return proportions.hashCode();
    }

    @Override
    public String toString() {
        return proportions.toString();
    }
}
