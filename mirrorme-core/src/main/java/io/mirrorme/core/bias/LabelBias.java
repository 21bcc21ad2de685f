package io.mirrorme.core.bias;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dominant label within one breakdown, as a percentage.
 *
 * @param distribution percentage per label, omitted when nothing was labeled
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record LabelBias(boolean biasDetected, String dominant, double biasStrength, Map<String, Double> distribution) {
    static final double DETECTION_THRESHOLD = 60;

    public LabelBias {
        distribution = distribution == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(distribution));
    }

    /**
     * Ties go to the first label in breakdown order.
     */
    public static LabelBias of(Map<String, Integer> breakdown) {
        int total = breakdown.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) {
            return new LabelBias(false, "neutral", 0, Map.of());
        }
        Map<String, Double> percentages = new LinkedHashMap<>();
        String dominant = null;
        double strongest = -1;
        for (Map.Entry<String, Integer> entry : breakdown.entrySet()) {
            double pct = entry.getValue() * 100.0 / total;
            percentages.put(entry.getKey(), pct);
            if (pct > strongest) {
                strongest = pct;
                dominant = entry.getKey();
            }
        }
        return new LabelBias(strongest > DETECTION_THRESHOLD, dominant, strongest, percentages);
    }
}
