package io.mirrorme.core.distribution;

import io.mirrorme.core.model.BehaviorRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Proportions of one label dimension over the records that carry that label.
 *
 * <p>Unlabeled records do not count towards the denominator.
 */
public final class DistributionAnalyzer {
    public static final DistributionAnalyzer SENTIMENT = new DistributionAnalyzer(
        "sentiment",
        List.of("positive", "negative", "neutral"),
        record -> record.sentiment() == null ? null : record.sentiment().label()
    );

    public static final DistributionAnalyzer POLITICAL_TILT = new DistributionAnalyzer(
        "political_tilt",
        List.of("left", "right", "neutral"),
        record -> record.politicalTilt() == null ? null : record.politicalTilt().label()
    );

    private final String dimension;
    private final List<String> labels;
    private final Function<BehaviorRecord, String> labelOf;

    private DistributionAnalyzer(String dimension, List<String> labels, Function<BehaviorRecord, String> labelOf) {
        this.dimension = dimension;
        this.labels = List.copyOf(labels);
        this.labelOf = labelOf;
    }

    public String dimension() {
        return dimension;
    }

    public List<String> labels() {
        return labels;
    }

    public Distribution analyze(List<BehaviorRecord> records) {
        return Distribution.fromCounts(count(records));
    }

    /**
     * Raw label counts with every label of the dimension present, in declaration order.
     */
    public Map<String, Integer> count(List<BehaviorRecord> records) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String label : labels) {
            counts.put(label, 0);
        }
        if (records == null) {
            return counts;
        }
        for (BehaviorRecord record : records) {
            String label = labelOf.apply(record);
            if (label != null) {
                counts.merge(label, 1, Integer::sum);
            }
        }
        return counts;
    }
}
