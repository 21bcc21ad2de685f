package io.mirrorme.core.topic;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Topic occurrence counts in first-encounter order.
 */
public final class TopicCounts {
    private static final TopicCounts EMPTY = new TopicCounts(new LinkedHashMap<>());

    private final Map<Topic, Integer> counts;

    private TopicCounts(LinkedHashMap<Topic, Integer> counts) {
        this.counts = Collections.unmodifiableMap(counts);
    }

    public static TopicCounts empty() {
        return EMPTY;
    }

    static TopicCounts of(LinkedHashMap<Topic, Integer> counts) {
        return counts.isEmpty() ? EMPTY : new TopicCounts(new LinkedHashMap<>(counts));
    }

    public int count(Topic topic) {
        return counts.getOrDefault(topic, 0);
    }

    public int total() {
        int total = 0;
        for (int value : counts.values()) {
            total += value;
        }
        return total;
    }

    /**
     * Number of distinct topics seen.
     */
    public int breadth() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public int maxCount() {
        int max = 0;
        for (int value : counts.values()) {
            max = Math.max(max, value);
        }
        return max;
    }

    /**
     * Share of the total in [0,1]; 0 when nothing was counted.
     */
    public double share(Topic topic) {
        int total = total();
        return total == 0 ? 0.0 : (double) count(topic) / total;
    }

    public int sum(List<Topic> topics) {
        int sum = 0;
        for (Topic topic : topics) {
            sum += count(topic);
        }
        return sum;
    }

    /**
     * Topics ordered by count, descending; ties keep first-encounter order.
     */
    public List<Topic> ranked() {
        List<Topic> ranked = new ArrayList<>(counts.keySet());
        ranked.sort(Comparator.<Topic>comparingInt(this::count).reversed());
        return ranked;
    }

    public List<String> topIds(int limit) {
        return ranked().stream()
            .limit(Math.max(0, limit))
            .map(Topic::id)
            .toList();
    }

    /**
     * Read-only view in first-encounter order.
     */
    public Map<Topic, Integer> entries() {
        return counts;
    }

    @JsonValue
    public Map<String, Integer> asMap() {
        Map<String, Integer> byId = new LinkedHashMap<>();
        counts.forEach((topic, count) -> byId.put(topic.id(), count));
        return byId;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof TopicCounts that && counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
