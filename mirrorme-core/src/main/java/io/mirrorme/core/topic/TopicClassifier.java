package io.mirrorme.core.topic;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps free-text keywords onto the {@link Topic} taxonomy by case-insensitive substring match.
 */
public final class TopicClassifier {

    /**
     * Counts every topic whose seeds match each keyword. A keyword that matches seeds of
     * several topics increments all of them.
     */
    public TopicCounts classify(List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return TopicCounts.empty();
        }
        LinkedHashMap<Topic, Integer> counts = new LinkedHashMap<>();
        for (String keyword : keywords) {
            if (keyword == null) {
                continue;
            }
            String lowered = keyword.toLowerCase(Locale.ROOT);
            for (Topic topic : Topic.values()) {
                if (topic.matchesLowered(lowered)) {
                    counts.merge(topic, 1, Integer::sum);
                }
            }
        }
        return TopicCounts.of(counts);
    }

    /**
     * First topic in taxonomy order matching the keyword.
     */
    public Optional<Topic> firstMatch(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        String lowered = keyword.toLowerCase(Locale.ROOT);
        for (Topic topic : Topic.values()) {
            if (topic.matchesLowered(lowered)) {
                return Optional.of(topic);
            }
        }
        return Optional.empty();
    }
}
