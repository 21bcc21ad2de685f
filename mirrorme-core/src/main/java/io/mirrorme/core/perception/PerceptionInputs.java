package io.mirrorme.core.perception;

import io.mirrorme.core.distribution.Distribution;
import io.mirrorme.core.persona.PersonaProfile;
import io.mirrorme.core.platform.Platform;
import io.mirrorme.core.topic.Topic;
import io.mirrorme.core.topic.TopicCounts;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Everything a perception strategy may look at.
 *
 * @param hourHistogram activity count per hour of day (0-23), in the configured zone
 * @param contentSamples redacted, truncated content, newest first
 * @param mobileShare fraction of records captured from a mobile source
 */
public record PerceptionInputs(
    TopicCounts topics,
    Distribution sentiment,
    Distribution political,
    Map<Platform, Integer> platformActivity,
    Map<Integer, Integer> hourHistogram,
    List<String> contentSamples,
    double mobileShare,
    PersonaProfile profile
) {
    public PerceptionInputs {
        topics = topics == null ? TopicCounts.empty() : topics;
        sentiment = sentiment == null ? Distribution.neutralDefault() : sentiment;
        political = political == null ? Distribution.neutralDefault() : political;
        platformActivity = platformActivity == null || platformActivity.isEmpty()
            ? Collections.unmodifiableMap(new EnumMap<>(Platform.class))
            : Collections.unmodifiableMap(new EnumMap<>(platformActivity));
        hourHistogram = Collections.unmodifiableMap(hourHistogram == null ? new TreeMap<>() : new TreeMap<>(hourHistogram));
        contentSamples = contentSamples == null ? List.of() : List.copyOf(contentSamples);
        profile = profile == null ? PersonaProfile.empty() : profile;
    }

    /**
     * Topic total, or 1 when no topic matched, so shares never divide by zero.
     */
    int topicTotalOrOne() {
        int total = topics.total();
        return total == 0 ? 1 : total;
    }

    double topicShare(Topic topic) {
        return (double) topics.count(topic) / topicTotalOrOne();
    }

    double topicShare(List<Topic> group) {
        return (double) topics.sum(group) / topicTotalOrOne();
    }

    int activity(Platform platform) {
        return platformActivity.getOrDefault(platform, 0);
    }

    boolean hasActivity(Platform platform) {
        return platformActivity.containsKey(platform);
    }

    int platformCount() {
        return platformActivity.size();
    }

    int activityTotalOrOne() {
        int total = 0;
        for (int count : platformActivity.values()) {
            total += count;
        }
        return total == 0 ? 1 : total;
    }

    boolean hasHours() {
        return !hourHistogram.isEmpty();
    }

    int hourTotal() {
        int total = 0;
        for (int count : hourHistogram.values()) {
            total += count;
        }
        return total;
    }

    int hoursBetween(int fromInclusive, int toExclusive) {
        int sum = 0;
        for (int hour = fromInclusive; hour < toExclusive; hour++) {
            sum += hourHistogram.getOrDefault(hour, 0);
        }
        return sum;
    }

    /**
     * Busiest hour; the lowest hour wins ties.
     */
    OptionalInt peakHour() {
        int best = -1;
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> entry : hourHistogram.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best < 0 ? OptionalInt.empty() : OptionalInt.of(best);
    }

    int peakHourCount() {
        OptionalInt peak = peakHour();
        return peak.isPresent() ? hourHistogram.get(peak.getAsInt()) : 0;
    }

    /**
     * Share of activity in the busiest hour; 0 without any timestamps.
     */
    double peakHourShare() {
        int total = hourTotal();
        return total == 0 ? 0.0 : (double) peakHourCount() / total;
    }

    boolean leansAbove(double threshold) {
        return political.get("left") > threshold || political.get("right") > threshold;
    }

    List<String> samples(int limit) {
        return contentSamples.subList(0, Math.min(limit, contentSamples.size()));
    }

    int countSamplesContaining(List<String> samples, List<String> needles) {
        int count = 0;
        for (String sample : samples) {
            String lowered = sample.toLowerCase(Locale.ROOT);
            if (needles.stream().anyMatch(lowered::contains)) {
                count++;
            }
        }
        return count;
    }

    Map<String, Integer> platformActivityById() {
        Map<String, Integer> byId = new LinkedHashMap<>();
        platformActivity.forEach((platform, count) -> byId.put(platform.id(), count));
        return byId;
    }
}
