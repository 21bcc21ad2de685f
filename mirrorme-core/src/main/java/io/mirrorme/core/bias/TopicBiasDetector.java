package io.mirrorme.core.bias;

import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.platform.Platform;
import io.mirrorme.core.topic.Topic;
import io.mirrorme.core.topic.TopicClassifier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects topics that dominate a trailing window of exposure and topics pushed evenly across platforms.
 */
public final class TopicBiasDetector {
    private static final Logger LOG = LoggerFactory.getLogger(TopicBiasDetector.class);

    static final double PUSHED_SHARE = 20;
    static final int COORDINATION_MIN_PLATFORMS = 2;
    static final int COORDINATION_MIN_EXPOSURE = 10;
    public static final double MAX_COORDINATION_STRENGTH = 1000;

    private final TopicClassifier classifier;
    private final Clock clock;

    public TopicBiasDetector(TopicClassifier classifier, Clock clock) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public TopicBiasReport detect(List<BehaviorRecord> records, int windowDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(windowDays));
        Map<Topic, Tally> exposure = new LinkedHashMap<>();
        Map<String, Map<String, Integer>> platformTopics = new LinkedHashMap<>();
        int inWindow = 0;
        int matched = 0;

        for (BehaviorRecord record : records) {
            if (record.timestamp().isBefore(cutoff)) {
                continue;
            }
            inWindow++;
            String platform = Platform.of(record).id();
            for (String keyword : record.keywords()) {
                Optional<Topic> match = classifier.firstMatch(keyword);
                if (match.isEmpty()) {
                    continue;
                }
                Topic topic = match.get();
                matched++;
                exposure.computeIfAbsent(topic, t -> new Tally()).add(record, platform);
                platformTopics.computeIfAbsent(platform, p -> new LinkedHashMap<>()).merge(topic.id(), 1, Integer::sum);
            }
        }
        if (inWindow == 0) {
            return TopicBiasReport.empty(windowDays);
        }

        Map<String, TopicExposure> exposureById = new LinkedHashMap<>();
        List<PushedTopic> pushed = new ArrayList<>();
        for (Map.Entry<Topic, Tally> entry : exposure.entrySet()) {
            Topic topic = entry.getKey();
            TopicExposure topicExposure = entry.getValue().toExposure();
            exposureById.put(topic.id(), topicExposure);

            double share = topicExposure.totalCount() * 100.0 / matched;
            if (share > PUSHED_SHARE) {
                pushed.add(new PushedTopic(
                    topic.id(),
                    share,
                    LabelBias.of(topicExposure.sentimentBreakdown()),
                    LabelBias.of(topicExposure.politicalBreakdown()),
                    topicExposure.platformBreakdown(),
                    String.format(Locale.ROOT, "You're seeing unusually high amounts of %s content (%.1f%%)", topic.id(), share)
                ));
            }
        }
        LOG.debug("Topic bias over {} records: {} matched keywords, {} pushed topics", inWindow, matched, pushed.size());

        return new TopicBiasReport(
            exposureById,
            pushed,
            coordinated(platformTopics),
            platformTopics,
            inWindow,
            windowDays,
            null
        );
    }

    static List<CoordinatedTopic> coordinated(Map<String, Map<String, Integer>> platformTopics) {
        Map<String, Map<String, Integer>> byTopic = new LinkedHashMap<>();
        platformTopics.forEach((platform, topics) ->
            topics.forEach((topic, count) -> byTopic.computeIfAbsent(topic, t -> new LinkedHashMap<>()).put(platform, count)));

        List<CoordinatedTopic> result = new ArrayList<>();
        byTopic.forEach((topicId, perPlatform) -> {
            int total = perPlatform.values().stream().mapToInt(Integer::intValue).sum();
            if (perPlatform.size() < COORDINATION_MIN_PLATFORMS || total < COORDINATION_MIN_EXPOSURE) {
                return;
            }
            double mean = (double) total / perPlatform.size();
            double variance = perPlatform.values().stream()
                .mapToDouble(count -> (count - mean) * (count - mean))
                .sum() / perPlatform.size();
            if (variance >= mean * 0.5) {
                return;
            }
            boolean even = variance == 0;
            double strength = even ? MAX_COORDINATION_STRENGTH : Math.min(MAX_COORDINATION_STRENGTH, mean / variance);
            String label = Topic.fromId(topicId).map(Topic::displayLabel).orElse(topicId);
            result.add(new CoordinatedTopic(
                topicId,
                new ArrayList<>(perPlatform.keySet()),
                total,
                strength,
                even,
                label + " content is being pushed consistently across " + perPlatform.size() + " platforms"
            ));
        });
        return result;
    }

    private static final class Tally {
        private final Map<String, Integer> platforms = new LinkedHashMap<>();
        private final Map<String, Integer> sentiment = labels("positive", "negative", "neutral");
        private final Map<String, Integer> political = labels("left", "right", "neutral");
        private int total;

        void add(BehaviorRecord record, String platform) {
            total++;
            platforms.merge(platform, 1, Integer::sum);
            if (record.sentiment() != null) {
                sentiment.merge(record.sentiment().label(), 1, Integer::sum);
            }
            if (record.politicalTilt() != null) {
                political.merge(record.politicalTilt().label(), 1, Integer::sum);
            }
        }

        TopicExposure toExposure() {
            return new TopicExposure(total, platforms, sentiment, political);
        }

        private static Map<String, Integer> labels(String... names) {
            Map<String, Integer> map = new LinkedHashMap<>();
            for (String name : names) {
                map.put(name, 0);
            }
            return map;
        }
    }
}
