package io.mirrorme.core.persona;

import io.mirrorme.core.distribution.DistributionAnalyzer;
import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.platform.PlatformBehavior;
import io.mirrorme.core.platform.PlatformSummary;
import io.mirrorme.core.topic.Topic;
import io.mirrorme.core.topic.TopicClassifier;
import io.mirrorme.core.topic.TopicCounts;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Builds up to five avatars from overlapping record subsets, strongest first.
 */
public final class DigitalAvatarGenerator {
    static final int MAX_AVATARS = 5;

    private static final Set<String> WORK_KEYWORDS = Set.of("technology", "programming", "business", "career", "work");

    private final TopicClassifier classifier;

    public DigitalAvatarGenerator(TopicClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public List<DigitalAvatar> generate(List<BehaviorRecord> records, PlatformBehavior platforms) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<DigitalAvatar> avatars = new ArrayList<>();
        searcher(records).ifPresent(avatars::add);
        platforms.twitterSummary().flatMap(twitter -> socialConnector(records, twitter)).ifPresent(avatars::add);
        platforms.youtubeSummary().flatMap(youtube -> contentConsumer(records, youtube)).ifPresent(avatars::add);
        professional(records).ifPresent(avatars::add);
        explorer(records).ifPresent(avatars::add);

        avatars.sort(Comparator.comparingDouble(DigitalAvatar::strength).reversed());
        return List.copyOf(avatars.subList(0, Math.min(MAX_AVATARS, avatars.size())));
    }

    private Optional<DigitalAvatar> searcher(List<BehaviorRecord> records) {
        List<BehaviorRecord> subset = subset(records, BehaviorRecord::isSearch);
        if (subset.isEmpty()) {
            return Optional.empty();
        }
        TopicCounts topics = classifier.classify(BehaviorRecord.keywordsOf(subset));
        return Optional.of(new DigitalAvatar(
            "The Searcher",
            "Your intellectual curious side that actively seeks information",
            "Google/Search Engines",
            "🔍",
            List.of("curious", "research-oriented", "analytical"),
            firstTopicIds(topics, 3),
            DistributionAnalyzer.POLITICAL_TILT.analyze(subset).dominant(),
            DistributionAnalyzer.SENTIMENT.analyze(subset).dominant(),
            "Searches " + subset.size() + " times, focuses on " + firstTopicOr(topics, "various topics"),
            strength(subset, records)
        ));
    }

    private Optional<DigitalAvatar> socialConnector(List<BehaviorRecord> records, PlatformSummary twitter) {
        List<BehaviorRecord> subset = subset(records, BehaviorRecord::isTweet);
        if (subset.isEmpty()) {
            return Optional.empty();
        }
        List<String> traits = new ArrayList<>();
        if (twitter.engagement("likes") > twitter.engagement("views") * 0.1) {
            traits.add("highly-engaged");
        }
        if (twitter.engagement("retweets") > 0) {
            traits.add("content-amplifier");
        }
        if (twitter.engagement("compositions") > 0) {
            traits.add("content-creator");
        }
        if (traits.isEmpty()) {
            traits.add("social-observer");
        }
        return Optional.of(new DigitalAvatar(
            "The Social Connector",
            "Your social media persona that engages with trends and people",
            "Twitter/X",
            "🐦",
            traits,
            List.of("social-trends", "current-events", "discussions"),
            twitter.political().dominant(),
            twitter.sentiment().dominant(),
            twitter.engagement("likes") + " likes, " + twitter.engagement("retweets") + " retweets",
            strength(subset, records)
        ));
    }

    private Optional<DigitalAvatar> contentConsumer(List<BehaviorRecord> records, PlatformSummary youtube) {
        List<BehaviorRecord> subset = subset(records, BehaviorRecord::isYoutube);
        if (subset.isEmpty()) {
            return Optional.empty();
        }
        List<String> traits = new ArrayList<>();
        traits.add("entertainment-focused");
        if (youtube.topChannels().size() > 3) {
            traits.add("diverse-viewer");
        }
        if (youtube.engagement("comment_views") > 0) {
            traits.add("community-engaged");
        }
        String topChannel = youtube.topChannels().isEmpty() ? "Various creators" : youtube.topChannels().get(0).channel();
        return Optional.of(new DigitalAvatar(
            "The Content Consumer",
            "Your entertainment-seeking side that watches and learns",
            "YouTube",
            "📺",
            traits,
            List.of("video-content", "learning", "entertainment"),
            youtube.political().dominant(),
            youtube.sentiment().dominant(),
            "Watches videos, top channel: " + topChannel,
            strength(subset, records)
        ));
    }

    private Optional<DigitalAvatar> professional(List<BehaviorRecord> records) {
        List<BehaviorRecord> subset = subset(records, record -> record.keywords().stream().anyMatch(WORK_KEYWORDS::contains));
        if (subset.isEmpty()) {
            return Optional.empty();
        }
        TopicCounts topics = classifier.classify(BehaviorRecord.keywordsOf(subset));
        return Optional.of(new DigitalAvatar(
            "The Professional",
            "Your career-focused identity that seeks growth and knowledge",
            "Professional/Work Context",
            "💼",
            List.of("career-focused", "skill-building", "ambitious"),
            topics.isEmpty() ? List.of("professional-development") : firstTopicIds(topics, 3),
            "neutral",
            "positive",
            "Focuses on " + firstTopicOr(topics, "professional growth"),
            strength(subset, records)
        ));
    }

    private Optional<DigitalAvatar> explorer(List<BehaviorRecord> records) {
        List<BehaviorRecord> subset = subset(
            records,
            record -> "visit".equals(record.behaviorType()) || "engagement".equals(record.behaviorType())
        );
        if (subset.isEmpty()) {
            return Optional.empty();
        }
        List<String> keywords = BehaviorRecord.keywordsOf(subset);
        TopicCounts topics = classifier.classify(keywords);
        double diversity = keywords.isEmpty() ? 0.0 : (double) new HashSet<>(keywords).size() / keywords.size();

        List<String> traits = new ArrayList<>();
        traits.add("curious");
        if (diversity > 0.7) {
            traits.add("diverse-interests");
        }
        if (topics.breadth() > 5) {
            traits.add("renaissance-minded");
        }
        return Optional.of(new DigitalAvatar(
            "The Explorer",
            "Your genuine self that explores diverse interests and ideas",
            "General Web/Personal",
            "🌟",
            traits,
            topics.isEmpty() ? List.of("exploration") : firstTopicIds(topics, 3),
            "balanced",
            "curious",
            "Explores " + topics.breadth() + " different topics broadly",
            strength(subset, records)
        ));
    }

    private static List<BehaviorRecord> subset(List<BehaviorRecord> records, Predicate<BehaviorRecord> filter) {
        return records.stream().filter(filter).toList();
    }

    // first-encounter order, not ranked
    private static List<String> firstTopicIds(TopicCounts topics, int limit) {
        return topics.entries().keySet().stream().limit(limit).map(Topic::id).toList();
    }

    private static String firstTopicOr(TopicCounts topics, String fallback) {
        return topics.entries().keySet().stream().findFirst().map(Topic::id).orElse(fallback);
    }

    private static double strength(List<BehaviorRecord> subset, List<BehaviorRecord> all) {
        return all.isEmpty() ? 0.0 : (double) subset.size() / all.size();
    }
}
