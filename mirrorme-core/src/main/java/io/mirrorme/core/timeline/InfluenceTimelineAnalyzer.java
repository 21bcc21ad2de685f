package io.mirrorme.core.timeline;

import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.platform.Platform;
import io.mirrorme.core.topic.Topic;
import io.mirrorme.core.topic.TopicClassifier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups a trailing window of records by calendar day and looks for signs of algorithmic steering:
 * growing political lean, sentiment swings, topic concentration and lopsided platforms.
 */
public final class InfluenceTimelineAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(InfluenceTimelineAnalyzer.class);

    static final int MIN_DAYS = 3;
    static final int RECENT_DAYS = 7;
    static final int EARLY_FULL_WINDOW_DAYS = 14;
    static final double POLARIZATION_INCREASE = 10;
    static final double POLARIZATION_DECREASE = -5;
    static final double VOLATILITY_LIMIT = 30;
    static final double ECHO_CHAMBER_SHARE = 40;
    static final double PLATFORM_LEAN_LIMIT = 15;

    private final TopicClassifier classifier;
    private final Clock clock;
    private final ZoneId zone;

    public InfluenceTimelineAnalyzer(TopicClassifier classifier, Clock clock, ZoneId zone) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public InfluenceTimeline analyze(List<BehaviorRecord> records, int windowDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(windowDays));
        Map<LocalDate, DayTally> days = new TreeMap<>();
        int inWindow = 0;
        for (BehaviorRecord record : records) {
            if (record.timestamp().isBefore(cutoff)) {
                continue;
            }
            inWindow++;
            days.computeIfAbsent(record.timestamp().atZone(zone).toLocalDate(), d -> new DayTally()).add(record);
        }
        if (inWindow == 0) {
            return InfluenceTimeline.empty(windowDays);
        }

        List<TimelinePoint> points = new ArrayList<>();
        List<Double> politicalTrend = new ArrayList<>();
        List<Double> sentimentTrend = new ArrayList<>();
        days.forEach((date, tally) -> {
            TimelinePoint point = tally.toPoint(date);
            points.add(point);
            politicalTrend.add(point.politicalTrend());
            sentimentTrend.add(point.sentimentTrend());
        });
        LOG.debug("Built {} timeline points from {} records", points.size(), inWindow);

        return new InfluenceTimeline(
            points,
            politicalTrend,
            sentimentTrend,
            detect(points, politicalTrend, sentimentTrend),
            windowDays,
            inWindow,
            null
        );
    }

    static AlgorithmInfluence detect(List<TimelinePoint> points, List<Double> politicalTrend, List<Double> sentimentTrend) {
        if (politicalTrend.size() < MIN_DAYS) {
            return AlgorithmInfluence.none();
        }
        boolean reinforcement = false;
        String polarization = AlgorithmInfluence.STABLE;
        boolean manipulation = false;
        List<String> recommendations = new ArrayList<>();

        List<Double> recentPolitical = tail(politicalTrend, RECENT_DAYS);
        List<Double> earlyPolitical = politicalTrend.size() >= EARLY_FULL_WINDOW_DAYS
            ? politicalTrend.subList(0, RECENT_DAYS)
            : politicalTrend.subList(0, politicalTrend.size() / 2);
        if (recentPolitical.size() >= MIN_DAYS && earlyPolitical.size() >= MIN_DAYS) {
            double change = Math.abs(mean(recentPolitical)) - Math.abs(mean(earlyPolitical));
            if (change > POLARIZATION_INCREASE) {
                reinforcement = true;
                polarization = AlgorithmInfluence.INCREASING;
                recommendations.add("Your content consumption is becoming more politically polarized. Consider diversifying your sources.");
            } else if (change < POLARIZATION_DECREASE) {
                polarization = AlgorithmInfluence.MODERATING;
            }
        }

        List<Double> recentSentiment = tail(sentimentTrend, RECENT_DAYS);
        if (recentSentiment.size() >= MIN_DAYS) {
            double swing = recentSentiment.stream().mapToDouble(Double::doubleValue).max().orElse(0)
                - recentSentiment.stream().mapToDouble(Double::doubleValue).min().orElse(0);
            if (swing > VOLATILITY_LIMIT) {
                manipulation = true;
                recommendations.add("Your emotional responses to content show high volatility. Algorithms may be triggering strong reactions.");
            }
        }

        List<TimelinePoint> recentPoints = tail(points, RECENT_DAYS);
        return new AlgorithmInfluence(
            reinforcement,
            polarization,
            manipulation,
            echoChambers(recentPoints),
            platformBias(recentPoints),
            recommendations
        );
    }

    private static List<EchoChamber> echoChambers(List<TimelinePoint> recentPoints) {
        Map<String, Integer> concentration = new LinkedHashMap<>();
        for (TimelinePoint point : recentPoints) {
            point.topicDistribution().forEach((topic, count) -> concentration.merge(topic, count, Integer::sum));
        }
        int total = concentration.values().stream().mapToInt(Integer::intValue).sum();
        List<EchoChamber> chambers = new ArrayList<>();
        if (total == 0) {
            return chambers;
        }
        concentration.forEach((topic, count) -> {
            double share = count * 100.0 / total;
            if (share > ECHO_CHAMBER_SHARE) {
                chambers.add(new EchoChamber(
                    topic,
                    share,
                    String.format(Locale.ROOT,
                        "You're seeing %.1f%% %s content - algorithms may be creating an echo chamber", share, topic)
                ));
            }
        });
        return chambers;
    }

    private static List<PlatformBiasWarning> platformBias(List<TimelinePoint> recentPoints) {
        // the lean is the whole day's, attributed to every platform active that day
        Map<String, List<Double>> leans = new LinkedHashMap<>();
        for (TimelinePoint point : recentPoints) {
            if (point.totalInteractions() == 0) {
                continue;
            }
            for (String platform : point.platformDistribution().keySet()) {
                leans.computeIfAbsent(platform, p -> new ArrayList<>()).add(point.politicalTrend());
            }
        }
        List<PlatformBiasWarning> warnings = new ArrayList<>();
        leans.forEach((platform, shifts) -> {
            if (shifts.size() < MIN_DAYS) {
                return;
            }
            double avg = mean(shifts);
            if (Math.abs(avg) > PLATFORM_LEAN_LIMIT) {
                String side = avg > 0 ? "left" : "right";
                warnings.add(new PlatformBiasWarning(
                    platform,
                    side + "-leaning",
                    Math.abs(avg),
                    displayLabel(platform) + " is showing you predominantly " + side + "-leaning content"
                ));
            }
        });
        return warnings;
    }

    private static String displayLabel(String platformId) {
        for (Platform platform : Platform.values()) {
            if (platform.id().equals(platformId)) {
                return platform.displayLabel();
            }
        }
        return platformId;
    }

    private static <T> List<T> tail(List<T> values, int count) {
        return values.subList(Math.max(0, values.size() - count), values.size());
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private final class DayTally {
        private final Map<String, Integer> political = new LinkedHashMap<>();
        private final Map<String, Integer> sentiment = new LinkedHashMap<>();
        private final Map<String, Integer> platforms = new LinkedHashMap<>();
        private final Map<String, Integer> topics = new LinkedHashMap<>();
        private int total;

        void add(BehaviorRecord record) {
            total++;
            if (record.politicalTilt() != null) {
                political.merge(record.politicalTilt().label(), 1, Integer::sum);
            }
            if (record.sentiment() != null) {
                sentiment.merge(record.sentiment().label(), 1, Integer::sum);
            }
            platforms.merge(Platform.of(record).id(), 1, Integer::sum);
            for (String keyword : record.keywords()) {
                Optional<Topic> topic = classifier.firstMatch(keyword);
                topic.ifPresent(t -> topics.merge(t.id(), 1, Integer::sum));
            }
        }

        TimelinePoint toPoint(LocalDate date) {
            return new TimelinePoint(
                date,
                percent(political, "left"),
                percent(political, "right"),
                percent(political, "neutral"),
                percent(sentiment, "positive"),
                percent(sentiment, "negative"),
                percent(sentiment, "neutral"),
                total,
                platforms,
                topics
            );
        }

        private double percent(Map<String, Integer> counts, String label) {
            return counts.getOrDefault(label, 0) * 100.0 / total;
        }
    }
}
