package io.mirrorme.core.timeline;

import static io.mirrorme.core.RecordFixtures.CLOCK;
import static io.mirrorme.core.RecordFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;

import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.model.PoliticalTilt;
import io.mirrorme.core.model.Sentiment;
import io.mirrorme.core.topic.TopicClassifier;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class InfluenceTimelineAnalyzerTest {

    private final InfluenceTimelineAnalyzer analyzer =
        new InfluenceTimelineAnalyzer(new TopicClassifier(), CLOCK, ZoneOffset.UTC);

    @Test
    void shouldReturnNoDataTimelineWhenWindowIsEmpty() {
        List<BehaviorRecord> records = List.of(record("visit").daysAgo(45).build());

        InfluenceTimeline timeline = analyzer.analyze(records, 30);

        assertThat(timeline.message()).isEqualTo(InfluenceTimeline.NO_DATA_MESSAGE);
        assertThat(timeline.timelineData()).isEmpty();
        assertThat(timeline.analysisPeriodDays()).isEqualTo(30);
        assertThat(timeline.algorithmInfluence().recommendations())
            .containsExactly("Collect more browsing data to detect algorithmic influence patterns");
    }

    @Test
    void shouldReportStableInfluenceWithFewerThanThreeDays() {
        List<BehaviorRecord> records = List.of(
            record("tweet_view").tilt(PoliticalTilt.LEFT).keywords("politics").daysAgo(2).build(),
            record("tweet_view").tilt(PoliticalTilt.LEFT).keywords("politics").daysAgo(1).build(),
            record("tweet_view").tilt(PoliticalTilt.RIGHT).daysAgo(1).build()
        );

        InfluenceTimeline timeline = analyzer.analyze(records, 30);

        assertThat(timeline.message()).isNull();
        assertThat(timeline.totalDataPoints()).isEqualTo(3);
        assertThat(timeline.timelineData()).extracting(TimelinePoint::date)
            .containsExactly(LocalDate.of(2025, 3, 29), LocalDate.of(2025, 3, 30));
        assertThat(timeline.politicalTrend()).containsExactly(100.0, 0.0);
        assertThat(timeline.algorithmInfluence()).isEqualTo(AlgorithmInfluence.none());

        TimelinePoint second = timeline.timelineData().get(1);
        assertThat(second.totalInteractions()).isEqualTo(2);
        assertThat(second.politicalLeft()).isEqualTo(50.0);
        assertThat(second.politicalRight()).isEqualTo(50.0);
        assertThat(second.platformDistribution()).containsEntry("twitter", 2);
        assertThat(second.topicDistribution()).containsEntry("news", 1);
    }

    @Test
    void shouldDetectGrowingPoliticalLeanEchoChamberAndPlatformBias() {
        List<BehaviorRecord> records = new ArrayList<>();
        for (int day = 6; day >= 4; day--) {
            records.add(record("tweet_view").tilt(PoliticalTilt.NEUTRAL).sentiment(Sentiment.POSITIVE)
                .keywords("politics").daysAgo(day).build());
        }
        for (int day = 3; day >= 1; day--) {
            records.add(record("tweet_view").tilt(PoliticalTilt.LEFT).sentiment(Sentiment.POSITIVE)
                .keywords("politics").daysAgo(day).build());
        }

        AlgorithmInfluence influence = analyzer.analyze(records, 30).algorithmInfluence();

        assertThat(influence.biasReinforcementDetected()).isTrue();
        assertThat(influence.politicalPolarizationTrend()).isEqualTo(AlgorithmInfluence.INCREASING);
        assertThat(influence.sentimentManipulationDetected()).isFalse();
        assertThat(influence.recommendations()).containsExactly(
            "Your content consumption is becoming more politically polarized. Consider diversifying your sources.");
        assertThat(influence.topicEchoChambers()).containsExactly(new EchoChamber(
            "news", 100.0, "You're seeing 100.0% news content - algorithms may be creating an echo chamber"));
        assertThat(influence.platformBiasWarnings()).containsExactly(new PlatformBiasWarning(
            "twitter", "left-leaning", 50.0, "Twitter is showing you predominantly left-leaning content"));
    }

    @Test
    void shouldReportModeratingLean() {
        List<BehaviorRecord> records = new ArrayList<>();
        for (int day = 6; day >= 4; day--) {
            records.add(record("search").tilt(PoliticalTilt.RIGHT).daysAgo(day).build());
        }
        for (int day = 3; day >= 1; day--) {
            records.add(record("search").tilt(PoliticalTilt.NEUTRAL).daysAgo(day).build());
        }

        AlgorithmInfluence influence = analyzer.analyze(records, 30).algorithmInfluence();

        assertThat(influence.politicalPolarizationTrend()).isEqualTo(AlgorithmInfluence.MODERATING);
        assertThat(influence.biasReinforcementDetected()).isFalse();
        assertThat(influence.platformBiasWarnings()).extracting(PlatformBiasWarning::biasDirection)
            .containsExactly("right-leaning");
    }

    @Test
    void shouldFlagSentimentVolatility() {
        List<BehaviorRecord> records = List.of(
            record("visit").sentiment(Sentiment.POSITIVE).daysAgo(3).build(),
            record("visit").sentiment(Sentiment.NEGATIVE).daysAgo(2).build(),
            record("visit").sentiment(Sentiment.POSITIVE).daysAgo(1).build()
        );

        AlgorithmInfluence influence = analyzer.analyze(records, 30).algorithmInfluence();

        assertThat(influence.sentimentManipulationDetected()).isTrue();
        assertThat(influence.politicalPolarizationTrend()).isEqualTo(AlgorithmInfluence.STABLE);
        assertThat(influence.recommendations()).containsExactly(
            "Your emotional responses to content show high volatility. Algorithms may be triggering strong reactions.");
        assertThat(influence.topicEchoChambers()).isEmpty();
    }

    @Test
    void shouldGroupDaysInConfiguredZone() {
        List<BehaviorRecord> records = List.of(
            record("visit").at(Instant.parse("2025-03-29T23:30:00Z")).build(),
            record("visit").at(Instant.parse("2025-03-30T00:30:00Z")).build()
        );

        InfluenceTimeline utc = analyzer.analyze(records, 30);
        InfluenceTimeline shifted = new InfluenceTimelineAnalyzer(new TopicClassifier(), CLOCK, ZoneOffset.ofHours(2))
            .analyze(records, 30);

        assertThat(utc.timelineData()).hasSize(2);
        assertThat(shifted.timelineData()).extracting(TimelinePoint::date)
            .containsExactly(LocalDate.of(2025, 3, 30));
    }
}
