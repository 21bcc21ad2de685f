package io.mirrorme.core.perception;

import static io.mirrorme.core.perception.ScoreCard.oneDecimal;

import io.mirrorme.core.topic.Topic;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

final class AdvertiserPerception implements PerceptionStrategy {
    private static final List<Topic> PURCHASE_TOPICS = List.of(Topic.TECHNOLOGY, Topic.HEALTH, Topic.FINANCE, Topic.LIFESTYLE);
    private static final ImpressionScale SCALE = new ImpressionScale("low_value")
        .atLeast(75, "high_value")
        .atLeast(60, "valuable")
        .atLeast(40, "neutral");

    @Override
    public PerceiverType type() {
        return PerceiverType.ADVERTISER;
    }

    @Override
    public PerceptionResult evaluate(PerceptionInputs in) {
        ScoreCard card = new ScoreCard(type(), "valuable_signals", "ad_resistance", "red_flags", "recommendations");

        double purchaseShare = in.topicShare(PURCHASE_TOPICS);
        if (purchaseShare > 0.5) {
            card.note("valuable_signals", "Strong consumer interest signals across multiple categories", 20);
        }

        OptionalInt peak = in.peakHour();
        if (peak.isPresent()) {
            card.note(
                "valuable_signals",
                String.format(Locale.ROOT, "Predictable online activity pattern - most active around %02d:00", peak.getAsInt()),
                15
            );
        }

        if (in.platformCount() > 3) {
            card.note("valuable_signals", "Multi-platform user - high reach potential", 10);
        } else if (in.platformCount() == 1) {
            card.note("ad_resistance", "Limited platform engagement - harder to reach", -10);
        }

        if (in.sentiment().get("positive") > 0.6) {
            card.note("valuable_signals", "Positive sentiment suggests higher ad receptivity", 15);
        } else if (in.sentiment().get("negative") > 0.5) {
            card.note("ad_resistance", "Frequently negative sentiment may resist advertising", -15);
        }

        if (in.leansAbove(0.6)) {
            card.note("ad_resistance", "Strong political views limit acceptable ad content", -10);
        }

        if (in.topics().breadth() > 5) {
            card.note("valuable_signals", "Diverse interests enable broad targeting opportunities", 12);
        }

        if (in.topicShare(Topic.TECHNOLOGY) > 0.3) {
            card.note("ad_resistance", "Tech-savvy user likely uses ad blockers", -20);
        }

        if (card.delta() < 40) {
            card.note("recommendations", "Increase engagement signals through interactive content");
            card.note("recommendations", "Build stronger consumer intent signals");
        }

        card.detail("purchase_intent", oneDecimal(purchaseShare * 100) + "% purchase-related content");
        card.detail("sentiment_profile", in.sentiment());
        card.detail("platform_reach", in.platformActivityById());
        card.detail("peak_activity_hour", peak.isPresent() ? (Object) peak.getAsInt() : "Unknown");
        return card.finish(SCALE);
    }
}
