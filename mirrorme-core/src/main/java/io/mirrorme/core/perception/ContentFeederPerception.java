package io.mirrorme.core.perception;

import static io.mirrorme.core.perception.ScoreCard.oneDecimal;

import io.mirrorme.core.topic.Topic;

final class ContentFeederPerception implements PerceptionStrategy {
    private static final ImpressionScale SCALE = new ImpressionScale("unpredictable")
        .atLeast(75, "highly_predictable")
        .atLeast(60, "targetable")
        .atLeast(40, "neutral");

    @Override
    public PerceiverType type() {
        return PerceiverType.CONTENT_FEEDER;
    }

    @Override
    public PerceptionResult evaluate(PerceptionInputs in) {
        ScoreCard card = new ScoreCard(type(), "engagement_drivers", "algorithm_challenges", "red_flags", "recommendations");

        String primaryInterest = "unknown";
        if (!in.topics().isEmpty()) {
            Topic top = in.topics().ranked().get(0);
            primaryInterest = top.id();
            if (in.topicShare(top) > 0.4) {
                card.note("engagement_drivers", "Strong preference for " + top.id() + " content - high engagement probability", 20);
            }
        }

        if (in.hasHours() && in.peakHourCount() > in.hourTotal() * 0.3) {
            card.note("engagement_drivers", "Concentrated usage patterns - good for session-based recommendations", 15);
        }

        double preferenceStrength = in.sentiment().max();
        if (preferenceStrength > 0.6) {
            card.note("engagement_drivers", "Consistent " + in.sentiment().dominant() + " content preference", 10);
        } else if (preferenceStrength < 0.4) {
            card.note("algorithm_challenges", "Inconsistent sentiment preferences make content matching difficult", -15);
        }

        if (in.platformCount() == 1) {
            card.note("engagement_drivers", "Single platform focus - consistent engagement context", 12);
        } else if (in.platformCount() > 4) {
            card.note("algorithm_challenges", "Multi-platform behavior creates fragmented user profile", -10);
        }

        double depth = (double) in.topics().maxCount() / in.topicTotalOrOne();
        int breadth = in.topics().breadth();
        if (depth > 0.5 && breadth < 4) {
            card.note("engagement_drivers", "Deep interest in few topics - easy to serve relevant content", 18);
        } else if (breadth > 7 && depth < 0.3) {
            card.note("algorithm_challenges", "Broad but shallow interests make targeting difficult", -12);
        }

        if (in.leansAbove(0.7)) {
            card.note("algorithm_challenges", "Strong political bias requires careful content curation", -10);
        }

        card.detail("primary_interest", primaryInterest);
        card.detail("interest_concentration", oneDecimal(depth * 100) + "%");
        card.detail("platform_distribution", in.platformActivityById());
        card.detail("content_preference_strength", preferenceStrength);
        return card.finish(SCALE);
    }
}
