package io.mirrorme.core.perception;

import static io.mirrorme.core.perception.ScoreCard.oneDecimal;

import io.mirrorme.core.topic.Topic;
import java.util.List;

final class DataBrokerPerception implements PerceptionStrategy {
    private static final List<Topic> VALUABLE_TOPICS = List.of(Topic.FINANCE, Topic.HEALTH, Topic.TECHNOLOGY, Topic.CAREER);
    private static final List<String> SHOPPING_TERMS = List.of("buy", "purchase", "review", "price", "deal");
    private static final ImpressionScale SCALE = new ImpressionScale("limited_value")
        .atLeast(75, "premium_profile")
        .atLeast(60, "valuable_data")
        .atLeast(40, "standard_profile");

    @Override
    public PerceiverType type() {
        return PerceiverType.DATA_BROKER;
    }

    @Override
    public PerceptionResult evaluate(PerceptionInputs in) {
        ScoreCard card = new ScoreCard(type(), "profitable_traits", "data_gaps", "red_flags", "recommendations");

        double valuableShare = in.topicShare(VALUABLE_TOPICS);
        if (valuableShare > 0.4) {
            card.note("profitable_traits", "High-value demographic signals in finance, health, and technology", 25);
        }

        double timeConsistency = in.peakHourShare();
        if (timeConsistency > 0.3) {
            card.note("profitable_traits", "Predictable behavior patterns valuable for modeling", 15);
        }

        int purchaseSignals = in.countSamplesContaining(in.contentSamples(), SHOPPING_TERMS);
        if (purchaseSignals > in.contentSamples().size() * 0.2) {
            card.note("profitable_traits", "Strong purchase intent signals", 20);
        }

        if (in.mobileShare() > 0.5) {
            card.note("profitable_traits", "High mobile usage suggests location data availability", 12);
        }

        int richness = in.topics().breadth() + in.platformCount() + (in.hasHours() ? 1 : 0);
        if (richness < 5) {
            card.note("data_gaps", "Limited data points reduce profile completeness", -15);
        }

        if (in.topicShare(Topic.TECHNOLOGY) > 0.3) {
            card.note("data_gaps", "Tech-savvy users likely use privacy tools, limiting data collection", -20);
        }

        if (in.sentiment().max() - in.sentiment().min() > 0.4) {
            card.note("data_gaps", "High sentiment volatility reduces data reliability", -10);
        }

        if (in.platformCount() > 3) {
            card.note("profitable_traits", "Multi-platform presence enables cross-platform tracking", 15);
        }

        card.detail("demographic_value", oneDecimal(valuableShare * 100) + "% high-value signals");
        card.detail("behavioral_predictability", oneDecimal(timeConsistency * 100) + "%");
        card.detail("data_completeness", richness + "/10 data dimensions");
        card.detail("cross_platform_trackability", in.platformCount());
        card.detail("mobile_usage", oneDecimal(in.mobileShare() * 100) + "%");
        return card.finish(SCALE);
    }
}
