package io.mirrorme.core.perception;

import static io.mirrorme.core.perception.ScoreCard.oneDecimal;

import io.mirrorme.core.topic.Topic;
import io.mirrorme.core.topic.TopicCounts;

final class AiSystemPerception implements PerceptionStrategy {
    private static final ImpressionScale SCALE = new ImpressionScale("low_confidence")
        .atLeast(80, "high_confidence")
        .atLeast(65, "reliable_predictions")
        .atLeast(40, "moderate_accuracy");

    @Override
    public PerceiverType type() {
        return PerceiverType.AI_SYSTEM;
    }

    @Override
    public PerceptionResult evaluate(PerceptionInputs in) {
        ScoreCard card = new ScoreCard(type(), "ai_advantages", "ai_limitations", "red_flags", "recommendations");

        int volume = in.topicTotalOrOne();
        if (volume > 100) {
            card.note("ai_advantages", "Sufficient data volume for reliable AI analysis", 20);
        } else if (volume < 20) {
            card.note("ai_limitations", "Limited data volume reduces AI prediction accuracy", -25);
        }

        Double entropy = null;
        if (!in.topics().isEmpty()) {
            entropy = shannonEntropy(in.topics());
            if (entropy < 2) {
                card.note("ai_advantages", "Consistent behavioral patterns enable accurate predictions", 15);
            } else if (entropy > 4) {
                card.note("ai_limitations", "Highly random behavior patterns challenge AI modeling", -15);
            }
        }

        double sentimentConsistency = in.sentiment().max();
        if (sentimentConsistency > 0.7) {
            card.note("ai_advantages", "Consistent emotional patterns improve sentiment analysis accuracy", 12);
        } else if (sentimentConsistency < 0.4) {
            card.note("ai_limitations", "Inconsistent emotional patterns complicate sentiment modeling", -10);
        }

        double temporal = in.peakHourShare();
        if (in.hasHours() && temporal > 0.4) {
            card.note("ai_advantages", "Strong temporal patterns enable time-based predictions", 10);
        }

        // sentiment and political distributions are never empty
        int dimensions = 2
            + (in.topics().isEmpty() ? 0 : 1)
            + (in.platformCount() == 0 ? 0 : 1)
            + (in.hasHours() ? 1 : 0);
        if (dimensions >= 4) {
            card.note("ai_advantages", "Multi-dimensional data enables sophisticated AI modeling", 15);
        } else if (dimensions < 3) {
            card.note("ai_limitations", "Limited data dimensions constrain AI model complexity", -12);
        }

        if (in.topicShare(Topic.TECHNOLOGY) > 0.4) {
            card.note("ai_limitations", "High tech sophistication may indicate AI-aware behavior", -15);
        }

        if (in.contentSamples().size() > 10) {
            card.note("ai_advantages", "Sufficient content samples for anomaly detection", 8);
        }

        card.detail("data_volume", volume);
        card.detail("pattern_consistency", oneDecimal(sentimentConsistency * 100) + "%");
        card.detail("data_dimensions", dimensions);
        card.detail("temporal_predictability", in.hasHours() ? oneDecimal(temporal * 100) + "%" : "Unknown");
        card.detail("topic_entropy", entropy == null ? "Unknown" : oneDecimal(entropy));
        return card.finish(SCALE);
    }

    /**
     * Shannon entropy in bits over the topic shares.
     */
    static double shannonEntropy(TopicCounts topics) {
        int total = topics.total();
        if (total == 0) {
            return 0.0;
        }
        double entropy = 0.0;
        for (int count : topics.entries().values()) {
            if (count > 0) {
                double p = (double) count / total;
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }
        return entropy;
    }
}
