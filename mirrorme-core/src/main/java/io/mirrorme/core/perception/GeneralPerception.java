package io.mirrorme.core.perception;

/**
 * Fallback for perceiver names outside the known set. Always neutral.
 */
final class GeneralPerception implements PerceptionStrategy {
    private static final ImpressionScale SCALE = new ImpressionScale("neutral");

    @Override
    public PerceiverType type() {
        return PerceiverType.GENERAL;
    }

    @Override
    public PerceptionResult evaluate(PerceptionInputs in) {
        ScoreCard card = new ScoreCard(type(), "strengths", "areas_for_improvement");
        card.note("strengths", "Authentic online presence");
        card.note("areas_for_improvement", "Consider audience when posting");
        card.detail("sentiment_distribution", in.sentiment());
        card.detail("topic_interests", in.topics());
        card.detail("platform_activity", in.platformActivityById());
        return card.finish(SCALE);
    }
}
