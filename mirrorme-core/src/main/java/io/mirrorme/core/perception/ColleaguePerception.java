package io.mirrorme.core.perception;

import io.mirrorme.core.topic.Topic;
import java.util.List;

final class ColleaguePerception implements PerceptionStrategy {
    private static final List<Topic> WORK_TOPICS = List.of(Topic.TECHNOLOGY, Topic.CAREER, Topic.EDUCATION);
    private static final ImpressionScale SCALE = new ImpressionScale("challenging_colleague")
        .atLeast(70, "excellent_colleague")
        .atLeast(55, "good_colleague")
        .atLeast(40, "neutral");

    @Override
    public PerceiverType type() {
        return PerceiverType.COLLEAGUE;
    }

    @Override
    public PerceptionResult evaluate(PerceptionInputs in) {
        ScoreCard card = new ScoreCard(type(), "team_fit_qualities", "potential_friction");

        String style;
        if (in.sentiment().get("positive") > 0.5) {
            card.note("team_fit_qualities", "Positive communicator - likely to boost team morale", 15);
            style = "supportive";
        } else if (in.sentiment().get("negative") > 0.5) {
            card.note("potential_friction", "Often critical or negative - may create tense work environment", -15);
            style = "critical";
        } else {
            card.adjust(5);
            style = "balanced";
        }

        if (in.topicShare(WORK_TOPICS) > 0.4) {
            card.note("team_fit_qualities", "Strong professional interests - valuable team contributor", 20);
        }

        if (in.leansAbove(0.7)) {
            card.note("potential_friction", "Strong political views may create workplace tension", -10);
        }

        card.detail("communication_style", style);
        card.detail("sentiment_profile", in.sentiment());
        return card.finish(SCALE);
    }
}
