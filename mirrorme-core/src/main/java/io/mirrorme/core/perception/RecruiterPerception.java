package io.mirrorme.core.perception;

import static io.mirrorme.core.perception.ScoreCard.oneDecimal;

import io.mirrorme.core.platform.Platform;
import io.mirrorme.core.topic.Topic;
import java.util.List;

final class RecruiterPerception implements PerceptionStrategy {
    private static final List<Topic> PROFESSIONAL_TOPICS = List.of(Topic.TECHNOLOGY, Topic.CAREER, Topic.EDUCATION, Topic.FINANCE);
    private static final List<String> RED_FLAG_TERMS = List.of("hate", "discriminat", "illegal", "fired", "lawsuit", "drunk", "party");
    private static final ImpressionScale SCALE = new ImpressionScale("concerning")
        .atLeast(75, "very_positive")
        .atLeast(60, "positive")
        .atLeast(40, "neutral");

    @Override
    public PerceiverType type() {
        return PerceiverType.RECRUITER;
    }

    @Override
    public PerceptionResult evaluate(PerceptionInputs in) {
        ScoreCard card = new ScoreCard(type(), "strengths", "concerns", "red_flags", "recommendations");

        double professionalShare = in.topicShare(PROFESSIONAL_TOPICS);
        if (professionalShare > 0.6) {
            card.note("strengths", "Strong focus on professional development and industry knowledge", 20);
        } else if (professionalShare > 0.3) {
            card.note("strengths", "Good balance of professional and personal interests", 10);
        } else {
            card.note("concerns", "Limited evidence of professional interests or industry engagement", -10);
        }

        if (in.activity(Platform.SEARCH) > in.activity(Platform.TWITTER)) {
            card.note("strengths", "Research-oriented mindset, likely to be self-directed learner", 15);
        }

        if (in.leansAbove(0.7)) {
            card.note("concerns", "Heavily politically engaged - may bring divisive viewpoints to workplace", -15);
        } else if (in.leansAbove(0.4)) {
            card.note("strengths", "Engaged citizen with clear values", 5);
        }

        if (in.sentiment().get("negative") > 0.5) {
            card.note("concerns", "Frequently negative or critical online - may impact team morale", -20);
        } else if (in.sentiment().get("positive") > 0.6) {
            card.note("strengths", "Positive online presence suggests good attitude and team fit", 15);
        }

        int hourTotal = in.hourTotal() == 0 ? 1 : in.hourTotal();
        double workHourShare = (double) in.hoursBetween(9, 18) / hourTotal;
        if (workHourShare > 0.7) {
            card.note("concerns", "Heavy internet usage during work hours - potential productivity concerns", -15);
        } else if (workHourShare < 0.3) {
            card.note("strengths", "Good work-life digital boundaries", 10);
        }

        if (in.countSamplesContaining(in.samples(10), RED_FLAG_TERMS) > 0) {
            card.note("red_flags", "Potentially concerning language or behavior patterns in online content", -25);
        }

        if (in.topics().count(Topic.TECHNOLOGY) > in.topics().total() * 0.2) {
            card.note("strengths", "Tech-savvy, likely adaptable to new digital tools and systems", 10);
        }

        if (card.delta() < 40) {
            card.note("recommendations", "Consider sharing more professional achievements and industry insights");
            card.note("recommendations", "Engage with thought leaders and professional content in your field");
        }
        if (in.sentiment().get("negative") > 0.4) {
            card.note("recommendations", "Balance critical posts with more positive, solution-oriented content");
        }
        if (!in.hasActivity(Platform.SEARCH) && !in.hasActivity(Platform.YOUTUBE)) {
            card.note("recommendations", "Demonstrate continuous learning through educational content engagement");
        }

        card.detail("professional_interests", oneDecimal(professionalShare * 100) + "% of content");
        card.detail("political_engagement", in.political());
        card.detail("sentiment_profile", in.sentiment());
        card.detail("platform_usage", in.platformActivityById());
        card.detail("content_professionalism", card.isEmpty("red_flags") ? "High" : "Concerning");
        return card.finish(SCALE);
    }
}
