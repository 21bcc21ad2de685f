package io.mirrorme.core.perception;

import static io.mirrorme.core.perception.ScoreCard.oneDecimal;

import io.mirrorme.core.platform.Platform;
import io.mirrorme.core.topic.Topic;
import java.util.List;

final class RomanticPartnerPerception implements PerceptionStrategy {
    private static final List<String> RELATIONSHIP_TERMS = List.of("ex-", "dating app", "hookup", "single", "breakup", "toxic", "cheating");
    private static final List<String> CREATIVE_TERMS = List.of("art", "music", "creative", "design", "photography", "writing");
    private static final ImpressionScale SCALE = new ImpressionScale("concerning")
        .atLeast(75, "very_attractive")
        .atLeast(60, "attractive")
        .atLeast(40, "neutral");

    @Override
    public PerceiverType type() {
        return PerceiverType.ROMANTIC_PARTNER;
    }

    @Override
    public PerceptionResult evaluate(PerceptionInputs in) {
        ScoreCard card = new ScoreCard(type(), "attractive_qualities", "potential_concerns", "red_flags", "relationship_insights");

        if (in.sentiment().get("positive") > 0.5) {
            card.note("attractive_qualities", "Positive outlook and optimistic personality", 15);
        } else if (in.sentiment().get("negative") > 0.6) {
            card.note("potential_concerns", "Frequently negative online - may indicate pessimistic worldview", -20);
        }

        if (in.topicShare(Topic.ENTERTAINMENT) > 0.3 || in.topicShare(Topic.LIFESTYLE) > 0.2) {
            card.note("attractive_qualities", "Enjoys entertainment and lifestyle content - likely fun to be around", 10);
        }

        if (in.topics().count(Topic.HEALTH) > 0) {
            card.note("attractive_qualities", "Health-conscious lifestyle choices", 10);
        }

        int relationshipMentions = in.countSamplesContaining(in.samples(15), RELATIONSHIP_TERMS);
        if (relationshipMentions > 3) {
            card.note("red_flags", "Frequent mentions of dating/relationship drama - may indicate instability", -25);
        } else if (relationshipMentions == 0) {
            card.note("attractive_qualities", "Discrete about personal relationships - respects privacy", 5);
        }

        if (in.leansAbove(0.8)) {
            card.note("potential_concerns", "Strong political views may create relationship friction if values don't align", -10);
        } else if (in.leansAbove(0.3)) {
            card.note("attractive_qualities", "Has values and principles - likely thoughtful partner", 8);
        }

        int activityTotal = in.activityTotalOrOne();
        double socialShare = (double) (in.activity(Platform.TWITTER) + in.activity(Platform.INSTAGRAM)) / activityTotal;
        if (socialShare > 0.7) {
            card.note("potential_concerns", "Heavy social media usage - may prioritize online validation over real connections", -15);
        } else if (socialShare < 0.2) {
            card.note("attractive_qualities", "Not overly focused on social media - likely present in real-life interactions", 10);
        }

        if (in.topics().count(Topic.EDUCATION) > 0 || in.activity(Platform.SEARCH) > activityTotal * 0.3) {
            card.note("attractive_qualities", "Curious and learning-oriented - interesting conversation partner", 12);
        }

        if (in.hasHours() && (double) in.hoursBetween(18, 23) / in.hourTotal() > 0.4) {
            card.note("potential_concerns", "Heavy internet usage during evening hours - may limit quality time together", -10);
        }

        if (in.countSamplesContaining(in.contentSamples(), CREATIVE_TERMS) > 2) {
            card.note("attractive_qualities", "Creative interests and artistic appreciation", 8);
        }

        if (in.sentiment().get("positive") > 0.6) {
            card.note("relationship_insights", "Likely to bring positivity and joy to a relationship");
        }
        if (in.political().get("neutral") > 0.6) {
            card.note("relationship_insights", "Balanced political views suggest open-mindedness and flexibility");
        }
        if (in.topics().count(Topic.TECHNOLOGY) > in.topicTotalOrOne() * 0.3) {
            card.note("relationship_insights", "Tech-savvy partner who can help with digital challenges");
        }

        card.detail("emotional_tone", in.sentiment());
        card.detail("political_alignment", in.political());
        card.detail("social_media_engagement", oneDecimal(socialShare * 100) + "% of activity");
        card.detail("interests_diversity", in.topics().breadth());
        card.detail("relationship_discretion", relationshipMentions == 0 ? "High" : "Low");
        return card.finish(SCALE);
    }
}
