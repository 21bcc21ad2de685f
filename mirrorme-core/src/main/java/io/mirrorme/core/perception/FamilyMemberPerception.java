package io.mirrorme.core.perception;

import java.util.List;

final class FamilyMemberPerception implements PerceptionStrategy {
    private static final List<String> CONCERNING_TERMS = List.of("party", "drunk", "wild", "inappropriate");
    // the harmony score is reported, the impression is not graded
    private static final ImpressionScale SCALE = new ImpressionScale("neutral");

    @Override
    public PerceiverType type() {
        return PerceiverType.FAMILY_MEMBER;
    }

    @Override
    public PerceptionResult evaluate(PerceptionInputs in) {
        ScoreCard card = new ScoreCard(type(), "positive_traits", "family_concerns", "generational_insights");

        if (in.sentiment().get("positive") > 0.5) {
            card.note("positive_traits", "Generally positive outlook - pleasant to be around at family gatherings", 15);
        }

        if (in.countSamplesContaining(in.contentSamples(), CONCERNING_TERMS) > 2) {
            card.note("family_concerns", "Some content may be concerning to traditional family values", -20);
        }

        if (in.leansAbove(0.6)) {
            card.note("generational_insights", "Strong political views may clash with some family members", -5);
        }

        card.detail("emotional_tone", in.sentiment());
        card.detail("political_alignment", in.political());
        return card.finish(SCALE);
    }
}
