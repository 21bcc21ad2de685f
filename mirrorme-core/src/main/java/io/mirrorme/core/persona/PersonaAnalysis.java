package io.mirrorme.core.persona;

import io.mirrorme.core.distribution.Distribution;
import io.mirrorme.core.network.InterestNetwork;
import io.mirrorme.core.platform.PlatformBehavior;
import io.mirrorme.core.topic.TopicCounts;
import java.util.List;

public record PersonaAnalysis(
    String personaSummary,
    List<String> topTopics,
    TopicCounts topicCounts,
    List<String> personalityTraits,
    Distribution emotionalTone,
    Distribution politicalTilt,
    PlatformBehavior platformBehavior,
    List<DigitalAvatar> digitalAvatars,
    InterestNetwork interestNetwork,
    List<String> insights,
    EngagementPatterns engagementPatterns,
    int dataPointsAnalyzed
) {
    public static final String NO_DATA_SUMMARY = "No behavior data available for analysis. Start browsing with the extension "
        + "or log some sample behaviors to generate insights.";
    public static final String NO_DATA_INSIGHT = "Collect more browsing data to generate personalized insights";

    public PersonaAnalysis {
        topTopics = topTopics == null ? List.of() : List.copyOf(topTopics);
        personalityTraits = personalityTraits == null ? List.of() : List.copyOf(personalityTraits);
        digitalAvatars = digitalAvatars == null ? List.of() : List.copyOf(digitalAvatars);
        insights = insights == null ? List.of() : List.copyOf(insights);
    }

    public static PersonaAnalysis empty() {
        return new PersonaAnalysis(
            NO_DATA_SUMMARY,
            List.of(),
            TopicCounts.empty(),
            List.of(),
            Distribution.neutralDefault(),
            Distribution.neutralDefault(),
            PlatformBehavior.none(),
            List.of(),
            InterestNetwork.empty(),
            List.of(NO_DATA_INSIGHT),
            new EngagementPatterns(0, 0, 0, 0),
            0
        );
    }
}
