package io.mirrorme.core.persona;

import io.mirrorme.core.distribution.Distribution;
import io.mirrorme.core.network.InterestNetwork;
import java.util.List;

/**
 * Condensed persona used as context by the perception strategies.
 */
public record PersonaProfile(
    List<String> topTopics,
    Distribution emotionalTone,
    InterestNetwork interestNetwork,
    Distribution politicalBias,
    String personaSummary,
    List<String> personalityTraits,
    int dataPointsCount
) {
    public static final String NO_DATA_SUMMARY = "No data available for analysis";

    public PersonaProfile {
        topTopics = topTopics == null ? List.of() : List.copyOf(topTopics);
        personalityTraits = personalityTraits == null ? List.of() : List.copyOf(personalityTraits);
    }

    public static PersonaProfile empty() {
        return new PersonaProfile(
            List.of(),
            Distribution.neutralDefault(),
            InterestNetwork.empty(),
            Distribution.neutralDefault(),
            NO_DATA_SUMMARY,
            List.of(),
            0
        );
    }
}
