package io.mirrorme.core.persona;

import java.util.List;

/**
 * One facet of the user as seen through a subset of their activity.
 *
 * @param strength share of all records that belong to the facet, in [0,1]
 */
public record DigitalAvatar(
    String name,
    String description,
    String platform,
    String emoji,
    List<String> personalityTraits,
    List<String> topInterests,
    String politicalLean,
    String emotionalTone,
    String behaviorPattern,
    double strength
) {
    public DigitalAvatar {
        personalityTraits = personalityTraits == null ? List.of() : List.copyOf(personalityTraits);
        topInterests = topInterests == null ? List.of() : List.copyOf(topInterests);
    }
}
