package io.mirrorme.core.perception;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

/**
 * Closed set of simulated observers. Each carries the name of the score it produces.
 */
public enum PerceiverType {
    ADVERTISER("advertiser", "targeting_value"),
    CONTENT_FEEDER("content_feeder", "engagement_score"),
    DATA_BROKER("data_broker", "data_value"),
    AI_SYSTEM("ai_system", "ai_confidence"),
    RECRUITER("recruiter", "hire_likelihood"),
    ROMANTIC_PARTNER("romantic_partner", "compatibility_score"),
    COLLEAGUE("colleague", "collaboration_score"),
    FAMILY_MEMBER("family_member", "family_harmony_score"),
    GENERAL("general", "public_perception_score");

    /**
     * Perceivers that take part in comparisons and recommendation roll-ups.
     */
    public static final List<PerceiverType> PERSONAL = List.of(RECRUITER, ROMANTIC_PARTNER, COLLEAGUE, FAMILY_MEMBER);

    private final String id;
    private final String scoreName;

    PerceiverType(String id, String scoreName) {
        this.id = id;
        this.scoreName = scoreName;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String scoreName() {
        return scoreName;
    }

    /**
     * Resolves a perceiver by id, case-insensitively. Unknown or blank names map to {@link #GENERAL}.
     */
    public static PerceiverType fromName(String name) {
        if (name == null || name.isBlank()) {
            return GENERAL;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (PerceiverType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        return GENERAL;
    }
}
