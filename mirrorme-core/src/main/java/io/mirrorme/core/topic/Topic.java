package io.mirrorme.core.topic;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed interest taxonomy. Declaration order is the matching order.
 */
public enum Topic {
    TECHNOLOGY("technology", List.of("tech", "software", "programming", "ai", "computer", "app", "digital", "code")),
    HEALTH("health", List.of("health", "fitness", "medical", "wellness", "exercise", "nutrition", "mental")),
    FINANCE("finance", List.of("money", "investment", "crypto", "stock", "finance", "budget", "economy")),
    EDUCATION("education", List.of("learn", "study", "course", "education", "tutorial", "knowledge", "skill")),
    ENTERTAINMENT("entertainment", List.of("movie", "music", "game", "tv", "show", "entertainment", "fun")),
    NEWS("news", List.of("news", "politics", "world", "current", "events", "breaking", "update")),
    LIFESTYLE("lifestyle", List.of("fashion", "travel", "food", "home", "lifestyle", "culture", "art")),
    CAREER("career", List.of("job", "career", "work", "professional", "business", "interview", "resume"));

    private final String id;
    private final List<String> seeds;

    Topic(String id, List<String> seeds) {
        this.id = id;
        this.seeds = seeds;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public List<String> seeds() {
        return seeds;
    }

    public String displayLabel() {
        return Character.toUpperCase(id.charAt(0)) + id.substring(1);
    }

    /**
     * Whether any seed term occurs in the already lower-cased keyword.
     */
    boolean matchesLowered(String loweredKeyword) {
        for (String seed : seeds) {
            if (loweredKeyword.contains(seed)) {
                return true;
            }
        }
        return false;
    }

    public static Optional<Topic> fromId(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Topic topic : values()) {
            if (topic.id.equals(normalized)) {
                return Optional.of(topic);
            }
        }
        return Optional.empty();
    }
}
