package io.mirrorme.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Emotional label attached upstream. A record without a label carries {@code null}.
 */
public enum Sentiment {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NEUTRAL("neutral");

    private final String label;

    Sentiment(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Parses a wire label; blank values and {@code "unset"} map to {@code null}.
     */
    @JsonCreator
    public static Sentiment fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Sentiment sentiment : values()) {
            if (sentiment.label.equals(normalized)) {
                return sentiment;
            }
        }
        if ("unset".equals(normalized)) {
            return null;
        }
        throw new IllegalArgumentException("Unknown sentiment: " + raw);
    }
}
