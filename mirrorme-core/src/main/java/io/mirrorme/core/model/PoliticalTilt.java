package io.mirrorme.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Political label attached upstream. A record without a label carries {@code null}.
 */
public enum PoliticalTilt {
    LEFT("left"),
    RIGHT("right"),
    NEUTRAL("neutral");

    private final String label;

    PoliticalTilt(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static PoliticalTilt fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (PoliticalTilt tilt : values()) {
            if (tilt.label.equals(normalized)) {
                return tilt;
            }
        }
        if ("unset".equals(normalized)) {
            return null;
        }
        throw new IllegalArgumentException("Unknown political tilt: " + raw);
    }
}
