package io.mirrorme.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NarrativeSettings(
    boolean enabled,
    String provider,
    String model,
    @JsonAlias({"max_tokens"}) int maxTokens,
    @JsonAlias({"feedback_max_tokens"}) int feedbackMaxTokens,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds,
    double temperature
) {

    public static NarrativeSettings defaults() {
        return new NarrativeSettings(true, "gemini", "gemini-1.5-flash-latest", 150, 200, 20, 0.7);
    }

    public NarrativeSettings disabled() {
        return new NarrativeSettings(false, provider, model, maxTokens, feedbackMaxTokens, timeoutSeconds, temperature);
    }
}
