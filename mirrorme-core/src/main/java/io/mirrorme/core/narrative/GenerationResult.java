package io.mirrorme.core.narrative;

/**
 * Outcome of a text generation attempt. Exactly one of {@code text} and {@code failureReason} is set.
 */
public record GenerationResult(String text, String provider, String failureReason) {
    public static GenerationResult success(String text, String provider) {
        return new GenerationResult(text, provider, null);
    }

    public static GenerationResult failure(String reason) {
        return new GenerationResult(null, null, reason == null ? "unknown failure" : reason);
    }

    public boolean succeeded() {
        return failureReason == null && text != null && !text.isBlank();
    }
}
