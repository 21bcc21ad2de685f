package io.mirrorme.core.provider;

import java.util.Map;

/**
 * Completion outcome. Failures are values: {@code error} is set and {@code content} is empty.
 */
public record LlmResponse(String content, Map<String, Object> usage, String error) {
    static final String ERROR_PREFIX = "Error calling LLM: ";

    public LlmResponse {
        content = content == null ? "" : content;
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static LlmResponse success(String content, Map<String, Object> usage) {
        return new LlmResponse(content, usage, null);
    }

    public static LlmResponse failure(String reason) {
        return failure(reason, Map.of());
    }

    public static LlmResponse failure(String reason, Map<String, Object> usage) {
        return new LlmResponse("", usage, ERROR_PREFIX + (reason == null ? "unknown error" : reason));
    }

    public boolean failed() {
        return error != null;
    }
}
