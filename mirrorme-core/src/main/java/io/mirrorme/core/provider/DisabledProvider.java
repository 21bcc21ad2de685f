package io.mirrorme.core.provider;

import io.mirrorme.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

/**
 * Stands in for a provider that has no credentials. Every call fails without I/O.
 */
public record DisabledProvider(String name, String reason) implements LlmProvider {

    public DisabledProvider {
        if (reason == null || reason.isBlank()) {
            reason = "provider is disabled";
        }
    }

    @Override
    public LlmResponse complete(String model, List<ChatMessage> messages, int maxTokens) {
        return LlmResponse.failure(name + " unavailable: " + reason, Map.of("provider", name, "disabled", true));
    }
}
