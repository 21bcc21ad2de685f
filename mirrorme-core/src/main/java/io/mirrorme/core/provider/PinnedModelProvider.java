package io.mirrorme.core.provider;

import io.mirrorme.core.model.ChatMessage;
import java.util.List;
import java.util.Objects;

/**
 * Sends every request with a fixed model, whatever the caller asked for. Lets a fallback chain mix
 * providers that do not share model names.
 */
public final class PinnedModelProvider implements LlmProvider {
    private final LlmProvider delegate;
    private final String model;

    public PinnedModelProvider(LlmProvider delegate, String model) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public LlmResponse complete(String requestedModel, List<ChatMessage> messages, int maxTokens) {
        return delegate.complete(model, messages, maxTokens);
    }
}
