package io.mirrorme.core.provider;

import io.mirrorme.core.model.ChatMessage;
import java.util.List;

public interface LlmProvider {
    String name();

    LlmResponse complete(String model, List<ChatMessage> messages, int maxTokens);
}
