package io.mirrorme.core.narrative;

import io.mirrorme.core.model.ChatMessage;
import java.util.List;

public interface TextGenerator {
    GenerationResult generate(List<ChatMessage> messages, int maxTokens);
}
