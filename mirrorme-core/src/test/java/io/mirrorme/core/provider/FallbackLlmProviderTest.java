package io.mirrorme.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.mirrorme.core.model.ChatMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FallbackLlmProviderTest {

    @Test
    void shouldUseNextProviderWhenFirstFails() {
        LlmProvider primary = new DisabledProvider("gemini", "missing API key");
        LlmProvider secondary = new StubProvider("openai", LlmResponse.success("ok", Map.of()), new ArrayList<>());

        FallbackLlmProvider provider = new FallbackLlmProvider("gemini", List.of(primary, secondary));

        LlmResponse response = provider.complete("model", List.of(ChatMessage.user("hi")), 10);

        assertThat(response.failed()).isFalse();
        assertThat(response.content()).isEqualTo("ok");
        assertThat(response.usage()).containsEntry(FallbackLlmProvider.SERVED_BY, "openai");
    }

    @Test
    void shouldReportDisabledFailureWhenNothingElseWasTried() {
        FallbackLlmProvider provider = new FallbackLlmProvider("gemini", List.of(
            new DisabledProvider("gemini", "missing API key")
        ));

        LlmResponse response = provider.complete("model", List.of(ChatMessage.user("hi")), 10);

        assertThat(response.error()).isEqualTo("Error calling LLM: gemini unavailable: missing API key");
        assertThat(new FallbackLlmProvider("empty", List.of()).complete("model", List.of(), 10).error())
            .isEqualTo("Error calling LLM: no providers in fallback chain empty");
    }

    @Test
    void shouldReturnLastFailureWhenEveryProviderFails() {
        FallbackLlmProvider provider = new FallbackLlmProvider("gemini", List.of(
            new StubProvider("groq", LlmResponse.failure("HTTP 500"), new ArrayList<>()),
            new DisabledProvider("together", "missing API key")
        ));

        LlmResponse response = provider.complete("model", List.of(ChatMessage.user("hi")), 10);

        assertThat(response.failed()).isTrue();
        assertThat(response.error()).isEqualTo("Error calling LLM: HTTP 500");
    }

    @Test
    void pinnedProviderShouldIgnoreRequestedModel() {
        List<String> seenModels = new ArrayList<>();
        LlmProvider pinned = new PinnedModelProvider(
            new StubProvider("groq", LlmResponse.success("ok", Map.of()), seenModels),
            "mixtral-8x7b-32768"
        );

        pinned.complete("gemini-1.5-flash-latest", List.of(ChatMessage.user("hi")), 10);

        assertThat(pinned.name()).isEqualTo("groq");
        assertThat(seenModels).containsExactly("mixtral-8x7b-32768");
    }

    private record StubProvider(String name, LlmResponse response, List<String> seenModels) implements LlmProvider {
        @Override
        public LlmResponse complete(String model, List<ChatMessage> messages, int maxTokens) {
            seenModels.add(model);
            return response;
        }
    }
}
