package io.mirrorme.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.mirrorme.core.model.ChatMessage;
import java.io.IOException;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OllamaProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldCallGenerateWithoutStreaming() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"response\":\"local summary\",\"eval_count\":12}"));

        OllamaProvider provider = new OllamaProvider("ollama", server.url("/").toString());

        LlmResponse response = provider.complete(
            "qwen2.5:7b",
            List.of(ChatMessage.system("sys"), ChatMessage.user("question")),
            200
        );

        assertThat(response.content()).isEqualTo("local summary");
        assertThat(response.usage()).containsEntry("eval_count", 12);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/generate");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"stream\":false");
        assertThat(body).contains("\"num_predict\":200");
        assertThat(body).contains("System: sys\\nUser: question\\nAssistant:");
    }

    @Test
    void shouldGiveUpAfterTwoAttemptsByDefault() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));

        OllamaProvider provider = new OllamaProvider("ollama", server.url("/").toString());

        LlmResponse response = provider.complete("qwen2.5:7b", List.of(ChatMessage.user("hi")), 10);

        assertThat(response.failed()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }
}
