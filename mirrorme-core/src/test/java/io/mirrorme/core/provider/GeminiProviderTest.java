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

class GeminiProviderTest {

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
    void shouldSendFlattenedPromptAndReadFirstCandidate() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "candidates": [
                    { "content": { "parts": [ { "text": "A balanced, curious mind." } ] } }
                  ],
                  "usageMetadata": { "totalTokenCount": 17 }
                }
                """));

        GeminiProvider provider = new GeminiProvider("gemini", "g-key", server.url("/v1beta").toString());

        LlmResponse response = provider.complete(
            "gemini-1.5-flash-latest",
            List.of(ChatMessage.system("You are an analyst."), ChatMessage.user("Describe me.")),
            150
        );

        assertThat(response.content()).isEqualTo("A balanced, curious mind.");
        assertThat(response.usage()).containsEntry("totalTokenCount", 17);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1beta/models/gemini-1.5-flash-latest:generateContent?key=g-key");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("Instructions: You are an analyst.\\nUser: Describe me.");
        assertThat(body).contains("\"maxOutputTokens\":150");
    }

    @Test
    void shouldFailWhenNoCandidateIsReturned() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"candidates\":[]}"));

        GeminiProvider provider = new GeminiProvider("gemini", "g-key", server.url("/v1beta").toString());

        LlmResponse response = provider.complete("gemini-1.5-flash-latest", List.of(ChatMessage.user("hi")), 10);

        assertThat(response.failed()).isTrue();
        assertThat(response.error()).isEqualTo("Error calling LLM: No valid response from Gemini");
    }
}
