package io.mirrorme.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.mirrorme.core.model.ChatMessage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Non-streaming chat completions against any OpenAI-compatible endpoint (OpenAI, DeepSeek,
 * Groq, Together).
 */
public final class OpenAiCompatProvider extends HttpLlmProvider {
    private final String apiKey;
    private final Map<String, String> extraHeaders;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, DEFAULT_TEMPERATURE, 3);
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        double temperature,
        int maxAttempts
    ) {
        super(name, apiBase, temperature, maxAttempts);
        this.apiKey = apiKey == null ? "" : apiKey;
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    @Override
    protected String missingCredential() {
        return apiKey.isBlank() ? "missing API key" : null;
    }

    @Override
    protected Request buildRequest(String model, List<ChatMessage> messages, int maxTokens) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(messages));
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", temperature);

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json");
        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    @Override
    protected LlmResponse parseResponse(JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            return LlmResponse.failure("no completion content from " + name);
        }
        return LlmResponse.success(content.asText().strip(), usageAsMap(root.path("usage")));
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", switch (message.role()) {
                case SYSTEM -> "system";
                case USER -> "user";
                case ASSISTANT -> "assistant";
            });
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }
}
