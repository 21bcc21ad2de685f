package io.mirrorme.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.mirrorme.core.model.ChatMessage;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Google Gemini {@code generateContent}. System and user turns are folded into a single text part.
 */
public final class GeminiProvider extends HttpLlmProvider {
    private final String apiKey;

    public GeminiProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, DEFAULT_TEMPERATURE, 3);
    }

    public GeminiProvider(String name, String apiKey, String apiBase, double temperature, int maxAttempts) {
        super(name, apiBase, temperature, maxAttempts);
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    @Override
    protected String missingCredential() {
        return apiKey.isBlank() ? "missing API key" : null;
    }

    @Override
    protected Request buildRequest(String model, List<ChatMessage> messages, int maxTokens) throws IOException {
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("maxOutputTokens", maxTokens);
        generationConfig.put("temperature", temperature);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contents", List.of(Map.of(
            "parts", List.of(Map.of("text", flatten(messages, "Instructions", "User")))
        )));
        payload.put("generationConfig", generationConfig);

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(generateUrl(model))
            .post(body)
            .header("Content-Type", "application/json")
            .build();
    }

    @Override
    protected LlmResponse parseResponse(JsonNode root) {
        JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (!text.isTextual()) {
            return LlmResponse.failure("No valid response from Gemini");
        }
        return LlmResponse.success(text.asText().strip(), usageAsMap(root.path("usageMetadata")));
    }

    private HttpUrl generateUrl(String model) {
        return apiBase.newBuilder()
            .addPathSegment("models")
            .addPathSegment(model + ":generateContent")
            .addQueryParameter("key", apiKey)
            .build();
    }
}
