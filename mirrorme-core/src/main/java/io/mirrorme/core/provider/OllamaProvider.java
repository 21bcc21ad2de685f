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
 * Local Ollama server via {@code /api/generate}. Needs no credentials.
 */
public final class OllamaProvider extends HttpLlmProvider {

    public OllamaProvider(String name, String apiBase) {
        this(name, apiBase, DEFAULT_TEMPERATURE, 2);
    }

    public OllamaProvider(String name, String apiBase, double temperature, int maxAttempts) {
        super(name, apiBase, temperature, maxAttempts);
    }

    @Override
    protected Request buildRequest(String model, List<ChatMessage> messages, int maxTokens) throws IOException {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("num_predict", maxTokens);
        options.put("temperature", temperature);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("prompt", flatten(messages, "System", "User") + "\nAssistant:");
        payload.put("stream", false);
        payload.put("options", options);

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(generateUrl())
            .post(body)
            .build();
    }

    @Override
    protected LlmResponse parseResponse(JsonNode root) {
        JsonNode text = root.path("response");
        if (!text.isTextual() || text.asText().isBlank()) {
            return LlmResponse.failure("no response text from " + name);
        }
        Map<String, Object> usage = new LinkedHashMap<>();
        if (root.has("eval_count")) {
            usage.put("eval_count", root.path("eval_count").asInt());
        }
        return LlmResponse.success(text.asText().strip(), usage);
    }

    private HttpUrl generateUrl() {
        return apiBase.newBuilder()
            .addPathSegment("api")
            .addPathSegment("generate")
            .build();
    }
}
