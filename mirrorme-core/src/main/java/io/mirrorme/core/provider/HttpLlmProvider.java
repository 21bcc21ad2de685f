package io.mirrorme.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mirrorme.core.model.ChatMessage;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Shared request loop for JSON-over-HTTP providers: bounded retries on 429, 5xx and I/O
 * errors with doubling backoff.
 *
 * <p>Interrupting the calling thread cancels the in-flight call and ends the loop.
 */
abstract class HttpLlmProvider implements LlmProvider {
    static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final double DEFAULT_TEMPERATURE = 0.7;

    private static final long INITIAL_BACKOFF_MS = 250;
    private static final long MAX_BACKOFF_MS = 2000;

    protected final String name;
    protected final HttpUrl apiBase;
    protected final double temperature;
    protected final ObjectMapper mapper;
    private final OkHttpClient client;
    private final int maxAttempts;

    HttpLlmProvider(String name, String apiBase, double temperature, int maxAttempts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.temperature = temperature;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(60))
            .writeTimeout(Duration.ofSeconds(20))
            .callTimeout(Duration.ofSeconds(90))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse complete(String model, List<ChatMessage> messages, int maxTokens) {
        String missing = missingCredential();
        if (missing != null) {
            return LlmResponse.failure(missing + " for provider " + name);
        }

        long delayMs = INITIAL_BACKOFF_MS;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Request request = buildRequest(model, messages, maxTokens);
                try (Response response = execute(request)) {
                    if (!response.isSuccessful()) {
                        String errorBody = response.body() == null ? "" : response.body().string();
                        boolean retryable = response.code() == 429 || response.code() >= 500;
                        if (retryable && attempt < maxAttempts) {
                            Thread.sleep(delayMs);
                            delayMs = Math.min(delayMs * 2, MAX_BACKOFF_MS);
                            continue;
                        }
                        return LlmResponse.failure(
                            "HTTP " + response.code() + " " + errorBody,
                            Map.of("http_status", response.code())
                        );
                    }

                    ResponseBody body = response.body();
                    if (body == null) {
                        return LlmResponse.failure("empty response body from " + name);
                    }
                    return parseResponse(mapper.readTree(body.string()));
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return LlmResponse.failure("interrupted while calling " + name);
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    try {
                        Thread.sleep(delayMs);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        return LlmResponse.failure("interrupted while calling " + name);
                    }
                    delayMs = Math.min(delayMs * 2, MAX_BACKOFF_MS);
                    continue;
                }
                return LlmResponse.failure(ioe.getMessage());
            } catch (RuntimeException e) {
                return LlmResponse.failure(e.getMessage());
            }
        }
        return LlmResponse.failure("exhausted retries");
    }

    /**
     * Reason the provider cannot be called at all, or {@code null} when it can.
     */
    protected String missingCredential() {
        return null;
    }

    protected abstract Request buildRequest(String model, List<ChatMessage> messages, int maxTokens) throws IOException;

    protected abstract LlmResponse parseResponse(JsonNode root);

    protected Map<String, Object> usageAsMap(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return Map.of();
        }
        return mapper.convertValue(usage, new TypeReference<Map<String, Object>>() {
        });
    }

    /**
     * Flattens role-tagged messages into one prompt for completion-style endpoints.
     */
    static String flatten(List<ChatMessage> messages, String systemLabel, String userLabel) {
        StringBuilder prompt = new StringBuilder();
        for (ChatMessage message : messages) {
            String label = switch (message.role()) {
                case SYSTEM -> systemLabel;
                case USER -> userLabel;
                case ASSISTANT -> null;
            };
            if (label == null) {
                continue;
            }
            if (prompt.length() > 0) {
                prompt.append('\n');
            }
            prompt.append(label).append(": ").append(message.content());
        }
        return prompt.toString();
    }

    /**
     * Blocking call that waits interruptibly. On interrupt the call is cancelled and a late
     * response is closed.
     */
    private Response execute(Request request) throws IOException, InterruptedException {
        Call call = client.newCall(request);
        CompletableFuture<Response> pending = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                pending.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call succeeded, Response response) {
                pending.complete(response);
            }
        });
        try {
            return pending.get();
        } catch (InterruptedException e) {
            call.cancel();
            pending.thenAccept(Response::close);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(cause);
        }
    }
}
