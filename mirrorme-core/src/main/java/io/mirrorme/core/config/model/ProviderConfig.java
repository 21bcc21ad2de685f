package io.mirrorme.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base", "url"}) String apiBase,
    String model,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders
) {

    public static ProviderConfig defaults() {
        return new ProviderConfig("", null, null, Map.of());
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String apiBaseOr(String fallback) {
        return apiBase == null || apiBase.isBlank() ? fallback : apiBase;
    }

    public ProviderConfig withApiKey(String key) {
        return new ProviderConfig(key, apiBase, model, extraHeaders);
    }
}
