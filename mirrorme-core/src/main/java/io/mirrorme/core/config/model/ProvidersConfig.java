package io.mirrorme.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig gemini,
    ProviderConfig openai,
    ProviderConfig deepseek,
    ProviderConfig groq,
    ProviderConfig together,
    ProviderConfig ollama
) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            new ProviderConfig("", "http://localhost:11434", null, Map.of())
        );
    }

    /**
     * Fills blank API keys from {@code GEMINI_API_KEY}, {@code OPENAI_API_KEY} and so on, and the Ollama
     * base from {@code OLLAMA_URL}. Keys present in the file win.
     */
    public ProvidersConfig withEnvironment(Map<String, String> env) {
        ProviderConfig ollamaConfig = ollama == null ? ProviderConfig.defaults() : ollama;
        String ollamaUrl = env.get("OLLAMA_URL");
        if (ollamaUrl != null && !ollamaUrl.isBlank()) {
            ollamaConfig = new ProviderConfig(ollamaConfig.apiKey(), ollamaUrl, ollamaConfig.model(), ollamaConfig.extraHeaders());
        }
        return new ProvidersConfig(
            fromEnv(gemini, env, "GEMINI_API_KEY"),
            fromEnv(openai, env, "OPENAI_API_KEY"),
            fromEnv(deepseek, env, "DEEPSEEK_API_KEY"),
            fromEnv(groq, env, "GROQ_API_KEY"),
            fromEnv(together, env, "TOGETHER_API_KEY"),
            ollamaConfig
        );
    }

    private static ProviderConfig fromEnv(ProviderConfig config, Map<String, String> env, String variable) {
        ProviderConfig base = config == null ? ProviderConfig.defaults() : config;
        String value = env.get(variable);
        if (base.configured() || value == null || value.isBlank()) {
            return base;
        }
        return base.withApiKey(value);
    }
}
