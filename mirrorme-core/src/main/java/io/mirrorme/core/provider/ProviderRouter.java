package io.mirrorme.core.provider;

import java.util.Locale;

/**
 * Picks a provider by explicit name, or else by model-name heuristics. Gemini is the default.
 */
public final class ProviderRouter {
    private final ProviderRegistry registry;

    public ProviderRouter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public LlmProvider resolve(String preferredProvider, String model) {
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            return require(preferredProvider);
        }

        String normalizedModel = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (normalizedModel.contains("gemini")) {
            return require("gemini");
        }
        if (normalizedModel.contains("deepseek")) {
            return require("deepseek");
        }
        if (normalizedModel.contains("gpt") || normalizedModel.startsWith("openai/")) {
            return require("openai");
        }
        if (normalizedModel.contains("/")) {
            return require("together");
        }
        if (normalizedModel.contains(":")) {
            return require("ollama");
        }
        if (normalizedModel.contains("mixtral") || normalizedModel.contains("llama")) {
            return require("groq");
        }
        return require("gemini");
    }

    private LlmProvider require(String name) {
        return registry.find(name)
            .orElseThrow(() -> new IllegalArgumentException("Provider " + name + " is not registered"));
    }
}
