package io.mirrorme.core.provider;

import io.mirrorme.core.model.ChatMessage;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries each provider of the chain in order and returns the first completion that succeeds.
 *
 * <p>A successful response carries the serving provider under {@value #SERVED_BY} in its usage map.
 * When every hop fails, the last real failure is returned; failures of {@link DisabledProvider}
 * hops only count when nothing else was tried. An interrupted caller stops the chain at the current hop.
 */
public final class FallbackLlmProvider implements LlmProvider {
    public static final String SERVED_BY = "servedBy";

    private static final Logger LOG = LoggerFactory.getLogger(FallbackLlmProvider.class);
    private static final int MAX_LOGGED_ERROR = 300;

    private final String name;
    private final List<LlmProvider> chain;

    public FallbackLlmProvider(String name, List<LlmProvider> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse complete(String model, List<ChatMessage> messages, int maxTokens) {
        LlmResponse lastDisabled = null;
        LlmResponse lastFailure = null;
        for (LlmProvider hop : chain) {
            LlmResponse response = hop.complete(model, messages, maxTokens);
            if (!response.failed()) {
                LOG.debug("Chain {} served by {}", name, hop.name());
                Map<String, Object> usage = new HashMap<>(response.usage());
                usage.put(SERVED_BY, hop.name());
                return LlmResponse.success(response.content(), usage);
            }
            if (hop instanceof DisabledProvider) {
                lastDisabled = response;
                continue;
            }
            LOG.warn("Chain {} hop {} failed: {}", name, hop.name(), abbreviate(response.error()));
            lastFailure = response;
            if (Thread.currentThread().isInterrupted()) {
                return lastFailure;
            }
        }
        if (lastFailure != null) {
            return lastFailure;
        }
        return lastDisabled != null ? lastDisabled : LlmResponse.failure("no providers in fallback chain " + name);
    }

    private static String abbreviate(String error) {
        if (error == null || error.length() <= MAX_LOGGED_ERROR) {
            return error;
        }
        return error.substring(0, MAX_LOGGED_ERROR) + "...";
    }
}
