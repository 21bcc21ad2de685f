package io.mirrorme.core.narrative;

import io.mirrorme.core.model.ChatMessage;
import io.mirrorme.core.provider.FallbackLlmProvider;
import io.mirrorme.core.provider.LlmProvider;
import io.mirrorme.core.provider.LlmResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a provider completion under a bounded timeout and converts every outcome into a {@link GenerationResult}.
 *
 * <p>Each call runs on its own worker thread, which is shut down when the call returns. On timeout the
 * worker is interrupted, which cancels the provider's in-flight HTTP call.
 */
public final class ProviderTextGenerator implements TextGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderTextGenerator.class);

    private final LlmProvider provider;
    private final String model;
    private final Duration timeout;

    public ProviderTextGenerator(LlmProvider provider, String model, Duration timeout) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = model;
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(20) : timeout;
    }

    @Override
    public GenerationResult generate(List<ChatMessage> messages, int maxTokens) {
        ExecutorService worker = Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, "narrative-" + provider.name());
            thread.setDaemon(true);
            return thread;
        });
        try {
            Future<LlmResponse> call = worker.submit(() -> provider.complete(model, messages, maxTokens));
            return toResult(call.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            LOG.warn("Text generation via {} timed out after {} ms", provider.name(), timeout.toMillis());
            return GenerationResult.failure("timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GenerationResult.failure("interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("Text generation via {} failed: {}", provider.name(), cause.getMessage());
            return GenerationResult.failure(cause.getMessage());
        } finally {
            worker.shutdownNow();
        }
    }

    private GenerationResult toResult(LlmResponse response) {
        if (response == null) {
            return GenerationResult.failure("empty response");
        }
        if (response.failed()) {
            LOG.warn("Text generation via {} failed: {}", provider.name(), response.error());
            return GenerationResult.failure(response.error());
        }
        if (response.content().isBlank()) {
            return GenerationResult.failure("blank completion");
        }
        Object servedBy = response.usage().get(FallbackLlmProvider.SERVED_BY);
        String label = servedBy == null ? provider.name() : servedBy.toString();
        LOG.debug("Generated {} chars using {}", response.content().length(), label);
        return GenerationResult.success(response.content(), label);
    }
}
