package io.mirrorme.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.mirrorme.core.config.model.MirrorMeConfig;
import io.mirrorme.core.config.model.NarrativeSettings;
import io.mirrorme.core.config.model.ProviderConfig;
import io.mirrorme.core.config.model.ProvidersConfig;
import io.mirrorme.core.engine.MirrorMeEngine;
import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.narrative.NarrativeSummaryGenerator;
import io.mirrorme.core.provider.DisabledProvider;
import io.mirrorme.core.provider.LlmProvider;
import io.mirrorme.core.provider.OllamaProvider;
import io.mirrorme.core.provider.OpenAiCompatProvider;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MirrorMeApplicationTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-31T12:00:00Z"), ZoneOffset.UTC);
    private static final List<BehaviorRecord> RECORDS = List.of(
        new BehaviorRecord("u1", "extension", "search", null, List.of("software", "tutorial"), null, null, null,
            null, null, null, Instant.parse("2025-03-31T09:00:00Z"), false, null)
    );

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
    void shouldBuildEveryProviderInFixedOrder() {
        ProvidersConfig providers = ProvidersConfig.defaults()
            .withEnvironment(Map.of("OPENAI_API_KEY", "sk-openai"));

        Map<String, LlmProvider> built = MirrorMeApplication.buildProviders(providers, 0.7);

        assertThat(built.keySet()).containsExactly("gemini", "openai", "deepseek", "groq", "together", "ollama");
        assertThat(built.get("openai")).isInstanceOf(OpenAiCompatProvider.class);
        assertThat(built.get("gemini")).isInstanceOf(DisabledProvider.class);
        assertThat(built.get("groq")).isInstanceOf(DisabledProvider.class);
        assertThat(built.get("ollama")).isInstanceOf(OllamaProvider.class);
    }

    @Test
    void shouldPreferConfiguredModelOverBuiltInDefault() {
        ProvidersConfig defaults = ProvidersConfig.defaults();
        ProvidersConfig custom = new ProvidersConfig(
            defaults.gemini(),
            defaults.openai(),
            defaults.deepseek(),
            new ProviderConfig("gsk", null, "llama-3.1-8b-instant", Map.of()),
            defaults.together(),
            defaults.ollama()
        );

        assertThat(MirrorMeApplication.defaultModel("groq", custom)).isEqualTo("llama-3.1-8b-instant");
        assertThat(MirrorMeApplication.defaultModel("groq", defaults)).isEqualTo("mixtral-8x7b-32768");
        assertThat(MirrorMeApplication.defaultModel("ollama", defaults)).isEqualTo("qwen2.5:7b");
        assertThat(MirrorMeApplication.defaultModel("gemini", defaults)).isEqualTo("gemini-1.5-flash-latest");
    }

    @Test
    void shouldGenerateSummaryThroughConfiguredProvider() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"choices": [{"message": {"content": "A hands-on learner."}}]}
                """));
        ProvidersConfig defaults = ProvidersConfig.defaults();
        MirrorMeConfig config = MirrorMeConfig.defaults()
            .withNarrative(new NarrativeSettings(true, "openai", "gpt-test", 150, 200, 5, 0.7));
        config = new MirrorMeConfig(config.analysis(), config.narrative(), new ProvidersConfig(
            defaults.gemini(),
            new ProviderConfig("sk-test", server.url("/v1").toString(), null, Map.of()),
            defaults.deepseek(),
            defaults.groq(),
            defaults.together(),
            defaults.ollama()
        ));

        MirrorMeEngine engine = MirrorMeApplication.buildEngine(config, Map.of(), CLOCK);

        assertThat(engine.analyze(RECORDS).personaSummary()).isEqualTo("A hands-on learner.");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getBody().readUtf8()).contains("\"model\":\"gpt-test\"");
    }

    @Test
    void shouldFallBackToTemplatesWhenNarrativeDisabledOrProviderUnknown() {
        MirrorMeConfig defaults = MirrorMeConfig.defaults();
        String template = new MirrorMeEngine(defaults.analysis(), NarrativeSummaryGenerator.templatesOnly(), CLOCK)
            .analyze(RECORDS)
            .personaSummary();

        MirrorMeEngine disabled = MirrorMeApplication.buildEngine(
            defaults.withNarrative(defaults.narrative().disabled()), Map.of(), CLOCK);
        MirrorMeEngine unknown = MirrorMeApplication.buildEngine(
            defaults.withNarrative(new NarrativeSettings(true, "anthropic", "claude", 150, 200, 5, 0.7)), Map.of(), CLOCK);

        assertThat(disabled.analyze(RECORDS).personaSummary()).isEqualTo(template);
        assertThat(unknown.analyze(RECORDS).personaSummary()).isEqualTo(template);
        assertThat(server.getRequestCount()).isZero();
    }
}
