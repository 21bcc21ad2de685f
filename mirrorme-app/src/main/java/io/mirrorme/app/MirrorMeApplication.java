package io.mirrorme.app;

import io.mirrorme.cli.AnalyzeCommand;
import io.mirrorme.cli.BiasCommand;
import io.mirrorme.cli.CliContext;
import io.mirrorme.cli.InitCommand;
import io.mirrorme.cli.MirrorMeCliCommand;
import io.mirrorme.cli.PerceiveCommand;
import io.mirrorme.cli.StatusCommand;
import io.mirrorme.cli.TimelineCommand;
import io.mirrorme.core.config.ConfigPaths;
import io.mirrorme.core.config.ConfigService;
import io.mirrorme.core.config.model.MirrorMeConfig;
import io.mirrorme.core.config.model.NarrativeSettings;
import io.mirrorme.core.config.model.ProviderConfig;
import io.mirrorme.core.config.model.ProvidersConfig;
import io.mirrorme.core.engine.MirrorMeEngine;
import io.mirrorme.core.narrative.NarrativeSummaryGenerator;
import io.mirrorme.core.narrative.ProviderTextGenerator;
import io.mirrorme.core.provider.DisabledProvider;
import io.mirrorme.core.provider.FallbackLlmProvider;
import io.mirrorme.core.provider.GeminiProvider;
import io.mirrorme.core.provider.LlmProvider;
import io.mirrorme.core.provider.OllamaProvider;
import io.mirrorme.core.provider.OpenAiCompatProvider;
import io.mirrorme.core.provider.PinnedModelProvider;
import io.mirrorme.core.provider.ProviderRegistry;
import io.mirrorme.core.provider.ProviderRouter;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MirrorMeApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MirrorMeApplication.class);

    private MirrorMeApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Clock clock = Clock.systemUTC();
        CliContext context = new CliContext(
            configService,
            ConfigPaths.resolve(System.getenv("MIRRORME_CONFIG")),
            config -> buildEngine(config, System.getenv(), clock)
        );

        CommandLine commandLine = new CommandLine(new MirrorMeCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("analyze", new AnalyzeCommand(context));
        commandLine.addSubcommand("timeline", new TimelineCommand(context));
        commandLine.addSubcommand("bias", new BiasCommand(context));
        commandLine.addSubcommand("perceive", new PerceiveCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static MirrorMeEngine buildEngine(MirrorMeConfig config, Map<String, String> env, Clock clock) {
        NarrativeSettings narrative = config.narrative();
        if (!narrative.enabled()) {
            return new MirrorMeEngine(config.analysis(), NarrativeSummaryGenerator.templatesOnly(), clock);
        }

        Map<String, LlmProvider> providers = buildProviders(config.providers().withEnvironment(env), narrative.temperature());
        ProviderRegistry registry = new ProviderRegistry();
        providers.values().forEach(registry::register);

        LlmProvider primary;
        try {
            primary = new ProviderRouter(registry).resolve(narrative.provider(), narrative.model());
        } catch (IllegalArgumentException e) {
            LOG.warn("Narrative provider unavailable, using templates: {}", e.getMessage());
            return new MirrorMeEngine(config.analysis(), NarrativeSummaryGenerator.templatesOnly(), clock);
        }

        List<LlmProvider> chain = new ArrayList<>();
        chain.add(new PinnedModelProvider(primary, narrative.model()));
        providers.forEach((name, provider) -> {
            if (!name.equals(primary.name()) && !(provider instanceof DisabledProvider)) {
                chain.add(new PinnedModelProvider(provider, defaultModel(name, config.providers())));
            }
        });

        ProviderTextGenerator generator = new ProviderTextGenerator(
            new FallbackLlmProvider(primary.name(), chain),
            narrative.model(),
            Duration.ofSeconds(narrative.timeoutSeconds())
        );
        return new MirrorMeEngine(
            config.analysis(),
            new NarrativeSummaryGenerator(generator, narrative.maxTokens(), narrative.feedbackMaxTokens()),
            clock
        );
    }

    static Map<String, LlmProvider> buildProviders(ProvidersConfig providers, double temperature) {
        Map<String, LlmProvider> built = new LinkedHashMap<>();
        built.put("gemini", buildGeminiProvider(providers.gemini(), temperature));
        built.put("openai", buildOpenAiCompatProvider("openai", providers.openai(), "https://api.openai.com/v1", temperature));
        built.put("deepseek", buildOpenAiCompatProvider("deepseek", providers.deepseek(), "https://api.deepseek.com/v1", temperature));
        built.put("groq", buildOpenAiCompatProvider("groq", providers.groq(), "https://api.groq.com/openai/v1", temperature));
        built.put("together", buildOpenAiCompatProvider("together", providers.together(), "https://api.together.xyz/v1", temperature));
        built.put("ollama", new OllamaProvider("ollama", providers.ollama().apiBaseOr("http://localhost:11434"), temperature, 2));
        return built;
    }

    static String defaultModel(String providerName, ProvidersConfig providers) {
        ProviderConfig configured;
        String fallback;
        switch (providerName) {
            case "openai":
                configured = providers.openai();
                fallback = "gpt-3.5-turbo";
                break;
            case "deepseek":
                configured = providers.deepseek();
                fallback = "deepseek-chat";
                break;
            case "groq":
                configured = providers.groq();
                fallback = "mixtral-8x7b-32768";
                break;
            case "together":
                configured = providers.together();
                fallback = "Qwen/Qwen2.5-7B-Instruct-Turbo";
                break;
            case "ollama":
                configured = providers.ollama();
                fallback = "qwen2.5:7b";
                break;
            default:
                configured = providers.gemini();
                fallback = "gemini-1.5-flash-latest";
                break;
        }
        return configured == null || configured.model() == null || configured.model().isBlank() ? fallback : configured.model();
    }

    private static LlmProvider buildGeminiProvider(ProviderConfig providerConfig, double temperature) {
        if (providerConfig != null && providerConfig.configured()) {
            return new GeminiProvider(
                "gemini",
                providerConfig.apiKey(),
                providerConfig.apiBaseOr("https://generativelanguage.googleapis.com/v1beta"),
                temperature,
                3
            );
        }
        return new DisabledProvider("gemini", "missing API key");
    }

    private static LlmProvider buildOpenAiCompatProvider(
        String name,
        ProviderConfig providerConfig,
        String defaultBase,
        double temperature
    ) {
        if (providerConfig != null && providerConfig.configured()) {
            return new OpenAiCompatProvider(
                name,
                providerConfig.apiKey(),
                providerConfig.apiBaseOr(defaultBase),
                providerConfig.extraHeaders(),
                temperature,
                3
            );
        }
        return new DisabledProvider(name, "missing API key");
    }
}
