package io.mirrorme.cli;

import io.mirrorme.core.config.model.MirrorMeConfig;
import io.mirrorme.core.config.model.ProvidersConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and provider status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MirrorMeConfig config = context.configService().load(context.configPath());
            ProvidersConfig providers = config.providers().withEnvironment(System.getenv());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Window days: " + config.analysis().windowDays());
            System.out.println("Include sensitive: " + config.analysis().includeSensitive());
            System.out.println("Zone: " + config.analysis().zoneId());
            System.out.println("Narrative enabled: " + config.narrative().enabled());
            System.out.println("Narrative provider: " + config.narrative().provider());
            System.out.println("Narrative model: " + config.narrative().model());
            System.out.println("Gemini configured: " + providers.gemini().configured());
            System.out.println("OpenAI configured: " + providers.openai().configured());
            System.out.println("DeepSeek configured: " + providers.deepseek().configured());
            System.out.println("Groq configured: " + providers.groq().configured());
            System.out.println("Together configured: " + providers.together().configured());
            System.out.println("Ollama base: " + providers.ollama().apiBaseOr("http://localhost:11434"));
            return 0;
        } catch (Exception e) {
            System.err.println("Status failed: " + e.getMessage());
            return 1;
        }
    }
}
