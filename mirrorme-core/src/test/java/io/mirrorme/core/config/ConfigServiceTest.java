package io.mirrorme.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.mirrorme.core.config.model.AnalysisSettings;
import io.mirrorme.core.config.model.MirrorMeConfig;
import io.mirrorme.core.config.model.ProvidersConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        MirrorMeConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.analysis().windowDays()).isEqualTo(30);
        assertThat(config.analysis().includeSensitive()).isFalse();
        assertThat(config.narrative().provider()).isEqualTo("gemini");
        assertThat(config.narrative().model()).isEqualTo("gemini-1.5-flash-latest");
        assertThat(config.providers().gemini().configured()).isFalse();
        assertThat(config.providers().ollama().apiBase()).isEqualTo("http://localhost:11434");
    }

    @Test
    void shouldMergeDefaultsWithExistingValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "analysis": {
                "windowDays": 7,
                "zone": "Europe/Berlin"
              },
              "narrative": {
                "provider": "groq"
              },
              "providers": {
                "groq": {
                  "apiKey": "gsk-test"
                }
              },
              "unknownSection": true
            }
            """);

        MirrorMeConfig config = service.load(configPath);

        assertThat(config.analysis().windowDays()).isEqualTo(7);
        assertThat(config.analysis().maxContentSamples()).isEqualTo(50);
        assertThat(config.analysis().zoneId()).isEqualTo(ZoneId.of("Europe/Berlin"));
        assertThat(config.narrative().provider()).isEqualTo("groq");
        assertThat(config.narrative().maxTokens()).isEqualTo(150);
        assertThat(config.providers().groq().apiKey()).isEqualTo("gsk-test");
        assertThat(config.providers().openai().apiKey()).isEqualTo("");
    }

    @Test
    void snakeCaseKeysShouldOverrideDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "analysis": { "days_back": 14, "include_sensitive": true },
              "narrative": { "max_tokens": 90 },
              "providers": {
                "together": {
                  "api_key": "tg-test",
                  "url": "http://together.local/v1",
                  "extra_headers": { "X_Team": "growth" }
                }
              }
            }
            """);

        MirrorMeConfig config = service.load(configPath);

        assertThat(config.analysis().windowDays()).isEqualTo(14);
        assertThat(config.analysis().includeSensitive()).isTrue();
        assertThat(config.narrative().maxTokens()).isEqualTo(90);
        assertThat(config.providers().together().apiKey()).isEqualTo("tg-test");
        assertThat(config.providers().together().apiBase()).isEqualTo("http://together.local/v1");
        assertThat(config.providers().together().extraHeaders()).containsEntry("X_Team", "growth");
        assertThat(ConfigService.camelCase("feedback_max_tokens")).isEqualTo("feedbackMaxTokens");
    }

    @Test
    void initShouldCreateThenRefreshThenOverwrite() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".mirrorme/config.json");

        InitResult created = service.init(configPath, false);
        assertThat(created.createdConfig()).isTrue();
        assertThat(Files.exists(configPath)).isTrue();

        MirrorMeConfig custom = service.load(configPath)
            .withAnalysis(AnalysisSettings.defaults().withWindowDays(14));
        service.save(configPath, custom);

        InitResult refreshed = service.init(configPath, false);
        assertThat(refreshed.createdConfig()).isFalse();
        assertThat(refreshed.overwrittenConfig()).isFalse();
        assertThat(service.load(configPath).analysis().windowDays()).isEqualTo(14);

        InitResult overwritten = service.init(configPath, true);
        assertThat(overwritten.overwrittenConfig()).isTrue();
        assertThat(service.load(configPath).analysis().windowDays()).isEqualTo(30);
    }

    @Test
    void unknownZoneShouldFallBackToUtc() {
        AnalysisSettings settings = new AnalysisSettings(30, false, "Mars/Olympus", 50, 280);

        assertThat(settings.zoneId()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void environmentShouldFillOnlyBlankKeys() {
        ProvidersConfig providers = new ProvidersConfig(
            ProvidersConfig.defaults().gemini().withApiKey("from-file"),
            ProvidersConfig.defaults().openai(),
            ProvidersConfig.defaults().deepseek(),
            ProvidersConfig.defaults().groq(),
            ProvidersConfig.defaults().together(),
            ProvidersConfig.defaults().ollama()
        );

        ProvidersConfig resolved = providers.withEnvironment(Map.of(
            "GEMINI_API_KEY", "from-env",
            "OPENAI_API_KEY", "sk-env",
            "OLLAMA_URL", "http://gpu-box:11434"
        ));

        assertThat(resolved.gemini().apiKey()).isEqualTo("from-file");
        assertThat(resolved.openai().apiKey()).isEqualTo("sk-env");
        assertThat(resolved.groq().configured()).isFalse();
        assertThat(resolved.ollama().apiBase()).isEqualTo("http://gpu-box:11434");
    }

    @Test
    void shouldExpandHomeInConfigPaths() {
        Path home = Path.of(System.getProperty("user.home"));

        assertThat(ConfigPaths.resolve("~/custom/config.json")).isEqualTo(home.resolve("custom/config.json"));
        assertThat(ConfigPaths.resolve(" ")).isEqualTo(ConfigPaths.defaultConfigPath());
        assertThat(ConfigPaths.resolve("/etc/mirrorme.json")).isEqualTo(Path.of("/etc/mirrorme.json"));
    }
}
