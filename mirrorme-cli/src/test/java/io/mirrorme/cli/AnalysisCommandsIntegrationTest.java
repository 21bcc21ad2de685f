package io.mirrorme.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.mirrorme.core.config.ConfigService;
import io.mirrorme.core.engine.MirrorMeEngine;
import io.mirrorme.core.ingest.BehaviorRecordReader;
import io.mirrorme.core.narrative.NarrativeSummaryGenerator;
import io.mirrorme.core.narrative.ProviderTextGenerator;
import io.mirrorme.core.provider.OpenAiCompatProvider;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.Callable;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class AnalysisCommandsIntegrationTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-31T12:00:00Z"), ZoneOffset.UTC);

    private MockWebServer server;

    @TempDir
    Path tempDir;

    private Path configPath;
    private Path recordsPath;
    private CliContext context;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        configPath = tempDir.resolve("config.json");
        recordsPath = tempDir.resolve("records.json");
        Files.writeString(recordsPath, """
            [
              {"user_id": "u1", "behavior_type": "search", "keywords": ["software", "career"],
               "sentiment": "positive", "timestamp": "2025-03-30T20:00:00Z"},
              {"user_id": "u1", "behavior_type": "tweet_view", "keywords": ["news"], "sentiment": "negative",
               "content": "breaking news, write to me at someone@example.com", "timestamp": "2025-03-29T10:00:00Z"},
              {"user_id": "u1", "behavior_type": "visit", "keywords": ["travel"], "is_sensitive": true,
               "timestamp": "2025-03-28T10:00:00Z"},
              {"user_id": "u2", "behavior_type": "search", "keywords": ["crypto"], "timestamp": "2025-03-30T09:00:00Z"}
            ]
            """, StandardCharsets.UTF_8);

        OpenAiCompatProvider provider =
            new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of(), 0.7, 1);
        EngineFactory factory = config -> new MirrorMeEngine(
            config.analysis(),
            config.narrative().enabled()
                ? new NarrativeSummaryGenerator(new ProviderTextGenerator(provider, "gpt-test", Duration.ofSeconds(5)))
                : NarrativeSummaryGenerator.templatesOnly(),
            CLOCK
        );
        context = new CliContext(new ConfigService(), configPath, factory, new BehaviorRecordReader(), CLOCK);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void analyzeShouldPrintPersonaWithGeneratedSummary() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "You are a curious builder." } }
                  ]
                }
                """));

        Run run = run(new AnalyzeCommand(context), "-i", recordsPath.toString(), "-u", "u1");

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out())
            .contains("\"personaSummary\" : \"You are a curious builder.\"")
            .contains("\"dataPointsAnalyzed\" : 2")
            .doesNotContain("crypto");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void analyzeShouldHonorSensitiveAndProfileFlags() throws Exception {
        Run run = run(new AnalyzeCommand(context),
            "-i", recordsPath.toString(), "-u", "u1", "--include-sensitive", "--no-narrative", "--profile");

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out())
            .contains("\"dataPointsCount\" : 3")
            .contains("lifestyle")
            .doesNotContain("digitalAvatars");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void perceiveCompareShouldUseTemplatesWithoutNarrative() throws Exception {
        Run run = run(new PerceiveCommand(context), "-i", recordsPath.toString(), "--compare", "--no-narrative");

        assertThat(run.code()).isEqualTo(0);
        assertThat(run.out())
            .contains("\"recruiter\"")
            .contains("\"family_member\"")
            .contains("\"averageScore\"")
            .contains("\"feedback\"");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void perceiveShouldRequireExactlyOneMode() throws Exception {
        Run run = run(new PerceiveCommand(context), "-i", recordsPath.toString());

        assertThat(run.code()).isEqualTo(2);
    }

    @Test
    void timelineAndBiasShouldPrintReports() throws Exception {
        Run timeline = run(new TimelineCommand(context), "-i", recordsPath.toString(), "--days", "7");
        Run bias = run(new BiasCommand(context), "-i", recordsPath.toString(), "--days", "7");

        assertThat(timeline.code()).isEqualTo(0);
        assertThat(timeline.out()).contains("\"timelineData\"").contains("\"analysisPeriodDays\" : 7");
        assertThat(bias.code()).isEqualTo(0);
        assertThat(bias.out()).contains("\"algorithmicPushDetected\"").contains("\"totalInteractionsAnalyzed\" : 3");
    }

    @Test
    void shouldRejectNonPositiveWindow() throws Exception {
        Run run = run(new BiasCommand(context), "-i", recordsPath.toString(), "--days", "0");

        assertThat(run.code()).isEqualTo(1);
        assertThat(run.err()).contains("Bias failed: --days must be positive");
    }

    @Test
    void shouldReportMissingInputFile() throws Exception {
        Run run = run(new TimelineCommand(context), "-i", tempDir.resolve("missing.json").toString());

        assertThat(run.code()).isEqualTo(1);
        assertThat(run.err()).startsWith("Timeline failed:");
    }

    @Test
    void initThenStatusShouldDescribeConfig() throws Exception {
        Run init = run(new InitCommand(context));
        Run status = run(new StatusCommand(context));

        assertThat(init.code()).isEqualTo(0);
        assertThat(init.out()).contains("Created config: " + configPath);
        assertThat(Files.exists(configPath)).isTrue();
        assertThat(status.code()).isEqualTo(0);
        assertThat(status.out())
            .contains("Config exists: true")
            .contains("Window days: 30")
            .contains("Narrative provider: gemini");
    }

    private static Run run(Callable<Integer> command, String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = new CommandLine(command).execute(args);
            return new Run(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record Run(int code, String out, String err) {
    }
}
