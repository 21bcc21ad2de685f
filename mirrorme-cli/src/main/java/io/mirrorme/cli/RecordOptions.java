package io.mirrorme.cli;

import io.mirrorme.core.config.model.AnalysisSettings;
import io.mirrorme.core.config.model.MirrorMeConfig;
import io.mirrorme.core.ingest.RecordFilter;
import io.mirrorme.core.model.BehaviorRecord;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine.Option;

/**
 * Input and filtering options shared by the analysis commands.
 */
final class RecordOptions {

    @Option(names = {"-i", "--input"}, required = true, description = "JSON array of behavior records")
    Path input;

    @Option(names = {"-u", "--user"}, description = "Only analyze records of this user")
    String userId;

    @Option(names = {"-d", "--days"}, description = "Trailing window in days (default from config)")
    Integer days;

    @Option(names = "--include-sensitive", description = "Include records flagged as sensitive")
    boolean includeSensitive;

    @Option(names = "--no-narrative", description = "Use template text instead of calling a language model")
    boolean noNarrative;

    /**
     * Config with the command-line overrides applied.
     */
    MirrorMeConfig effectiveConfig(CliContext context) throws IOException {
        MirrorMeConfig config = context.configService().load(context.configPath());
        AnalysisSettings analysis = config.analysis();
        if (days != null) {
            if (days <= 0) {
                throw new IllegalArgumentException("--days must be positive");
            }
            analysis = analysis.withWindowDays(days);
        }
        if (includeSensitive) {
            analysis = analysis.withIncludeSensitive(true);
        }
        config = config.withAnalysis(analysis);
        return noNarrative ? config.withNarrative(config.narrative().disabled()) : config;
    }

    List<BehaviorRecord> load(CliContext context, MirrorMeConfig config) throws IOException {
        List<BehaviorRecord> all = context.recordReader().read(input);
        AnalysisSettings analysis = config.analysis();
        return new RecordFilter(context.clock()).apply(all, userId, analysis.windowDays(), analysis.includeSensitive());
    }
}
