package io.mirrorme.cli;

import io.mirrorme.core.config.model.MirrorMeConfig;
import io.mirrorme.core.engine.MirrorMeEngine;
import io.mirrorme.core.model.BehaviorRecord;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "analyze", description = "Build the persona analysis for a set of behavior records")
public final class AnalyzeCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    RecordOptions records;

    @ArgGroup(exclusive = true)
    View view;

    static final class View {
        @Option(names = "--profile", description = "Print the condensed persona profile only")
        boolean profile;

        @Option(names = "--avatars", description = "Print the digital avatars only")
        boolean avatars;
    }

    public AnalyzeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MirrorMeConfig config = records.effectiveConfig(context);
            List<BehaviorRecord> loaded = records.load(context, config);
            MirrorMeEngine engine = context.engineFactory().create(config);
            if (view != null && view.profile) {
                JsonOutput.print(engine.profile(loaded));
            } else if (view != null && view.avatars) {
                JsonOutput.print(engine.avatars(loaded));
            } else {
                JsonOutput.print(engine.analyze(loaded));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Analyze failed: " + e.getMessage());
            return 1;
        }
    }
}
