package io.mirrorme.cli;

import io.mirrorme.core.config.model.MirrorMeConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(name = "timeline", description = "Show day-by-day exposure and detected algorithmic influence")
public final class TimelineCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    RecordOptions records;

    public TimelineCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MirrorMeConfig config = records.effectiveConfig(context);
            JsonOutput.print(context.engineFactory().create(config).timeline(records.load(context, config)));
            return 0;
        } catch (Exception e) {
            System.err.println("Timeline failed: " + e.getMessage());
            return 1;
        }
    }
}
