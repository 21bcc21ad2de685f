package io.mirrorme.cli;

import io.mirrorme.core.config.model.MirrorMeConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(name = "bias", description = "Detect topics pushed disproportionately or evenly across platforms")
public final class BiasCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    RecordOptions records;

    public BiasCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MirrorMeConfig config = records.effectiveConfig(context);
            JsonOutput.print(context.engineFactory().create(config).topicBias(records.load(context, config)));
            return 0;
        } catch (Exception e) {
            System.err.println("Bias failed: " + e.getMessage());
            return 1;
        }
    }
}
