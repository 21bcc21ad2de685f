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

@Command(name = "perceive", description = "Simulate how a given kind of observer perceives the user")
public final class PerceiveCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    RecordOptions records;

    @ArgGroup(exclusive = true, multiplicity = "1")
    Mode mode;

    static final class Mode {
        @Option(names = "--as", paramLabel = "PERCEIVER",
            description = "advertiser, content_feeder, data_broker, ai_system, recruiter, romantic_partner, "
                + "colleague, family_member; anything else is treated as general")
        String perceiver;

        @Option(names = "--compare", description = "Compare recruiter, romantic partner, colleague and family member")
        boolean compare;

        @Option(names = "--recommendations", description = "Aggregate recommendations and an action plan")
        boolean recommendations;
    }

    public PerceiveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MirrorMeConfig config = records.effectiveConfig(context);
            List<BehaviorRecord> loaded = records.load(context, config);
            MirrorMeEngine engine = context.engineFactory().create(config);
            if (mode.compare) {
                JsonOutput.print(engine.comparePerceptions(loaded));
            } else if (mode.recommendations) {
                JsonOutput.print(engine.perceptionRecommendations(loaded));
            } else {
                JsonOutput.print(engine.perceive(loaded, mode.perceiver));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Perceive failed: " + e.getMessage());
            return 1;
        }
    }
}
