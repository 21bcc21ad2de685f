package io.mirrorme.cli;

import io.mirrorme.core.config.ConfigService;
import io.mirrorme.core.ingest.BehaviorRecordReader;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    EngineFactory engineFactory,
    BehaviorRecordReader recordReader,
    Clock clock
) {
    public CliContext(ConfigService configService, Path configPath, EngineFactory engineFactory) {
        this(configService, configPath, engineFactory, new BehaviorRecordReader(), Clock.systemUTC());
    }
}
