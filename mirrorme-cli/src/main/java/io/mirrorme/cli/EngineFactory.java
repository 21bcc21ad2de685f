package io.mirrorme.cli;

import io.mirrorme.core.config.model.MirrorMeConfig;
import io.mirrorme.core.engine.MirrorMeEngine;

@FunctionalInterface
public interface EngineFactory {
    MirrorMeEngine create(MirrorMeConfig config);
}
