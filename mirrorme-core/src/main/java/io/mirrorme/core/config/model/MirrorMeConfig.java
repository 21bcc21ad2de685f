package io.mirrorme.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MirrorMeConfig(
    AnalysisSettings analysis,
    NarrativeSettings narrative,
    ProvidersConfig providers
) {

    public static MirrorMeConfig defaults() {
        return new MirrorMeConfig(
            AnalysisSettings.defaults(),
            NarrativeSettings.defaults(),
            ProvidersConfig.defaults()
        );
    }

    public MirrorMeConfig withAnalysis(AnalysisSettings settings) {
        return new MirrorMeConfig(settings, narrative, providers);
    }

    public MirrorMeConfig withNarrative(NarrativeSettings settings) {
        return new MirrorMeConfig(analysis, settings, providers);
    }
}
