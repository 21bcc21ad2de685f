package io.mirrorme.core.timeline;

import java.util.List;

public record AlgorithmInfluence(
    boolean biasReinforcementDetected,
    String politicalPolarizationTrend,
    boolean sentimentManipulationDetected,
    List<EchoChamber> topicEchoChambers,
    List<PlatformBiasWarning> platformBiasWarnings,
    List<String> recommendations
) {
    public static final String STABLE = "stable";
    public static final String INCREASING = "increasing";
    public static final String MODERATING = "moderating";

    public AlgorithmInfluence {
        topicEchoChambers = topicEchoChambers == null ? List.of() : List.copyOf(topicEchoChambers);
        platformBiasWarnings = platformBiasWarnings == null ? List.of() : List.copyOf(platformBiasWarnings);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static AlgorithmInfluence none() {
        return new AlgorithmInfluence(false, STABLE, false, List.of(), List.of(), List.of());
    }

    static AlgorithmInfluence noData() {
        return new AlgorithmInfluence(
            false,
            STABLE,
            false,
            List.of(),
            List.of(),
            List.of("Collect more browsing data to detect algorithmic influence patterns")
        );
    }
}
