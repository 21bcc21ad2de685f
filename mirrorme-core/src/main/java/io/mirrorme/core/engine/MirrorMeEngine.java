package io.mirrorme.core.engine;

import io.mirrorme.core.bias.TopicBiasDetector;
import io.mirrorme.core.bias.TopicBiasReport;
import io.mirrorme.core.config.model.AnalysisSettings;
import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.narrative.NarrativeSummaryGenerator;
import io.mirrorme.core.perception.ContentSampler;
import io.mirrorme.core.perception.PerceiverType;
import io.mirrorme.core.perception.PerceptionAdvisor;
import io.mirrorme.core.perception.PerceptionComparison;
import io.mirrorme.core.perception.PerceptionInputs;
import io.mirrorme.core.perception.PerceptionInputsCollector;
import io.mirrorme.core.perception.PerceptionRecommendations;
import io.mirrorme.core.perception.PerceptionResult;
import io.mirrorme.core.perception.PerceptionSimulator;
import io.mirrorme.core.persona.DigitalAvatar;
import io.mirrorme.core.persona.PersonaAnalysis;
import io.mirrorme.core.persona.PersonaAnalyzer;
import io.mirrorme.core.persona.PersonaProfile;
import io.mirrorme.core.timeline.InfluenceTimeline;
import io.mirrorme.core.timeline.InfluenceTimelineAnalyzer;
import io.mirrorme.core.topic.TopicClassifier;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for every analysis. Built once by the caller and safe to reuse; it keeps no state between calls.
 *
 * <p>Records passed in are expected to have gone through {@link io.mirrorme.core.ingest.RecordFilter} already.
 * Timeline and bias analysis additionally apply the configured trailing window themselves.
 */
public final class MirrorMeEngine {
    private static final Logger LOG = LoggerFactory.getLogger(MirrorMeEngine.class);

    /** Perception works on at most this many of the newest records. */
    static final int PERCEPTION_RECORD_LIMIT = 1000;

    private final AnalysisSettings settings;
    private final NarrativeSummaryGenerator narrative;
    private final PersonaAnalyzer personaAnalyzer;
    private final InfluenceTimelineAnalyzer timelineAnalyzer;
    private final TopicBiasDetector biasDetector;
    private final PerceptionInputsCollector inputsCollector;
    private final PerceptionSimulator simulator = new PerceptionSimulator();
    private final PerceptionAdvisor advisor = new PerceptionAdvisor();

    public MirrorMeEngine(AnalysisSettings settings, NarrativeSummaryGenerator narrative, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.narrative = Objects.requireNonNull(narrative, "narrative must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        TopicClassifier classifier = new TopicClassifier();
        this.personaAnalyzer = new PersonaAnalyzer(classifier, narrative);
        this.timelineAnalyzer = new InfluenceTimelineAnalyzer(classifier, clock, settings.zoneId());
        this.biasDetector = new TopicBiasDetector(classifier, clock);
        this.inputsCollector = new PerceptionInputsCollector(
            classifier,
            new ContentSampler(settings.maxContentSamples(), settings.maxContentLength()),
            settings.zoneId()
        );
    }

    public AnalysisSettings settings() {
        return settings;
    }

    public PersonaAnalysis analyze(List<BehaviorRecord> records) {
        return personaAnalyzer.analyze(records);
    }

    public PersonaProfile profile(List<BehaviorRecord> records) {
        return personaAnalyzer.profile(records);
    }

    public List<DigitalAvatar> avatars(List<BehaviorRecord> records) {
        return personaAnalyzer.avatars(records);
    }

    public InfluenceTimeline timeline(List<BehaviorRecord> records) {
        return timelineAnalyzer.analyze(records, settings.windowDays());
    }

    public TopicBiasReport topicBias(List<BehaviorRecord> records) {
        return biasDetector.detect(records, settings.windowDays());
    }

    /**
     * Simulates one perceiver and attaches narrative feedback. Unknown names are treated as {@code general}.
     */
    public PerceptionResult perceive(List<BehaviorRecord> records, String perceiverName) {
        PerceiverType type = PerceiverType.fromName(perceiverName);
        List<BehaviorRecord> recent = newest(records);
        if (recent.isEmpty()) {
            return PerceptionResult.insufficientData(type);
        }
        PerceptionInputs inputs = inputsCollector.collect(recent, personaAnalyzer.profile(recent));
        return withFeedback(simulator.simulate(type, inputs));
    }

    public PerceptionComparison comparePerceptions(List<BehaviorRecord> records) {
        List<BehaviorRecord> recent = newest(records);
        if (recent.isEmpty()) {
            return PerceptionComparison.empty();
        }
        PerceptionInputs inputs = inputsCollector.collect(recent, personaAnalyzer.profile(recent));
        List<PerceptionResult> results = new ArrayList<>();
        for (PerceiverType type : PerceiverType.PERSONAL) {
            results.add(withFeedback(simulator.simulate(type, inputs)));
        }
        return PerceptionComparison.of(results, recent.size());
    }

    public PerceptionRecommendations perceptionRecommendations(List<BehaviorRecord> records) {
        List<BehaviorRecord> recent = newest(records);
        if (recent.isEmpty()) {
            return PerceptionRecommendations.dataCollection();
        }
        PerceptionInputs inputs = inputsCollector.collect(recent, personaAnalyzer.profile(recent));
        List<PerceptionResult> results = new ArrayList<>();
        for (PerceiverType type : PerceiverType.PERSONAL) {
            results.add(simulator.simulate(type, inputs));
        }
        return advisor.advise(results);
    }

    private PerceptionResult withFeedback(PerceptionResult result) {
        return result.withFeedback(narrative.perceptionFeedback(result));
    }

    private static List<BehaviorRecord> newest(List<BehaviorRecord> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        if (records.size() <= PERCEPTION_RECORD_LIMIT) {
            return records;
        }
        LOG.debug("Limiting perception to the newest {} of {} records", PERCEPTION_RECORD_LIMIT, records.size());
        List<BehaviorRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(BehaviorRecord::timestamp).reversed());
        return sorted.subList(0, PERCEPTION_RECORD_LIMIT);
    }
}
