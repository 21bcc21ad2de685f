package io.mirrorme.core.perception;

import io.mirrorme.core.distribution.DistributionAnalyzer;
import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.persona.PersonaProfile;
import io.mirrorme.core.platform.Platform;
import io.mirrorme.core.topic.TopicClassifier;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Single pass over the records producing the {@link PerceptionInputs} every strategy shares.
 */
public final class PerceptionInputsCollector {
    private final TopicClassifier classifier;
    private final ContentSampler sampler;
    private final ZoneId zone;

    public PerceptionInputsCollector(TopicClassifier classifier, ContentSampler sampler, ZoneId zone) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public PerceptionInputs collect(List<BehaviorRecord> records, PersonaProfile profile) {
        List<String> keywords = new ArrayList<>();
        Map<Platform, Integer> platformActivity = new EnumMap<>(Platform.class);
        Map<Integer, Integer> hours = new TreeMap<>();
        int mobile = 0;

        for (BehaviorRecord record : records) {
            keywords.addAll(record.keywords());
            platformActivity.merge(Platform.of(record), 1, Integer::sum);
            hours.merge(record.timestamp().atZone(zone).getHour(), 1, Integer::sum);
            if (record.source() != null && record.source().toLowerCase(Locale.ROOT).contains("mobile")) {
                mobile++;
            }
        }

        return new PerceptionInputs(
            classifier.classify(keywords),
            DistributionAnalyzer.SENTIMENT.analyze(records),
            DistributionAnalyzer.POLITICAL_TILT.analyze(records),
            platformActivity,
            hours,
            sampler.sample(records),
            records.isEmpty() ? 0.0 : (double) mobile / records.size(),
            profile
        );
    }
}
