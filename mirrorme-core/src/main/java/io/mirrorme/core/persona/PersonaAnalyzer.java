package io.mirrorme.core.persona;

import io.mirrorme.core.distribution.Distribution;
import io.mirrorme.core.distribution.DistributionAnalyzer;
import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.narrative.NarrativeSummaryGenerator;
import io.mirrorme.core.network.InterestNetwork;
import io.mirrorme.core.network.InterestNetworkBuilder;
import io.mirrorme.core.platform.PlatformBehavior;
import io.mirrorme.core.platform.PlatformBehaviorAnalyzer;
import io.mirrorme.core.topic.TopicClassifier;
import io.mirrorme.core.topic.TopicCounts;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes topic, distribution, platform, network, trait, avatar and insight analysis into a persona.
 * Records are expected to be filtered already.
 */
public final class PersonaAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(PersonaAnalyzer.class);
    static final int TOP_TOPIC_LIMIT = 10;

    private final TopicClassifier classifier;
    private final PlatformBehaviorAnalyzer platformAnalyzer = new PlatformBehaviorAnalyzer();
    private final InterestNetworkBuilder networkBuilder = new InterestNetworkBuilder();
    private final PersonalityTraitExtractor traitExtractor = new PersonalityTraitExtractor();
    private final InsightGenerator insightGenerator = new InsightGenerator();
    private final DigitalAvatarGenerator avatarGenerator;
    private final NarrativeSummaryGenerator narrative;

    public PersonaAnalyzer(TopicClassifier classifier, NarrativeSummaryGenerator narrative) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.narrative = Objects.requireNonNull(narrative, "narrative must not be null");
        this.avatarGenerator = new DigitalAvatarGenerator(classifier);
    }

    public PersonaAnalysis analyze(List<BehaviorRecord> records) {
        if (records == null || records.isEmpty()) {
            return PersonaAnalysis.empty();
        }
        LOG.debug("Analyzing persona over {} records", records.size());

        TopicCounts topics = classifier.classify(BehaviorRecord.keywordsOf(records));
        Distribution sentiment = DistributionAnalyzer.SENTIMENT.analyze(records);
        Distribution political = DistributionAnalyzer.POLITICAL_TILT.analyze(records);
        List<String> traits = traitExtractor.extract(topics, sentiment, political, records);
        InterestNetwork network = networkBuilder.build(topics);
        PlatformBehavior platforms = platformAnalyzer.analyze(records);
        List<DigitalAvatar> avatars = avatarGenerator.generate(records, platforms);

        return new PersonaAnalysis(
            narrative.personaSummary(topics, sentiment, topics.total()),
            topics.topIds(TOP_TOPIC_LIMIT),
            topics,
            traits,
            sentiment,
            political,
            platforms,
            avatars,
            network,
            insightGenerator.generate(topics, sentiment, political, records, platforms),
            EngagementPatterns.of(records),
            records.size()
        );
    }

    public PersonaProfile profile(List<BehaviorRecord> records) {
        if (records == null || records.isEmpty()) {
            return PersonaProfile.empty();
        }
        TopicCounts topics = classifier.classify(BehaviorRecord.keywordsOf(records));
        Distribution sentiment = DistributionAnalyzer.SENTIMENT.analyze(records);
        Distribution political = DistributionAnalyzer.POLITICAL_TILT.analyze(records);

        return new PersonaProfile(
            topics.topIds(TOP_TOPIC_LIMIT),
            sentiment,
            networkBuilder.build(topics),
            political,
            narrative.personaSummary(topics, sentiment, topics.total()),
            traitExtractor.extract(topics, sentiment, political, records),
            records.size()
        );
    }

    public List<DigitalAvatar> avatars(List<BehaviorRecord> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        return avatarGenerator.generate(records, platformAnalyzer.analyze(records));
    }
}
