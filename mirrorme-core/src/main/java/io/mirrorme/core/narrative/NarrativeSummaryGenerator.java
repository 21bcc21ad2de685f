package io.mirrorme.core.narrative;

import io.mirrorme.core.distribution.Distribution;
import io.mirrorme.core.model.ChatMessage;
import io.mirrorme.core.perception.PerceptionResult;
import io.mirrorme.core.topic.TopicCounts;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces persona summaries and perception feedback. Generation failures fall back to fixed templates,
 * so neither method throws.
 */
public final class NarrativeSummaryGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(NarrativeSummaryGenerator.class);

    static final String SUMMARY_SYSTEM_PROMPT =
        "You are a thoughtful digital behavior analyst who creates respectful, insightful personality summaries.";
    static final String FEEDBACK_SYSTEM_PROMPT =
        "You are a thoughtful digital behavior analyst who provides constructive, actionable feedback on online presence.";
    static final String GENERIC_FEEDBACK =
        "Your online presence shows authentic engagement with diverse topics. Consider your audience when posting "
            + "and maintain a balance between personal expression and public perception.";

    private final TextGenerator generator;
    private final int summaryMaxTokens;
    private final int feedbackMaxTokens;

    public NarrativeSummaryGenerator(TextGenerator generator) {
        this(generator, 150, 200);
    }

    public NarrativeSummaryGenerator(TextGenerator generator, int summaryMaxTokens, int feedbackMaxTokens) {
        this.generator = generator;
        this.summaryMaxTokens = summaryMaxTokens;
        this.feedbackMaxTokens = feedbackMaxTokens;
    }

    /**
     * A generator that never calls out and always answers with the templates.
     */
    public static NarrativeSummaryGenerator templatesOnly() {
        return new NarrativeSummaryGenerator(null);
    }

    public String personaSummary(TopicCounts topics, Distribution sentiment, int totalInteractions) {
        List<ChatMessage> messages = List.of(
            ChatMessage.system(SUMMARY_SYSTEM_PROMPT),
            ChatMessage.user(summaryPrompt(topics, sentiment, totalInteractions))
        );
        return compose(call(messages, summaryMaxTokens), fallbackSummary(topics, sentiment));
    }

    public String perceptionFeedback(PerceptionResult result) {
        List<ChatMessage> messages = List.of(
            ChatMessage.system(FEEDBACK_SYSTEM_PROMPT),
            ChatMessage.user(feedbackPrompt(result))
        );
        return compose(call(messages, feedbackMaxTokens), fallbackFeedback(result));
    }

    /**
     * Generated text when it succeeded, otherwise the fallback.
     */
    public static String compose(GenerationResult result, String fallback) {
        if (result != null && result.succeeded()) {
            return result.text();
        }
        return fallback;
    }

    private GenerationResult call(List<ChatMessage> messages, int maxTokens) {
        if (generator == null) {
            return GenerationResult.failure("text generation disabled");
        }
        try {
            GenerationResult result = generator.generate(messages, maxTokens);
            if (result != null && !result.succeeded()) {
                LOG.info("Narrative generation unavailable, using template: {}", result.failureReason());
            }
            return result;
        } catch (RuntimeException e) {
            LOG.warn("Narrative generation failed, using template", e);
            return GenerationResult.failure(e.getMessage());
        }
    }

    static String summaryPrompt(TopicCounts topics, Distribution sentiment, int totalInteractions) {
        String interests = String.join(", ", topics.topIds(5));
        String tone = sentiment.asMap().entrySet().stream()
            .map(e -> e.getKey() + ": " + String.format(Locale.ROOT, "%.2f", e.getValue()))
            .collect(Collectors.joining(", "));
        return "Based on the following digital behavior data, create a thoughtful persona summary:\n\n"
            + "Top interests: " + interests + "\n"
            + "Emotional tone: " + tone + "\n"
            + "Total interactions: " + totalInteractions + "\n\n"
            + "Write a 2-3 sentence summary that captures this person's digital personality in a respectful, "
            + "insightful way. Focus on their curiosity patterns and interests, not judgments.\n\n"
            + "Example: \"You appear to be someone with a strong curiosity about technology and health, often "
            + "exploring topics with a balanced emotional approach. Your digital behavior suggests an analytical "
            + "mindset with interests spanning both practical and creative domains.\"\n";
    }

    static String fallbackSummary(TopicCounts topics, Distribution sentiment) {
        List<String> top = topics.topIds(3);
        String dominant = sentiment == null ? "balanced" : sentiment.dominant();
        if (top.size() >= 2) {
            return "Your digital behavior shows strong interests in " + top.get(0) + " and " + top.get(1)
                + ", with a generally " + dominant + " approach to online exploration. "
                + "You demonstrate curiosity across multiple domains.";
        }
        if (top.size() == 1) {
            return "You show focused interest in " + top.get(0) + ", with a " + dominant
                + " approach to digital exploration.";
        }
        return "Your digital behavior shows diverse interests and a balanced approach to online exploration.";
    }

    static String feedbackPrompt(PerceptionResult result) {
        String score = "Score: " + result.score() + "/100\n";
        switch (result.perceiverType()) {
            case ADVERTISER:
                return "Based on this person's digital behavior analysis, provide feedback on their advertising profile:\n\n"
                    + score
                    + line("Valuable Signals", result, "valuable_signals")
                    + line("Ad Resistance", result, "ad_resistance")
                    + focus(
                        "How valuable this person is for targeted advertising",
                        "What types of ads would be most effective",
                        "Any challenges in reaching this audience")
                    + "Be analytical and marketing-focused.";
            case CONTENT_FEEDER:
                return "Based on this person's digital behavior analysis, provide feedback on their content algorithm profile:\n\n"
                    + score
                    + line("Engagement Drivers", result, "engagement_drivers")
                    + line("Algorithm Challenges", result, "algorithm_challenges")
                    + focus(
                        "How predictable their content preferences are",
                        "What content recommendation strategies would work best",
                        "Any algorithmic challenges in serving relevant content")
                    + "Be technical and algorithm-focused.";
            case DATA_BROKER:
                return "Based on this person's digital behavior analysis, provide feedback on their data broker profile:\n\n"
                    + score
                    + line("Profitable Traits", result, "profitable_traits")
                    + line("Data Gaps", result, "data_gaps")
                    + focus(
                        "How valuable their data profile is for resale",
                        "What data points make them attractive to buyers",
                        "Any limitations in data collection or reliability")
                    + "Be business and data-focused.";
            case AI_SYSTEM:
                return "Based on this person's digital behavior analysis, provide feedback on their AI system profile:\n\n"
                    + score
                    + line("AI Advantages", result, "ai_advantages")
                    + line("AI Limitations", result, "ai_limitations")
                    + focus(
                        "How well AI systems can model and predict their behavior",
                        "What makes them easy or difficult for AI to understand",
                        "Any data quality or pattern recognition challenges")
                    + "Be technical and AI-focused.";
            case RECRUITER:
                return "Based on this person's digital behavior analysis, provide specific feedback on how they appear to potential employers:\n\n"
                    + score
                    + line("Strengths", result, "strengths")
                    + line("Concerns", result, "concerns")
                    + line("Red Flags", result, "red_flags")
                    + "\nWrite a 2-3 sentence professional assessment focusing on:\n"
                    + "1. What impression this person gives to recruiters\n"
                    + "2. Specific suggestions for improving their professional online presence\n"
                    + "3. Key strengths they should highlight more\n\n"
                    + "Be constructive and actionable.";
            case ROMANTIC_PARTNER:
                return "Based on this person's digital behavior analysis, provide feedback on how they appear to potential romantic partners:\n\n"
                    + score
                    + line("Attractive Qualities", result, "attractive_qualities")
                    + line("Concerns", result, "potential_concerns")
                    + line("Red Flags", result, "red_flags")
                    + focus(
                        "What dating impression this person creates online",
                        "How to present themselves more attractively while staying authentic",
                        "Any behaviors that might be deterring potential partners")
                    + "Be respectful and helpful.";
            default:
                String impression = result.overallImpression() == null ? "neutral" : result.overallImpression();
                return "Based on this person's digital behavior, provide general feedback on their online presence:\n\n"
                    + score
                    + "Overall impression: " + impression + "\n\n"
                    + "Write 2-3 sentences about how they come across online and suggestions for improvement.";
        }
    }

    private static String line(String label, PerceptionResult result, String bucket) {
        return label + ": " + String.join(", ", result.findings(bucket)) + "\n";
    }

    private static String focus(String first, String second, String third) {
        return "\nWrite a 2-3 sentence assessment focusing on:\n"
            + "1. " + first + "\n"
            + "2. " + second + "\n"
            + "3. " + third + "\n\n";
    }

    static String fallbackFeedback(PerceptionResult result) {
        String[] tiers = FALLBACK_TIERS.get(result.perceiverType().id());
        if (tiers == null) {
            return GENERIC_FEEDBACK;
        }
        int score = result.score();
        if (score >= 70) {
            return tiers[0];
        }
        return score >= 50 ? tiers[1] : tiers[2];
    }

    // high (>= 70), moderate (>= 50), low
    private static final Map<String, String[]> FALLBACK_TIERS = Map.of(
        "advertiser", new String[] {
            "Your digital behavior shows strong consumer signals that are highly valuable for targeted advertising. "
                + "Your diverse interests and predictable patterns make you an attractive target for marketers.",
            "Your online presence provides moderate value for advertisers. Consider diversifying your digital "
                + "engagement to increase or decrease your advertising profile visibility.",
            "Your digital behavior patterns show strong resistance to advertising targeting. Your privacy-conscious "
                + "behavior and unpredictable patterns make you a challenging audience to reach."
        },
        "content_feeder", new String[] {
            "Your content consumption patterns are highly predictable, making you an ideal user for content "
                + "recommendation algorithms. Your consistent preferences enable accurate content targeting.",
            "Your content behavior is moderately predictable for recommendation algorithms. Some patterns are clear "
                + "while others present targeting challenges for content systems.",
            "Your content consumption patterns are unpredictable and challenging for recommendation algorithms. "
                + "Your diverse and inconsistent preferences make content targeting difficult."
        },
        "data_broker", new String[] {
            "Your digital profile is highly valuable to data brokers due to rich behavioral patterns and valuable "
                + "demographic signals. Your data would command premium prices in data markets.",
            "Your digital profile has moderate value for data brokers. Some valuable signals are present but gaps "
                + "limit the overall market value of your information.",
            "Your digital profile has limited value for data brokers due to privacy-conscious behavior and "
                + "fragmented data patterns. Your information would be difficult to monetize."
        },
        "ai_system", new String[] {
            "AI systems can model your behavior with high confidence due to consistent patterns and rich data. "
                + "Your digital footprint enables accurate predictions and classifications.",
            "AI systems have moderate confidence in modeling your behavior. Some patterns are clear while others "
                + "present challenges for machine learning algorithms.",
            "AI systems struggle to model your behavior due to inconsistent patterns or limited data. Your digital "
                + "footprint presents significant challenges for algorithmic analysis."
        },
        "recruiter", new String[] {
            "Your professional online presence shows strong industry engagement and positive communication. "
                + "Continue sharing expertise and professional insights to maintain this excellent impression.",
            "Your online presence is professionally acceptable but could be enhanced. Consider sharing more industry "
                + "insights and reducing personal content during work hours.",
            "Your online presence may raise concerns for recruiters. Focus on professional content, avoid "
                + "controversial topics, and showcase your expertise more prominently."
        },
        "romantic_partner", new String[] {
            "Your online presence suggests you're a positive, interesting person who would be an engaging partner. "
                + "Your balanced interests and discrete approach to personal matters are attractive qualities.",
            "Your online presence is generally appealing but could be more attractive to potential partners. "
                + "Consider sharing more positive content and diverse interests while maintaining authenticity.",
            "Your online behavior may not be creating the best impression for potential romantic partners. Focus on "
                + "positive content, reduce controversial posts, and show your fun, creative side more."
        }
    );
}
