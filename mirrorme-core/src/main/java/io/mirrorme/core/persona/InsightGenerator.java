package io.mirrorme.core.persona;

import io.mirrorme.core.distribution.Distribution;
import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.platform.PlatformBehavior;
import io.mirrorme.core.topic.Topic;
import io.mirrorme.core.topic.TopicCounts;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

public final class InsightGenerator {

    public List<String> generate(
        TopicCounts topics,
        Distribution sentiment,
        Distribution political,
        List<BehaviorRecord> records,
        PlatformBehavior platforms
    ) {
        List<String> insights = new ArrayList<>();

        if (!topics.isEmpty()) {
            Topic top = topics.ranked().get(0);
            insights.add("Your strongest interest area is " + top.id() + " with " + topics.count(top) + " interactions");
        }

        if (sentiment.get("positive") > 0.7) {
            insights.add("You tend to engage positively with online content");
        } else if (sentiment.get("negative") > 0.4) {
            insights.add("You engage critically and analytically with content");
        }

        double left = political.get("left");
        double right = political.get("right");
        if (left > 0.5) {
            insights.add("Your content consumption shows a progressive/liberal political lean");
        } else if (right > 0.5) {
            insights.add("Your content consumption shows a conservative political lean");
        } else if (left > 0.3 || right > 0.3) {
            insights.add("You engage with political content from multiple perspectives");
        }

        platforms.twitterSummary().ifPresent(twitter -> {
            if (twitter.engagement("likes") > twitter.engagement("views") * 0.1) {
                insights.add("You're an active Twitter engager who likes content frequently");
            }
            if (twitter.engagement("retweets") > 0) {
                insights.add("You amplify content through retweets, showing influence behavior");
            }
        });
        platforms.youtubeSummary()
            .filter(youtube -> !youtube.topChannels().isEmpty())
            .ifPresent(youtube -> insights.add("Your most watched YouTube channel is " + youtube.topChannels().get(0).channel()));

        if (topics.breadth() >= 5) {
            insights.add("You have diverse interests spanning multiple domains");
        } else if (topics.breadth() <= 2) {
            insights.add("You have focused, specialized interests");
        }

        if (ratio(records, BehaviorRecord::isSearch) > 0.6) {
            insights.add("You're a research-oriented user who actively searches for information");
        }
        if (ratio(records, BehaviorRecord::isTweet) > 0.3) {
            insights.add("You're highly active on social media platforms");
        }
        return insights;
    }

    private static double ratio(List<BehaviorRecord> records, Predicate<BehaviorRecord> filter) {
        if (records.isEmpty()) {
            return 0.0;
        }
        return (double) records.stream().filter(filter).count() / records.size();
    }
}
