package io.mirrorme.core.persona;

import io.mirrorme.core.distribution.Distribution;
import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.topic.Topic;
import io.mirrorme.core.topic.TopicCounts;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives trait tags from the aggregates. Each rule is independent; the result is sorted.
 */
public final class PersonalityTraitExtractor {

    public List<String> extract(
        TopicCounts topics,
        Distribution sentiment,
        Distribution political,
        List<BehaviorRecord> records
    ) {
        Set<String> traits = new TreeSet<>();

        if (topics.breadth() >= 5) {
            traits.add("curious");
        }
        if (topics.breadth() >= 3) {
            traits.add("diverse-interests");
        }

        if (sentiment.get("positive") > 0.6) {
            traits.add("optimistic");
        } else if (sentiment.get("negative") > 0.4) {
            traits.add("analytical");
        }

        if (political.get("left") > 0.4 || political.get("right") > 0.4) {
            traits.add("politically-engaged");
        }

        if (topics.count(Topic.TECHNOLOGY) > topics.total() * 0.3) {
            traits.add("tech-savvy");
        }
        if (topics.count(Topic.HEALTH) > 0) {
            traits.add("health-conscious");
        }
        if (topics.count(Topic.EDUCATION) > 0) {
            traits.add("learning-oriented");
        }

        long searches = records.stream().filter(BehaviorRecord::isSearch).count();
        if (searches > records.size() * 0.7) {
            traits.add("research-oriented");
        }
        long tweets = records.stream().filter(BehaviorRecord::isTweet).count();
        if (tweets > records.size() * 0.3) {
            traits.add("social-media-active");
        }

        return List.copyOf(traits);
    }
}
