package io.mirrorme.core.persona;

import static io.mirrorme.core.RecordFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.platform.PlatformBehaviorAnalyzer;
import io.mirrorme.core.topic.TopicClassifier;
import java.util.List;
import org.junit.jupiter.api.Test;

class DigitalAvatarGeneratorTest {

    private final DigitalAvatarGenerator generator = new DigitalAvatarGenerator(new TopicClassifier());
    private final PlatformBehaviorAnalyzer platforms = new PlatformBehaviorAnalyzer();

    @Test
    void shouldOrderAvatarsByStrength() {
        List<BehaviorRecord> records = List.of(
            record("search").keywords("budget").build(),
            record("search").keywords("crypto").build(),
            record("tweet_like").build(),
            record("tweet_view").build(),
            record("tweet_view").build(),
            record("youtube_video_watch").video("v1", "Tech Daily").build(),
            record("visit").keywords("travel", "career").build(),
            record("engagement").keywords("music").build()
        );

        List<DigitalAvatar> avatars = generator.generate(records, platforms.analyze(records));

        assertThat(avatars).hasSizeLessThanOrEqualTo(DigitalAvatarGenerator.MAX_AVATARS);
        assertThat(avatars).extracting(DigitalAvatar::name).containsExactly(
            "The Social Connector",
            "The Searcher",
            "The Explorer",
            "The Content Consumer",
            "The Professional"
        );
        for (int i = 0; i < avatars.size(); i++) {
            assertThat(avatars.get(i).strength()).isBetween(0.0, 1.0);
            if (i > 0) {
                assertThat(avatars.get(i).strength()).isLessThanOrEqualTo(avatars.get(i - 1).strength());
            }
        }

        DigitalAvatar social = avatars.get(0);
        assertThat(social.strength()).isCloseTo(3 / 8.0, within(1e-9));
        assertThat(social.personalityTraits()).containsExactly("highly-engaged");
        assertThat(social.behaviorPattern()).isEqualTo("1 likes, 0 retweets");

        DigitalAvatar searcher = avatars.get(1);
        assertThat(searcher.topInterests()).containsExactly("finance");
        assertThat(searcher.behaviorPattern()).isEqualTo("Searches 2 times, focuses on finance");

        assertThat(avatars.get(3).behaviorPattern()).isEqualTo("Watches videos, top channel: Tech Daily");
    }

    @Test
    void shouldSkipSocialConnectorWithoutTweetActivity() {
        List<BehaviorRecord> records = List.of(record("visit").author("https://twitter.com/someone").build());

        List<DigitalAvatar> avatars = generator.generate(records, platforms.analyze(records));

        assertThat(avatars).extracting(DigitalAvatar::name).containsExactly("The Explorer");
        assertThat(avatars.get(0).topInterests()).containsExactly("exploration");
        assertThat(avatars.get(0).strength()).isEqualTo(1.0);
    }
}
