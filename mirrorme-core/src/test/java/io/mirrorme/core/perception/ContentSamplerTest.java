package io.mirrorme.core.perception;

import static io.mirrorme.core.RecordFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mirrorme.core.model.BehaviorRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContentSamplerTest {

    @Test
    void shouldTakeNewestContentFirstUpToTheLimit() {
        List<BehaviorRecord> records = List.of(
            record("tweet_view").content("oldest").daysAgo(3).build(),
            record("tweet_view").content("newest").daysAgo(1).build(),
            record("tweet_view").content("   ").build(),
            record("tweet_view").build(),
            record("tweet_view").content("middle").daysAgo(2).build()
        );

        assertThat(new ContentSampler(2, 280).sample(records)).containsExactly("newest", "middle");
        assertThat(new ContentSampler(0, 280).sample(records)).isEmpty();
    }

    @Test
    void shouldTruncateLongContent() {
        List<BehaviorRecord> records = List.of(record("tweet_compose").content("abcdefghij").build());

        assertThat(new ContentSampler(5, 4).sample(records)).containsExactly("abcd");
    }

    @Test
    void shouldMaskContactDetails() {
        ContentSampler sampler = new ContentSampler(5, 280);

        String redacted = sampler.redact("mail jane.doe@example.com or call 555-123-4567 from 192.168.1.10");

        assertThat(redacted).isEqualTo("mail [REDACTED_EMAIL] or call [REDACTED_PHONE] from [REDACTED_IP]");
        assertThat(sampler.redact("nothing to hide")).isEqualTo("nothing to hide");
    }

    @Test
    void shouldRejectInvalidLimits() {
        assertThatThrownBy(() -> new ContentSampler(-1, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ContentSampler(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
