package io.mirrorme.core.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mirrorme.core.model.BehaviorRecord;
import io.mirrorme.core.model.PoliticalTilt;
import io.mirrorme.core.model.Sentiment;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BehaviorRecordReaderTest {

    private final BehaviorRecordReader reader = new BehaviorRecordReader();

    @TempDir
    Path tempDir;

    @Test
    void shouldReadSnakeCaseRecordsFromFile() throws Exception {
        Path file = tempDir.resolve("records.json");
        Files.writeString(file, """
            [
              {
                "user_id": "u1",
                "source": "extension",
                "behavior_type": "youtube_video_watch",
                "keywords": ["music", "tutorial"],
                "sentiment": "positive",
                "political_tilt": "left",
                "video_id": "abc123",
                "channel": "Tech Daily",
                "timestamp": "2025-03-30T10:15:00+02:00",
                "is_sensitive": true,
                "include_in_analysis": false,
                "extra_field": 42
              }
            ]
            """);

        List<BehaviorRecord> records = reader.read(file);

        assertThat(records).hasSize(1);
        BehaviorRecord record = records.get(0);
        assertThat(record.userId()).isEqualTo("u1");
        assertThat(record.behaviorType()).isEqualTo("youtube_video_watch");
        assertThat(record.keywords()).containsExactly("music", "tutorial");
        assertThat(record.sentiment()).isEqualTo(Sentiment.POSITIVE);
        assertThat(record.politicalTilt()).isEqualTo(PoliticalTilt.LEFT);
        assertThat(record.videoId()).isEqualTo("abc123");
        assertThat(record.timestamp()).isEqualTo(Instant.parse("2025-03-30T08:15:00Z"));
        assertThat(record.sensitive()).isTrue();
        assertThat(record.includeInAnalysis()).isFalse();
    }

    @Test
    void shouldAcceptTimestampsWithoutOffsetAndEpochMillis() throws Exception {
        List<BehaviorRecord> records = read("""
            [
              {"behaviorType": "search", "timestamp": "2025-03-30T10:15:00"},
              {"behaviorType": "visit", "timestamp": 1743329700000, "sentiment": "unset"}
            ]
            """);

        assertThat(records).extracting(BehaviorRecord::timestamp).containsExactly(
            Instant.parse("2025-03-30T10:15:00Z"),
            Instant.parse("2025-03-30T10:15:00Z")
        );
        assertThat(records.get(1).sentiment()).isNull();
        assertThat(records.get(0).keywords()).isEmpty();
        assertThat(records.get(0).includeInAnalysis()).isTrue();
    }

    @Test
    void shouldRejectMalformedTimestamps() {
        assertThatThrownBy(() -> read("[{\"behaviorType\": \"search\", \"timestamp\": \"yesterday\"}]"))
            .isInstanceOf(IOException.class);
    }

    private List<BehaviorRecord> read(String json) throws IOException {
        return reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }
}
